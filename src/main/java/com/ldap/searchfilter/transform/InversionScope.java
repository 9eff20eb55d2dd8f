package com.ldap.searchfilter.transform;

/**
 * Kind of branch a removable negation dominates.
 */
public enum InversionScope {
    FILTER,
    FILTER_LIST
}
