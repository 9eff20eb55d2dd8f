package com.ldap.searchfilter.transform;

/**
 * Where a removable BooleanOperator is defined: inside a Filter, e.g. {@code (!name=sabi)}, or on a
 * FilterList.
 */
public enum BooleanOperatorScope {
    FILTER,
    FILTER_LIST
}
