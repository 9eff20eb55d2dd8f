package com.ldap.searchfilter.transform;

/**
 * Kind of content a grouping layer wraps: a single Filter, or FilterLists / several branches.
 */
public enum ParenthesisScope {
    FILTER,
    FILTER_LIST
}
