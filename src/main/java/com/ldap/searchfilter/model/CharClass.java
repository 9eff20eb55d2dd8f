package com.ldap.searchfilter.model;

public enum CharClass {
    ALPHA,
    NUMERIC,
    SPECIAL
}
