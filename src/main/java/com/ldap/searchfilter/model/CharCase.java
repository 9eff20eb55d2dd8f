package com.ldap.searchfilter.model;

public enum CharCase {
    UPPER,
    LOWER,
    NONE
}
