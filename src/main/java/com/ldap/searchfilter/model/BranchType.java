package com.ldap.searchfilter.model;

public enum BranchType {
    FILTER("Filter"),
    FILTER_LIST("FilterList");

    private final String name;

    BranchType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
