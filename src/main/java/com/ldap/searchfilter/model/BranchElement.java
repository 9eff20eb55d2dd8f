package com.ldap.searchfilter.model;

/**
 * Anything that can sit in a branch body: a {@link Token}, a {@link Filter} or a nested {@link Branch}.
 */
public interface BranchElement {

    String getContent();

    int getDepth();
}
