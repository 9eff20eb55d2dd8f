package com.ldap.searchfilter.model;

/**
 * Secondary classification of a token.
 */
public enum TokenSubType {
    /** Component of a Relative Distinguished Name inside a DN-shaped Value. */
    RDN,
    /** Whitespace run that was merged from originally adjacent Whitespace tokens. */
    MERGED_WHITESPACE
}
