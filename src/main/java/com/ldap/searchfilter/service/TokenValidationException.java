package com.ldap.searchfilter.service;

/**
 * Internal-consistency failure of a mutation primitive, e.g. a token that can no longer be found
 * in its branch. The current operation must abort instead of continuing on stale state.
 */
public class TokenValidationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public TokenValidationException(String message) {
        super(message);
    }
}
