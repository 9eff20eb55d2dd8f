package com.ldap.searchfilter.parser;

/**
 * Malformed SearchFilter input. Carries the offending source offset; the lexer does not recover.
 */
public class FilterParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int offset;
    private final String reason;

    public FilterParseException(int offset, String reason) {
        super(reason + " at offset " + offset);
        this.offset = offset;
        this.reason = reason;
    }

    public int getOffset() {
        return offset;
    }

    public String getReason() {
        return reason;
    }
}
