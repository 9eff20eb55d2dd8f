package com.ldap.searchfilter.model;

public enum TokenType {
    GROUP_START(1, "GroupStart"),
    GROUP_END(2, "GroupEnd"),
    BOOLEAN_OPERATOR(3, "BooleanOperator"),
    ATTRIBUTE(4, "Attribute"),
    EXTENSIBLE_MATCH_FILTER(5, "ExtensibleMatchFilter"),
    COMPARISON_OPERATOR(6, "ComparisonOperator"),
    VALUE(7, "Value"),
    WHITESPACE(8, "Whitespace"),
    COMMA_DELIMITER(9, "CommaDelimiter");

    TokenType(final int pCode, final String pName) {
        this.code = pCode;
        this.name = pName;
    }

    public final int code;
    private final String name;

    public String getName() {
        return name;
    }

    /**
     * Lower-case form used in AddToken location names, e.g. "booleanoperator"
     * in "before_booleanoperator".
     */
    public String getLocationName() {
        return name.toLowerCase();
    }

    public static TokenType findByName(final String pName) {
        if (pName == null) {
            return null;
        }
        final String lowerName = pName.toLowerCase();
        for (TokenType type : values()) {
            if (type.getLocationName().equals(lowerName)) {
                return type;
            }
        }
        return null;
    }

    public static TokenType findByCode(final int pCode) {
        for (TokenType type : values()) {
            if (type.code == pCode) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown TokenType: code=" + pCode);
    }

    @Override
    public String toString() {
        return name;
    }
}
