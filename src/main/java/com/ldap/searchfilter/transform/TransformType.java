package com.ldap.searchfilter.transform;

import java.util.function.Supplier;

public enum TransformType {
    EXTENSIBLE_MATCH_FILTER(1, ExtensibleMatchFilterRemover.NAME, ExtensibleMatchFilterRemover::new),
    WHITESPACE(2, WhitespaceRemover.NAME, WhitespaceRemover::new),
    WILDCARD(3, WildcardRemover.NAME, WildcardRemover::new),
    BOOLEAN_OPERATOR_INVERSION(4, BooleanOperatorInversionRemover.NAME, BooleanOperatorInversionRemover::new),
    BOOLEAN_OPERATOR(5, BooleanOperatorRemover.NAME, BooleanOperatorRemover::new),
    PARENTHESIS(6, ParenthesisRemover.NAME, ParenthesisRemover::new);

    TransformType(final int pCode, final String pName, final Supplier<SearchFilterTransform> pFactory) {
        this.code = pCode;
        this.name = pName;
        this.factory = pFactory;
    }

    public final int code;
    private final String name;
    private final Supplier<SearchFilterTransform> factory;

    public String getName() {
        return name;
    }

    public SearchFilterTransform newTransform() {
        return factory.get();
    }

    /**
     * Accepts the transform name ("BooleanOperator"), the enum constant name ("BOOLEAN_OPERATOR") or
     * either with a "Remove-Random" prefix, ignoring case.
     */
    public static TransformType findByName(final String pName) {
        if (pName == null) {
            return null;
        }
        String normalized = pName.trim().toLowerCase().replace("_", "").replace("-", "");
        if (normalized.startsWith("removerandom")) {
            normalized = normalized.substring("removerandom".length());
        }
        for (TransformType type : values()) {
            if (type.name.toLowerCase().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
