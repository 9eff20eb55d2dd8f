package com.ldap.searchfilter.parser;

/**
 * Representations a SearchFilter can be requested in or returned as.
 */
public enum SearchFilterFormat {
    /** Raw text. */
    STRING,
    /** Flat {@code List<Token>}. */
    TOKENS,
    /** Flat {@code List<Token>} with TypeBefore/TypeAfter populated. */
    TOKENS_ENRICHED,
    /** {@code List<Filter>}, comparison clauses only. */
    FILTERS,
    /** {@code List<BranchElement>}: Filters kept whole, every other token in between. */
    FILTERS_AND_TOKENS,
    /** Full {@code Branch} tree. */
    BRANCHES;

    public static SearchFilterFormat findByName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase().replace('-', '_');
        for (SearchFilterFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        return null;
    }
}
