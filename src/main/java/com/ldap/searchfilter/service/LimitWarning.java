package com.ldap.searchfilter.service;

/**
 * A protocol-limit counter of a tree that exceeds its configured maximum. The tree is still
 * syntactically valid; servers enforcing the limit will reject it.
 */
public class LimitWarning {

    public enum Limit {
        DEPTH("depth"),
        BOOLEAN_OPERATOR_COUNT("BooleanOperator count"),
        BOOLEAN_OPERATOR_LOGICAL_COUNT("BooleanOperator logical count");

        private final String description;

        Limit(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Limit limit;
    private final int actual;
    private final int max;

    public LimitWarning(Limit limit, int actual, int max) {
        this.limit = limit;
        this.actual = actual;
        this.max = max;
    }

    public Limit getLimit() {
        return limit;
    }

    public int getActual() {
        return actual;
    }

    public int getMax() {
        return max;
    }

    @Override
    public String toString() {
        return limit.getDescription() + " " + actual + " exceeds maximum " + max;
    }
}
