package com.ldap.searchfilter.service;

/**
 * Immutable running state of a BooleanOperator chain read outermost first.
 *
 * Reducing a chain only needs the top two retained operators and the parity of retained
 * negations: retained negations never sit next to each other, so a cancelled {@code !} always
 * uncovers an {@code &}, an {@code |} or nothing. Appending operators is therefore constant work
 * per character whatever the length of the chain already read.
 */
public final class OperatorChainState {

    private static final char NONE = 0;

    public static final OperatorChainState EMPTY = new OperatorChainState(NONE, NONE, false, NONE, NONE, false, NONE,
            false);

    private final char top;
    private final char under;
    private final boolean negated;

    // reducer state after the last character that was not a negation
    private final char trailTop;
    private final char trailUnder;
    private final boolean trailNegated;

    private final char lastAndOr;
    private final boolean pathNegated;

    private OperatorChainState(char top, char under, boolean negated, char trailTop, char trailUnder,
            boolean trailNegated, char lastAndOr, boolean pathNegated) {
        this.top = top;
        this.under = under;
        this.negated = negated;
        this.trailTop = trailTop;
        this.trailUnder = trailUnder;
        this.trailNegated = trailNegated;
        this.lastAndOr = lastAndOr;
        this.pathNegated = pathNegated;
    }

    /**
     * Appends operators; commas and whitespace are skipped.
     *
     * @throws IllegalArgumentException on any other character
     */
    public OperatorChainState append(CharSequence operators) {
        if (operators == null || operators.length() == 0) {
            return this;
        }
        char t = top;
        char u = under;
        boolean n = negated;
        char tt = trailTop;
        char tu = trailUnder;
        boolean tn = trailNegated;
        char andOr = lastAndOr;
        boolean path = pathNegated;
        for (int i = 0; i < operators.length(); i++) {
            char c = operators.charAt(i);
            if (c == '!') {
                if (t == '!') {
                    t = u;
                } else {
                    u = t;
                    t = '!';
                }
                n = !n;
                path = !path;
            } else if (c == '&' || c == '|') {
                u = t;
                t = c;
                andOr = c;
                tt = t;
                tu = u;
                tn = n;
            } else if (c != ',' && !Character.isWhitespace(c)) {
                throw new IllegalArgumentException("Invalid BooleanOperator '" + c + "' in chain '" + operators + "'");
            }
        }
        return new OperatorChainState(t, u, n, tt, tu, tn, andOr, path);
    }

    /** Same reducer state with the negation count along the path reset, as below a junction. */
    public OperatorChainState resetPath() {
        if (!pathNegated) {
            return this;
        }
        return new OperatorChainState(top, under, negated, trailTop, trailUnder, trailNegated, lastAndOr, false);
    }

    /** Net operator of the chain read so far. */
    public String reduce() {
        return reduce(top, negated);
    }

    /** Net operator of the chain read so far, ignoring its trailing run of negations. */
    public String reduceIgnoringTrailingNegation() {
        return reduce(trailTop, trailNegated);
    }

    private static String reduce(char top, boolean negated) {
        if (top == NONE) {
            return "";
        }
        if (top == '!') {
            return "!";
        }
        return (negated ? "!" : "") + top;
    }

    /** Last {@code &} or {@code |} read; {@code &} when there is none. */
    public char effectiveOperator() {
        return lastAndOr == NONE ? '&' : lastAndOr;
    }

    public boolean hasAndOr() {
        return lastAndOr != NONE;
    }

    /** Odd number of negations read since the last path reset. */
    public boolean isPathNegated() {
        return pathNegated;
    }

    @Override
    public String toString() {
        return "OperatorChainState[reduced=" + reduce() + ", effective=" + effectiveOperator() + ", pathNegated="
                + pathNegated + "]";
    }
}
