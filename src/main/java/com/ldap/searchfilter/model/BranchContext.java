package com.ldap.searchfilter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cached ancestry of BooleanOperator tokens for one branch.
 *
 * Staleness contract: the Branch Builder writes an authoritative context for every branch. The
 * mutation primitives only recompute the context of the branch they edit and flag its immediate
 * nested branches as stale; deeper descendants are not touched and may silently hold stale
 * chains. Callers that need tree-wide accuracy must reparse first.
 */
public class BranchContext {

    private TokenChain filterListBooleanOperatorTokens = TokenChain.EMPTY;
    private List<Token> filterBooleanOperatorTokens = new ArrayList<>();
    private TokenChain inheritedByNestedTokens = TokenChain.EMPTY;
    private boolean stale = false;
    private boolean locallyPatched = false;

    /**
     * Applicable FilterList-scope operators, outermost first. Walks up the ancestry and stops at
     * (and includes) the nearest ancestor with more than one nested branch. For a FilterList the
     * branch's own operators are appended last.
     */
    public List<Token> getFilterListBooleanOperatorTokens() {
        return Collections.unmodifiableList(filterListBooleanOperatorTokens.toList());
    }

    public TokenChain getFilterListChain() {
        return filterListBooleanOperatorTokens;
    }

    public void setFilterListChain(TokenChain chain) {
        this.filterListBooleanOperatorTokens = chain;
    }

    /** Filter-scope operators of a terminal Filter branch; empty for FilterLists. */
    public List<Token> getFilterBooleanOperatorTokens() {
        return Collections.unmodifiableList(filterBooleanOperatorTokens);
    }

    public void setFilterBooleanOperatorTokens(List<Token> tokens) {
        this.filterBooleanOperatorTokens = new ArrayList<>(tokens);
    }

    /** Chain handed down to this branch's nested branches. */
    public List<Token> getInheritedByNestedTokens() {
        return Collections.unmodifiableList(inheritedByNestedTokens.toList());
    }

    public TokenChain getInheritedByNestedChain() {
        return inheritedByNestedTokens;
    }

    public void setInheritedByNestedChain(TokenChain chain) {
        this.inheritedByNestedTokens = chain;
    }

    public String getFilterListBooleanOperator() {
        return filterListBooleanOperatorTokens.getContent();
    }

    public String getFilterBooleanOperator() {
        return join(filterBooleanOperatorTokens);
    }

    /** FilterList chain followed by the Filter-scope chain. */
    public String getBooleanOperatorChain() {
        return getFilterListBooleanOperator() + getFilterBooleanOperator();
    }

    public boolean isStale() {
        return stale;
    }

    public void setStale(boolean stale) {
        this.stale = stale;
    }

    public boolean isLocallyPatched() {
        return locallyPatched;
    }

    public void setLocallyPatched(boolean locallyPatched) {
        this.locallyPatched = locallyPatched;
    }

    private static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.getContent());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "BranchContext[filterList=" + getFilterListBooleanOperator() + ", filter=" + getFilterBooleanOperator()
                + (stale ? ", stale" : "") + "]";
    }
}
