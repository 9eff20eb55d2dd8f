package com.ldap.searchfilter.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.ldap.searchfilter.model.Branch;

/**
 * Memoized operator chains for one pass of compatibility checks over a tree.
 *
 * {@link #handed(Branch)} is the chain state a branch receives from its ancestors and
 * {@link #path(Branch)} summarizes the operators from a branch down to the end of its run of
 * single-child FilterLists. Both are valid as long as the tree is mutated bottom-up: a pass may
 * change a branch and the branches below it after asking about them, and must report every change
 * through {@link #invalidate(Branch)}.
 */
public class OperatorChainCache {

    private final Map<Branch, OperatorChainState> handed = new HashMap<>();
    private final Map<Branch, OperatorPath> paths = new HashMap<>();

    /**
     * Operators and negation count from a branch down through single-child FilterLists, up to and
     * including the first Filter or FilterList that does not have exactly one nested branch.
     */
    public static final class OperatorPath {

        private final Branch end;
        private final boolean negated;
        private final char andOr;

        OperatorPath(Branch end, boolean negated, char andOr) {
            this.end = end;
            this.negated = negated;
            this.andOr = andOr;
        }

        public Branch getEnd() {
            return end;
        }

        public boolean isNegated() {
            return negated;
        }

        /** Deepest {@code &} or {@code |} along the path, 0 when there is none. */
        public char getAndOr() {
            return andOr;
        }

        /** The path ends in a FilterList whose effective operator is decided above it. */
        boolean endsInUndecidedJunction() {
            return end.getNestedBranchCount() > 1 && andOr == 0;
        }
    }

    /**
     * Chain state handed to a branch: the operators of its single-child ancestors, up to and
     * including the nearest ancestor with more than one nested branch, whose negations do not count
     * towards the path.
     */
    public OperatorChainState handed(Branch branch) {
        List<Branch> missing = new ArrayList<>();
        Branch current = branch;
        OperatorChainState state = null;
        while (current != null) {
            state = handed.get(current);
            if (state != null) {
                break;
            }
            missing.add(current);
            current = current.getParent();
        }
        for (int i = missing.size() - 1; i >= 0; i--) {
            Branch missingBranch = missing.get(i);
            Branch parent = missingBranch.getParent();
            if (parent == null) {
                state = OperatorChainState.EMPTY;
            } else if (parent.getNestedBranchCount() > 1) {
                state = OperatorChainState.EMPTY.append(BooleanOperatorLogic.operators(parent)).resetPath();
            } else {
                state = state.append(BooleanOperatorLogic.operators(parent));
            }
            handed.put(missingBranch, state);
        }
        return state;
    }

    public OperatorPath path(Branch branch) {
        List<Branch> missing = new ArrayList<>();
        Branch current = branch;
        OperatorPath below;
        while (true) {
            below = paths.get(current);
            if (below != null) {
                break;
            }
            missing.add(current);
            if (current.isFilter() || current.getNestedBranchCount() != 1) {
                break;
            }
            current = current.getNestedBranches().get(0);
        }
        for (int i = missing.size() - 1; i >= 0; i--) {
            Branch missingBranch = missing.get(i);
            String own = BooleanOperatorLogic.operators(missingBranch);
            boolean negated = count(own, '!') % 2 == 1;
            char andOr = lastAndOr(own);
            if (below == null) {
                below = new OperatorPath(missingBranch, negated, andOr);
            } else {
                below = new OperatorPath(below.end, negated != below.negated, below.andOr != 0 ? below.andOr : andOr);
            }
            paths.put(missingBranch, below);
        }
        return below;
    }

    /**
     * Forgets the paths running through a changed branch. Handed states below it go stale, which a
     * bottom-up pass never reads again.
     */
    public void invalidate(Branch changed) {
        paths.remove(changed);
        Branch parent = changed.getParent();
        while (parent != null && parent.getNestedBranchCount() == 1 && paths.remove(parent) != null) {
            parent = parent.getParent();
        }
    }

    static char lastAndOr(String operators) {
        for (int i = operators.length() - 1; i >= 0; i--) {
            char c = operators.charAt(i);
            if (c == '&' || c == '|') {
                return c;
            }
        }
        return 0;
    }

    private static int count(String s, char c) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
