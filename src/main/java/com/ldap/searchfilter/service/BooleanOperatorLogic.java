package com.ldap.searchfilter.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;

/**
 * Boolean Logic Reducer.
 *
 * Reduces a chain of {@code &}, {@code |} and {@code !} characters (outermost first) to the one net
 * logical operator it is equivalent to, and decides which candidate operator insertions,
 * replacements or removals leave a branch's logical meaning unchanged.
 */
public class BooleanOperatorLogic {

    private static final Logger logger = LoggerFactory.getLogger(BooleanOperatorLogic.class);

    public enum Operation {
        INSERT, REPLACE, REMOVE
    }

    public static String reduce(String chain) {
        return reduce(chain, false);
    }

    /**
     * Reduces an operator chain. Commas and whitespace between operators are ignored, so both
     * {@code "&!"} and {@code "&,!"} are accepted.
     *
     * Adjacent negations cancel in pairs. When the last retained character is {@code &} or
     * {@code |} it is the net operator, prefixed with {@code !} if an odd number of negations
     * survive before it. A retained trailing negation reduces to {@code !}.
     *
     * @param ignoreTrailingNegation strip the raw trailing run of {@code !} first, used when the
     *            result is applied to several sibling branches at once
     */
    public static String reduce(String chain, boolean ignoreTrailingNegation) {
        OperatorChainState state = OperatorChainState.EMPTY.append(chain);
        return ignoreTrailingNegation ? state.reduceIgnoringTrailingNegation() : state.reduce();
    }

    public static String reduce(List<Token> tokens, boolean ignoreTrailingNegation) {
        return reduce(join(tokens), ignoreTrailingNegation);
    }

    /**
     * Operator chain applicable to a branch, computed from the live parent structure rather than
     * the cached context: its own operators preceded by everything each single-child ancestor hands
     * down, up to and including the nearest ancestor with more than one nested branch.
     */
    public static String getBooleanOperatorChain(Branch branch) {
        return chain(branch, Collections.<Branch, String>emptyMap());
    }

    /**
     * Candidate operator values that can be applied without changing the filter's logical meaning.
     *
     * A single-character candidate applies to {@code branch} only. A double-character candidate
     * takes its first character from {@code branch} and its second from either {@code branch} or
     * {@code descendant}, the nearest operator-bearing branch below it through single-child
     * FilterLists (may be null).
     *
     * @param candidates operator allow-list such as {@code "&"}, {@code "!!"} or {@code "&!"}
     */
    public static List<OperatorCandidate> findCompatible(Branch branch, Branch descendant, Collection<String> candidates,
            Operation operation) {
        return findCompatible(branch, descendant, candidates, operation, new OperatorChainCache());
    }

    /**
     * As {@link #findCompatible(Branch, Branch, Collection, Operation)}, reusing chains memoized by a
     * pass that mutates the tree bottom-up.
     */
    public static List<OperatorCandidate> findCompatible(Branch branch, Branch descendant, Collection<String> candidates,
            Operation operation, OperatorChainCache cache) {
        List<OperatorCandidate> compatible = new ArrayList<>();
        for (OperatorCandidate candidate : enumerate(branch, descendant, candidates, operation)) {
            if (isCompatible(candidate, cache)) {
                compatible.add(candidate);
            }
        }
        if (logger.isDebugEnabled() && !compatible.isEmpty()) {
            logger.debug("{} compatible {} candidate(s) for {}: {}", compatible.size(), operation, branch, compatible);
        }
        return compatible;
    }

    public static boolean isCompatible(OperatorCandidate candidate) {
        return isCompatible(candidate, new OperatorChainCache());
    }

    /**
     * True when applying the candidate keeps both the reduced operator of the deepest changed
     * branch and the evaluation structure of the whole tree.
     *
     * A change to one branch, or to a single-child FilterList and a branch below it along its run
     * of single-child FilterLists, is checked against the few evaluation entries it can reach. Any
     * other candidate is checked by comparing the signature of the whole tree.
     */
    public static boolean isCompatible(OperatorCandidate candidate, OperatorChainCache cache) {
        Map<Branch, String> after = candidate.getOperatorsAfter();
        Branch top = null;
        Branch deepest = null;
        for (Branch changed : after.keySet()) {
            if (top == null || changed.getDepth() < top.getDepth()) {
                top = changed;
            }
            if (deepest == null || changed.getDepth() > deepest.getDepth()) {
                deepest = changed;
            }
        }
        if (deepest == null) {
            return true;
        }
        List<Branch> run = singleChildRun(top, deepest, after.size());
        if (run == null) {
            return isCompatibleBySignature(candidate, deepest);
        }

        OperatorChainState before = cache.handed(top);
        OperatorChainState applied = before;
        for (Branch branch : run) {
            before = before.append(operators(branch));
            applied = applied.append(operators(branch, after));
        }
        if (!sameLocalOperator(deepest, before, applied) || before.isPathNegated() != applied.isPathNegated()) {
            return false;
        }
        if (deepest.isFilter()) {
            return true;
        }
        if (deepest.getNestedBranchCount() > 1) {
            if (before.effectiveOperator() != applied.effectiveOperator()) {
                return false;
            }
            if (effectiveOperator(operators(deepest)) == effectiveOperator(after.get(deepest))) {
                return true;
            }
            for (Branch nested : deepest.getNestedBranches()) {
                if (cache.path(nested).endsInUndecidedJunction()) {
                    return false;
                }
            }
            return true;
        }
        if (deepest.getNestedBranchCount() == 1 && cache.path(deepest.getNestedBranches().get(0)).endsInUndecidedJunction()) {
            return before.effectiveOperator() == applied.effectiveOperator();
        }
        return true;
    }

    /** Compares the signature of the whole tree before and after the candidate. */
    static boolean isCompatibleBySignature(OperatorCandidate candidate, Branch deepest) {
        Map<Branch, String> after = candidate.getOperatorsAfter();
        OperatorChainState before = stateAt(deepest, Collections.<Branch, String>emptyMap());
        if (!sameLocalOperator(deepest, before, stateAt(deepest, after))) {
            return false;
        }
        Branch root = deepest.getRoot();
        return signature(root, Collections.<Branch, String>emptyMap()).equals(signature(root, after));
    }

    private static boolean sameLocalOperator(Branch deepest, OperatorChainState before, OperatorChainState after) {
        if (deepest.getNestedBranchCount() < 2) {
            // Filter and single-child FilterList: & and | are interchangeable, only negation counts
            return negationOf(before.reduce()).equals(negationOf(after.reduce()));
        }
        return before.reduce().equals(after.reduce())
                && before.reduceIgnoringTrailingNegation().equals(after.reduceIgnoringTrailingNegation());
    }

    /**
     * Branches from {@code top} down to {@code deepest} when every changed branch lies on that run
     * and {@code top} hands all its operators down to a single nested branch; null otherwise.
     */
    private static List<Branch> singleChildRun(Branch top, Branch deepest, int changes) {
        List<Branch> run = new ArrayList<>();
        run.add(top);
        if (top == deepest) {
            return changes == 1 ? run : null;
        }
        if (changes != 2) {
            return null;
        }
        Branch current = top;
        while (current != deepest) {
            if (current.isFilter() || current.getNestedBranchCount() != 1) {
                return null;
            }
            current = current.getNestedBranches().get(0);
            run.add(current);
        }
        return run;
    }

    private static String negationOf(String reduced) {
        return reduced.startsWith("!") ? "!" : "";
    }

    static List<OperatorCandidate> enumerate(Branch branch, Branch descendant, Collection<String> candidates,
            Operation operation) {
        List<OperatorCandidate> result = new ArrayList<>();
        List<Token> own = operatorTokens(branch);
        List<Token> below = descendant == null ? Collections.<Token>emptyList() : operatorTokens(descendant);
        for (String value : candidates) {
            if (value == null || value.isEmpty() || value.length() > 2) {
                continue;
            }
            char first = value.charAt(0);
            switch (operation) {
            case REMOVE:
                if (value.length() == 1) {
                    for (Token token : own) {
                        if (token.getContent().charAt(0) == first) {
                            result.add(removal(value, branch, token, null, null));
                        }
                    }
                } else {
                    char second = value.charAt(1);
                    for (int i = 0; i < own.size(); i++) {
                        if (own.get(i).getContent().charAt(0) != first) {
                            continue;
                        }
                        for (int j = i + 1; j < own.size(); j++) {
                            if (own.get(j).getContent().charAt(0) == second) {
                                result.add(removal(value, branch, own.get(i), branch, own.get(j)));
                            }
                        }
                        for (Token token : below) {
                            if (token.getContent().charAt(0) == second) {
                                result.add(removal(value, branch, own.get(i), descendant, token));
                            }
                        }
                    }
                }
                break;
            case INSERT:
                OperatorCandidate insertion = new OperatorCandidate(value, operation);
                String ops = operators(branch);
                if (value.length() == 1 || descendant == null) {
                    insertion.put(branch, ops + value, null);
                } else {
                    insertion.put(branch, ops + first, null);
                    insertion.put(descendant, operators(descendant) + value.charAt(1), null);
                }
                result.add(insertion);
                break;
            case REPLACE:
                if (own.isEmpty()) {
                    break;
                }
                OperatorCandidate replacement = new OperatorCandidate(value, operation);
                if (value.length() == 1) {
                    replacement.put(branch, replaceLast(operators(branch), value), own.get(own.size() - 1));
                } else if (descendant != null && !below.isEmpty()) {
                    replacement.put(branch, replaceLast(operators(branch), String.valueOf(first)), own.get(own.size() - 1));
                    replacement.put(descendant, replaceLast(operators(descendant), value.substring(1)), below.get(below.size() - 1));
                } else if (own.size() >= 2) {
                    String ownOps = operators(branch);
                    replacement.put(branch, ownOps.substring(0, ownOps.length() - 2) + value, own.get(own.size() - 2));
                    replacement.addToken(own.get(own.size() - 1));
                } else {
                    break;
                }
                result.add(replacement);
                break;
            default:
                break;
            }
        }
        return result;
    }

    private static OperatorCandidate removal(String value, Branch branch, Token token, Branch secondBranch, Token secondToken) {
        OperatorCandidate candidate = new OperatorCandidate(value, Operation.REMOVE);
        if (secondBranch == branch) {
            candidate.put(branch, without(branch, token, secondToken), token);
            candidate.addToken(secondToken);
        } else {
            candidate.put(branch, without(branch, token, null), token);
            if (secondBranch != null) {
                candidate.put(secondBranch, without(secondBranch, secondToken, null), secondToken);
            }
        }
        return candidate;
    }

    private static String without(Branch branch, Token first, Token second) {
        StringBuilder sb = new StringBuilder();
        for (Token token : operatorTokens(branch)) {
            if (token != first && token != second) {
                sb.append(token.getContent());
            }
        }
        return sb.toString();
    }

    private static String replaceLast(String ops, String replacement) {
        return ops.substring(0, ops.length() - replacement.length()) + replacement;
    }

    static List<Token> operatorTokens(Branch branch) {
        return branch.isFilter() ? branch.getFilter().getBooleanOperatorTokens() : branch.getBooleanOperatorTokens();
    }

    static String operators(Branch branch) {
        return join(operatorTokens(branch));
    }

    private static String operators(Branch branch, Map<Branch, String> overrides) {
        String override = overrides.get(branch);
        return override != null ? override : operators(branch);
    }

    private static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.getContent());
        }
        return sb.toString();
    }

    private static String chain(Branch branch, Map<Branch, String> overrides) {
        List<String> parts = new ArrayList<>();
        parts.add(operators(branch, overrides));
        Branch parent = branch.getParent();
        while (parent != null) {
            parts.add(operators(parent, overrides));
            if (parent.getNestedBranchCount() > 1) {
                break;
            }
            parent = parent.getParent();
        }
        StringBuilder chain = new StringBuilder();
        for (int i = parts.size() - 1; i >= 0; i--) {
            chain.append(parts.get(i));
        }
        return chain.toString();
    }

    private static OperatorChainState stateAt(Branch branch, Map<Branch, String> overrides) {
        return OperatorChainState.EMPTY.append(chain(branch, overrides));
    }

    /**
     * Evaluation structure of a tree: for every Filter and every FilterList with more than one nested
     * branch, the parity of negations since the previous such junction, and for FilterLists the
     * effective {@code &}/{@code |}. Two trees with the same shape and signature match the same
     * entries.
     */
    static List<String> signature(Branch root, Map<Branch, String> overrides) {
        List<String> signature = new ArrayList<>();
        Map<Branch, OperatorChainState> handedDown = new HashMap<>();
        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(root);
        handedDown.put(root, OperatorChainState.EMPTY);
        while (!stack.isEmpty()) {
            Branch branch = stack.pop();
            String own = operators(branch, overrides);
            OperatorChainState state = handedDown.remove(branch).append(own);
            int parity = state.isPathNegated() ? 1 : 0;
            List<Branch> nested = branch.getNestedBranches();
            if (branch.isFilter()) {
                signature.add("F" + parity);
                continue;
            }
            OperatorChainState toNested;
            if (nested.size() > 1) {
                signature.add("L" + parity + state.effectiveOperator() + nested.size());
                toNested = OperatorChainState.EMPTY.append(own).resetPath();
            } else {
                toNested = state;
            }
            for (int n = nested.size() - 1; n >= 0; n--) {
                handedDown.put(nested.get(n), toNested);
                stack.push(nested.get(n));
            }
        }
        return signature;
    }

    /** Last {@code &} or {@code |} of a chain; {@code &} when there is none. */
    public static char effectiveOperator(String chain) {
        for (int i = chain.length() - 1; i >= 0; i--) {
            char c = chain.charAt(i);
            if (c == '&' || c == '|') {
                return c;
            }
        }
        return '&';
    }
}
