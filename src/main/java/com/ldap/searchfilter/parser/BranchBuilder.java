package com.ldap.searchfilter.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.BranchContext;
import com.ldap.searchfilter.model.Filter;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenChain;
import com.ldap.searchfilter.model.TokenType;

/**
 * Builds the recursive Filter/FilterList tree from a flat token list in a single pass, then computes
 * every branch's BooleanOperator context and protocol-limit counters. All walks use explicit stacks.
 */
public class BranchBuilder {

    /**
     * Builds the tree for a token list produced by {@link SearchFilterLexer}.
     *
     * @throws FilterParseException if the token list is structurally incomplete
     */
    public static Branch build(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new FilterParseException(0, "empty search filter");
        }
        Branch base = Branch.filterList(0);
        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(base);

        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            switch (token.getType()) {
            case GROUP_START:
                if (isFilterGroup(tokens, i)) {
                    int end = matchingGroupEnd(tokens, i);
                    Filter filter = new Filter(tokens.subList(i, end + 1), token.getDepth() + 1);
                    requireComplete(filter, token);
                    stack.peek().appendElement(Branch.filter(filter, token.getDepth() + 1));
                    i = end + 1;
                } else {
                    Branch filterList = Branch.filterList(token.getDepth() + 1);
                    filterList.appendElement(token);
                    stack.peek().appendElement(filterList);
                    stack.push(filterList);
                    i++;
                }
                break;
            case GROUP_END:
                if (stack.size() < 2) {
                    throw new FilterParseException(token.getStart(), "unbalanced parenthesis");
                }
                stack.peek().appendElement(token);
                stack.pop();
                i++;
                break;
            case ATTRIBUTE:
                // Parenthesis-less filter at the top level
                int last = tokens.size() - 1;
                while (last > i && tokens.get(last).isType(TokenType.WHITESPACE)) {
                    last--;
                }
                Filter bare = new Filter(tokens.subList(i, last + 1), 0);
                requireComplete(bare, token);
                stack.peek().appendElement(Branch.filter(bare, 0));
                i = last + 1;
                break;
            default:
                stack.peek().appendElement(token);
                i++;
            }
        }
        if (stack.size() != 1) {
            throw new FilterParseException(tokens.get(tokens.size() - 1).getStart(), "unbalanced parenthesis");
        }
        base.collapseToFilter();
        computeMetadata(base);
        return base;
    }

    private static boolean isFilterGroup(List<Token> tokens, int groupStart) {
        for (int j = groupStart + 1; j < tokens.size(); j++) {
            TokenType type = tokens.get(j).getType();
            if (type == TokenType.WHITESPACE || type == TokenType.BOOLEAN_OPERATOR) {
                continue;
            }
            if (type == TokenType.GROUP_START) {
                return false;
            }
            if (type == TokenType.ATTRIBUTE) {
                return true;
            }
            throw new FilterParseException(tokens.get(j).getStart(), "group is missing a filter");
        }
        throw new FilterParseException(tokens.get(groupStart).getStart(), "unbalanced parenthesis");
    }

    private static int matchingGroupEnd(List<Token> tokens, int groupStart) {
        int depth = tokens.get(groupStart).getDepth();
        for (int j = groupStart + 1; j < tokens.size(); j++) {
            Token candidate = tokens.get(j);
            if (candidate.isType(TokenType.GROUP_END) && candidate.getDepth() == depth) {
                return j;
            }
            if (candidate.isType(TokenType.GROUP_START)) {
                throw new FilterParseException(candidate.getStart(), "nested group inside filter");
            }
        }
        throw new FilterParseException(tokens.get(groupStart).getStart(), "unbalanced parenthesis");
    }

    private static void requireComplete(Filter filter, Token first) {
        if (filter.getAttribute() == null) {
            throw new FilterParseException(first.getStart(), "missing attribute");
        }
        if (filter.getComparisonOperator() == null) {
            throw new FilterParseException(first.getStart(), "missing comparison operator");
        }
        if (filter.getValue() == null) {
            throw new FilterParseException(first.getStart(), "missing value");
        }
    }

    /**
     * Recomputes context chains and counters for a whole tree. Called by the builder and usable to
     * refresh a tree after local edits without reparsing its text.
     */
    public static void computeMetadata(Branch base) {
        computeContexts(base);
        computeCounters(base);
    }

    /**
     * Top-down: a branch's FilterList chain is what its parent hands down plus its own operators.
     * A parent with more than one nested branch hands down only its own operators.
     */
    private static void computeContexts(Branch base) {
        Map<Branch, TokenChain> handedDown = new HashMap<>();
        handedDown.put(base, TokenChain.EMPTY);
        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(base);
        while (!stack.isEmpty()) {
            Branch branch = stack.pop();
            TokenChain fromParent = handedDown.remove(branch);
            BranchContext context = new BranchContext();
            if (branch.isFilter()) {
                context.setFilterListChain(fromParent);
                context.setFilterBooleanOperatorTokens(branch.getFilter().getBooleanOperatorTokens());
            } else {
                TokenChain chain = fromParent.extend(branch.getBooleanOperatorTokens());
                context.setFilterListChain(chain);
                TokenChain toNested = branch.getNestedBranchCount() > 1
                        ? TokenChain.of(branch.getBooleanOperatorTokens())
                        : chain;
                context.setInheritedByNestedChain(toNested);
                List<Branch> nested = branch.getNestedBranches();
                for (int n = nested.size() - 1; n >= 0; n--) {
                    handedDown.put(nested.get(n), toNested);
                    stack.push(nested.get(n));
                }
            }
            branch.setContext(context);
        }
    }

    /**
     * Counters per branch: deepest depth below it, and the largest number of operators (and operators
     * plus wildcards) on any base-to-leaf path through it.
     */
    private static void computeCounters(Branch base) {
        Map<Branch, Integer> prefixOperators = new HashMap<>();
        List<Branch> preOrder = new ArrayList<>();
        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(base);
        prefixOperators.put(base, 0);
        while (!stack.isEmpty()) {
            Branch branch = stack.pop();
            preOrder.add(branch);
            int below = prefixOperators.get(branch) + branch.getBooleanOperatorTokens().size();
            for (Branch nested : branch.getNestedBranches()) {
                prefixOperators.put(nested, below);
                stack.push(nested);
            }
        }

        Map<Branch, int[]> downward = new HashMap<>();
        for (int k = preOrder.size() - 1; k >= 0; k--) {
            Branch branch = preOrder.get(k);
            int own = branch.getBooleanOperatorTokens().size();
            int depthMax = branch.getDepth();
            int operatorsDown = 0;
            int logicalDown = 0;
            if (branch.isFilter()) {
                Token value = branch.getFilter().getValue();
                logicalDown = value == null ? 0 : value.getWildcardCount();
            }
            for (Branch nested : branch.getNestedBranches()) {
                int[] child = downward.get(nested);
                depthMax = Math.max(depthMax, child[0]);
                operatorsDown = Math.max(operatorsDown, child[1]);
                logicalDown = Math.max(logicalDown, child[2]);
            }
            downward.put(branch, new int[] { depthMax, own + operatorsDown, own + logicalDown });
        }

        for (Branch branch : preOrder) {
            int[] down = downward.get(branch);
            int prefix = prefixOperators.get(branch);
            branch.setDepthMax(down[0]);
            branch.setBooleanOperatorCountMax(prefix + down[1]);
            branch.setBooleanOperatorLogicalCountMax(prefix + down[2]);
        }
    }
}
