package com.ldap.searchfilter.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Recursive node of a SearchFilter tree.
 *
 * A FilterList body is an ordered mix of its own tokens (GroupStart, BooleanOperator, Whitespace,
 * GroupEnd) and nested branches. A Filter body is exactly one {@link Filter}. The base branch of a
 * parsed tree carries no GroupStart/GroupEnd of its own.
 */
public class Branch implements BranchElement {

    private BranchType type;
    private int depth;
    private final List<BranchElement> elements = new ArrayList<>();
    private Branch parent;
    private BranchContext context = new BranchContext();

    // Protocol-limit counters
    private int depthMax;
    private int booleanOperatorCountMax;
    private int booleanOperatorLogicalCountMax;

    private Branch(BranchType type, int depth) {
        this.type = type;
        this.depth = depth;
    }

    public static Branch filterList(int depth) {
        return new Branch(BranchType.FILTER_LIST, depth);
    }

    public static Branch filter(Filter filter, int depth) {
        Branch branch = new Branch(BranchType.FILTER, depth);
        branch.elements.add(filter);
        return branch;
    }

    public BranchType getType() {
        return type;
    }

    public boolean isFilter() {
        return type == BranchType.FILTER;
    }

    public boolean isFilterList() {
        return type == BranchType.FILTER_LIST;
    }

    @Override
    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public Branch getParent() {
        return parent;
    }

    public void setParent(Branch parent) {
        this.parent = parent;
    }

    public Branch getRoot() {
        Branch current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    public boolean isBase() {
        return parent == null;
    }

    public List<BranchElement> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public void appendElement(BranchElement element) {
        insertElement(elements.size(), element);
    }

    public void insertElement(int index, BranchElement element) {
        elements.add(index, element);
        if (element instanceof Branch) {
            ((Branch) element).parent = this;
        }
    }

    public BranchElement removeElementAt(int index) {
        BranchElement removed = elements.remove(index);
        if (removed instanceof Branch) {
            ((Branch) removed).parent = null;
        }
        return removed;
    }

    public void setElement(int index, BranchElement element) {
        elements.set(index, element);
        if (element instanceof Branch) {
            ((Branch) element).parent = this;
        }
    }

    public int indexOfElement(BranchElement element) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == element) {
                return i;
            }
        }
        return -1;
    }

    /** The wrapped Filter of a Filter branch, null for FilterLists. */
    public Filter getFilter() {
        if (type != BranchType.FILTER || elements.isEmpty()) {
            return null;
        }
        return (Filter) elements.get(0);
    }

    public List<Branch> getNestedBranches() {
        List<Branch> nested = new ArrayList<>();
        for (BranchElement element : elements) {
            if (element instanceof Branch) {
                nested.add((Branch) element);
            }
        }
        return nested;
    }

    public int getNestedBranchCount() {
        int count = 0;
        for (BranchElement element : elements) {
            if (element instanceof Branch) {
                count++;
            }
        }
        return count;
    }

    /**
     * Tokens defined directly on this branch: the Filter's tokens for a Filter branch, otherwise
     * the FilterList's own tokens (nested branches excluded).
     */
    public List<Token> getTokens() {
        if (type == BranchType.FILTER) {
            return getFilter().getTokens();
        }
        List<Token> tokens = new ArrayList<>();
        for (BranchElement element : elements) {
            if (element instanceof Token) {
                tokens.add((Token) element);
            }
        }
        return tokens;
    }

    public List<Token> getTokens(TokenType tokenType) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : getTokens()) {
            if (token.getType() == tokenType) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public List<Token> getBooleanOperatorTokens() {
        return getTokens(TokenType.BOOLEAN_OPERATOR);
    }

    /**
     * Directly-defined operator(s) of this branch. Empty when the operator is inherited from an
     * ancestor; inheritance is positional and never copied down.
     */
    public String getBooleanOperator() {
        StringBuilder sb = new StringBuilder();
        for (Token token : getBooleanOperatorTokens()) {
            sb.append(token.getContent());
        }
        return sb.toString();
    }

    public boolean hasBooleanOperator() {
        return !getBooleanOperatorTokens().isEmpty();
    }

    public Token getGroupStart() {
        List<Token> starts = getTokens(TokenType.GROUP_START);
        return starts.isEmpty() ? null : starts.get(0);
    }

    public Token getGroupEnd() {
        List<Token> ends = getTokens(TokenType.GROUP_END);
        return ends.isEmpty() ? null : ends.get(ends.size() - 1);
    }

    public boolean hasGroupTokens() {
        return getGroupStart() != null || getGroupEnd() != null;
    }

    public int indexOfToken(Token token) {
        for (int i = 0; i < elements.size(); i++) {
            BranchElement element = elements.get(i);
            if (element instanceof Token && ((Token) element).matches(token)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Collapses a FilterList into a Filter when it has no grouping or operator tokens of its own and
     * wraps exactly one nested Filter branch. Remaining own tokens (whitespace) are merged into the
     * Filter at their original positions.
     *
     * @return true if the branch changed type
     */
    public boolean collapseToFilter() {
        if (type != BranchType.FILTER_LIST || hasGroupTokens() || hasBooleanOperator()) {
            return false;
        }
        List<Branch> nested = getNestedBranches();
        if (nested.size() != 1 || !nested.get(0).isFilter()) {
            return false;
        }
        Branch inner = nested.get(0);
        List<Token> merged = new ArrayList<>();
        for (BranchElement element : elements) {
            if (element instanceof Token) {
                merged.add((Token) element);
            } else {
                merged.addAll(inner.getFilter().getTokens());
            }
        }
        Filter filter = new Filter(merged, inner.getFilter().getDepth());
        elements.clear();
        elements.add(filter);
        type = BranchType.FILTER;
        depth = inner.depth;
        context.setFilterBooleanOperatorTokens(filter.getBooleanOperatorTokens());
        context.setLocallyPatched(true);
        return true;
    }

    public BranchContext getContext() {
        return context;
    }

    public void setContext(BranchContext context) {
        this.context = context;
    }

    public int getDepthMax() {
        return depthMax;
    }

    public void setDepthMax(int depthMax) {
        this.depthMax = depthMax;
    }

    public int getBooleanOperatorCountMax() {
        return booleanOperatorCountMax;
    }

    public void setBooleanOperatorCountMax(int booleanOperatorCountMax) {
        this.booleanOperatorCountMax = booleanOperatorCountMax;
    }

    public int getBooleanOperatorLogicalCountMax() {
        return booleanOperatorLogicalCountMax;
    }

    public void setBooleanOperatorLogicalCountMax(int booleanOperatorLogicalCountMax) {
        this.booleanOperatorLogicalCountMax = booleanOperatorLogicalCountMax;
    }

    public int getStart() {
        List<Token> flat = flattenTokens();
        return flat.isEmpty() ? -1 : flat.get(0).getStart();
    }

    /**
     * All tokens of this branch and its descendants in document order. Iterative so that deep
     * nesting does not grow the call stack.
     */
    public List<Token> flattenTokens() {
        List<Token> tokens = new ArrayList<>();
        Deque<BranchElement> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            BranchElement element = stack.pop();
            if (element instanceof Token) {
                tokens.add((Token) element);
            } else if (element instanceof Filter) {
                tokens.addAll(((Filter) element).getTokens());
            } else {
                List<BranchElement> children = ((Branch) element).elements;
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return tokens;
    }

    @Override
    public String getContent() {
        StringBuilder sb = new StringBuilder();
        for (Token token : flattenTokens()) {
            sb.append(token.getContent());
        }
        return sb.toString();
    }

    public int getLength() {
        return getContent().length();
    }

    @Override
    public String toString() {
        return type.getName() + "[" + depth + "]" + getContent();
    }
}
