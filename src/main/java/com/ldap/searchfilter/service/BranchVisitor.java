package com.ldap.searchfilter.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.BranchElement;

/**
 * Generic traversal of a branch tree. Every mode runs on an explicit stack so nesting depth never
 * turns into call-stack depth.
 */
public class BranchVisitor {

    public enum Mode {
        /** Collect every non-empty callback result, pre-order. */
        RETURN_ALL,
        /** Stop at the first non-empty callback result. */
        RETURN_FIRST,
        /** Invoke the callback for its side effects and replace each branch with what it returns. */
        MODIFY
    }

    /**
     * Single entry point for all three modes. For {@link Mode#MODIFY} the callback result must be a
     * Branch (or null to keep the visited branch) and the returned list holds the resulting tree.
     */
    @SuppressWarnings("unchecked")
    public static <R> List<R> visit(Branch branch, Function<Branch, R> callback, Mode mode) {
        switch (mode) {
        case RETURN_ALL:
            return collectAll(branch, callback);
        case RETURN_FIRST:
            List<R> first = new ArrayList<>();
            findFirst(branch, callback).ifPresent(first::add);
            return first;
        case MODIFY:
            Branch modified = modify(branch, b -> {
                R result = callback.apply(b);
                return result instanceof Branch ? (Branch) result : b;
            });
            List<R> tree = new ArrayList<>();
            tree.add((R) modified);
            return tree;
        default:
            throw new IllegalArgumentException("Unsupported mode: " + mode);
        }
    }

    public static <R> List<R> collectAll(Branch branch, Function<Branch, R> callback) {
        List<R> results = new ArrayList<>();
        for (Branch visited : preOrder(branch)) {
            R result = callback.apply(visited);
            if (!isEmpty(result)) {
                results.add(result);
            }
        }
        return results;
    }

    public static <R> Optional<R> findFirst(Branch branch, Function<Branch, R> callback) {
        return findFirst(branch, callback, b -> true);
    }

    /**
     * Pre-order search that only descends into branches accepted by {@code descend}. The starting
     * branch itself is always visited.
     */
    public static <R> Optional<R> findFirst(Branch branch, Function<Branch, R> callback, Predicate<Branch> descend) {
        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(branch);
        while (!stack.isEmpty()) {
            Branch current = stack.pop();
            R result = callback.apply(current);
            if (!isEmpty(result)) {
                return Optional.of(result);
            }
            if (descend.test(current)) {
                List<Branch> nested = current.getNestedBranches();
                for (int i = nested.size() - 1; i >= 0; i--) {
                    stack.push(nested.get(i));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Pre-order modification: the callback sees a branch before its nested branches, and the
     * traversal continues into whatever branch the callback returned.
     */
    public static Branch modify(Branch branch, UnaryOperator<Branch> callback) {
        Branch root = replacement(branch, callback.apply(branch));
        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Branch current = stack.pop();
            List<BranchElement> elements = current.getElements();
            List<Branch> visitNext = new ArrayList<>();
            for (int i = 0; i < elements.size(); i++) {
                if (elements.get(i) instanceof Branch) {
                    Branch nested = (Branch) elements.get(i);
                    Branch replaced = replacement(nested, callback.apply(nested));
                    if (replaced != nested) {
                        current.setElement(i, replaced);
                    }
                    visitNext.add(replaced);
                }
            }
            for (int i = visitNext.size() - 1; i >= 0; i--) {
                stack.push(visitNext.get(i));
            }
        }
        return root;
    }

    /**
     * Post-order modification: nested branches are finished before their parent is visited.
     */
    public static Branch modifyBottomUp(Branch branch, UnaryOperator<Branch> callback) {
        List<Branch> order = postOrder(branch);
        Branch root = branch;
        for (Branch current : order) {
            Branch parent = current.getParent();
            Branch replaced = replacement(current, callback.apply(current));
            if (replaced == current) {
                continue;
            }
            if (current == root) {
                root = replaced;
            } else if (parent != null) {
                int index = parent.indexOfElement(current);
                if (index >= 0) {
                    parent.setElement(index, replaced);
                }
            }
        }
        return root;
    }

    public static List<Branch> preOrder(Branch branch) {
        List<Branch> order = new ArrayList<>();
        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(branch);
        while (!stack.isEmpty()) {
            Branch current = stack.pop();
            order.add(current);
            List<Branch> nested = current.getNestedBranches();
            for (int i = nested.size() - 1; i >= 0; i--) {
                stack.push(nested.get(i));
            }
        }
        return order;
    }

    public static List<Branch> postOrder(Branch branch) {
        List<Branch> order = new ArrayList<>();
        Deque<Branch> stack = new ArrayDeque<>();
        Deque<Boolean> expanded = new ArrayDeque<>();
        stack.push(branch);
        expanded.push(false);
        while (!stack.isEmpty()) {
            Branch current = stack.pop();
            boolean done = expanded.pop();
            if (done) {
                order.add(current);
                continue;
            }
            stack.push(current);
            expanded.push(true);
            List<Branch> nested = current.getNestedBranches();
            for (int i = nested.size() - 1; i >= 0; i--) {
                stack.push(nested.get(i));
                expanded.push(false);
            }
        }
        return order;
    }

    private static Branch replacement(Branch original, Branch result) {
        return result == null ? original : result;
    }

    private static boolean isEmpty(Object result) {
        if (result == null) {
            return true;
        }
        if (result instanceof Optional) {
            return ((Optional<?>) result).isEmpty();
        }
        if (result instanceof Collection) {
            return ((Collection<?>) result).isEmpty();
        }
        if (result instanceof CharSequence) {
            return ((CharSequence) result).length() == 0;
        }
        if (result instanceof Boolean) {
            return !((Boolean) result);
        }
        return false;
    }
}
