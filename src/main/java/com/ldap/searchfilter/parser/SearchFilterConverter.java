package com.ldap.searchfilter.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.BranchElement;
import com.ldap.searchfilter.model.Filter;
import com.ldap.searchfilter.model.Token;

/**
 * Converts between the supported SearchFilter representations. Every conversion goes through the
 * serializer, so any representation can be turned into any other.
 */
public class SearchFilterConverter {

    /**
     * @param input a String, a Branch, or a List of Tokens, Filters or mixed BranchElements
     */
    public static Object convert(Object input, SearchFilterFormat target) {
        Branch tree = toBranch(input);
        switch (target) {
        case STRING:
            return SearchFilterSerializer.toString(tree);
        case TOKENS:
            return toTokens(tree, false);
        case TOKENS_ENRICHED:
            return toTokens(tree, true);
        case FILTERS:
            return toFilters(tree);
        case FILTERS_AND_TOKENS:
            return toFiltersAndTokens(tree);
        case BRANCHES:
            return tree;
        default:
            throw new IllegalArgumentException("Unsupported target format: " + target);
        }
    }

    public static Branch toBranch(Object input) {
        if (input instanceof Branch) {
            return (Branch) input;
        }
        return SearchFilterSerializer.parse(toSearchFilterString(input));
    }

    public static String toSearchFilterString(Object input) {
        if (input instanceof String) {
            return (String) input;
        }
        if (input instanceof Branch) {
            return SearchFilterSerializer.toString((Branch) input);
        }
        if (input instanceof List) {
            List<BranchElement> elements = new ArrayList<>();
            for (Object item : (List<?>) input) {
                if (!(item instanceof BranchElement)) {
                    throw new IllegalArgumentException("Unsupported list element: " + (item == null ? "null" : item.getClass().getName()));
                }
                elements.add((BranchElement) item);
            }
            return SearchFilterSerializer.toString(elements);
        }
        throw new IllegalArgumentException("Unsupported SearchFilter input: " + (input == null ? "null" : input.getClass().getName()));
    }

    public static List<Token> toTokens(Branch tree, boolean enriched) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : tree.flattenTokens()) {
            tokens.add(token.copy());
        }
        if (enriched) {
            SearchFilterLexer.enrich(tokens);
        } else {
            for (Token token : tokens) {
                token.setTypeBefore(null);
                token.setTypeAfter(null);
            }
        }
        return tokens;
    }

    public static List<Filter> toFilters(Branch tree) {
        List<Filter> filters = new ArrayList<>();
        for (BranchElement element : toFiltersAndTokens(tree)) {
            if (element instanceof Filter) {
                filters.add((Filter) element);
            }
        }
        return filters;
    }

    /**
     * Document-order list where each Filter stays whole and all FilterList tokens appear in between.
     */
    public static List<BranchElement> toFiltersAndTokens(Branch tree) {
        List<BranchElement> result = new ArrayList<>();
        Deque<BranchElement> stack = new ArrayDeque<>();
        stack.push(tree);
        while (!stack.isEmpty()) {
            BranchElement element = stack.pop();
            if (element instanceof Branch) {
                List<BranchElement> children = ((Branch) element).getElements();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            } else {
                result.add(element);
            }
        }
        return result;
    }
}
