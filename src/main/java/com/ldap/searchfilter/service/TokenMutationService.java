package com.ldap.searchfilter.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.BranchContext;
import com.ldap.searchfilter.model.BranchElement;
import com.ldap.searchfilter.model.Filter;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenChain;
import com.ldap.searchfilter.model.TokenType;
import com.ldap.searchfilter.parser.ValueParser;

/**
 * The four sanctioned ways to change a tree: NewToken, AddToken, RemoveToken and EditToken.
 *
 * Each call touches exactly one branch. Cached metadata (Filter content and lookup, branch
 * counters, the branch's BooleanOperator context) is patched locally for that branch only; its
 * immediate nested branches are flagged stale and nothing deeper is visited. A full reparse through
 * {@code SearchFilterSerializer.reparse} restores tree-wide accuracy.
 */
public class TokenMutationService {

    private static final Logger logger = LoggerFactory.getLogger(TokenMutationService.class);

    private static final Set<String> BOOLEAN_OPERATORS = Set.of("&", "|", "!");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "~=", ">=", "<=");

    /** Pseudo token type usable in locations to address a nested branch, e.g. "after_branch". */
    public static final String BRANCH_LOCATION = "branch";

    // Fallback locations used when a requested location's token type is absent from the branch
    private static final Map<String, List<String>> NEXT_OF_KIN = new LinkedHashMap<>();
    static {
        NEXT_OF_KIN.put("before_booleanoperator", Arrays.asList("before_attribute", "before_branch"));
        NEXT_OF_KIN.put("after_booleanoperator", Arrays.asList("after_groupstart", "before_attribute", "before_branch"));
        NEXT_OF_KIN.put("before_extensiblematchfilter", Arrays.asList("before_comparisonoperator"));
        NEXT_OF_KIN.put("after_extensiblematchfilter", Arrays.asList("after_attribute"));
        NEXT_OF_KIN.put("after_groupstart", Arrays.asList("before_attribute", "before_branch"));
        NEXT_OF_KIN.put("before_groupend", Arrays.asList("after_value", "after_branch"));
        NEXT_OF_KIN.put("before_whitespace", Arrays.asList("before_attribute", "before_branch"));
        NEXT_OF_KIN.put("after_whitespace", Arrays.asList("after_groupstart", "after_booleanoperator"));
    }

    public static Token newToken(TokenType type, String content) {
        return newToken(type, content, null, null);
    }

    /**
     * Pure construction. A missing start means the token is synthesized (-1).
     */
    public static Token newToken(TokenType type, String content, Integer start, Integer depth) {
        Token token = new Token(type, content, start == null ? -1 : start, depth == null ? 0 : depth);
        if (type == TokenType.VALUE) {
            ValueParser.populate(token);
        }
        return token;
    }

    /**
     * Inserts the token at one randomly chosen location among the candidates. Location names have
     * the form {@code before_<tokentype>} or {@code after_<tokentype>}, where the type may also be
     * {@value #BRANCH_LOCATION}. Candidates whose type is absent fall back to their next-of-kin
     * locations.
     *
     * @throws TokenValidationException if no candidate location resolves in this branch
     */
    public static Token addToken(Branch branch, Token token, List<String> candidateLocations, Random random) {
        List<Integer> positions = new ArrayList<>();
        for (String location : candidateLocations) {
            List<Integer> resolved = resolveLocation(branch, location);
            if (resolved.isEmpty() && NEXT_OF_KIN.containsKey(location)) {
                for (String kin : NEXT_OF_KIN.get(location)) {
                    resolved = resolveLocation(branch, kin);
                    if (!resolved.isEmpty()) {
                        break;
                    }
                }
            }
            positions.addAll(resolved);
        }
        if (positions.isEmpty()) {
            throw new TokenValidationException("No location in " + candidateLocations + " resolves in branch " + branch);
        }
        int index = positions.get(random.nextInt(positions.size()));

        token.setDepth(tokenDepth(branch, token.getType()));
        if (token.isType(TokenType.VALUE)) {
            ValueParser.populate(token);
        }
        token.setModified(true);
        if (branch.isFilter()) {
            branch.getFilter().insertToken(index, token);
        } else {
            branch.insertElement(index, token);
        }

        if (token.isType(TokenType.BOOLEAN_OPERATOR)) {
            adjustOperatorCounters(branch, 1);
            refreshContext(branch);
        } else if (token.isType(TokenType.VALUE)) {
            adjustLogicalCounter(branch, token.getWildcardCount());
        } else if (token.isType(TokenType.EXTENSIBLE_MATCH_FILTER)) {
            removeWhitespaceBeforeComparisonOperator(branch);
        }
        logger.debug("Added {} at index {} of {} branch (depth {})", token, index, branch.getType(), branch.getDepth());
        return token;
    }

    /**
     * Removes a token located by identity, content and position. A FilterList left with no grouping
     * or operator tokens around exactly one nested Filter becomes a Filter.
     *
     * @throws TokenValidationException if the token is not defined directly in this branch
     */
    public static Token removeToken(Branch branch, Token token) {
        Token removed;
        if (branch.isFilter()) {
            Filter filter = branch.getFilter();
            int index = filter.indexOf(token);
            if (index < 0) {
                throw notFound(branch, token);
            }
            TokenType type = token.getType();
            if ((type == TokenType.ATTRIBUTE || type == TokenType.COMPARISON_OPERATOR || type == TokenType.VALUE)
                    && filter.getTokens(type).size() == 1) {
                throw new TokenValidationException("Cannot remove the only " + type + " of filter " + filter);
            }
            removed = filter.removeTokenAt(index);
        } else {
            int index = branch.indexOfToken(token);
            if (index < 0) {
                throw notFound(branch, token);
            }
            removed = (Token) branch.removeElementAt(index);
        }

        if (removed.isType(TokenType.BOOLEAN_OPERATOR)) {
            adjustOperatorCounters(branch, -1);
        } else if (removed.isType(TokenType.VALUE)) {
            adjustLogicalCounter(branch, -removed.getWildcardCount());
        }
        if (branch.collapseToFilter()) {
            logger.debug("FilterList collapsed into Filter {}", branch.getFilter());
        }
        if (removed.isType(TokenType.BOOLEAN_OPERATOR) || branch.isFilter()) {
            refreshContext(branch);
        }
        logger.debug("Removed {} from {} branch (depth {})", removed, branch.getType(), branch.getDepth());
        return removed;
    }

    /**
     * Rewrites a token's content and re-derives everything cached from it in the owning branch.
     * An empty BooleanOperator or ExtensibleMatchFilter removes the token; an Attribute edited to
     * {@code name:rule:} is split into Attribute and ExtensibleMatchFilter tokens.
     *
     * @throws TokenValidationException if the token is not in this branch or the content is invalid for its type
     */
    public static Token editToken(Branch branch, Token token, String newContent) {
        Token target = locate(branch, token);
        String oldContent = target.getContent();
        String content = newContent == null ? "" : newContent;
        if (oldContent.equals(content)) {
            return target;
        }

        switch (target.getType()) {
        case BOOLEAN_OPERATOR:
            if (content.isEmpty()) {
                return removeToken(branch, target);
            }
            if (!BOOLEAN_OPERATORS.contains(content)) {
                throw new TokenValidationException("Invalid BooleanOperator '" + content + "'");
            }
            target.setContent(content);
            refreshContext(branch);
            break;
        case EXTENSIBLE_MATCH_FILTER:
            if (content.isEmpty()) {
                return removeToken(branch, target);
            }
            if (!content.startsWith(":") || !content.endsWith(":")) {
                throw new TokenValidationException("Invalid ExtensibleMatchFilter '" + content + "'");
            }
            target.setContent(content);
            break;
        case COMPARISON_OPERATOR:
            if (!COMPARISON_OPERATORS.contains(content)) {
                throw new TokenValidationException("Invalid ComparisonOperator '" + content + "'");
            }
            target.setContent(content);
            break;
        case VALUE:
            int oldWildcards = target.getWildcardCount();
            target.setContent(content);
            ValueParser.populate(target);
            adjustLogicalCounter(branch, target.getWildcardCount() - oldWildcards);
            if ("*".equals(content)) {
                removeWhitespaceAfterPresenceValue(branch, target);
            }
            break;
        case ATTRIBUTE:
            int colon = content.indexOf(':');
            if (colon > 0 && branch.isFilter()) {
                target.setContent(content.substring(0, colon));
                introduceExtensibleMatchFilter(branch, target, content.substring(colon));
            } else {
                target.setContent(content);
            }
            break;
        default:
            target.setContent(content);
        }
        target.setModified(true);
        if (branch.isFilter()) {
            branch.getFilter().refresh();
        }
        logger.debug("Edited {} '{}' -> '{}' in {} branch (depth {})", target.getType(), oldContent, content,
                branch.getType(), branch.getDepth());
        return target;
    }

    private static void introduceExtensibleMatchFilter(Branch branch, Token attribute, String rule) {
        if (!rule.endsWith(":")) {
            throw new TokenValidationException("Invalid ExtensibleMatchFilter '" + rule + "'");
        }
        Filter filter = branch.getFilter();
        Token existing = filter.getExtensibleMatchFilter();
        if (existing != null) {
            existing.setContent(rule);
            existing.setModified(true);
        } else {
            Token emf = newToken(TokenType.EXTENSIBLE_MATCH_FILTER, rule, null, attribute.getDepth());
            emf.setModified(true);
            filter.insertToken(filter.indexOf(attribute) + 1, emf);
        }
        removeWhitespaceBeforeComparisonOperator(branch);
    }

    private static void removeWhitespaceBeforeComparisonOperator(Branch branch) {
        if (!branch.isFilter()) {
            return;
        }
        Filter filter = branch.getFilter();
        Token operator = filter.getComparisonOperator();
        if (operator == null) {
            return;
        }
        int index = filter.indexOf(operator);
        while (index > 0 && filter.getTokens().get(index - 1).isType(TokenType.WHITESPACE)) {
            filter.removeTokenAt(index - 1);
            index--;
        }
    }

    private static void removeWhitespaceAfterPresenceValue(Branch branch, Token value) {
        if (!branch.isFilter()) {
            return;
        }
        Filter filter = branch.getFilter();
        int index = filter.indexOf(value);
        while (index >= 0 && index + 1 < filter.getTokens().size()
                && filter.getTokens().get(index + 1).isType(TokenType.WHITESPACE)) {
            filter.removeTokenAt(index + 1);
        }
    }

    private static Token locate(Branch branch, Token token) {
        if (branch.isFilter()) {
            int index = branch.getFilter().indexOf(token);
            if (index >= 0) {
                return branch.getFilter().getTokens().get(index);
            }
        } else {
            int index = branch.indexOfToken(token);
            if (index >= 0) {
                return (Token) branch.getElements().get(index);
            }
        }
        throw notFound(branch, token);
    }

    private static TokenValidationException notFound(Branch branch, Token token) {
        return new TokenValidationException("Token " + token + " not found in " + branch.getType() + " branch " + branch);
    }

    /**
     * Resolves a location name to insertion indexes in the branch's own token container.
     */
    static List<Integer> resolveLocation(Branch branch, String location) {
        List<Integer> positions = new ArrayList<>();
        int separator = location == null ? -1 : location.indexOf('_');
        if (separator < 0) {
            throw new TokenValidationException("Invalid location name '" + location + "'");
        }
        String side = location.substring(0, separator).toLowerCase();
        String typeName = location.substring(separator + 1).toLowerCase();
        boolean before = "before".equals(side);
        if (!before && !"after".equals(side)) {
            throw new TokenValidationException("Invalid location name '" + location + "'");
        }
        boolean branchLocation = BRANCH_LOCATION.equals(typeName);
        TokenType type = branchLocation ? null : TokenType.findByName(typeName);
        if (!branchLocation && type == null) {
            throw new TokenValidationException("Unknown token type in location '" + location + "'");
        }

        List<? extends BranchElement> container = branch.isFilter() ? branch.getFilter().getTokens() : branch.getElements();
        for (int i = 0; i < container.size(); i++) {
            BranchElement element = container.get(i);
            boolean matches = branchLocation
                    ? element instanceof Branch
                    : element instanceof Token && ((Token) element).getType() == type;
            if (matches) {
                positions.add(before ? i : i + 1);
            }
        }
        return positions;
    }

    private static int tokenDepth(Branch branch, TokenType type) {
        if (branch.isFilterList() && (type == TokenType.GROUP_START || type == TokenType.GROUP_END)) {
            return Math.max(0, branch.getDepth() - 1);
        }
        if (branch.isFilter() && (type == TokenType.GROUP_START || type == TokenType.GROUP_END)) {
            return Math.max(0, branch.getFilter().getDepth() - 1);
        }
        return branch.isFilter() ? branch.getFilter().getDepth() : branch.getDepth();
    }

    private static void adjustOperatorCounters(Branch branch, int delta) {
        branch.setBooleanOperatorCountMax(Math.max(0, branch.getBooleanOperatorCountMax() + delta));
        branch.setBooleanOperatorLogicalCountMax(Math.max(0, branch.getBooleanOperatorLogicalCountMax() + delta));
    }

    private static void adjustLogicalCounter(Branch branch, int delta) {
        if (delta != 0) {
            branch.setBooleanOperatorLogicalCountMax(Math.max(0, branch.getBooleanOperatorLogicalCountMax() + delta));
        }
    }

    /**
     * Recomputes the context of one branch from its parent's cached hand-down chain, then flags the
     * immediate nested branches as stale.
     */
    static void refreshContext(Branch branch) {
        Branch parent = branch.getParent();
        TokenChain fromParent = parent == null ? TokenChain.EMPTY : parent.getContext().getInheritedByNestedChain();
        BranchContext context = new BranchContext();
        if (branch.isFilter()) {
            context.setFilterListChain(fromParent);
            context.setFilterBooleanOperatorTokens(branch.getFilter().getBooleanOperatorTokens());
        } else {
            TokenChain chain = fromParent.extend(branch.getBooleanOperatorTokens());
            context.setFilterListChain(chain);
            context.setInheritedByNestedChain(branch.getNestedBranchCount() > 1
                    ? TokenChain.of(branch.getBooleanOperatorTokens())
                    : chain);
        }
        context.setLocallyPatched(true);
        branch.setContext(context);
        for (Branch nested : branch.getNestedBranches()) {
            nested.getContext().setStale(true);
        }
    }
}
