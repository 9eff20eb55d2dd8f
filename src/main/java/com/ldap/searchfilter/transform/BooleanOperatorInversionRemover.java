package com.ldap.searchfilter.transform;

import java.util.Arrays;
import java.util.List;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenType;
import com.ldap.searchfilter.service.BooleanOperatorLogic;
import com.ldap.searchfilter.service.BranchVisitor;
import com.ldap.searchfilter.service.TokenMutationService;

/**
 * Removes a FilterList negation by pushing it down, De Morgan style.
 *
 * The negated content is the first branch below the negation that is not a single-child FilterList
 * without operators. A negated Filter has its own negation toggled, a negated negation cancels,
 * and a negated FilterList swaps {@code &}/{@code |} and toggles the negation of each nested
 * branch. Inversion stops there.
 */
public class BooleanOperatorInversionRemover extends AbstractSearchFilterTransform {

    public static final String NAME = "BooleanOperatorInversion";

    private static final List<String> OPERATOR_LOCATIONS = Arrays.asList("after_booleanoperator", "after_groupstart");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int apply(Branch tree, TransformOptions options) {
        int changes = 0;
        for (Branch branch : BranchVisitor.postOrder(tree)) {
            if (!isNegation(branch)) {
                continue;
            }
            Branch negated = findNegatedContent(branch);
            InversionScope scope = negated.isFilter() ? InversionScope.FILTER : InversionScope.FILTER_LIST;
            if (!options.getInversionScopes().contains(scope) || !canInvert(negated) || !options.rollNode()) {
                continue;
            }
            invert(negated, options);
            TokenMutationService.removeToken(branch, branch.getBooleanOperatorTokens().get(0));
            logger.debug("Removed negation of FilterList at depth {} by inverting {} branch at depth {}", branch.getDepth(),
                    negated.getType(), negated.getDepth());
            changes++;
        }
        return changes;
    }

    /** A FilterList whose only own operator is a single negation over exactly one nested branch. */
    static boolean isNegation(Branch branch) {
        return branch.isFilterList() && "!".equals(branch.getBooleanOperator()) && branch.getNestedBranchCount() == 1;
    }

    static Branch findNegatedContent(Branch negation) {
        Branch current = negation.getNestedBranches().get(0);
        while (current.isFilterList() && !current.hasBooleanOperator() && current.getNestedBranchCount() == 1) {
            current = current.getNestedBranches().get(0);
        }
        return current;
    }

    /**
     * A nested FilterList that gets an explicit operator hands it down to its own nested branches.
     * Inversion is skipped when one of those would inherit a different operator as a result.
     */
    private static boolean canInvert(Branch negated) {
        if (negated.isFilter() || negated.getBooleanOperator().indexOf('!') >= 0) {
            return true;
        }
        for (Branch child : negated.getNestedBranches()) {
            if (child.isFilter() || hasAndOr(child.getBooleanOperator()) || child.getNestedBranchCount() < 2) {
                continue;
            }
            for (Branch grandchild : child.getNestedBranches()) {
                if (grandchild.isFilterList() && !hasAndOr(grandchild.getBooleanOperator())) {
                    return false;
                }
            }
        }
        return true;
    }

    private void invert(Branch negated, TransformOptions options) {
        if (negated.isFilter()) {
            toggleNegation(negated, null, options);
            return;
        }
        Token ownNegation = firstNegation(negated.getBooleanOperatorTokens());
        if (ownNegation != null) {
            TokenMutationService.removeToken(negated, ownNegation);
            return;
        }

        char operator = BooleanOperatorLogic.effectiveOperator(BooleanOperatorLogic.getBooleanOperatorChain(negated));
        // Several nested branches inherit the negated list's own operators only, a single one the whole chain
        char nestedOperator = negated.getNestedBranchCount() > 1
                ? BooleanOperatorLogic.effectiveOperator(negated.getBooleanOperator())
                : operator;
        String swapped = operator == '&' ? "|" : "&";
        Token own = lastAndOr(negated.getBooleanOperatorTokens());
        if (own != null) {
            TokenMutationService.editToken(negated, own, swapped);
        } else {
            TokenMutationService.addToken(negated, TokenMutationService.newToken(TokenType.BOOLEAN_OPERATOR, swapped),
                    OPERATOR_LOCATIONS, options.getRandom());
        }
        for (Branch child : negated.getNestedBranches()) {
            toggleNegation(child, String.valueOf(nestedOperator), options);
        }
    }

    /**
     * @param inheritedOperator operator a nested FilterList evaluated with before the inversion, kept
     *            explicitly when it has none of its own; null for the negated content itself
     */
    private void toggleNegation(Branch branch, String inheritedOperator, TransformOptions options) {
        List<Token> operators = branch.isFilter() ? branch.getFilter().getBooleanOperatorTokens()
                : branch.getBooleanOperatorTokens();
        if (branch.isFilterList() && inheritedOperator != null && lastAndOr(operators) == null) {
            TokenMutationService.addToken(branch, TokenMutationService.newToken(TokenType.BOOLEAN_OPERATOR, inheritedOperator),
                    OPERATOR_LOCATIONS, options.getRandom());
        }
        Token negation = firstNegation(operators);
        if (negation != null) {
            TokenMutationService.removeToken(branch, negation);
        } else {
            TokenMutationService.addToken(branch, TokenMutationService.newToken(TokenType.BOOLEAN_OPERATOR, "!"),
                    Arrays.asList("after_groupstart"), options.getRandom());
        }
    }

    private static Token firstNegation(List<Token> operators) {
        for (Token token : operators) {
            if ("!".equals(token.getContent())) {
                return token;
            }
        }
        return null;
    }

    private static Token lastAndOr(List<Token> operators) {
        for (int i = operators.size() - 1; i >= 0; i--) {
            if (hasAndOr(operators.get(i).getContent())) {
                return operators.get(i);
            }
        }
        return null;
    }

    private static boolean hasAndOr(String operators) {
        return operators.indexOf('&') >= 0 || operators.indexOf('|') >= 0;
    }
}
