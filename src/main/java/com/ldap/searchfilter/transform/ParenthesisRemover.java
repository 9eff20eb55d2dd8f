package com.ldap.searchfilter.transform;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.service.BooleanOperatorLogic;
import com.ldap.searchfilter.service.BranchVisitor;
import com.ldap.searchfilter.service.TokenMutationService;

/**
 * Removes the GroupStart/GroupEnd of FilterLists that only group their content.
 *
 * A grouping layer with one nested branch can always go. One with several nested branches can
 * go when they are all Filters and the enclosing FilterList combines with the same operator. A
 * FilterList whose content changed in this pass shields its parent until the next pass, so the
 * structure read from the tree is never out of date.
 */
public class ParenthesisRemover extends AbstractSearchFilterTransform {

    public static final String NAME = "Parenthesis";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int apply(Branch tree, TransformOptions options) {
        int changes = 0;
        Set<Branch> changed = new HashSet<>();
        for (Branch branch : BranchVisitor.postOrder(tree)) {
            if (changed.contains(branch) || !isEligible(branch, options) || !options.rollNode()) {
                continue;
            }
            Token groupStart = branch.getGroupStart();
            Token groupEnd = branch.getGroupEnd();
            TokenMutationService.removeToken(branch, groupStart);
            TokenMutationService.removeToken(branch, groupEnd);
            changed.add(branch.getParent());
            logger.debug("Removed grouping of FilterList at depth {}", branch.getDepth());
            changes++;
        }
        return changes;
    }

    boolean isEligible(Branch branch, TransformOptions options) {
        Branch parent = branch.getParent();
        if (parent == null || !branch.isFilterList() || branch.getGroupStart() == null || branch.getGroupEnd() == null
                || branch.hasBooleanOperator()) {
            return false;
        }
        List<Branch> nested = branch.getNestedBranches();
        if (nested.size() == 1) {
            ParenthesisScope scope = nested.get(0).isFilter() ? ParenthesisScope.FILTER : ParenthesisScope.FILTER_LIST;
            return options.getParenthesisScopes().contains(scope);
        }
        if (!options.getParenthesisScopes().contains(ParenthesisScope.FILTER_LIST)) {
            return false;
        }
        // Splicing several branches: the parent must be a real FilterList that is not negated
        if (parent.isBase() || parent.getBooleanOperator().indexOf('!') >= 0) {
            return false;
        }
        for (Branch child : nested) {
            if (!child.isFilter()) {
                return false;
            }
        }
        char own = BooleanOperatorLogic.effectiveOperator(BooleanOperatorLogic.getBooleanOperatorChain(branch));
        char enclosing = BooleanOperatorLogic.effectiveOperator(BooleanOperatorLogic.getBooleanOperatorChain(parent));
        return own == enclosing;
    }
}
