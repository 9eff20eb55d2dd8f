package com.ldap.searchfilter.transform;

import java.util.ArrayList;
import java.util.List;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.service.BooleanOperatorLogic;
import com.ldap.searchfilter.service.BooleanOperatorLogic.Operation;
import com.ldap.searchfilter.service.BranchVisitor;
import com.ldap.searchfilter.service.OperatorCandidate;
import com.ldap.searchfilter.service.OperatorChainCache;
import com.ldap.searchfilter.service.TokenMutationService;

/**
 * Removes BooleanOperators that do not change the filter's logical meaning, bottom-up.
 *
 * Single-token removals are preferred. When none is compatible, double-character candidates are
 * tried: both characters from the same branch, or the second from the nearest operator-bearing
 * branch below it through single-child FilterLists.
 */
public class BooleanOperatorRemover extends AbstractSearchFilterTransform {

    public static final String NAME = "BooleanOperator";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int apply(Branch tree, TransformOptions options) {
        List<String> singles = new ArrayList<>();
        List<String> doubles = new ArrayList<>();
        for (String operator : options.getBooleanOperators()) {
            (operator.length() == 1 ? singles : doubles).add(operator);
        }

        OperatorChainCache cache = new OperatorChainCache();
        int changes = 0;
        for (Branch branch : BranchVisitor.postOrder(tree)) {
            BooleanOperatorScope scope = branch.isFilter() ? BooleanOperatorScope.FILTER : BooleanOperatorScope.FILTER_LIST;
            if (!options.getBooleanOperatorScopes().contains(scope)) {
                continue;
            }
            while (hasOperators(branch) && options.rollNode()) {
                Branch descendant = findOperatorDescendant(branch);
                List<OperatorCandidate> candidates = BooleanOperatorLogic.findCompatible(branch, null, singles, Operation.REMOVE,
                        cache);
                if (candidates.isEmpty()) {
                    candidates = BooleanOperatorLogic.findCompatible(branch, descendant, doubles, Operation.REMOVE,
                            cache);
                }
                if (candidates.isEmpty()) {
                    break;
                }
                remove(candidates.get(options.getRandom().nextInt(candidates.size())), cache);
                changes++;
            }
        }
        return changes;
    }

    private void remove(OperatorCandidate candidate, OperatorChainCache cache) {
        List<Branch> owners = new ArrayList<>();
        for (Token token : candidate.getTokens()) {
            owners.add(candidate.getBranch(token));
        }
        for (int i = 0; i < owners.size(); i++) {
            Token token = candidate.getTokens().get(i);
            Branch owner = owners.get(i);
            TokenMutationService.removeToken(owner, token);
            cache.invalidate(owner);
            logger.debug("Removed BooleanOperator '{}' ({}) from {} branch at depth {}", token.getContent(),
                    candidate.getOperator(), owner.getType(), owner.getDepth());
        }
    }

    private static boolean hasOperators(Branch branch) {
        return branch.isFilter() ? !branch.getFilter().getBooleanOperatorTokens().isEmpty() : branch.hasBooleanOperator();
    }

    /**
     * Nearest branch with its own operators below a FilterList, looking only through single-child
     * FilterLists without operators.
     */
    static Branch findOperatorDescendant(Branch branch) {
        if (!branch.isFilterList() || branch.getNestedBranchCount() != 1) {
            return null;
        }
        return BranchVisitor.findFirst(branch.getNestedBranches().get(0),
                b -> hasOperators(b) ? b : null,
                b -> b.isFilterList() && b.getNestedBranchCount() == 1)
                .orElse(null);
    }
}
