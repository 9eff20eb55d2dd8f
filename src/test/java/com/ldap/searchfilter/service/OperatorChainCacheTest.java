package com.ldap.searchfilter.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.parser.SearchFilterSerializer;
import com.ldap.searchfilter.service.BooleanOperatorLogic.Operation;
import com.ldap.searchfilter.service.OperatorChainCache.OperatorPath;
import com.ldap.searchfilter.transform.TransformOptions;

public class OperatorChainCacheTest {

    @Test
    public void testHanded() {
        Branch tree = SearchFilterSerializer.parse("(|(!(&(a=1)(b=2)))(c=3))");
        Branch or = tree.getNestedBranches().get(0);
        Branch not = or.getNestedBranches().get(0);
        Branch and = not.getNestedBranches().get(0);
        OperatorChainCache cache = new OperatorChainCache();

        OperatorChainState toNot = cache.handed(not);
        assertEquals("|", toNot.reduce());
        assertFalse(toNot.isPathNegated());

        OperatorChainState toAnd = cache.handed(and);
        assertEquals("!", toAnd.reduce());
        assertTrue(toAnd.isPathNegated());
        assertEquals("|!&", BooleanOperatorLogic.getBooleanOperatorChain(and));

        OperatorChainState toFilter = cache.handed(and.getNestedBranches().get(0));
        assertEquals("&", toFilter.reduce());
        assertFalse(toFilter.isPathNegated());
    }

    @Test
    public void testPath() {
        Branch tree = SearchFilterSerializer.parse("(!((|!(a=1)(b=2))))");
        Branch not = tree.getNestedBranches().get(0);
        OperatorChainCache cache = new OperatorChainCache();

        OperatorPath path = cache.path(not);
        Branch or = not.getNestedBranches().get(0).getNestedBranches().get(0);
        assertSame(or, path.getEnd());
        assertFalse(path.isNegated());
        assertEquals('|', path.getAndOr());

        OperatorPath filter = cache.path(or.getNestedBranches().get(1));
        assertTrue(filter.getEnd().isFilter());
        assertEquals(0, filter.getAndOr());
    }

    @Test
    public void testInvalidateAfterRemoval() {
        Branch tree = SearchFilterSerializer.parse("(!(!(&(a=1)(b=2))))");
        Branch outer = tree.getNestedBranches().get(0);
        Branch inner = outer.getNestedBranches().get(0);
        OperatorChainCache cache = new OperatorChainCache();

        assertFalse(cache.path(outer).isNegated());
        OperatorCandidate candidate = BooleanOperatorLogic
                .findCompatible(outer, inner, Arrays.asList("!!"), Operation.REMOVE, cache).get(0);
        TokenMutationService.removeToken(inner, candidate.getTokens().get(1));
        cache.invalidate(inner);

        assertTrue(cache.path(outer).isNegated());
        assertTrue(cache.path(inner).getEnd().getNestedBranchCount() > 1);
    }

    @Test
    public void testLocalCheckMatchesTreeSignature() {
        for (String filter : Arrays.asList("(!(!(&(a=1)(b=2))))", "(|(!((a=1)(b=2))))", "(&|(a=1)(!!b=2))",
                "(!((!(&(a=1)(b=2)))))", "(|(!(((a=1)(b=2))(c=3)))(d=4))", "(!&(|(a=1)(b=2)))",
                "(|!((a=1)((b=2)(c=3))))", "(!(|((a=1)(b=2))((c=3)(d=4))))")) {
            Branch tree = SearchFilterSerializer.parse(filter);
            OperatorChainCache cache = new OperatorChainCache();
            for (Branch branch : BranchVisitor.postOrder(tree)) {
                Branch descendant = branch.getNestedBranchCount() == 1 ? branch.getNestedBranches().get(0) : null;
                for (Operation operation : Operation.values()) {
                    for (OperatorCandidate candidate : BooleanOperatorLogic.enumerate(branch, descendant,
                            TransformOptions.DEFAULT_BOOLEAN_OPERATORS, operation)) {
                        assertEquals(BooleanOperatorLogic.isCompatibleBySignature(candidate, deepest(candidate)),
                                BooleanOperatorLogic.isCompatible(candidate, cache),
                                filter + " " + operation + " " + candidate.getOperatorsAfter());
                    }
                }
            }
        }
    }

    private static Branch deepest(OperatorCandidate candidate) {
        Branch deepest = null;
        for (Branch branch : candidate.getOperatorsAfter().keySet()) {
            if (deepest == null || branch.getDepth() > deepest.getDepth()) {
                deepest = branch;
            }
        }
        return deepest;
    }
}
