package com.ldap.searchfilter.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.parser.SearchFilterSerializer;
import com.ldap.searchfilter.service.BooleanOperatorLogic.Operation;

public class BooleanOperatorLogicTest {

    @Test
    public void testReduce() {
        assertEquals("&", BooleanOperatorLogic.reduce("&"));
        assertEquals("!", BooleanOperatorLogic.reduce("&,!"));
        assertEquals("!", BooleanOperatorLogic.reduce("&!"));
        assertEquals("&", BooleanOperatorLogic.reduce("&!!"));
        assertEquals("!&", BooleanOperatorLogic.reduce("!&!!"));
        assertEquals("!&", BooleanOperatorLogic.reduce("||!!|!&!!"));
        assertEquals("!", BooleanOperatorLogic.reduce("!|!!!"));
        assertEquals("!|", BooleanOperatorLogic.reduce("!|!!!", true));
    }

    @Test
    public void testReduceEdgeCases() {
        assertEquals("", BooleanOperatorLogic.reduce(""));
        assertEquals("", BooleanOperatorLogic.reduce("!!"));
        assertEquals("!", BooleanOperatorLogic.reduce("!"));
        assertEquals("|", BooleanOperatorLogic.reduce("&|"));
        assertEquals("&", BooleanOperatorLogic.reduce("!!&"));
        assertEquals("&", BooleanOperatorLogic.reduce(" & , & "));
        assertThrows(IllegalArgumentException.class, () -> BooleanOperatorLogic.reduce("&x"));
    }

    @Test
    public void testEffectiveOperator() {
        assertEquals('|', BooleanOperatorLogic.effectiveOperator("!|!"));
        assertEquals('&', BooleanOperatorLogic.effectiveOperator("|&"));
        assertEquals('&', BooleanOperatorLogic.effectiveOperator(""));
    }

    @Test
    public void testBooleanOperatorChain() {
        Branch tree = SearchFilterSerializer.parse("(!(&(!name=sabi)(!name=dbo)))");
        Branch and = tree.getNestedBranches().get(0).getNestedBranches().get(0);

        assertEquals("!&", BooleanOperatorLogic.getBooleanOperatorChain(and));
        assertEquals("&!", BooleanOperatorLogic.getBooleanOperatorChain(and.getNestedBranches().get(0)));
    }

    @Test
    public void testRemoveFromFilter() {
        Branch tree = SearchFilterSerializer.parse("(|(|name=sabi)(&name=dbo))");
        Branch or = tree.getNestedBranches().get(0);
        List<String> operators = Arrays.asList("&", "|", "!");

        List<OperatorCandidate> sabi = BooleanOperatorLogic.findCompatible(or.getNestedBranches().get(0), null, operators,
                Operation.REMOVE);
        assertEquals(1, sabi.size());
        assertEquals("|", sabi.get(0).getOperator());
        assertSame(or.getNestedBranches().get(0), sabi.get(0).getBranch(sabi.get(0).getTokens().get(0)));

        assertTrue(BooleanOperatorLogic.findCompatible(or, null, operators, Operation.REMOVE).isEmpty());
    }

    @Test
    public void testRemoveRedundantNestedOperator() {
        Branch same = SearchFilterSerializer.parse("(&(a=1)(&(b=2)(c=3)))");
        Branch inner = same.getNestedBranches().get(0).getNestedBranches().get(1);
        assertEquals(1, BooleanOperatorLogic.findCompatible(inner, null, Arrays.asList("&"), Operation.REMOVE).size());

        Branch different = SearchFilterSerializer.parse("(|(a=1)(&(b=2)(c=3)))");
        Branch and = different.getNestedBranches().get(0).getNestedBranches().get(1);
        assertTrue(BooleanOperatorLogic.findCompatible(and, null, Arrays.asList("&"), Operation.REMOVE).isEmpty());
    }

    @Test
    public void testRemoveDoubleNegationAcrossBranches() {
        Branch tree = SearchFilterSerializer.parse("(!(!(&(a=1)(b=2))))");
        Branch outer = tree.getNestedBranches().get(0);
        Branch inner = outer.getNestedBranches().get(0);

        assertTrue(BooleanOperatorLogic.findCompatible(outer, null, Arrays.asList("!"), Operation.REMOVE).isEmpty());

        List<OperatorCandidate> doubles = BooleanOperatorLogic.findCompatible(outer, inner, Arrays.asList("!!"),
                Operation.REMOVE);
        assertEquals(1, doubles.size());
        assertEquals(2, doubles.get(0).getTokens().size());
        assertSame(inner, doubles.get(0).getBranch(doubles.get(0).getTokens().get(1)));
    }

    @Test
    public void testInsert() {
        Branch tree = SearchFilterSerializer.parse("(name=sabi)");

        assertEquals(1, BooleanOperatorLogic.findCompatible(tree, null, Arrays.asList("!!"), Operation.INSERT).size());
        assertTrue(BooleanOperatorLogic.findCompatible(tree, null, Arrays.asList("!"), Operation.INSERT).isEmpty());
        // & and | are interchangeable on a single Filter
        assertEquals(2, BooleanOperatorLogic.findCompatible(tree, null, Arrays.asList("&", "|"), Operation.INSERT).size());
    }

    @Test
    public void testReplace() {
        Branch tree = SearchFilterSerializer.parse("(|(|name=sabi)(&name=dbo))");
        Branch or = tree.getNestedBranches().get(0);

        assertEquals(1, BooleanOperatorLogic.findCompatible(or.getNestedBranches().get(1), null, Collections.singletonList("|"),
                Operation.REPLACE).size());
        assertTrue(BooleanOperatorLogic.findCompatible(or, null, Collections.singletonList("&"), Operation.REPLACE).isEmpty());
    }
}
