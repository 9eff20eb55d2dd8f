package com.ldap.searchfilter.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenType;
import com.ldap.searchfilter.parser.SearchFilterSerializer;

public class TokenMutationServiceTest {

    private final Random random = new Random(42);

    private static Token negation() {
        return TokenMutationService.newToken(TokenType.BOOLEAN_OPERATOR, "!");
    }

    @Test
    public void testNewToken() {
        Token token = TokenMutationService.newToken(TokenType.VALUE, "a\\62");

        assertEquals(-1, token.getStart());
        assertEquals(0, token.getDepth());
        assertEquals(2, token.getParsedChars().size());
        assertEquals("ab", token.getDecodedContent());

        Token placed = TokenMutationService.newToken(TokenType.ATTRIBUTE, "cn", 4, 2);
        assertEquals(4, placed.getStart());
        assertEquals(2, placed.getDepth());
    }

    @Test
    public void testAddToken() {
        Branch tree = SearchFilterSerializer.parse("(name=sabi)");

        Token added = TokenMutationService.addToken(tree, negation(), Arrays.asList("before_attribute"), random);

        assertEquals("(!name=sabi)", tree.getContent());
        assertTrue(added.isModified());
        assertEquals(1, added.getDepth());
        assertEquals(1, tree.getBooleanOperatorCountMax());
        assertEquals("!", tree.getContext().getFilterBooleanOperator());
        assertTrue(tree.getContext().isLocallyPatched());
    }

    @Test
    public void testAddTokenFallsBackToNextOfKin() {
        Branch tree = SearchFilterSerializer.parse("(name=sabi)");

        TokenMutationService.addToken(tree, negation(), Arrays.asList("before_booleanoperator"), random);

        assertEquals("(!name=sabi)", tree.getContent());
    }

    @Test
    public void testAddTokenUnresolvable() {
        Branch tree = SearchFilterSerializer.parse("(name=sabi)");

        assertThrows(TokenValidationException.class,
                () -> TokenMutationService.addToken(tree, negation(), Arrays.asList("before_branch"), random));
        assertThrows(TokenValidationException.class,
                () -> TokenMutationService.addToken(tree, negation(), Arrays.asList("middle_attribute"), random));
        assertThrows(TokenValidationException.class,
                () -> TokenMutationService.addToken(tree, negation(), Arrays.asList("before_nonsense"), random));
        assertEquals("(name=sabi)", tree.getContent());
    }

    @Test
    public void testResolveLocation() {
        Branch and = SearchFilterSerializer.parse("(&(a=1)(b=2))").getNestedBranches().get(0);

        assertEquals(Arrays.asList(3, 4), TokenMutationService.resolveLocation(and, "after_branch"));
        assertEquals(Arrays.asList(1), TokenMutationService.resolveLocation(and, "before_booleanoperator"));
        assertTrue(TokenMutationService.resolveLocation(and, "after_value").isEmpty());
    }

    @Test
    public void testRemoveToken() {
        Branch tree = SearchFilterSerializer.parse("(&(a=1)(b=2))");
        Branch and = tree.getNestedBranches().get(0);

        TokenMutationService.removeToken(and, and.getBooleanOperatorTokens().get(0));

        assertEquals("((a=1)(b=2))", tree.getContent());
        assertEquals(0, and.getBooleanOperatorCountMax());
        assertEquals("", and.getContext().getFilterListBooleanOperator());
    }

    @Test
    public void testRemoveTokenNotFound() {
        Branch and = SearchFilterSerializer.parse("(&(a=1)(b=2))").getNestedBranches().get(0);

        assertThrows(TokenValidationException.class, () -> TokenMutationService.removeToken(and, negation()));
    }

    @Test
    public void testRemoveGroupingCollapsesToFilter() {
        Branch tree = SearchFilterSerializer.parse("((name=sabi))");
        Branch wrapper = tree.getNestedBranches().get(0);

        TokenMutationService.removeToken(wrapper, wrapper.getGroupStart());
        assertTrue(wrapper.isFilterList());
        TokenMutationService.removeToken(wrapper, wrapper.getGroupEnd());

        assertTrue(wrapper.isFilter());
        assertEquals("(name=sabi)", wrapper.getFilter().getContent());
        assertEquals("(name=sabi)", tree.getContent());
    }

    @Test
    public void testRemoveOnlyAttributeRejected() {
        Branch tree = SearchFilterSerializer.parse("(name=sabi)");

        assertThrows(TokenValidationException.class,
                () -> TokenMutationService.removeToken(tree, tree.getFilter().getAttribute()));
    }

    @Test
    public void testEditValue() {
        Branch tree = SearchFilterSerializer.parse("(name=sabi)");

        Token value = TokenMutationService.editToken(tree, tree.getFilter().getValue(), "sa*bi");

        assertEquals("(name=sa*bi)", tree.getContent());
        assertTrue(value.isModified());
        assertEquals(1, value.getWildcardCount());
        assertEquals(1, tree.getBooleanOperatorLogicalCountMax());
    }

    @Test
    public void testEditValueToPresenceDropsTrailingWhitespace() {
        Branch tree = SearchFilterSerializer.parse("(name=*  )");

        TokenMutationService.editToken(tree, tree.getFilter().getValue(), "x*");
        assertEquals("(name=x*  )", tree.getContent());

        TokenMutationService.editToken(tree, tree.getFilter().getValue(), "*");
        assertEquals("(name=*)", tree.getContent());
    }

    @Test
    public void testEditBooleanOperator() {
        Branch tree = SearchFilterSerializer.parse("(&(a=1)(|(b=2)(c=3)))");
        Branch and = tree.getNestedBranches().get(0);
        Branch or = and.getNestedBranches().get(1);

        TokenMutationService.editToken(and, and.getBooleanOperatorTokens().get(0), "|");

        assertEquals("(|(a=1)(|(b=2)(c=3)))", tree.getContent());
        assertEquals("|", and.getContext().getFilterListBooleanOperator());
        assertTrue(and.getNestedBranches().get(0).getContext().isStale());
        assertTrue(or.getContext().isStale());
        // Only immediate nested branches are flagged
        assertFalse(or.getNestedBranches().get(0).getContext().isStale());

        TokenMutationService.editToken(and, and.getBooleanOperatorTokens().get(0), "");
        assertEquals("((a=1)(|(b=2)(c=3)))", tree.getContent());
    }

    @Test
    public void testEditInvalidContent() {
        Branch tree = SearchFilterSerializer.parse("(!name:1.2.3:=sabi)");
        Branch and = SearchFilterSerializer.parse("(&(a=1)(b=2))").getNestedBranches().get(0);

        assertThrows(TokenValidationException.class,
                () -> TokenMutationService.editToken(and, and.getBooleanOperatorTokens().get(0), "x"));
        assertThrows(TokenValidationException.class,
                () -> TokenMutationService.editToken(tree, tree.getFilter().getComparisonOperator(), "=="));
        assertThrows(TokenValidationException.class,
                () -> TokenMutationService.editToken(tree, tree.getFilter().getExtensibleMatchFilter(), "1.2.3"));
    }

    @Test
    public void testEditAttributeIntroducesExtensibleMatchFilter() {
        Branch tree = SearchFilterSerializer.parse("(name =sabi)");

        TokenMutationService.editToken(tree, tree.getFilter().getAttribute(), "name:1.2.3:");

        assertEquals("(name:1.2.3:=sabi)", tree.getContent());
        assertEquals(":1.2.3:", tree.getFilter().getExtensibleMatchFilter().getContent());
        assertEquals("name", tree.getFilter().getAttribute().getContent());
    }
}
