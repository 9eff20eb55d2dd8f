package com.ldap.searchfilter.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenSubType;
import com.ldap.searchfilter.model.TokenType;
import com.ldap.searchfilter.service.TokenMutationService;

public class SearchFilterSerializerTest {

    private static final List<String> FILTERS = Arrays.asList(
            "(name=sabi)",
            "name=sabi",
            "  ( &  (a=1)( | (b=2) (c=*  )) )  ",
            "(!(&(!name=sabi)(!name=dbo)))",
            "(|((((name=sabi))))(name=dbo))",
            "(userAccountControl:1.2.840.113556.1.4.803:=2)",
            "(name:dn:=sabi)",
            "(name=s\\61bi\\c3\\a9)",
            "(member=CN=sabi , OU=Users,DC=corp)",
            "(&|!(name=***sa**bi))");

    @Test
    public void testRoundTrip() {
        for (String filter : FILTERS) {
            assertEquals(filter, SearchFilterSerializer.toString(SearchFilterSerializer.parse(filter)), filter);
        }
    }

    @Test
    public void testReparseKeepsIdentity() {
        Branch tree = SearchFilterSerializer.parse("(&(a=1)(b=2))");
        List<UUID> before = tree.flattenTokens().stream().map(Token::getGuid).collect(Collectors.toList());

        Branch reparsed = SearchFilterSerializer.reparse(tree);

        assertNotSame(tree, reparsed);
        assertEquals(before, reparsed.flattenTokens().stream().map(Token::getGuid).collect(Collectors.toList()));
    }

    @Test
    public void testReparseTracksModification() {
        Branch tree = SearchFilterSerializer.parse("(&(a=1)(b=2))");
        Branch first = tree.getNestedBranches().get(0).getNestedBranches().get(0);
        Token value = first.getFilter().getValue();
        TokenMutationService.editToken(first, value, "x");

        Branch tracked = SearchFilterSerializer.reparse(tree, true);
        Token trackedValue = tracked.getNestedBranches().get(0).getNestedBranches().get(0).getFilter().getValue();
        assertEquals("x", trackedValue.getContent());
        assertEquals(value.getGuid(), trackedValue.getGuid());
        assertTrue(trackedValue.isModified());
        // The second value was never touched
        assertFalse(tracked.getNestedBranches().get(0).getNestedBranches().get(1).getFilter().getValue().isModified());

        Branch untracked = SearchFilterSerializer.reparse(tree, false);
        for (Token token : untracked.flattenTokens()) {
            assertFalse(token.isModified());
        }
    }

    @Test
    public void testReparseMergesAdjacentWhitespace() {
        Branch tree = SearchFilterSerializer.parse("(& (a=1)(b=2))");
        Branch and = tree.getNestedBranches().get(0);
        Token original = and.getTokens(TokenType.WHITESPACE).get(0);
        TokenMutationService.addToken(and, TokenMutationService.newToken(TokenType.WHITESPACE, "  "),
                Arrays.asList("after_whitespace"), new Random(1));
        assertEquals("(&   (a=1)(b=2))", and.getContent());

        Branch reparsed = SearchFilterSerializer.reparse(tree);
        Token merged = reparsed.getNestedBranches().get(0).getTokens(TokenType.WHITESPACE).get(0);

        assertEquals("   ", merged.getContent());
        assertEquals(original.getGuid(), merged.getGuid());
        assertEquals(2, merged.getTokenList().size());
        assertEquals(TokenSubType.MERGED_WHITESPACE, merged.getTokenList().get(0).getSubType());
        assertEquals("  ", merged.getTokenList().get(1).getContent());
    }
}
