package com.ldap.searchfilter.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.BranchElement;
import com.ldap.searchfilter.model.Filter;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenType;

public class SearchFilterConverterTest {

    private static final String FILTER = "(&(a=1)(b=2))";

    @Test
    @SuppressWarnings("unchecked")
    public void testTokens() {
        List<Token> tokens = (List<Token>) SearchFilterConverter.convert(FILTER, SearchFilterFormat.TOKENS);

        assertEquals(13, tokens.size());
        assertNull(tokens.get(1).getTypeBefore());
        assertEquals(FILTER, SearchFilterConverter.convert(tokens, SearchFilterFormat.STRING));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testEnrichedTokens() {
        List<Token> tokens = (List<Token>) SearchFilterConverter.convert(FILTER, SearchFilterFormat.TOKENS_ENRICHED);

        assertEquals(TokenType.GROUP_START, tokens.get(1).getTypeBefore());
        assertEquals(TokenType.GROUP_START, tokens.get(1).getTypeAfter());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testFilters() {
        List<Filter> filters = (List<Filter>) SearchFilterConverter.convert(FILTER, SearchFilterFormat.FILTERS);

        assertEquals(2, filters.size());
        assertEquals("(a=1)", filters.get(0).getContent());
        assertEquals("(b=2)", filters.get(1).getContent());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testFiltersAndTokens() {
        List<BranchElement> elements = (List<BranchElement>) SearchFilterConverter.convert(FILTER,
                SearchFilterFormat.FILTERS_AND_TOKENS);

        assertEquals(5, elements.size());
        assertTrue(elements.get(2) instanceof Filter);
        assertEquals(FILTER, SearchFilterConverter.convert(elements, SearchFilterFormat.STRING));
    }

    @Test
    public void testBranches() {
        Object tree = SearchFilterConverter.convert(FILTER, SearchFilterFormat.BRANCHES);

        assertTrue(tree instanceof Branch);
        assertSame(tree, SearchFilterConverter.convert(tree, SearchFilterFormat.BRANCHES));
    }

    @Test
    public void testFormatNames() {
        assertEquals(SearchFilterFormat.TOKENS_ENRICHED, SearchFilterFormat.findByName("tokens-enriched"));
        assertNull(SearchFilterFormat.findByName("xml"));
    }

    @Test
    public void testUnsupportedInput() {
        assertThrows(IllegalArgumentException.class, () -> SearchFilterConverter.convert(42, SearchFilterFormat.STRING));
    }
}
