package com.ldap.searchfilter.transform;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.parser.SearchFilterSerializer;
import com.ldap.searchfilter.parser.ValueParser;

public class WildcardRemoverTest {

    private final WildcardRemover remover = new WildcardRemover();

    private String run(String filter, TransformOptions options) {
        return remover.transform(SearchFilterSerializer.parse(filter), options).getContent();
    }

    @Test
    public void testCollapseRuns() {
        assertEquals("(name=*sa*bi)", run("(name=***sa**bi)", FullStrengthOptions.create()));
        assertEquals("(name=*)", run("(name=**)", FullStrengthOptions.create()));
        assertEquals("(&(a=*x*)(b=*))", run("(&(a=**x***)(b=***))", FullStrengthOptions.create()));
    }

    @Test
    public void testEscapedAsteriskIsLiteral() {
        assertEquals("(name=\\2a\\2a*)", run("(name=\\2a\\2a*)", FullStrengthOptions.create()));
        assertEquals("(name=*\\2a*)", run("(name=**\\2a**)", FullStrengthOptions.create()));
    }

    @Test
    public void testHasWildcardRun() {
        assertTrue(WildcardRemover.hasWildcardRun(ValueParser.parseChars("a**", 0)));
        assertFalse(WildcardRemover.hasWildcardRun(ValueParser.parseChars("*a*", 0)));
        assertFalse(WildcardRemover.hasWildcardRun(ValueParser.parseChars("*\\2a", 0)));
    }

    @Test
    public void testZeroPercent() {
        TransformOptions noNodes = FullStrengthOptions.create();
        noNodes.setRandomNodePercent(0);
        assertEquals("(name=***sa**bi)", run("(name=***sa**bi)", noNodes));

        TransformOptions noChars = FullStrengthOptions.create();
        noChars.setRandomCharPercent(0);
        assertEquals("(name=***sa**bi)", run("(name=***sa**bi)", noChars));
    }

    @Test
    public void testPartialRemovalKeepsOneWildcard() {
        for (long seed = 0; seed < 20; seed++) {
            TransformOptions options = FullStrengthOptions.create();
            options.setRandomCharPercent(50);
            options.setSeed(seed);
            String result = run("(name=*****sa***bi)", options);
            assertTrue(result.startsWith("(name=*"), result);
            assertTrue(result.contains("sa*"), result);
            assertTrue(FilterEvaluator.isEquivalent("(name=*****sa***bi)", result), result);
        }
    }
}
