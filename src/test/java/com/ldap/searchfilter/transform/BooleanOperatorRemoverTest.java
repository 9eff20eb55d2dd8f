package com.ldap.searchfilter.transform;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.parser.SearchFilterSerializer;

public class BooleanOperatorRemoverTest {

    private final BooleanOperatorRemover remover = new BooleanOperatorRemover();

    private String run(String filter, TransformOptions options) {
        return remover.transform(SearchFilterSerializer.parse(filter), options).getContent();
    }

    private String run(String filter) {
        return run(filter, FullStrengthOptions.create());
    }

    @Test
    public void testRedundantFilterOperators() {
        assertEquals("(|(name=sabi)(name=dbo))", run("(|(|name=sabi)(&name=dbo))"));
    }

    @Test
    public void testRedundantNestedOperator() {
        assertEquals("(&(a=1)((b=2)(c=3)))", run("(&(a=1)(&(b=2)(c=3)))"));
        assertEquals("(|(a=1)(&(b=2)(c=3)))", run("(|(a=1)(&(b=2)(c=3)))"));
    }

    @Test
    public void testRepeatedOperator() {
        assertEquals("(&(a=1)(b=2))", run("(&&(a=1)(b=2))"));
    }

    @Test
    public void testDoubleNegation() {
        assertEquals("((a=1))", run("(!!(a=1))"));
        assertEquals("(((&(a=1)(b=2))))", run("(!(!(&(a=1)(b=2))))"));
    }

    @Test
    public void testNegationKept() {
        assertEquals("(!(a=1))", run("(!(a=1))"));
        assertEquals("(!a=1)", run("(!a=1)"));
    }

    @Test
    public void testOperatorAllowList() {
        TransformOptions options = FullStrengthOptions.create();
        options.setBooleanOperators(Arrays.asList("&"));

        assertEquals("(|(|name=sabi)(name=dbo))", run("(|(|name=sabi)(&name=dbo))", options));
        assertThrows(IllegalArgumentException.class, () -> options.setBooleanOperators(Arrays.asList("&&&")));
    }

    @Test
    public void testScopes() {
        TransformOptions filterListOnly = FullStrengthOptions.create();
        filterListOnly.setBooleanOperatorScopes(EnumSet.of(BooleanOperatorScope.FILTER_LIST));
        assertEquals("(|(|name=sabi)(&name=dbo))", run("(|(|name=sabi)(&name=dbo))", filterListOnly));
        assertEquals("(&(a=1)((b=2)(c=3)))", run("(&(a=1)(&(b=2)(c=3)))", filterListOnly));
    }

    @Test
    public void testZeroPercent() {
        TransformOptions options = FullStrengthOptions.create();
        options.setRandomNodePercent(0);

        assertEquals("(|(|name=sabi)(&name=dbo))", run("(|(|name=sabi)(&name=dbo))", options));
    }

    @Test
    public void testFindOperatorDescendant() {
        Branch tree = SearchFilterSerializer.parse("(!((!(&(a=1)(b=2)))))");
        Branch outer = tree.getNestedBranches().get(0);

        Branch descendant = BooleanOperatorRemover.findOperatorDescendant(outer);
        assertNotNull(descendant);
        assertEquals("(!(&(a=1)(b=2)))", descendant.getContent());
        assertNull(BooleanOperatorRemover.findOperatorDescendant(descendant.getNestedBranches().get(0)));
    }

    @Test
    public void testMeaningKept() {
        for (String filter : Arrays.asList("(!((!(&(a=1)(b=2)))))", "(&|(a=1)(!!b=2))", "(|(!(|(a=1)(b=2)))(&(c=3)))")) {
            String result = run(filter);
            assertTrue(FilterEvaluator.isEquivalent(filter, result), filter + " -> " + result);
        }
    }

    @Test
    public void testDeeplyNestedNegations() {
        int depth = 20000;
        String filter = "(!".repeat(depth) + "a=1" + ")".repeat(depth);

        String result = assertTimeout(Duration.ofSeconds(30), () -> run(filter));
        // Every negation pairs up with the one below it
        assertEquals("(".repeat(depth) + "a=1" + ")".repeat(depth), result);
    }

    @Test
    public void testNestedNegationsKeepMeaning() {
        for (int depth = 1; depth <= 6; depth++) {
            String filter = "(!".repeat(depth) + "(&(a=1)(b=2))" + ")".repeat(depth);
            String result = run(filter);
            assertTrue(FilterEvaluator.isEquivalent(filter, result), filter + " -> " + result);
            assertEquals(depth % 2, result.length() - result.replace("!", "").length());
        }
    }
}
