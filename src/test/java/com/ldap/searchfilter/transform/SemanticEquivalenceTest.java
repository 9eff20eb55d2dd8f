package com.ldap.searchfilter.transform;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.config.DeobfuscationConfig;
import com.ldap.searchfilter.parser.SearchFilterSerializer;

/**
 * Every transform, alone and in the full pipeline, must keep the logical meaning of a filter.
 */
public class SemanticEquivalenceTest {

    private static final List<String> FILTERS = Arrays.asList(
            "((name=sabi))",
            "((((|((((((((((((name=sabi))))))))))))(((name=dbo)))))))",
            "(|(|name=sabi)(&name=dbo))",
            "(!(&(!name=sabi)(!name=dbo)))",
            "  (  name=   sabi)  ",
            "(name=***sa**bi)",
            "(name:timeSaved:=sabi)",
            "(!name:1.3.3.7:=sabi)",
            "(&(a=1)(&(b=2)(c=3)))",
            "(|(a=1)(&(b=2)(c=3)))",
            "(!(!(&(a=1)(b=2))))",
            "(&&(a=1)(b=2))",
            "(!!(a=1))",
            "(!((a=1)(b=2)))",
            "(!(&(a=1)(|(b=2)(c=3))))",
            "(!(&(a=1)((b=2)(c=3))))",
            "(!(&(a=1)(((b=2)(c=3))(d=4))))",
            "(&(a=1)((b=2)(c=3)))",
            "(|(a=1)((b=2)(c=3)))",
            "(&(!(!name=x))(y=1))",
            "( & (a=1) ( | (b=2) (!c=3) ) )",
            "(|(&(a=1)(b=2))(!(|(c=3)(d=4))))",
            "(member=CN=sabi , OU=Users,DC=corp)",
            "(&(uac:1.2.840.113556.1.4.803:=2)(!(name=x)))",
            "(&|(a=1)(b=2))",
            "(|(!((a=1)(b=2))))",
            "(|(!(((a=1)(b=2))(c=3))))",
            "(|(!(((a=1)(b=2))(c=3)))(d=4))",
            "(!|(!(((a3=*)(a0=x)(|!a1=**x))(a2=y*))))");

    @Test
    public void testEachTransformKeepsMeaning() {
        for (TransformType type : TransformType.values()) {
            SearchFilterTransform transform = type.newTransform();
            for (String filter : FILTERS) {
                String result = transform.transform(SearchFilterSerializer.parse(filter), FullStrengthOptions.create()).getContent();
                assertTrue(FilterEvaluator.isEquivalent(filter, result), type + ": " + filter + " -> " + result);
            }
        }
    }

    @Test
    public void testZeroPercentIsIdentity() {
        TransformOptions options = FullStrengthOptions.create();
        options.setRandomNodePercent(0);
        for (TransformType type : TransformType.values()) {
            SearchFilterTransform transform = type.newTransform();
            for (String filter : FILTERS) {
                assertEquals(filter, transform.transform(SearchFilterSerializer.parse(filter), options).getContent(),
                        type.getName());
            }
        }
    }

    @Test
    public void testPipelineKeepsMeaning() {
        for (long seed = 0; seed < 5; seed++) {
            DeobfuscationConfig config = new DeobfuscationConfig();
            config.setRandomNodePercent(seed == 0 ? 100 : 50);
            config.setRandomCharPercent(seed == 0 ? 100 : 50);
            config.setSeed(seed);
            DeobfuscationPipeline pipeline = config.toPipeline();
            for (String filter : FILTERS) {
                String result = pipeline.run(filter).getOutputString();
                assertTrue(FilterEvaluator.isEquivalent(filter, result), filter + " -> " + result);
            }
        }
    }

    @Test
    public void testEvaluatorDistinguishesFilters() {
        assertFalse(FilterEvaluator.isEquivalent("(&(a=1)(b=2))", "(|(a=1)(b=2))"));
        assertFalse(FilterEvaluator.isEquivalent("(a=1)", "(!a=1)"));
        assertFalse(FilterEvaluator.isEquivalent("(name:1.3.3.7:=x)", "(name=x)"));
        assertTrue(FilterEvaluator.isEquivalent("(!(|(a=1)(b=2)))", "(&(!a=1)(!b=2))"));
    }

    @Test
    public void testEvaluatorEffectiveOperator() {
        // No & or | anywhere in the chain evaluates as &
        assertTrue(FilterEvaluator.isEquivalent("((a=1)(b=2))", "(&(a=1)(b=2))"));
        assertTrue(FilterEvaluator.isEquivalent("(|!(!(a=1)(b=2)))", "(|(a=1)(b=2))"));
        assertFalse(FilterEvaluator.isEquivalent("(|&(a=1)(b=2))", "(|(a=1)(b=2))"));
        assertEquals('|', FilterEvaluator.lastAndOr("&!|!"));
        assertEquals(0, FilterEvaluator.lastAndOr("!!"));
    }
}
