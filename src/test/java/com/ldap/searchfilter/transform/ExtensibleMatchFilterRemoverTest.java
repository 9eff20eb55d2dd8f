package com.ldap.searchfilter.transform;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.parser.SearchFilterSerializer;

public class ExtensibleMatchFilterRemoverTest {

    private final ExtensibleMatchFilterRemover remover = new ExtensibleMatchFilterRemover();

    private String run(String filter, TransformOptions options) {
        return remover.transform(SearchFilterSerializer.parse(filter), options).getContent();
    }

    private String run(String filter) {
        return run(filter, FullStrengthOptions.create());
    }

    @Test
    public void testRemoveIgnoredRule() {
        assertEquals("(name=sabi)", run("(name:timeSaved:=sabi)"));
        assertEquals("(name=sabi)", run("(name:dn:=sabi)"));
    }

    @Test
    public void testRedactUnsupportedRule() {
        assertEquals("(!name:.:=sabi)", run("(!name:1.3.3.7:=sabi)"));
        assertEquals("(name:.:=sabi)", run("(name:.:=sabi)"));
    }

    @Test
    public void testSupportedRuleKept() {
        assertEquals("(userAccountControl:1.2.840.113556.1.4.803:=2)", run("(userAccountControl:1.2.840.113556.1.4.803:=2)"));
        assertEquals("(uac:OID.1.2.840.113556.1.4.0803:=2)", run("(uac:OID.1.2.840.113556.1.4.0803:=2)"));
        assertEquals("(memberOf:dn:1.2.840.113556.1.4.1941:=CN=a,DC=b)", run("(memberOf:dn:1.2.840.113556.1.4.1941:=CN=a,DC=b)"));
    }

    @Test
    public void testCustomSupportedRules() {
        TransformOptions options = FullStrengthOptions.create();
        Set<String> rules = new HashSet<>(options.getSupportedMatchingRules());
        rules.add("1.3.3.7");
        options.setSupportedMatchingRules(rules);

        assertEquals("(!name:1.3.3.7:=sabi)", run("(!name:1.3.3.7:=sabi)", options));
    }

    @Test
    public void testScopes() {
        TransformOptions removeOnly = FullStrengthOptions.create();
        removeOnly.setExtensibleMatchFilterScopes(EnumSet.of(ExtensibleMatchFilterScope.REMOVE));
        assertEquals("(!name:1.3.3.7:=sabi)", run("(!name:1.3.3.7:=sabi)", removeOnly));
        assertEquals("(name=sabi)", run("(name:timeSaved:=sabi)", removeOnly));

        TransformOptions redactOnly = FullStrengthOptions.create();
        redactOnly.setExtensibleMatchFilterScopes(EnumSet.of(ExtensibleMatchFilterScope.REDACT));
        assertEquals("(name:timeSaved:=sabi)", run("(name:timeSaved:=sabi)", redactOnly));
    }

    @Test
    public void testZeroPercent() {
        TransformOptions options = FullStrengthOptions.create();
        options.setRandomNodePercent(0);

        assertEquals("(name:timeSaved:=sabi)", run("(name:timeSaved:=sabi)", options));
    }

    @Test
    public void testResolveRule() {
        assertEquals("1.2.840.113556.1.4.803", ExtensibleMatchFilterRemover.resolveRule(":dn:OID.1.2.840.113556.1.4.0803:"));
        assertEquals("caseExactMatch", ExtensibleMatchFilterRemover.resolveRule(":caseExactMatch:"));
        assertEquals("0", ExtensibleMatchFilterRemover.resolveRule(":0:"));
        assertEquals("", ExtensibleMatchFilterRemover.resolveRule(":dn:"));
        assertTrue(ExtensibleMatchFilterRemover.isSupported(":1.2.840.113556.1.4.804:",
                TransformOptions.DEFAULT_SUPPORTED_MATCHING_RULES));
        assertFalse(ExtensibleMatchFilterRemover.isSupported(":dn:", TransformOptions.DEFAULT_SUPPORTED_MATCHING_RULES));
    }
}
