package com.ldap.searchfilter.transform;

import java.util.Set;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.service.BranchVisitor;
import com.ldap.searchfilter.service.TokenMutationService;

/**
 * Removes or redacts ExtensibleMatchFilters whose matching rule the directory does not support.
 *
 * An unsupported rule without a period is ignored by the server and is removed. An unsupported
 * rule with a period makes the clause never match, so it is kept in the constant form
 * {@value #REDACTED}.
 */
public class ExtensibleMatchFilterRemover extends AbstractSearchFilterTransform {

    public static final String NAME = "ExtensibleMatchFilter";

    public static final String REDACTED = ":.:";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int apply(Branch tree, TransformOptions options) {
        int changes = 0;
        for (Branch branch : BranchVisitor.preOrder(tree)) {
            if (!branch.isFilter()) {
                continue;
            }
            Token rule = branch.getFilter().getExtensibleMatchFilter();
            if (rule == null || REDACTED.equals(rule.getContent())
                    || isSupported(rule.getContent(), options.getSupportedMatchingRules())) {
                continue;
            }
            boolean hasPeriod = rule.getContent().indexOf('.') >= 0;
            ExtensibleMatchFilterScope scope = hasPeriod ? ExtensibleMatchFilterScope.REDACT : ExtensibleMatchFilterScope.REMOVE;
            if (!options.getExtensibleMatchFilterScopes().contains(scope) || !options.rollNode()) {
                continue;
            }
            String before = rule.getContent();
            TokenMutationService.editToken(branch, rule, hasPeriod ? REDACTED : "");
            logger.debug("{} ExtensibleMatchFilter '{}' at depth {}", hasPeriod ? "Redacted" : "Removed", before,
                    branch.getDepth());
            changes++;
        }
        return changes;
    }

    public static boolean isSupported(String content, Set<String> supportedRules) {
        String resolved = resolveRule(content);
        return !resolved.isEmpty() && supportedRules.contains(resolved);
    }

    /**
     * Normalizes an ExtensibleMatchFilter such as {@code :dn:OID.1.2.840.113556.1.4.0803:} to the bare
     * rule {@code 1.2.840.113556.1.4.803}: colons and the {@code dn} flag are dropped, an
     * {@code oid.} prefix is stripped and leading zeros are removed from numeric arcs.
     */
    public static String resolveRule(String content) {
        StringBuilder rule = new StringBuilder();
        for (String segment : content.split(":")) {
            if (segment.isEmpty() || "dn".equalsIgnoreCase(segment)) {
                continue;
            }
            rule.append(segment);
        }
        String resolved = rule.toString();
        if (resolved.regionMatches(true, 0, "oid.", 0, 4)) {
            resolved = resolved.substring(4);
        }
        String[] arcs = resolved.split("\\.", -1);
        StringBuilder normalized = new StringBuilder();
        for (int i = 0; i < arcs.length; i++) {
            String arc = arcs[i];
            if (!arc.isEmpty() && arc.chars().allMatch(Character::isDigit)) {
                arc = arc.replaceFirst("^0+(?=\\d)", "");
            }
            if (i > 0) {
                normalized.append('.');
            }
            normalized.append(arc);
        }
        return normalized.toString();
    }
}
