package com.ldap.searchfilter.transform;

import java.util.List;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.ParsedChar;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.service.BranchVisitor;
import com.ldap.searchfilter.service.TokenMutationService;

/**
 * Collapses runs of consecutive unescaped {@code *} in Values. Each extra wildcard of a run is
 * removed independently with {@code randomCharPercent}; the first one of a run always stays.
 */
public class WildcardRemover extends AbstractSearchFilterTransform {

    public static final String NAME = "Wildcard";

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
            Token value = branch.getFilter().getValue();
            if (value == null || !hasWildcardRun(value.getParsedChars()) || !options.rollNode()) {
                continue;
            }
            String collapsed = collapse(value.getParsedChars(), options);
            if (!collapsed.equals(value.getContent())) {
                String before = value.getContent();
                TokenMutationService.editToken(branch, value, collapsed);
                logger.debug("Collapsed wildcards '{}' -> '{}' at depth {}", before, collapsed, branch.getDepth());
                changes++;
            }
        }
        return changes;
    }

    static boolean hasWildcardRun(List<ParsedChar> chars) {
        for (int i = 1; i < chars.size(); i++) {
            if (chars.get(i).isWildcard() && chars.get(i - 1).isWildcard()) {
                return true;
            }
        }
        return false;
    }

    private static String collapse(List<ParsedChar> chars, TransformOptions options) {
        StringBuilder sb = new StringBuilder();
        boolean previousWildcard = false;
        for (ParsedChar pc : chars) {
            if (pc.isWildcard() && previousWildcard && options.rollChar()) {
                continue;
            }
            previousWildcard = pc.isWildcard();
            sb.append(pc.getContent());
        }
        return sb.toString();
    }
}
