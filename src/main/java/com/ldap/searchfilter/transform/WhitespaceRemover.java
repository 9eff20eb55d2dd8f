package com.ldap.searchfilter.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenType;
import com.ldap.searchfilter.service.BranchVisitor;
import com.ldap.searchfilter.service.TokenMutationService;

/**
 * Removes or shrinks insignificant Whitespace tokens, including the whitespace inside
 * Distinguished-Name values.
 */
public class WhitespaceRemover extends AbstractSearchFilterTransform {

    public static final String NAME = "Whitespace";

    private static final int MAX_SHRINK = 3;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int apply(Branch tree, TransformOptions options) {
        int changes = 0;
        for (Branch branch : BranchVisitor.preOrder(tree)) {
            for (Token token : new ArrayList<>(branch.getTokens())) {
                if (token.isType(TokenType.WHITESPACE)) {
                    if (isAdjacentTo(token, options.getWhitespaceAdjacentTypes()) && options.rollNode()) {
                        String trimmed = trim(token.getContent(), options);
                        if (trimmed.isEmpty()) {
                            TokenMutationService.removeToken(branch, token);
                        } else {
                            TokenMutationService.editToken(branch, token, trimmed);
                        }
                        changes++;
                    }
                } else if (options.isIncludeRdn() && token.isType(TokenType.VALUE) && token.hasRdnTokens()) {
                    changes += trimRdnWhitespace(branch, token, options);
                }
            }
        }
        return changes;
    }

    private int trimRdnWhitespace(Branch branch, Token value, TransformOptions options) {
        int changes = 0;
        List<Token> rdnTokens = value.getTokenList();
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < rdnTokens.size(); i++) {
            Token rdnToken = rdnTokens.get(i);
            String part = rdnToken.getContent();
            if (rdnToken.isType(TokenType.WHITESPACE) && isAdjacentTo(rdnTokens, i, options.getWhitespaceAdjacentTypes())
                    && options.rollNode()) {
                part = trim(part, options);
                changes++;
            }
            content.append(part);
        }
        if (changes > 0) {
            TokenMutationService.editToken(branch, value, content.toString());
            logger.debug("Trimmed {} RDN Whitespace token(s) in Value", changes);
        }
        return changes;
    }

    /**
     * Removes the whole run, or shrinks it by up to three characters taken from its start or end.
     */
    String trim(String whitespace, TransformOptions options) {
        if (whitespace.length() == 1 || options.rollNode()) {
            return "";
        }
        int shrink = 1 + options.getRandom().nextInt(Math.min(MAX_SHRINK, whitespace.length() - 1));
        return options.getRandom().nextBoolean() ? whitespace.substring(shrink)
                : whitespace.substring(0, whitespace.length() - shrink);
    }

    private static boolean isAdjacentTo(Token token, Set<TokenType> types) {
        return (token.getTypeBefore() != null && types.contains(token.getTypeBefore()))
                || (token.getTypeAfter() != null && types.contains(token.getTypeAfter()));
    }

    private static boolean isAdjacentTo(List<Token> tokens, int index, Set<TokenType> types) {
        TokenType before = index > 0 ? tokens.get(index - 1).getType() : null;
        TokenType after = index < tokens.size() - 1 ? tokens.get(index + 1).getType() : null;
        return (before != null && types.contains(before)) || (after != null && types.contains(after));
    }
}
