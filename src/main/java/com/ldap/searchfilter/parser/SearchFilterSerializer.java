package com.ldap.searchfilter.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.BranchElement;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenSubType;
import com.ldap.searchfilter.model.TokenType;

/**
 * Canonical string form of any representation, and the full reparse that makes offsets, depths,
 * lookups and contexts authoritative again after incremental edits.
 */
public class SearchFilterSerializer {

    public static String toString(Branch branch) {
        return branch.getContent();
    }

    public static String toString(List<? extends BranchElement> elements) {
        StringBuilder sb = new StringBuilder();
        for (BranchElement element : elements) {
            sb.append(element.getContent());
        }
        return sb.toString();
    }

    public static Branch parse(String searchFilter) {
        return BranchBuilder.build(SearchFilterLexer.tokenize(searchFilter));
    }

    public static Branch reparse(Branch tree) {
        return reparse(tree, false);
    }

    /**
     * Serializes the tree and parses it again. Token identities survive where a new token sits at
     * the same output offset with the same type and content as an old one. Runs of adjacent old
     * Whitespace tokens that now lex as one token are kept in its token list.
     *
     * @param trackModification keep the modified flag of carried-over tokens, otherwise clear all flags
     */
    public static Branch reparse(Branch tree, boolean trackModification) {
        List<Token> oldTokens = tree.flattenTokens();
        Map<Integer, List<Token>> oldByOffset = new HashMap<>();
        int offset = 0;
        for (Token token : oldTokens) {
            oldByOffset.computeIfAbsent(offset, k -> new ArrayList<>()).add(token);
            offset += token.getLength();
        }
        String content = toString(tree);
        Branch reparsed = parse(content);

        for (Token token : reparsed.flattenTokens()) {
            List<Token> candidates = oldByOffset.get(token.getStart());
            if (candidates == null) {
                continue;
            }
            Token exact = null;
            for (Token candidate : candidates) {
                if (candidate.getType() == token.getType() && candidate.getContent().equals(token.getContent())) {
                    exact = candidate;
                    break;
                }
            }
            if (exact != null) {
                token.setGuid(exact.getGuid());
                token.setModified(trackModification && exact.isModified());
            } else if (token.isType(TokenType.WHITESPACE)) {
                mergeWhitespace(token, oldByOffset, trackModification);
            }
        }
        return reparsed;
    }

    private static void mergeWhitespace(Token merged, Map<Integer, List<Token>> oldByOffset, boolean trackModification) {
        List<Token> runs = new ArrayList<>();
        int offset = merged.getStart();
        int end = merged.getStart() + merged.getLength();
        while (offset < end) {
            Token run = null;
            List<Token> candidates = oldByOffset.get(offset);
            if (candidates != null) {
                for (Token candidate : candidates) {
                    if (candidate.isType(TokenType.WHITESPACE) && candidate.getLength() > 0) {
                        run = candidate;
                        break;
                    }
                }
            }
            if (run == null) {
                return;
            }
            runs.add(run);
            offset += run.getLength();
        }
        if (offset != end || runs.size() < 2) {
            return;
        }
        List<Token> nested = new ArrayList<>();
        boolean modified = false;
        for (Token run : runs) {
            Token copy = run.copy();
            copy.setSubType(TokenSubType.MERGED_WHITESPACE);
            nested.add(copy);
            modified |= run.isModified();
        }
        merged.setGuid(runs.get(0).getGuid());
        merged.setTokenList(nested);
        merged.setModified(trackModification && modified);
    }
}
