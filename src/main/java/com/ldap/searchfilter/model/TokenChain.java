package com.ldap.searchfilter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable chain of tokens that shares its prefix with the chain it was extended from, so the
 * chains of a deep run of nested branches take space in proportion to the run, not its square.
 */
public final class TokenChain {

    public static final TokenChain EMPTY = new TokenChain(null, Collections.<Token>emptyList());

    private final TokenChain prefix;
    private final List<Token> tokens;
    private final int size;

    private TokenChain(TokenChain prefix, List<Token> tokens) {
        this.prefix = prefix;
        this.tokens = tokens;
        this.size = (prefix == null ? 0 : prefix.size) + tokens.size();
    }

    public static TokenChain of(List<Token> tokens) {
        return EMPTY.extend(tokens);
    }

    public TokenChain extend(List<Token> more) {
        if (more == null || more.isEmpty()) {
            return this;
        }
        return new TokenChain(this, Collections.unmodifiableList(new ArrayList<>(more)));
    }

    public int size() {
        return size;
    }

    /** Tokens outermost first. */
    public List<Token> toList() {
        List<List<Token>> parts = new ArrayList<>();
        for (TokenChain chain = this; chain != null; chain = chain.prefix) {
            parts.add(chain.tokens);
        }
        List<Token> list = new ArrayList<>(size);
        for (int i = parts.size() - 1; i >= 0; i--) {
            list.addAll(parts.get(i));
        }
        return list;
    }

    public String getContent() {
        StringBuilder sb = new StringBuilder();
        for (Token token : toList()) {
            sb.append(token.getContent());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getContent();
    }
}
