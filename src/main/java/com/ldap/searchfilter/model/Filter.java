package com.ldap.searchfilter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A single comparison clause, e.g. {@code (!name=sabi)}. Owns its tokens both as an ordered list
 * and as a type-keyed lookup. The cached content is rebuilt on every token insert/remove/refresh.
 */
public class Filter implements BranchElement {

    private final List<Token> tokens;
    private final Map<TokenType, List<Token>> tokenDict = new EnumMap<>(TokenType.class);
    private String content = "";
    private int depth;

    public Filter(List<Token> tokens, int depth) {
        this.tokens = new ArrayList<>(tokens);
        this.depth = depth;
        refresh();
    }

    /**
     * Re-derives the cached content and the type-keyed lookup from the ordered token list.
     */
    public void refresh() {
        tokenDict.clear();
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            tokenDict.computeIfAbsent(token.getType(), t -> new ArrayList<>()).add(token);
            sb.append(token.getContent());
        }
        content = sb.toString();
    }

    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public Map<TokenType, List<Token>> getTokenDict() {
        return Collections.unmodifiableMap(tokenDict);
    }

    public List<Token> getTokens(TokenType type) {
        List<Token> list = tokenDict.get(type);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    private Token first(TokenType type) {
        List<Token> list = tokenDict.get(type);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    public Token getAttribute() {
        return first(TokenType.ATTRIBUTE);
    }

    public Token getExtensibleMatchFilter() {
        return first(TokenType.EXTENSIBLE_MATCH_FILTER);
    }

    public Token getComparisonOperator() {
        return first(TokenType.COMPARISON_OPERATOR);
    }

    public Token getValue() {
        return first(TokenType.VALUE);
    }

    public List<Token> getBooleanOperatorTokens() {
        return getTokens(TokenType.BOOLEAN_OPERATOR);
    }

    /** Concatenated Filter-scope operators, e.g. "!" for {@code (!name=sabi)}. */
    public String getBooleanOperator() {
        StringBuilder sb = new StringBuilder();
        for (Token token : getBooleanOperatorTokens()) {
            sb.append(token.getContent());
        }
        return sb.toString();
    }

    public boolean hasGroupTokens() {
        return tokenDict.containsKey(TokenType.GROUP_START);
    }

    /**
     * True when the lookup holds exactly one Attribute, ComparisonOperator and Value and at most one
     * ExtensibleMatchFilter.
     */
    public boolean isComplete() {
        return getTokens(TokenType.ATTRIBUTE).size() == 1
                && getTokens(TokenType.COMPARISON_OPERATOR).size() == 1
                && getTokens(TokenType.VALUE).size() == 1
                && getTokens(TokenType.EXTENSIBLE_MATCH_FILTER).size() <= 1;
    }

    public int indexOf(Token token) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).matches(token)) {
                return i;
            }
        }
        return -1;
    }

    public void insertToken(int index, Token token) {
        tokens.add(index, token);
        refresh();
    }

    public Token removeTokenAt(int index) {
        Token removed = tokens.remove(index);
        refresh();
        return removed;
    }

    @Override
    public String getContent() {
        return content;
    }

    @Override
    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public int getStart() {
        return tokens.isEmpty() ? -1 : tokens.get(0).getStart();
    }

    public int getLength() {
        return content.length();
    }

    @Override
    public String toString() {
        return content;
    }
}
