package com.ldap.searchfilter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Smallest unit of a SearchFilter. Content is kept exactly as written (hex escapes included);
 * decoded forms are available through {@link #getParsedChars()} for Value tokens.
 *
 * Setters exist for the parser and for {@code TokenMutationService}; anything else should
 * go through the mutation service so that the owning Filter/Branch stays consistent.
 */
public class Token implements BranchElement {

    private UUID guid;
    private String content;
    private final TokenType type;
    private TokenSubType subType;
    private int start;
    private int depth;

    // Enrichment layer
    private TokenType typeBefore;
    private TokenType typeAfter;

    private List<Token> tokenList = new ArrayList<>();
    private List<ParsedChar> parsedChars = Collections.emptyList();
    private boolean modified = false;

    public Token(TokenType type, String content, int start, int depth) {
        this(UUID.randomUUID(), type, content, start, depth);
    }

    public Token(UUID guid, TokenType type, String content, int start, int depth) {
        this.guid = Objects.requireNonNull(guid);
        this.type = Objects.requireNonNull(type);
        this.content = content == null ? "" : content;
        this.start = start;
        this.depth = depth;
    }

    /**
     * Copy keeping the same identity, so the copy can still be located in the original tree.
     */
    public Token copy() {
        Token copy = new Token(guid, type, content, start, depth);
        copy.subType = subType;
        copy.typeBefore = typeBefore;
        copy.typeAfter = typeAfter;
        copy.modified = modified;
        copy.parsedChars = parsedChars;
        for (Token nested : tokenList) {
            copy.tokenList.add(nested.copy());
        }
        return copy;
    }

    public UUID getGuid() {
        return guid;
    }

    public void setGuid(UUID guid) {
        this.guid = Objects.requireNonNull(guid);
    }

    @Override
    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content == null ? "" : content;
    }

    public TokenType getType() {
        return type;
    }

    public TokenSubType getSubType() {
        return subType;
    }

    public void setSubType(TokenSubType subType) {
        this.subType = subType;
    }

    /** Source offset, or -1 if the token was synthesized. */
    public int getStart() {
        return start;
    }

    public void setStart(int start) {
        this.start = start;
    }

    public int getLength() {
        return content.length();
    }

    @Override
    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public TokenType getTypeBefore() {
        return typeBefore;
    }

    public void setTypeBefore(TokenType typeBefore) {
        this.typeBefore = typeBefore;
    }

    public TokenType getTypeAfter() {
        return typeAfter;
    }

    public void setTypeAfter(TokenType typeAfter) {
        this.typeAfter = typeAfter;
    }

    /**
     * Nested tokens: RDN components of a DN-shaped Value, or the original runs of a merged Whitespace token.
     */
    public List<Token> getTokenList() {
        return tokenList;
    }

    public void setTokenList(List<Token> tokenList) {
        this.tokenList = tokenList == null ? new ArrayList<>() : new ArrayList<>(tokenList);
    }

    public boolean hasRdnTokens() {
        return !tokenList.isEmpty() && tokenList.get(0).getSubType() == TokenSubType.RDN;
    }

    public List<ParsedChar> getParsedChars() {
        return parsedChars;
    }

    public void setParsedChars(List<ParsedChar> parsedChars) {
        this.parsedChars = parsedChars == null ? Collections.emptyList() : List.copyOf(parsedChars);
    }

    /** Content with hex escapes resolved; equals {@link #getContent()} for non-Value tokens. */
    public String getDecodedContent() {
        if (parsedChars.isEmpty()) {
            return content;
        }
        StringBuilder sb = new StringBuilder();
        for (ParsedChar pc : parsedChars) {
            sb.append(pc.getDecoded());
        }
        return sb.toString();
    }

    public int getDecodedLength() {
        return parsedChars.isEmpty() ? content.length() : parsedChars.size();
    }

    public int getWildcardCount() {
        int count = 0;
        for (ParsedChar pc : parsedChars) {
            if (pc.isWildcard()) {
                count++;
            }
        }
        return count;
    }

    public boolean isModified() {
        return modified;
    }

    public void setModified(boolean modified) {
        this.modified = modified;
    }

    public boolean isType(TokenType tokenType) {
        return type == tokenType;
    }

    /**
     * Identity match used by the mutation primitives: same guid, content and start offset.
     */
    public boolean matches(Token other) {
        return other != null && guid.equals(other.guid) && content.equals(other.content) && start == other.start;
    }

    @Override
    public String toString() {
        return type.getName() + "[" + start + "," + depth + "]='" + content + "'";
    }
}
