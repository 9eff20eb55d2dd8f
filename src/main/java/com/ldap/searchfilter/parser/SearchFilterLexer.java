package com.ldap.searchfilter.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenType;

/**
 * Turns raw SearchFilter text into a flat token list annotated with offsets and depth.
 *
 * Grammar is RFC 4515 plus the forms Active Directory tolerates: whitespace around groups, operators,
 * attributes and before values; Filter-scope operators such as {@code (!name=sabi)} and
 * {@code (&|name=sabi)}; several operators per group; a parenthesis-less top-level filter.
 * Nesting is tracked with an explicit depth counter, never with recursion.
 */
public class SearchFilterLexer {

    static final Logger logger = LoggerFactory.getLogger(SearchFilterLexer.class);

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int pos = 0;
    private int depth = 0;

    private SearchFilterLexer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes a SearchFilter and fills in the adjacent-type enrichment layer.
     *
     * @throws FilterParseException on malformed input
     */
    public static List<Token> tokenize(String searchFilter) {
        if (searchFilter == null) {
            throw new FilterParseException(0, "search filter is null");
        }
        List<Token> tokens = new SearchFilterLexer(searchFilter).run();
        enrich(tokens);
        if (logger.isTraceEnabled()) {
            logger.trace("Tokenized {} chars into {} tokens", searchFilter.length(), tokens.size());
        }
        return tokens;
    }

    /**
     * Sets TypeBefore/TypeAfter on every token from its neighbours in the flat list.
     */
    public static void enrich(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            token.setTypeBefore(i > 0 ? tokens.get(i - 1).getType() : null);
            token.setTypeAfter(i < tokens.size() - 1 ? tokens.get(i + 1).getType() : null);
        }
    }

    public static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    public static boolean isBooleanOperator(char c) {
        return c == '&' || c == '|' || c == '!';
    }

    private List<Token> run() {
        readWhitespace();
        if (atEnd()) {
            throw new FilterParseException(0, "empty search filter");
        }
        if (peek() == '(') {
            readGroups();
        } else if (peek() == ')') {
            throw new FilterParseException(pos, "unbalanced parenthesis");
        } else {
            readFilterItem();
        }
        readWhitespace();
        if (!atEnd()) {
            char c = peek();
            if (c == '(') {
                throw new FilterParseException(pos, "more than one top-level filter");
            }
            if (c == ')') {
                throw new FilterParseException(pos, "unbalanced parenthesis");
            }
            throw new FilterParseException(pos, "unexpected character '" + c + "'");
        }
        return tokens;
    }

    private void readGroups() {
        openGroup();
        while (depth > 0) {
            // Directly after a GroupStart: operators, then a nested group or a filter item
            readWhitespace();
            readBooleanOperators();
            if (atEnd()) {
                throw new FilterParseException(pos, "unbalanced parenthesis");
            }
            char c = peek();
            if (c == '(') {
                openGroup();
                continue;
            }
            if (c == ')') {
                throw new FilterParseException(pos, "group is missing a filter");
            }
            readFilterItem();
            closeGroup();

            // After a group closes: a sibling group or the close of enclosing groups
            while (depth > 0) {
                readWhitespace();
                if (atEnd()) {
                    throw new FilterParseException(pos, "unbalanced parenthesis");
                }
                c = peek();
                if (c == ')') {
                    closeGroup();
                } else if (c == '(') {
                    openGroup();
                    break;
                } else {
                    throw new FilterParseException(pos, "unexpected character '" + c + "' after group");
                }
            }
        }
    }

    private void openGroup() {
        emit(TokenType.GROUP_START, "(", pos);
        pos++;
        depth++;
    }

    private void closeGroup() {
        if (atEnd() || peek() != ')') {
            throw new FilterParseException(pos, "unbalanced parenthesis");
        }
        depth--;
        emit(TokenType.GROUP_END, ")", pos);
        pos++;
    }

    private void readBooleanOperators() {
        while (!atEnd() && isBooleanOperator(peek())) {
            emit(TokenType.BOOLEAN_OPERATOR, String.valueOf(peek()), pos);
            pos++;
            readWhitespace();
        }
    }

    private void readWhitespace() {
        int start = pos;
        while (!atEnd() && isWhitespace(peek())) {
            pos++;
        }
        if (pos > start) {
            emit(TokenType.WHITESPACE, input.substring(start, pos), start);
        }
    }

    private void readFilterItem() {
        int attrStart = pos;
        while (!atEnd() && !isAttributeTerminator(peek())) {
            pos++;
        }
        String attribute = input.substring(attrStart, pos);
        if (attribute.isEmpty()) {
            throw new FilterParseException(attrStart, "missing attribute");
        }
        for (int i = 0; i < attribute.length(); i++) {
            char c = attribute.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '-' || c == '.' || c == ';' || c == '_')) {
                throw new FilterParseException(attrStart + i, "invalid character '" + c + "' in attribute");
            }
        }
        emit(TokenType.ATTRIBUTE, attribute, attrStart);
        readWhitespace();

        if (!atEnd() && peek() == ':') {
            int end = input.indexOf(":=", pos);
            if (end < 0) {
                throw new FilterParseException(pos, "unterminated extensible match filter");
            }
            String rule = input.substring(pos, end + 1);
            for (int i = 0; i < rule.length(); i++) {
                char c = rule.charAt(i);
                if (c == '(' || c == ')' || isWhitespace(c)) {
                    throw new FilterParseException(pos + i, "invalid character in extensible match filter");
                }
            }
            emit(TokenType.EXTENSIBLE_MATCH_FILTER, rule, pos);
            pos = end + 1;
        }

        readComparisonOperator();
        readValue();
    }

    private boolean isAttributeTerminator(char c) {
        return c == ':' || c == '=' || c == '~' || c == '>' || c == '<' || c == '(' || c == ')' || isWhitespace(c);
    }

    private void readComparisonOperator() {
        if (input.startsWith("~=", pos) || input.startsWith(">=", pos) || input.startsWith("<=", pos)) {
            emit(TokenType.COMPARISON_OPERATOR, input.substring(pos, pos + 2), pos);
            pos += 2;
        } else if (!atEnd() && peek() == '=') {
            emit(TokenType.COMPARISON_OPERATOR, "=", pos);
            pos++;
        } else {
            throw new FilterParseException(pos, "missing comparison operator");
        }
    }

    private void readValue() {
        int valueStart = pos;
        while (!atEnd()) {
            char c = peek();
            if (c == ')') {
                break;
            }
            if (c == '(') {
                throw new FilterParseException(pos, "unescaped '(' in value");
            }
            if (c == '\\') {
                if (!ValueParser.isHexPair(input, pos + 1)) {
                    throw new FilterParseException(pos, "invalid hex escape in value");
                }
                pos += 3;
                continue;
            }
            pos++;
        }
        if (atEnd() && depth > 0) {
            throw new FilterParseException(pos, "unbalanced parenthesis");
        }
        String raw = input.substring(valueStart, pos);

        // Leading whitespace is insignificant as long as a value follows it
        int lead = 0;
        while (lead < raw.length() && isWhitespace(raw.charAt(lead))) {
            lead++;
        }
        if (lead > 0 && lead < raw.length()) {
            emit(TokenType.WHITESPACE, raw.substring(0, lead), valueStart);
            valueStart += lead;
            raw = raw.substring(lead);
        }

        // Trailing whitespace is only insignificant after a bare presence value
        int trimmedEnd = raw.length();
        while (trimmedEnd > 0 && isWhitespace(raw.charAt(trimmedEnd - 1))) {
            trimmedEnd--;
        }
        if (trimmedEnd < raw.length() && "*".equals(raw.substring(0, trimmedEnd))) {
            emitValue("*", valueStart);
            emit(TokenType.WHITESPACE, raw.substring(trimmedEnd), valueStart + trimmedEnd);
        } else {
            emitValue(raw, valueStart);
        }
    }

    private void emitValue(String content, int start) {
        Token value = emit(TokenType.VALUE, content, start);
        ValueParser.populate(value);
    }

    private Token emit(TokenType type, String content, int start) {
        Token token = new Token(type, content, start, depth);
        tokens.add(token);
        return token;
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }
}
