package com.ldap.searchfilter.parser;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import com.ldap.searchfilter.model.ParsedChar;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenSubType;
import com.ldap.searchfilter.model.TokenType;

/**
 * Character-level parsing of Attribute-Value content: hex-escape decoding (UTF-8 aware),
 * per-character classification and decomposition of Distinguished-Name values into RDN tokens.
 */
public class ValueParser {

    private static final Pattern RDN_ATTRIBUTE = Pattern.compile("(?:[A-Za-z][A-Za-z0-9-]*|(?i:oid\\.)?[0-9]+(?:\\.[0-9]+)*)");

    /**
     * Fills in parsed-character metadata and, for DN-shaped values, the nested RDN tokens.
     */
    public static void populate(Token valueToken) {
        int offset = Math.max(valueToken.getStart(), 0);
        valueToken.setParsedChars(parseChars(valueToken.getContent(), offset));
        valueToken.setTokenList(parseRdnTokens(valueToken.getContent(), valueToken.getStart(), valueToken.getDepth()));
    }

    /**
     * Splits encoded value content into decoded characters. {@code \XX} escapes are decoded as UTF-8
     * byte sequences when they form one, otherwise byte-for-byte.
     *
     * @param offset source offset of the first character, used for error reporting
     */
    public static List<ParsedChar> parseChars(String content, int offset) {
        List<ParsedChar> chars = new ArrayList<>();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\') {
                int first = hexByte(content, i, offset);
                int sequenceLength = utf8SequenceLength(first);
                if (sequenceLength > 1) {
                    byte[] bytes = new byte[sequenceLength];
                    bytes[0] = (byte) first;
                    boolean valid = true;
                    for (int k = 1; k < sequenceLength; k++) {
                        int pos = i + (3 * k);
                        if (pos >= content.length() || content.charAt(pos) != '\\' || !isHexPair(content, pos + 1)) {
                            valid = false;
                            break;
                        }
                        int next = Integer.parseInt(content.substring(pos + 1, pos + 3), 16);
                        if ((next & 0xC0) != 0x80) {
                            valid = false;
                            break;
                        }
                        bytes[k] = (byte) next;
                    }
                    if (valid) {
                        String decoded = new String(bytes, StandardCharsets.UTF_8);
                        chars.add(new ParsedChar(content.substring(i, i + 3 * sequenceLength), decoded, true, false));
                        i += 3 * sequenceLength;
                        continue;
                    }
                }
                chars.add(new ParsedChar(content.substring(i, i + 3), String.valueOf((char) first), true, false));
                i += 3;
            } else {
                int cp = content.codePointAt(i);
                String single = new String(Character.toChars(cp));
                chars.add(new ParsedChar(single, single, false, cp == '*'));
                i += single.length();
            }
        }
        return chars;
    }

    /**
     * Decodes all hex escapes of a value.
     */
    public static String decode(String content) {
        StringBuilder sb = new StringBuilder();
        for (ParsedChar pc : parseChars(content, 0)) {
            sb.append(pc.getDecoded());
        }
        return sb.toString();
    }

    private static int hexByte(String content, int index, int offset) {
        if (!isHexPair(content, index + 1)) {
            throw new FilterParseException(offset + index, "invalid hex escape in value");
        }
        return Integer.parseInt(content.substring(index + 1, index + 3), 16);
    }

    static boolean isHexPair(String content, int index) {
        return index + 1 < content.length() && isHex(content.charAt(index)) && isHex(content.charAt(index + 1));
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static int utf8SequenceLength(int lead) {
        if (lead >= 0xC2 && lead <= 0xDF) {
            return 2;
        }
        if (lead >= 0xE0 && lead <= 0xEF) {
            return 3;
        }
        if (lead >= 0xF0 && lead <= 0xF4) {
            return 4;
        }
        return 1;
    }

    /**
     * Decomposes a Distinguished-Name value such as {@code CN=sabi , OU=Users,DC=corp} into
     * Attribute/ComparisonOperator/Value/CommaDelimiter/Whitespace tokens (sub type RDN).
     * Returns an empty list when the value is not DN-shaped: fewer than two RDNs, an unescaped
     * wildcard, or any component that is not {@code attr=value}.
     *
     * @param start source offset of the value, -1 if synthesized
     */
    public static List<Token> parseRdnTokens(String content, int start, int depth) {
        if (content.indexOf(',') < 0 || content.indexOf('*') >= 0) {
            return Collections.emptyList();
        }
        List<Token> tokens = new ArrayList<>();
        int segmentStart = 0;
        int segments = 0;
        while (segmentStart <= content.length()) {
            int comma = content.indexOf(',', segmentStart);
            int segmentEnd = comma < 0 ? content.length() : comma;
            if (!parseRdn(content, segmentStart, segmentEnd, start, depth, tokens)) {
                return Collections.emptyList();
            }
            segments++;
            if (comma < 0) {
                break;
            }
            tokens.add(rdnToken(TokenType.COMMA_DELIMITER, ",", start, comma, depth));
            segmentStart = comma + 1;
        }
        return segments >= 2 ? tokens : Collections.<Token>emptyList();
    }

    private static boolean parseRdn(String content, int from, int to, int start, int depth, List<Token> tokens) {
        int i = from;
        i = whitespace(content, i, to, start, depth, tokens);

        int attrStart = i;
        while (i < to && !SearchFilterLexer.isWhitespace(content.charAt(i)) && content.charAt(i) != '=') {
            i++;
        }
        String attribute = content.substring(attrStart, i);
        if (attribute.isEmpty() || !RDN_ATTRIBUTE.matcher(attribute).matches()) {
            return false;
        }
        tokens.add(rdnToken(TokenType.ATTRIBUTE, attribute, start, attrStart, depth));

        i = whitespace(content, i, to, start, depth, tokens);
        if (i >= to || content.charAt(i) != '=') {
            return false;
        }
        tokens.add(rdnToken(TokenType.COMPARISON_OPERATOR, "=", start, i, depth));
        i++;

        i = whitespace(content, i, to, start, depth, tokens);
        int valueEnd = to;
        while (valueEnd > i && SearchFilterLexer.isWhitespace(content.charAt(valueEnd - 1))) {
            valueEnd--;
        }
        String value = content.substring(i, valueEnd);
        if (value.isEmpty() || value.indexOf('=') >= 0) {
            return false;
        }
        Token valueToken = rdnToken(TokenType.VALUE, value, start, i, depth);
        valueToken.setParsedChars(parseChars(value, Math.max(start, 0) + i));
        tokens.add(valueToken);

        whitespace(content, valueEnd, to, start, depth, tokens);
        return true;
    }

    private static int whitespace(String content, int from, int to, int start, int depth, List<Token> tokens) {
        int i = from;
        while (i < to && SearchFilterLexer.isWhitespace(content.charAt(i))) {
            i++;
        }
        if (i > from) {
            tokens.add(rdnToken(TokenType.WHITESPACE, content.substring(from, i), start, from, depth));
        }
        return i;
    }

    private static Token rdnToken(TokenType type, String content, int valueStart, int index, int depth) {
        Token token = new Token(type, content, valueStart < 0 ? -1 : valueStart + index, depth);
        token.setSubType(TokenSubType.RDN);
        return token;
    }
}
