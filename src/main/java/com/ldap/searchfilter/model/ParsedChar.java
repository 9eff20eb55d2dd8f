package com.ldap.searchfilter.model;

import java.util.Objects;

/**
 * One decoded character of a Value (or RDN) token. Keeps both the encoded form as it
 * appears in the filter text (e.g. "\61" or "a") and the decoded form ("a").
 */
public class ParsedChar {

    private final String content;
    private final String decoded;
    private final boolean hexEncoded;
    private final boolean wildcard;
    private final CharClass charClass;
    private final CharCase charCase;
    private final boolean printable;

    public ParsedChar(String content, String decoded, boolean hexEncoded, boolean wildcard) {
        this.content = content;
        this.decoded = decoded;
        this.hexEncoded = hexEncoded;
        this.wildcard = wildcard;
        this.charClass = classify(decoded);
        this.charCase = caseOf(decoded);
        this.printable = isPrintable(decoded);
    }

    private static CharClass classify(String decoded) {
        int cp = decoded.codePointAt(0);
        if (Character.isLetter(cp)) {
            return CharClass.ALPHA;
        }
        if (Character.isDigit(cp)) {
            return CharClass.NUMERIC;
        }
        return CharClass.SPECIAL;
    }

    private static CharCase caseOf(String decoded) {
        int cp = decoded.codePointAt(0);
        if (Character.isUpperCase(cp)) {
            return CharCase.UPPER;
        }
        if (Character.isLowerCase(cp)) {
            return CharCase.LOWER;
        }
        return CharCase.NONE;
    }

    private static boolean isPrintable(String decoded) {
        int cp = decoded.codePointAt(0);
        if (Character.isISOControl(cp)) {
            return false;
        }
        int type = Character.getType(cp);
        return type != Character.UNASSIGNED && type != Character.FORMAT
                && type != Character.PRIVATE_USE && type != Character.SURROGATE;
    }

    /** Encoded text, exactly as it appears in the filter. */
    public String getContent() {
        return content;
    }

    public String getDecoded() {
        return decoded;
    }

    public boolean isHexEncoded() {
        return hexEncoded;
    }

    /** True only for an unescaped '*'; an encoded \2a is a literal asterisk. */
    public boolean isWildcard() {
        return wildcard;
    }

    public CharClass getCharClass() {
        return charClass;
    }

    public CharCase getCharCase() {
        return charCase;
    }

    public boolean isPrintable() {
        return printable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParsedChar that = (ParsedChar) o;
        return hexEncoded == that.hexEncoded && wildcard == that.wildcard
                && Objects.equals(content, that.content) && Objects.equals(decoded, that.decoded);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, decoded, hexEncoded, wildcard);
    }

    @Override
    public String toString() {
        return content;
    }
}
