package com.ldap.searchfilter.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import com.ldap.searchfilter.model.TokenType;
import com.ldap.searchfilter.parser.SearchFilterFormat;

/**
 * Parameters shared by all transforms. Each transform reads the percentages, the random source and
 * the scope allow-list that concerns it.
 */
public class TransformOptions {

    public static final List<String> DEFAULT_BOOLEAN_OPERATORS = Collections.unmodifiableList(
            Arrays.asList("&", "|", "!", "&&", "||", "!!", "&|", "|&", "&!", "!&", "|!", "!|"));

    public static final Set<String> DEFAULT_SUPPORTED_MATCHING_RULES = Collections.unmodifiableSet(new LinkedHashSet<>(
            Arrays.asList("1.2.840.113556.1.4.803", "1.2.840.113556.1.4.804", "1.2.840.113556.1.4.1941",
                    "1.2.840.113556.1.4.2253")));

    private int randomNodePercent = 50;
    private int randomCharPercent = 50;
    private boolean trackModification = false;
    private Random random = new Random();
    private SearchFilterFormat target = SearchFilterFormat.BRANCHES;

    private Set<ParenthesisScope> parenthesisScopes = EnumSet.allOf(ParenthesisScope.class);
    private Set<BooleanOperatorScope> booleanOperatorScopes = EnumSet.allOf(BooleanOperatorScope.class);
    private List<String> booleanOperators = new ArrayList<>(DEFAULT_BOOLEAN_OPERATORS);
    private Set<InversionScope> inversionScopes = EnumSet.allOf(InversionScope.class);
    private Set<TokenType> whitespaceAdjacentTypes = EnumSet.allOf(TokenType.class);
    private boolean includeRdn = true;
    private Set<ExtensibleMatchFilterScope> extensibleMatchFilterScopes = EnumSet.allOf(ExtensibleMatchFilterScope.class);
    private Set<String> supportedMatchingRules = new LinkedHashSet<>(DEFAULT_SUPPORTED_MATCHING_RULES);

    /**
     * Bernoulli gate: true with probability {@code percent}/100. Never consumes randomness at 0 or
     * 100 so those settings are exact.
     */
    public boolean roll(int percent) {
        if (percent <= 0) {
            return false;
        }
        if (percent >= 100) {
            return true;
        }
        return random.nextInt(100) < percent;
    }

    public boolean rollNode() {
        return roll(randomNodePercent);
    }

    public boolean rollChar() {
        return roll(randomCharPercent);
    }

    public int getRandomNodePercent() {
        return randomNodePercent;
    }

    public void setRandomNodePercent(int randomNodePercent) {
        this.randomNodePercent = checkPercent("randomNodePercent", randomNodePercent);
    }

    public int getRandomCharPercent() {
        return randomCharPercent;
    }

    public void setRandomCharPercent(int randomCharPercent) {
        this.randomCharPercent = checkPercent("randomCharPercent", randomCharPercent);
    }

    private static int checkPercent(String name, int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException(name + " must be between 0 and 100: " + percent);
        }
        return percent;
    }

    public boolean isTrackModification() {
        return trackModification;
    }

    public void setTrackModification(boolean trackModification) {
        this.trackModification = trackModification;
    }

    public Random getRandom() {
        return random;
    }

    public void setRandom(Random random) {
        this.random = random;
    }

    public void setSeed(long seed) {
        this.random = new Random(seed);
    }

    public SearchFilterFormat getTarget() {
        return target;
    }

    public void setTarget(SearchFilterFormat target) {
        this.target = target;
    }

    public Set<ParenthesisScope> getParenthesisScopes() {
        return parenthesisScopes;
    }

    public void setParenthesisScopes(Collection<ParenthesisScope> scopes) {
        this.parenthesisScopes = scopes.isEmpty() ? EnumSet.noneOf(ParenthesisScope.class) : EnumSet.copyOf(scopes);
    }

    public Set<BooleanOperatorScope> getBooleanOperatorScopes() {
        return booleanOperatorScopes;
    }

    public void setBooleanOperatorScopes(Collection<BooleanOperatorScope> scopes) {
        this.booleanOperatorScopes = scopes.isEmpty() ? EnumSet.noneOf(BooleanOperatorScope.class) : EnumSet.copyOf(scopes);
    }

    public List<String> getBooleanOperators() {
        return booleanOperators;
    }

    public void setBooleanOperators(List<String> booleanOperators) {
        for (String operator : booleanOperators) {
            if (!DEFAULT_BOOLEAN_OPERATORS.contains(operator)) {
                throw new IllegalArgumentException("Unsupported BooleanOperator value: " + operator);
            }
        }
        this.booleanOperators = new ArrayList<>(booleanOperators);
    }

    public Set<InversionScope> getInversionScopes() {
        return inversionScopes;
    }

    public void setInversionScopes(Collection<InversionScope> scopes) {
        this.inversionScopes = scopes.isEmpty() ? EnumSet.noneOf(InversionScope.class) : EnumSet.copyOf(scopes);
    }

    public Set<TokenType> getWhitespaceAdjacentTypes() {
        return whitespaceAdjacentTypes;
    }

    public void setWhitespaceAdjacentTypes(Collection<TokenType> types) {
        this.whitespaceAdjacentTypes = types.isEmpty() ? EnumSet.noneOf(TokenType.class) : EnumSet.copyOf(types);
    }

    public boolean isIncludeRdn() {
        return includeRdn;
    }

    public void setIncludeRdn(boolean includeRdn) {
        this.includeRdn = includeRdn;
    }

    public Set<ExtensibleMatchFilterScope> getExtensibleMatchFilterScopes() {
        return extensibleMatchFilterScopes;
    }

    public void setExtensibleMatchFilterScopes(Collection<ExtensibleMatchFilterScope> scopes) {
        this.extensibleMatchFilterScopes = scopes.isEmpty() ? EnumSet.noneOf(ExtensibleMatchFilterScope.class)
                : EnumSet.copyOf(scopes);
    }

    public Set<String> getSupportedMatchingRules() {
        return supportedMatchingRules;
    }

    public void setSupportedMatchingRules(Collection<String> supportedMatchingRules) {
        this.supportedMatchingRules = new LinkedHashSet<>(supportedMatchingRules);
    }
}
