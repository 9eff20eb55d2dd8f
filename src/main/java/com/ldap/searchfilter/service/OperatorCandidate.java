package com.ldap.searchfilter.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.service.BooleanOperatorLogic.Operation;

/**
 * One simulated operator change: the operator value it applies, the operator string each affected
 * branch would own afterwards, and the existing tokens it removes or replaces.
 */
public class OperatorCandidate {

    private final String operator;
    private final Operation operation;
    private final Map<Branch, String> operatorsAfter = new LinkedHashMap<>();
    private final List<Token> tokens = new ArrayList<>();

    public OperatorCandidate(String operator, Operation operation) {
        this.operator = operator;
        this.operation = operation;
    }

    void put(Branch branch, String operators, Token token) {
        operatorsAfter.put(branch, operators);
        if (token != null) {
            tokens.add(token);
        }
    }

    void addToken(Token token) {
        tokens.add(token);
    }

    public String getOperator() {
        return operator;
    }

    public Operation getOperation() {
        return operation;
    }

    public Map<Branch, String> getOperatorsAfter() {
        return Collections.unmodifiableMap(operatorsAfter);
    }

    /** Tokens removed or replaced by this candidate, outermost branch first. */
    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    /** Branch that owns the given token of this candidate. */
    public Branch getBranch(Token token) {
        for (Branch branch : operatorsAfter.keySet()) {
            for (Token own : BooleanOperatorLogic.operatorTokens(branch)) {
                if (own == token) {
                    return branch;
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return operation + " '" + operator + "' " + tokens;
    }
}
