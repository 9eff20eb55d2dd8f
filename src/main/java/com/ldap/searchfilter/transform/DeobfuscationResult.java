package com.ldap.searchfilter.transform;

import java.util.List;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.service.LimitWarning;

public class DeobfuscationResult {

    private final String input;
    private final Branch output;
    private final int passes;
    private final List<LimitWarning> warnings;

    public DeobfuscationResult(String input, Branch output, int passes, List<LimitWarning> warnings) {
        this.input = input;
        this.output = output;
        this.passes = passes;
        this.warnings = warnings;
    }

    public String getInput() {
        return input;
    }

    public Branch getOutput() {
        return output;
    }

    public String getOutputString() {
        return output.getContent();
    }

    public int getPasses() {
        return passes;
    }

    public List<LimitWarning> getWarnings() {
        return warnings;
    }

    public boolean isChanged() {
        return !input.equals(getOutputString());
    }

    @Override
    public String toString() {
        return input + " -> " + getOutputString();
    }
}
