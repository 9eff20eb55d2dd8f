package com.ldap.searchfilter;

import java.io.PrintStream;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.ldap.searchfilter.transform.DeobfuscationResult;

/**
 * Accumulates length reduction and pass counts over a batch of deobfuscated SearchFilters.
 */
public class DeobfuscationStats {

    private long count;
    private long changed;
    private long failed;
    private long warnings;
    private long inputChars;
    private long outputChars;

    private DescriptiveStatistics reductionStats = new DescriptiveStatistics();
    private DescriptiveStatistics passStats = new DescriptiveStatistics();

    public void add(DeobfuscationResult result) {
        count++;
        int before = result.getInput().length();
        int after = result.getOutputString().length();
        inputChars += before;
        outputChars += after;
        if (result.isChanged()) {
            changed++;
        }
        warnings += result.getWarnings().size();
        reductionStats.addValue(before == 0 ? 0.0 : 100.0 * (before - after) / before);
        passStats.addValue(result.getPasses());
    }

    public void addFailure() {
        failed++;
    }

    public long getCount() {
        return count;
    }

    public long getChanged() {
        return changed;
    }

    public long getFailed() {
        return failed;
    }

    public long getWarnings() {
        return warnings;
    }

    public long getInputChars() {
        return inputChars;
    }

    public long getOutputChars() {
        return outputChars;
    }

    /** Mean length reduction in percent of the input length. */
    public double getMeanReduction() {
        return reductionStats.getN() > 0 ? reductionStats.getMean() : 0.0;
    }

    public double getMaxReduction() {
        return reductionStats.getN() > 0 ? reductionStats.getMax() : 0.0;
    }

    public double getPercentile95Reduction() {
        return reductionStats.getN() > 0 ? reductionStats.getPercentile(95) : 0.0;
    }

    public double getMeanPasses() {
        return passStats.getN() > 0 ? passStats.getMean() : 0.0;
    }

    public void report(PrintStream out) {
        out.println(String.format("%-12s %8s %8s %8s %10s %10s %10s %10s %8s", "Filters", "Changed", "Failed", "Warnings",
                "InChars", "OutChars", "Mean%", "p95%", "Passes"));
        out.println(String.format("%-12d %8d %8d %8d %10d %10d %10.1f %10.1f %8.1f", count, changed, failed, warnings,
                inputChars, outputChars, getMeanReduction(), getPercentile95Reduction(), getMeanPasses()));
    }
}
