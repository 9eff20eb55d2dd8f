package com.ldap.searchfilter.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.service.LimitWarning.Limit;

/**
 * Compares the running counters of a tree's base branch with the configured protocol maxima.
 */
public class ProtocolLimitChecker {

    private static final Logger logger = LoggerFactory.getLogger(ProtocolLimitChecker.class);

    public static final int DEFAULT_DEPTH_MAX = 100;
    public static final int DEFAULT_BOOLEAN_OPERATOR_COUNT_MAX = 500;
    public static final int DEFAULT_BOOLEAN_OPERATOR_LOGICAL_COUNT_MAX = 500;

    private final int depthMax;
    private final int booleanOperatorCountMax;
    private final int booleanOperatorLogicalCountMax;

    public ProtocolLimitChecker() {
        this(DEFAULT_DEPTH_MAX, DEFAULT_BOOLEAN_OPERATOR_COUNT_MAX, DEFAULT_BOOLEAN_OPERATOR_LOGICAL_COUNT_MAX);
    }

    public ProtocolLimitChecker(int depthMax, int booleanOperatorCountMax, int booleanOperatorLogicalCountMax) {
        this.depthMax = depthMax;
        this.booleanOperatorCountMax = booleanOperatorCountMax;
        this.booleanOperatorLogicalCountMax = booleanOperatorLogicalCountMax;
    }

    public List<LimitWarning> check(Branch tree) {
        Branch base = tree.getRoot();
        List<LimitWarning> warnings = new ArrayList<>();
        if (base.getDepthMax() > depthMax) {
            warnings.add(new LimitWarning(Limit.DEPTH, base.getDepthMax(), depthMax));
        }
        if (base.getBooleanOperatorCountMax() > booleanOperatorCountMax) {
            warnings.add(new LimitWarning(Limit.BOOLEAN_OPERATOR_COUNT, base.getBooleanOperatorCountMax(),
                    booleanOperatorCountMax));
        }
        if (base.getBooleanOperatorLogicalCountMax() > booleanOperatorLogicalCountMax) {
            warnings.add(new LimitWarning(Limit.BOOLEAN_OPERATOR_LOGICAL_COUNT, base.getBooleanOperatorLogicalCountMax(),
                    booleanOperatorLogicalCountMax));
        }
        for (LimitWarning warning : warnings) {
            logger.warn("Protocol limit exceeded: {}", warning);
        }
        return warnings;
    }

    public int getDepthMax() {
        return depthMax;
    }

    public int getBooleanOperatorCountMax() {
        return booleanOperatorCountMax;
    }

    public int getBooleanOperatorLogicalCountMax() {
        return booleanOperatorLogicalCountMax;
    }
}
