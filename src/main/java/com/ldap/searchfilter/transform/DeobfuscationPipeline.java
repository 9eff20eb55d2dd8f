package com.ldap.searchfilter.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.parser.SearchFilterConverter;
import com.ldap.searchfilter.service.LimitWarning;
import com.ldap.searchfilter.service.ProtocolLimitChecker;

/**
 * Applies a sequence of transforms repeatedly until the SearchFilter stops changing or the pass
 * limit is reached, then checks the result against the protocol limits.
 */
public class DeobfuscationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DeobfuscationPipeline.class);

    public static final int DEFAULT_MAX_PASSES = 8;

    private final List<SearchFilterTransform> transforms;
    private final TransformOptions options;
    private final int maxPasses;
    private final ProtocolLimitChecker limitChecker;

    public DeobfuscationPipeline(List<SearchFilterTransform> transforms, TransformOptions options) {
        this(transforms, options, DEFAULT_MAX_PASSES, new ProtocolLimitChecker());
    }

    public DeobfuscationPipeline(List<SearchFilterTransform> transforms, TransformOptions options, int maxPasses,
            ProtocolLimitChecker limitChecker) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1: " + maxPasses);
        }
        this.transforms = new ArrayList<>(transforms);
        this.options = options;
        this.maxPasses = maxPasses;
        this.limitChecker = limitChecker;
    }

    public static List<SearchFilterTransform> newTransforms(List<TransformType> types) {
        List<SearchFilterTransform> transforms = new ArrayList<>();
        for (TransformType type : types) {
            transforms.add(type.newTransform());
        }
        return transforms;
    }

    /**
     * @param input any supported SearchFilter representation
     */
    public DeobfuscationResult run(Object input) {
        Branch tree = SearchFilterConverter.toBranch(input);
        String original = tree.getContent();
        String previous = original;
        int passes = 0;
        while (passes < maxPasses) {
            for (SearchFilterTransform transform : transforms) {
                tree = transform.transform(tree, options);
            }
            passes++;
            String current = tree.getContent();
            logger.debug("Pass {}: '{}'", passes, current);
            if (current.equals(previous)) {
                break;
            }
            previous = current;
        }
        List<LimitWarning> warnings = limitChecker == null ? Collections.<LimitWarning>emptyList() : limitChecker.check(tree);
        return new DeobfuscationResult(original, tree, passes, warnings);
    }

    public List<SearchFilterTransform> getTransforms() {
        return Collections.unmodifiableList(transforms);
    }

    public TransformOptions getOptions() {
        return options;
    }

    public int getMaxPasses() {
        return maxPasses;
    }
}
