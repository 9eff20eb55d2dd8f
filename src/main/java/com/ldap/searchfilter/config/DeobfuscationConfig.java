package com.ldap.searchfilter.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.service.ProtocolLimitChecker;
import com.ldap.searchfilter.transform.DeobfuscationPipeline;
import com.ldap.searchfilter.transform.TransformOptions;
import com.ldap.searchfilter.transform.TransformType;

/**
 * Deobfuscation settings. Defaults are built in; a properties file can override them.
 */
public class DeobfuscationConfig {

    private static final Logger logger = LoggerFactory.getLogger(DeobfuscationConfig.class);

    public static final List<TransformType> DEFAULT_ORDER = Arrays.asList(TransformType.EXTENSIBLE_MATCH_FILTER,
            TransformType.WHITESPACE, TransformType.WILDCARD, TransformType.BOOLEAN_OPERATOR_INVERSION,
            TransformType.BOOLEAN_OPERATOR, TransformType.PARENTHESIS);

    private int randomNodePercent = 50;
    private int randomCharPercent = 50;
    private boolean trackModification = false;
    private Long seed;
    private List<TransformType> order = new ArrayList<>(DEFAULT_ORDER);
    private int maxPasses = DeobfuscationPipeline.DEFAULT_MAX_PASSES;
    private Set<String> supportedMatchingRules = new LinkedHashSet<>(TransformOptions.DEFAULT_SUPPORTED_MATCHING_RULES);
    private int booleanOperatorCountMax = ProtocolLimitChecker.DEFAULT_BOOLEAN_OPERATOR_COUNT_MAX;
    private int booleanOperatorLogicalCountMax = ProtocolLimitChecker.DEFAULT_BOOLEAN_OPERATOR_LOGICAL_COUNT_MAX;
    private int depthMax = ProtocolLimitChecker.DEFAULT_DEPTH_MAX;

    /**
     * Loads a properties file on top of the current values. An unreadable file is logged and the
     * current values are kept.
     */
    public void loadFromFile(String configFile) {
        try (InputStream in = new FileInputStream(configFile)) {
            Properties props = new Properties();
            props.load(in);
            loadFromProperties(props);
            logger.info("Loaded deobfuscation configuration from: {}", configFile);
        } catch (IOException e) {
            logger.warn("Could not load config file: {}. Using defaults.", configFile);
        }
    }

    /**
     * Load settings from properties.
     * Supports:
     * - transform.randomNodePercent, transform.randomCharPercent, transform.trackModification, transform.seed
     * - transform.order: comma-separated transform names
     * - pipeline.maxPasses
     * - matchingRule.supported: comma-separated list (replaces defaults)
     * - matchingRule.supported.add / matchingRule.supported.remove: comma-separated lists
     * - limits.booleanOperatorCount.max, limits.booleanOperatorLogicalCount.max, limits.depth.max
     *
     * @throws IllegalArgumentException on a value that cannot be parsed
     */
    public void loadFromProperties(Properties props) {
        randomNodePercent = getInt(props, "transform.randomNodePercent", randomNodePercent);
        randomCharPercent = getInt(props, "transform.randomCharPercent", randomCharPercent);
        String track = props.getProperty("transform.trackModification");
        if (!isBlank(track)) {
            trackModification = Boolean.parseBoolean(track.trim());
        }
        String seedValue = props.getProperty("transform.seed");
        if (!isBlank(seedValue)) {
            seed = parseLong("transform.seed", seedValue);
        }

        String orderList = props.getProperty("transform.order");
        if (!isBlank(orderList)) {
            List<TransformType> parsed = new ArrayList<>();
            for (String name : split(orderList)) {
                TransformType type = TransformType.findByName(name);
                if (type == null) {
                    throw new IllegalArgumentException("Unknown transform in transform.order: " + name);
                }
                parsed.add(type);
            }
            order = parsed;
        }
        maxPasses = getInt(props, "pipeline.maxPasses", maxPasses);

        // Replace entire list if specified
        String supported = props.getProperty("matchingRule.supported");
        if (!isBlank(supported)) {
            supportedMatchingRules.clear();
            supportedMatchingRules.addAll(split(supported));
        }
        String additional = props.getProperty("matchingRule.supported.add");
        if (!isBlank(additional)) {
            supportedMatchingRules.addAll(split(additional));
        }
        String removed = props.getProperty("matchingRule.supported.remove");
        if (!isBlank(removed)) {
            supportedMatchingRules.removeAll(split(removed));
        }

        booleanOperatorCountMax = getInt(props, "limits.booleanOperatorCount.max", booleanOperatorCountMax);
        booleanOperatorLogicalCountMax = getInt(props, "limits.booleanOperatorLogicalCount.max",
                booleanOperatorLogicalCountMax);
        depthMax = getInt(props, "limits.depth.max", depthMax);
    }

    public TransformOptions toTransformOptions() {
        TransformOptions options = new TransformOptions();
        options.setRandomNodePercent(randomNodePercent);
        options.setRandomCharPercent(randomCharPercent);
        options.setTrackModification(trackModification);
        if (seed != null) {
            options.setSeed(seed);
        }
        options.setSupportedMatchingRules(supportedMatchingRules);
        return options;
    }

    public ProtocolLimitChecker toLimitChecker() {
        return new ProtocolLimitChecker(depthMax, booleanOperatorCountMax, booleanOperatorLogicalCountMax);
    }

    public DeobfuscationPipeline toPipeline() {
        return new DeobfuscationPipeline(DeobfuscationPipeline.newTransforms(order), toTransformOptions(), maxPasses,
                toLimitChecker());
    }

    private static int getInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long for " + key + ": " + value, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static List<String> split(String list) {
        List<String> values = new ArrayList<>();
        for (String value : list.split(",")) {
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    public int getRandomNodePercent() {
        return randomNodePercent;
    }

    public void setRandomNodePercent(int randomNodePercent) {
        this.randomNodePercent = randomNodePercent;
    }

    public int getRandomCharPercent() {
        return randomCharPercent;
    }

    public void setRandomCharPercent(int randomCharPercent) {
        this.randomCharPercent = randomCharPercent;
    }

    public boolean isTrackModification() {
        return trackModification;
    }

    public void setTrackModification(boolean trackModification) {
        this.trackModification = trackModification;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public List<TransformType> getOrder() {
        return new ArrayList<>(order);
    }

    public void setOrder(List<TransformType> order) {
        this.order = new ArrayList<>(order);
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public void setMaxPasses(int maxPasses) {
        this.maxPasses = maxPasses;
    }

    public Set<String> getSupportedMatchingRules() {
        return new LinkedHashSet<>(supportedMatchingRules);
    }

    public int getBooleanOperatorCountMax() {
        return booleanOperatorCountMax;
    }

    public int getBooleanOperatorLogicalCountMax() {
        return booleanOperatorLogicalCountMax;
    }

    public int getDepthMax() {
        return depthMax;
    }
}
