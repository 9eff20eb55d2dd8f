package com.ldap.searchfilter.transform;

/**
 * Options that transform every eligible node and character, so results do not depend on the random
 * source.
 */
final class FullStrengthOptions {

    private FullStrengthOptions() {
    }

    static TransformOptions create() {
        TransformOptions options = new TransformOptions();
        options.setRandomNodePercent(100);
        options.setRandomCharPercent(100);
        return options;
    }
}
