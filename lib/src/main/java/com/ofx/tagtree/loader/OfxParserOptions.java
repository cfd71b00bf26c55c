package com.ofx.tagtree.loader;

import java.util.Properties;

/**
 * Immutable parser settings. Values come from defaults, from system properties with an
 * environment fallback, or from an explicit {@link Properties} instance.
 */
public final class OfxParserOptions {
    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final String MAX_DEPTH_PROPERTY = "ofx.tagtree.maxDepth";
    private static final String MAX_DEPTH_ENV = "OFX_TAGTREE_MAX_DEPTH";

    private static final OfxParserOptions DEFAULTS = new OfxParserOptions(DEFAULT_MAX_DEPTH);

    private final int maxDepth;

    private OfxParserOptions(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public static OfxParserOptions defaults() {
        return DEFAULTS;
    }

    /** Reads {@code ofx.tagtree.maxDepth}, falling back to {@code OFX_TAGTREE_MAX_DEPTH}. */
    public static OfxParserOptions fromSystem() {
        String value = System.getProperty(MAX_DEPTH_PROPERTY);
        if (value == null) {
            value = System.getenv(MAX_DEPTH_ENV);
        }
        return value == null ? DEFAULTS : new OfxParserOptions(parseDepth(value));
    }

    public static OfxParserOptions fromProperties(Properties properties) {
        String value = properties.getProperty(MAX_DEPTH_PROPERTY);
        return value == null ? DEFAULTS : new OfxParserOptions(parseDepth(value));
    }

    public OfxParserOptions withMaxDepth(int depth) {
        return new OfxParserOptions(depth);
    }

    /** Deepest allowed nesting, counting the root element as depth 1. */
    public int getMaxDepth() {
        return maxDepth;
    }

    private static int parseDepth(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(
                    "Invalid " + MAX_DEPTH_PROPERTY + " value: '" + value + "'", ex);
        }
    }

    @Override
    public String toString() {
        return "OfxParserOptions[maxDepth=" + maxDepth + "]";
    }
}
