package com.seriesfilter.reads.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for translating read filters.
 *
 * <p>Values come from system properties:
 * <ul>
 *   <li>{@code seriesfilter.reads.maxNodeDepth} - deepest translated expression
 *       accepted, counting the folded chain of each logical node
 *       (default {@value #DEFAULT_MAX_NODE_DEPTH})</li>
 *   <li>{@code seriesfilter.reads.remapTagKeys} - whether tag keys are renamed
 *       with {@link #DEFAULT_TAG_KEY_REMAP} (default true)</li>
 * </ul>
 * Invalid values are logged and replaced by the default.
 */
public final class ReadFilterConfig {
    private static final Logger logger = LoggerFactory.getLogger(ReadFilterConfig.class);

    public static final String PROP_MAX_NODE_DEPTH = "seriesfilter.reads.maxNodeDepth";
    public static final String PROP_REMAP_TAG_KEYS = "seriesfilter.reads.remapTagKeys";

    /** Default maximum nesting depth of a filter tree. */
    public static final int DEFAULT_MAX_NODE_DEPTH = 512;

    /**
     * Tag keys clients use for the measurement, mapped to the name the
     * predicate layer expects.
     */
    public static final Map<String, String> DEFAULT_TAG_KEY_REMAP = Map.of(
        "_measurement", "_name",
        "\u0000", "_name"
    );

    private final int maxNodeDepth;
    private final Map<String, String> tagKeyRemap;

    /**
     * Creates a configuration.
     *
     * @param maxNodeDepth the deepest filter tree accepted, at least 1
     * @param tagKeyRemap tag keys to rename during translation
     */
    public ReadFilterConfig(int maxNodeDepth, Map<String, String> tagKeyRemap) {
        if (maxNodeDepth < 1) {
            throw new IllegalArgumentException("maxNodeDepth must be positive: " + maxNodeDepth);
        }
        this.maxNodeDepth = maxNodeDepth;
        this.tagKeyRemap = Map.copyOf(Objects.requireNonNull(tagKeyRemap, "tagKeyRemap must not be null"));
    }

    public static ReadFilterConfig defaults() {
        return new ReadFilterConfig(DEFAULT_MAX_NODE_DEPTH, DEFAULT_TAG_KEY_REMAP);
    }

    public static ReadFilterConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from a property set.
     *
     * @param props the properties
     * @return the configuration
     */
    public static ReadFilterConfig fromProperties(Properties props) {
        int depth = parseMaxNodeDepth(props.getProperty(PROP_MAX_NODE_DEPTH));
        boolean remap = parseRemap(props.getProperty(PROP_REMAP_TAG_KEYS));
        return new ReadFilterConfig(depth, remap ? DEFAULT_TAG_KEY_REMAP : Map.of());
    }

    public int maxNodeDepth() {
        return maxNodeDepth;
    }

    public Map<String, String> tagKeyRemap() {
        return tagKeyRemap;
    }

    // ========== Configuration Helpers ==========

    static int parseMaxNodeDepth(String value) {
        if (value == null) {
            return DEFAULT_MAX_NODE_DEPTH;
        }
        try {
            int depth = Integer.parseInt(value.trim());
            if (depth > 0) {
                return depth;
            }
            logger.warn("Ignoring non-positive {}={}, using {}", PROP_MAX_NODE_DEPTH, value, DEFAULT_MAX_NODE_DEPTH);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}={}, using {}", PROP_MAX_NODE_DEPTH, value, DEFAULT_MAX_NODE_DEPTH);
        }
        return DEFAULT_MAX_NODE_DEPTH;
    }

    static boolean parseRemap(String value) {
        if (value == null) {
            return true;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                logger.warn("Ignoring invalid {}={}, using true", PROP_REMAP_TAG_KEYS, value);
                return true;
        }
    }

    @Override
    public String toString() {
        return "ReadFilterConfig{maxNodeDepth=" + maxNodeDepth + ", tagKeyRemap=" + tagKeyRemap.keySet() + "}";
    }
}
