package org.radixtree;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * @param radix            maximum number of segments in one node
 * @param maxSegmentLength maximum length of a non-empty segment, longer keys span several levels
 */
public record RadixTreeSettings(int radix, int maxSegmentLength) {
    public static final String RADIX_PROPERTY = "radix-tree.radix";
    public static final String MAX_SEGMENT_LENGTH_PROPERTY = "radix-tree.max-segment-length";

    public static final int DEFAULT_RADIX = 16;
    // one 8 byte slot per segment, minus its length byte
    public static final int DEFAULT_MAX_SEGMENT_LENGTH = 7;

    public static final RadixTreeSettings DEFAULT = new RadixTreeSettings(DEFAULT_RADIX, DEFAULT_MAX_SEGMENT_LENGTH);

    public RadixTreeSettings {
        if (radix < 2) {
            throw new IllegalArgumentException("Radix must be at least 2, got " + radix);
        }
        if (maxSegmentLength < 1) {
            throw new IllegalArgumentException("Max segment length must be at least 1, got " + maxSegmentLength);
        }
    }

    public RadixTreeSettings withRadix(int radix) {
        return new RadixTreeSettings(radix, maxSegmentLength);
    }

    public RadixTreeSettings withMaxSegmentLength(int maxSegmentLength) {
        return new RadixTreeSettings(radix, maxSegmentLength);
    }

    public static RadixTreeSettings fromProperties(Properties properties) {
        return new RadixTreeSettings(
                intProperty(properties, RADIX_PROPERTY, DEFAULT_RADIX),
                intProperty(properties, MAX_SEGMENT_LENGTH_PROPERTY, DEFAULT_MAX_SEGMENT_LENGTH));
    }

    /**
     * Reads settings from a properties file on the classpath. Missing keys fall back to the defaults.
     */
    public static RadixTreeSettings load(String resource) {
        try (InputStream in = RadixTreeSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Settings resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read settings resource " + resource, e);
        }
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        String value = properties.getProperty(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " is not an integer: " + value, e);
        }
    }
}
