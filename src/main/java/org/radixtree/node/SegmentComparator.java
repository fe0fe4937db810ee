package org.radixtree.node;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Unsigned lexicographic comparison of key segments against key remainders.
 * A remainder is addressed as {@code key[offset..]} so the walk never copies the key.
 */
public final class SegmentComparator {
    public static final Comparator<byte[]> COMPARATOR = Arrays::compareUnsigned;

    private SegmentComparator() {
    }

    public static int compare(byte[] segment, byte[] key, int offset) {
        return Arrays.compareUnsigned(segment, 0, segment.length, key, offset, key.length);
    }

    /**
     * @return true if {@code segment} is a prefix (proper or not) of {@code key[offset..]}
     */
    public static boolean isPrefixOf(byte[] segment, byte[] key, int offset) {
        int remaining = key.length - offset;
        if (segment.length > remaining) {
            return false;
        }
        return Arrays.mismatch(segment, 0, segment.length, key, offset, offset + segment.length) < 0;
    }

    public static boolean startsWith(byte[] segment, byte[] prefix) {
        if (prefix.length > segment.length) {
            return false;
        }
        return Arrays.mismatch(segment, 0, prefix.length, prefix, 0, prefix.length) < 0;
    }

    public static int commonPrefixLength(byte[] segment, byte[] key, int offset) {
        int length = Math.min(segment.length, key.length - offset);
        int mismatch = Arrays.mismatch(segment, 0, length, key, offset, offset + length);
        return mismatch < 0 ? length : mismatch;
    }
}
