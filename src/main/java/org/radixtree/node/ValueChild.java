package org.radixtree.node;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Stored value. Equality is by content, like keys.
 */
public record ValueChild(byte[] value) implements Child {

    @Override
    public boolean equals(Object o) {
        return o instanceof ValueChild other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "ValueChild[value=" + HexFormat.of().formatHex(value) + "]";
    }
}
