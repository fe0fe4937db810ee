package org.radixtree;

import java.nio.ByteBuffer;

/**
 * Sorted, thread-safe map from byte-array keys to byte-array values.
 */
public interface RadixTree {

    /**
     * @return a copy of the value stored under the key, or null if the key was never put
     */
    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    /**
     * @return number of distinct keys
     */
    int size();

    default byte[] get(ByteBuffer key) {
        return get(remainingBytes(key));
    }

    default void put(ByteBuffer key, byte[] value) {
        put(remainingBytes(key), value);
    }

    private static byte[] remainingBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }
}
