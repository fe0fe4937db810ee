package org.radixtree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.radixtree.node.MapBasedNodeManager;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultRadixTreeTest {

    private DefaultRadixTree tree;

    @BeforeEach
    void setUp() {
        tree = new DefaultRadixTree();
    }

    @Test
    void testGetFromEmptyTree() {
        assertNull(tree.get("x".getBytes()));
        assertNull(tree.get(new byte[0]));
        assertEquals(0, tree.size());
    }

    @Test
    void testSimplePutAndGet() {
        tree.put("cat".getBytes(), "meow".getBytes());
        assertArrayEquals("meow".getBytes(), tree.get("cat".getBytes()));
        assertEquals(1, tree.size());
    }

    @Test
    void testOverwriteValue() {
        tree.put("cat".getBytes(), "meow".getBytes());
        tree.put("cat".getBytes(), "purr".getBytes());
        assertArrayEquals("purr".getBytes(), tree.get("cat".getBytes()));
        assertEquals(1, tree.size());
    }

    @Test
    void testPrefixKeysAreIndependent() {
        tree.put("a".getBytes(), "1".getBytes());
        tree.put("a.b".getBytes(), "2".getBytes());
        assertArrayEquals("1".getBytes(), tree.get("a".getBytes()));
        assertArrayEquals("2".getBytes(), tree.get("a.b".getBytes()));
        assertNull(tree.get("a.x".getBytes()));
        assertNull(tree.get("a.".getBytes()));
    }

    @Test
    void testPrefixKeysInReverseOrder() {
        tree.put("ab".getBytes(), "2".getBytes());
        tree.put("a".getBytes(), "1".getBytes());
        assertArrayEquals("1".getBytes(), tree.get("a".getBytes()));
        assertArrayEquals("2".getBytes(), tree.get("ab".getBytes()));
    }

    @Test
    void testNonInterferenceRegardlessOfOrder() {
        DefaultRadixTree reversed = new DefaultRadixTree();
        tree.put("key1".getBytes(), "val1".getBytes());
        tree.put("key2".getBytes(), "val2".getBytes());
        reversed.put("key2".getBytes(), "val2".getBytes());
        reversed.put("key1".getBytes(), "val1".getBytes());

        for (RadixTree t : new RadixTree[]{tree, reversed}) {
            assertArrayEquals("val1".getBytes(), t.get("key1".getBytes()));
            assertArrayEquals("val2".getBytes(), t.get("key2".getBytes()));
        }
    }

    @Test
    void testMissingKey() {
        tree.put("key".getBytes(), "value".getBytes());
        assertNull(tree.get("other".getBytes()));
    }

    @Test
    void testEmptyKey() {
        tree.put(new byte[0], "empty".getBytes());
        tree.put("k".getBytes(), "1".getBytes());
        assertArrayEquals("empty".getBytes(), tree.get(new byte[0]));
        assertArrayEquals("1".getBytes(), tree.get("k".getBytes()));
    }

    @Test
    void testEmptyValueIsDistinguishableFromMissing() {
        tree.put("k".getBytes(), new byte[0]);
        byte[] value = tree.get("k".getBytes());
        assertNotNull(value);
        assertEquals(0, value.length);
    }

    @Test
    void testMultipleSizes() {
        tree.put("k".getBytes(), "1".getBytes());
        tree.put("key".getBytes(), "v".getBytes());
        tree.put(new byte[0], "empty".getBytes());
        tree.put("a".getBytes(), "A".getBytes());

        assertArrayEquals("empty".getBytes(), tree.get(new byte[0]));
        assertArrayEquals("1".getBytes(), tree.get("k".getBytes()));
        assertArrayEquals("A".getBytes(), tree.get("a".getBytes()));
        assertArrayEquals("v".getBytes(), tree.get("key".getBytes()));
        assertEquals(4, tree.size());
    }

    @Test
    void testKeysWithNullBytes() {
        byte[] key = "key\0with\0nulls".getBytes();
        tree.put(key, "value".getBytes());
        assertArrayEquals("value".getBytes(), tree.get("key\0with\0nulls".getBytes()));
        assertNull(tree.get("key".getBytes()));
    }

    @Test
    void testKeyEqualityIsByContent() {
        byte[] k1 = "identical".getBytes();
        byte[] k2 = "identical".getBytes();
        tree.put(k1, "value".getBytes());
        assertArrayEquals("value".getBytes(), tree.get(k2));
    }

    @Test
    void testDivergingKeysDoNotResolveToStoredValues() {
        tree.put("abcdefghij".getBytes(), "long".getBytes());
        tree.put("abc".getBytes(), "short".getBytes());

        // shares the stored path but diverges inside a segment
        assertNull(tree.get("abcdefgXij".getBytes()));
        assertNull(tree.get("abd".getBytes()));
        // runs past a stored value
        assertNull(tree.get("abcd".getBytes()));
        assertNull(tree.get("abcdefghijk".getBytes()));
        // stops inside a stored segment
        assertNull(tree.get("ab".getBytes()));
        assertNull(tree.get("abcdefgh".getBytes()));

        assertArrayEquals("long".getBytes(), tree.get("abcdefghij".getBytes()));
        assertArrayEquals("short".getBytes(), tree.get("abc".getBytes()));
    }

    @Test
    void testReturnedValueIsACopy() {
        byte[] value = "value".getBytes();
        tree.put("k".getBytes(), value);
        value[0] = 'X';

        byte[] returned = tree.get("k".getBytes());
        assertArrayEquals("value".getBytes(), returned);
        returned[0] = 'Y';
        assertArrayEquals("value".getBytes(), tree.get("k".getBytes()));
    }

    @Test
    void testByteBufferKeys() {
        ByteBuffer key = ByteBuffer.wrap("--key".getBytes());
        key.position(2);
        tree.put(key, "value".getBytes());

        assertEquals(2, key.position());
        assertArrayEquals("value".getBytes(), tree.get("key".getBytes()));
        assertArrayEquals("value".getBytes(), tree.get(ByteBuffer.wrap("key".getBytes())));
    }

    @Test
    void testRejectsNulls() {
        assertThrows(NullPointerException.class, () -> tree.put((byte[]) null, new byte[0]));
        assertThrows(NullPointerException.class, () -> tree.put(new byte[0], null));
        assertThrows(NullPointerException.class, () -> tree.get((byte[]) null));
        assertFalse(tree.isPoisoned());
    }

    @Test
    void testVariableKeyAndValueSizes() {
        for (int i = 1; i <= 1024; i *= 2) {
            byte[] key = new byte[i];
            byte[] value = new byte[i * 2];
            Arrays.fill(key, (byte) i);
            Arrays.fill(value, (byte) (255 - i));
            tree.put(key, value);
            assertArrayEquals(value, tree.get(key));
        }
        tree.stats();
    }

    @Test
    void testInsertLargeKeyValue() {
        byte[] key = new byte[1024];
        byte[] value = new byte[2048];
        Random random = new Random(7);
        random.nextBytes(key);
        random.nextBytes(value);
        tree.put(key, value);
        assertArrayEquals(value, tree.get(key));
        assertNull(tree.get(Arrays.copyOf(key, 1023)));
    }

    @Test
    void testInsertMultipleAndGetCorrectValues() {
        for (int i = 0; i < 1000; i++) {
            tree.put(("key" + i).getBytes(), ("value" + i).getBytes());
        }
        for (int i = 0; i < 1000; i++) {
            assertArrayEquals(("value" + i).getBytes(), tree.get(("key" + i).getBytes()),
                    "Value for key" + i + " should match");
        }
        assertEquals(1000, tree.size());
        assertEquals(1000, tree.stats().valueCount());
    }

    @Test
    void testPrintStructure() {
        assertEquals("Radix Tree Structure:\nRadix Tree Structure end.\n", tree.printStructure());

        tree.put("a".getBytes(), "1".getBytes());
        tree.put("ab".getBytes(), "2".getBytes());
        String structure = tree.toString();
        assertTrue(structure.contains("[61] ->"), structure);
        assertTrue(structure.contains("[] = 31"), structure);
        assertTrue(structure.contains("[62] = 32"), structure);
    }

    @Test
    void testDebugHelpersHandleVeryLongKey() {
        byte[] key = new byte[1_000_000];
        tree.put(key, "deep".getBytes());
        assertArrayEquals("deep".getBytes(), tree.get(key));

        int nodeCount = tree.stats().nodeCount();
        List<Long> reachable = tree.collectReachableNodeIds();
        assertEquals(nodeCount, reachable.size());

        String structure = tree.printStructure();
        assertTrue(structure.startsWith("Radix Tree Structure:\nnode#" + reachable.get(0) + "\n"));
        assertTrue(structure.contains("node#" + reachable.get(reachable.size() - 1) + "\n"));
        assertTrue(structure.endsWith("[00] = 64656570\nRadix Tree Structure end.\n"));
        assertEquals(structure, tree.toString());
    }

    @Test
    void testRejectsNodeManagerWithDifferentRadix() {
        RadixTreeSettings settings = new RadixTreeSettings(4, 7);
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultRadixTree(new MapBasedNodeManager(16), settings));

        DefaultRadixTree matching = new DefaultRadixTree(new MapBasedNodeManager(4), settings);
        for (int i = 0; i < 100; i++) {
            matching.put(("key" + i).getBytes(), ("value" + i).getBytes());
        }
        assertEquals(100, matching.stats().valueCount());
    }

    @Test
    void testSettingsFromClasspath() {
        DefaultRadixTree small = new DefaultRadixTree(RadixTreeSettings.load("radix-tree-test.properties"));
        for (int i = 0; i < 300; i++) {
            small.put(("key" + i).getBytes(), ("value" + i).getBytes());
        }
        for (int i = 0; i < 300; i++) {
            assertArrayEquals(("value" + i).getBytes(), small.get(("key" + i).getBytes()));
        }
        assertEquals(300, small.stats().valueCount());
    }
}
