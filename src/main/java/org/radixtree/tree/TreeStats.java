package org.radixtree.tree;

/**
 * @param nodeCount  nodes reachable from the root, overflow nodes included
 * @param valueCount stored values, equal to the number of distinct keys
 * @param maxDepth   longest root-to-value path counted in logical nodes, 0 for an empty tree
 */
public record TreeStats(
        int nodeCount,
        int valueCount,
        int maxDepth
) {
    public static final TreeStats EMPTY = new TreeStats(0, 0, 0);
}
