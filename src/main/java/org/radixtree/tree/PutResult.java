package org.radixtree.tree;

/**
 * @param inserted       true if the key was new, false if an existing value was replaced
 * @param allocatedNodes number of nodes allocated by the put
 */
public record PutResult(
        boolean inserted,
        int allocatedNodes
) {
}
