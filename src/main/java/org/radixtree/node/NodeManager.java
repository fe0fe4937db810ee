package org.radixtree.node;

import org.radixtree.CorruptedTreeException;

/**
 * Arena of tree nodes. Nodes reference each other by id only.
 */
public interface NodeManager {
    RadixNode allocateNode();

    /**
     * @return the node or null if no node with this id was allocated
     */
    RadixNode readNode(long nodeId);

    int nodeCount();

    /**
     * @return capacity of every node this manager allocates
     */
    int radix();

    default RadixNode readExistingNode(long nodeId) {
        RadixNode node = readNode(nodeId);
        if (node == null) {
            throw new CorruptedTreeException("Node " + nodeId + " is referenced but was never allocated");
        }
        return node;
    }
}
