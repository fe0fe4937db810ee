package org.radixtree.node;

/**
 * Reference to a subtree by node id, resolved through the {@link NodeManager}.
 */
public record NodeChild(long nodeId) implements Child {
}
