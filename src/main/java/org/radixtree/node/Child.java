package org.radixtree.node;

/**
 * What a segment resolves to: either the value of a complete key or a subtree.
 */
public sealed interface Child permits ValueChild, NodeChild {
}
