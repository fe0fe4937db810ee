package org.radixtree;

/**
 * Thrown by every operation after a writer failed while holding the write lock,
 * since the tree may have been left half-updated.
 */
public class TreePoisonedException extends IllegalStateException {
    public TreePoisonedException(Throwable cause) {
        super("Tree is unusable: a previous put failed while holding the write lock", cause);
    }
}
