package org.radixtree;

/**
 * A structural invariant of the tree does not hold. This is a defect, never a lookup miss.
 */
public class CorruptedTreeException extends IllegalStateException {
    public CorruptedTreeException(String message) {
        super(message);
    }
}
