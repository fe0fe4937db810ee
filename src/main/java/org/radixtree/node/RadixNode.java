package org.radixtree.node;

public interface RadixNode {
    long id();

    int numSegments();

    int capacity();

    boolean isFull();

    byte[] segment(int idx);

    Child child(int idx);

    void setChild(int idx, Child child);

    /**
     * Inserts the pair at its sorted position.
     *
     * @return the index the pair was stored at
     */
    int insert(byte[] segment, Child child);

    void remove(int idx);

    void removeRange(int fromIdx, int toIdx);

    /**
     * @return index of the greatest segment that is less or equal to {@code key[offset..]}, or -1
     */
    int floorIndex(byte[] key, int offset);

    /**
     * @return index of the first segment that is greater or equal to {@code key}, or {@link #numSegments()}
     */
    int lowerBound(byte[] key);

    /**
     * @return the next node of the overflow chain, or -1 when this node is the tail
     */
    long overflowNodeId();
}
