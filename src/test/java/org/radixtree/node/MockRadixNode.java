package org.radixtree.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Node that stores whatever it is given, in the given order, so tests can build broken structures.
 */
public class MockRadixNode implements RadixNode {
    private final long id;
    private final int capacity;
    private final List<byte[]> segments = new ArrayList<>();
    private final List<Child> children = new ArrayList<>();

    public MockRadixNode(long id, int capacity) {
        this.id = id;
        this.capacity = capacity;
    }

    public MockRadixNode add(String segment, Child child) {
        segments.add(segment.getBytes());
        children.add(child);
        return this;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public int numSegments() {
        return segments.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public boolean isFull() {
        return segments.size() >= capacity;
    }

    @Override
    public byte[] segment(int idx) {
        return segments.get(idx);
    }

    @Override
    public Child child(int idx) {
        return children.get(idx);
    }

    @Override
    public void setChild(int idx, Child child) {
        children.set(idx, child);
    }

    @Override
    public int insert(byte[] segment, Child child) {
        segments.add(segment);
        children.add(child);
        return segments.size() - 1;
    }

    @Override
    public void remove(int idx) {
        segments.remove(idx);
        children.remove(idx);
    }

    @Override
    public void removeRange(int fromIdx, int toIdx) {
        for (int i = toIdx - 1; i >= fromIdx; i--) {
            remove(i);
        }
    }

    @Override
    public int floorIndex(byte[] key, int offset) {
        return -1;
    }

    @Override
    public int lowerBound(byte[] key) {
        return segments.size();
    }

    @Override
    public long overflowNodeId() {
        return -1;
    }
}
