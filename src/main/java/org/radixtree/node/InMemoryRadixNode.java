package org.radixtree.node;

import java.util.Arrays;
import java.util.HexFormat;

import static org.radixtree.node.SegmentComparator.COMPARATOR;

public class InMemoryRadixNode implements RadixNode {
    private static final HexFormat HEX = HexFormat.of();

    private final long id;
    private final byte[][] segments;
    private final Child[] children;

    private int numSegments = 0;

    public InMemoryRadixNode(long id, int radix) {
        this.id = id;
        this.segments = new byte[radix][];
        this.children = new Child[radix];
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public int numSegments() {
        return numSegments;
    }

    @Override
    public int capacity() {
        return segments.length;
    }

    @Override
    public boolean isFull() {
        return numSegments == segments.length;
    }

    @Override
    public byte[] segment(int idx) {
        checkIndex(idx);
        return segments[idx];
    }

    @Override
    public Child child(int idx) {
        checkIndex(idx);
        return children[idx];
    }

    @Override
    public void setChild(int idx, Child child) {
        checkIndex(idx);
        children[idx] = child;
    }

    @Override
    public int insert(byte[] segment, Child child) {
        if (isFull()) {
            throw new IllegalStateException("Cannot insert into full node " + id);
        }
        int idx = lowerBound(segment);
        if (idx < numSegments && COMPARATOR.compare(segments[idx], segment) == 0) {
            throw new IllegalStateException("Segment " + HEX.formatHex(segment) + " already present in node " + id);
        }
        if (numSegments > idx) {
            System.arraycopy(segments, idx, segments, idx + 1, numSegments - idx);
            System.arraycopy(children, idx, children, idx + 1, numSegments - idx);
        }
        segments[idx] = segment;
        children[idx] = child;
        numSegments++;
        return idx;
    }

    @Override
    public void remove(int idx) {
        removeRange(idx, idx + 1);
    }

    @Override
    public void removeRange(int fromIdx, int toIdx) {
        if (fromIdx < 0 || toIdx > numSegments || fromIdx > toIdx) {
            throw new IndexOutOfBoundsException("Range [" + fromIdx + ", " + toIdx + ") out of " + numSegments);
        }
        int removed = toIdx - fromIdx;
        if (removed == 0) {
            return;
        }
        System.arraycopy(segments, toIdx, segments, fromIdx, numSegments - toIdx);
        System.arraycopy(children, toIdx, children, fromIdx, numSegments - toIdx);
        Arrays.fill(segments, numSegments - removed, numSegments, null);
        Arrays.fill(children, numSegments - removed, numSegments, null);
        numSegments -= removed;
    }

    @Override
    public int floorIndex(byte[] key, int offset) {
        int low = 0;
        int high = numSegments - 1;
        int floor = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = SegmentComparator.compare(segments[mid], key, offset);
            if (cmp == 0) {
                return mid;
            }
            if (cmp < 0) {
                floor = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return floor;
    }

    @Override
    public int lowerBound(byte[] key) {
        int low = 0;
        int high = numSegments;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (COMPARATOR.compare(segments[mid], key) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @Override
    public long overflowNodeId() {
        if (numSegments > 0 && segments[0].length == 0 && children[0] instanceof NodeChild next) {
            return next.nodeId();
        }
        return -1;
    }

    private void checkIndex(int idx) {
        if (idx < 0 || idx >= numSegments) {
            throw new IndexOutOfBoundsException("Index " + idx + " out of " + numSegments + " in node " + id);
        }
    }

    @Override
    public String toString() {
        StringBuilder data = new StringBuilder();
        for (int i = 0; i < numSegments; i++) {
            if (i > 0) {
                data.append(", ");
            }
            data.append(HEX.formatHex(segments[i])).append('=');
            if (children[i] instanceof NodeChild node) {
                data.append("node#").append(node.nodeId());
            } else if (children[i] instanceof ValueChild value) {
                data.append(HEX.formatHex(value.value()));
            }
        }
        return "InMemoryRadixNode{" +
                "id=" + id +
                ", size=" + numSegments + "/" + segments.length +
                ", data={" + data +
                "}}";
    }
}
