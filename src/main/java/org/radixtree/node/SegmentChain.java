package org.radixtree.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A node together with the overflow nodes chained from it through their empty segment.
 * <p>
 * The non-empty segments of the whole chain are prefix-free, so a key remainder has at most one
 * segment that equals it or is a proper prefix of it. The empty segment of the tail holds the value
 * of the key that ends at this position; the empty segment of any other chain node points to the next node.
 */
public class SegmentChain {
    private static final Logger logger = LoggerFactory.getLogger(SegmentChain.class);
    static final byte[] EMPTY = new byte[0];

    private final NodeManager nodeManager;
    private final RadixNode head;

    public SegmentChain(NodeManager nodeManager, RadixNode head) {
        this.nodeManager = nodeManager;
        this.head = head;
    }

    public RadixNode head() {
        return head;
    }

    public RadixNode next(RadixNode node) {
        long nextId = node.overflowNodeId();
        return nextId < 0 ? null : nodeManager.readExistingNode(nextId);
    }

    public RadixNode tail() {
        RadixNode node = head;
        RadixNode next;
        while ((next = next(node)) != null) {
            node = next;
        }
        return node;
    }

    /**
     * Finds the entry whose segment equals {@code key[offset..]} or is a proper prefix of it.
     * An exhausted key only matches the value stored under the empty segment.
     */
    public Match find(byte[] key, int offset) {
        for (RadixNode node = head; node != null; node = next(node)) {
            if (offset == key.length) {
                if (node.numSegments() > 0
                        && node.segment(0).length == 0
                        && node.child(0) instanceof ValueChild) {
                    return new Match(node, 0);
                }
                continue;
            }
            int idx = node.floorIndex(key, offset);
            if (idx >= 0) {
                byte[] segment = node.segment(idx);
                if (segment.length > 0 && SegmentComparator.isPrefixOf(segment, key, offset)) {
                    return new Match(node, idx);
                }
            }
        }
        return null;
    }

    public boolean hasCapacityFor(byte[] segment) {
        if (segment.length == 0) {
            return !tail().isFull();
        }
        for (RadixNode node = head; node != null; node = next(node)) {
            if (!node.isFull()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if some segment has {@code prefix} as a proper prefix
     */
    public boolean hasExtensions(byte[] prefix) {
        for (RadixNode node = head; node != null; node = next(node)) {
            int idx = node.lowerBound(prefix);
            for (; idx < node.numSegments(); idx++) {
                byte[] segment = node.segment(idx);
                if (!SegmentComparator.startsWith(segment, prefix)) {
                    break;
                }
                if (segment.length > prefix.length) {
                    return true;
                }
            }
        }
        return false;
    }

    public int longestCommonPrefix(byte[] key, int offset) {
        int longest = 0;
        for (RadixNode node = head; node != null; node = next(node)) {
            for (int i = 0; i < node.numSegments(); i++) {
                longest = Math.max(longest, SegmentComparator.commonPrefixLength(node.segment(i), key, offset));
            }
        }
        return longest;
    }

    /**
     * Stores the pair in the chain node closest to the head that has a free slot,
     * extending the chain when every node is full.
     */
    public void insert(byte[] segment, Child child) {
        if (segment.length == 0) {
            RadixNode tail = tail();
            if (!tail.isFull()) {
                tail.insert(segment, child);
                return;
            }
        } else {
            for (RadixNode node = head; node != null; node = next(node)) {
                if (!node.isFull()) {
                    node.insert(segment, child);
                    return;
                }
            }
        }
        extend().insert(segment, child);
    }

    /**
     * Moves every entry whose segment starts with {@code prefix} into a new node, strips the prefix from
     * their segments and links the new node under {@code prefix}. An entry equal to the prefix ends up
     * under the empty segment.
     *
     * @return the new node
     */
    public RadixNode group(byte[] prefix) {
        RadixNode groupNode = nodeManager.allocateNode();
        List<byte[]> segments = new ArrayList<>();
        List<Child> children = new ArrayList<>();
        for (RadixNode node = head; node != null; node = next(node)) {
            int from = node.lowerBound(prefix);
            int to = from;
            while (to < node.numSegments() && SegmentComparator.startsWith(node.segment(to), prefix)) {
                segments.add(node.segment(to));
                children.add(node.child(to));
                to++;
            }
            node.removeRange(from, to);
        }

        SegmentChain groupChain = new SegmentChain(nodeManager, groupNode);
        for (int i = 0; i < segments.size(); i++) {
            byte[] segment = segments.get(i);
            groupChain.insert(Arrays.copyOfRange(segment, prefix.length, segment.length), children.get(i));
        }
        insert(prefix, new NodeChild(groupNode.id()));

        logger.debug("Grouped {} entries of node {} into node {}", segments.size(), head.id(), groupNode.id());
        return groupNode;
    }

    private RadixNode extend() {
        RadixNode tail = tail();
        RadixNode next = nodeManager.allocateNode();
        // the empty segment of a non-tail node is reserved for the overflow link
        int moved = tail.segment(0).length == 0 ? 0 : tail.numSegments() - 1;
        next.insert(tail.segment(moved), tail.child(moved));
        tail.remove(moved);
        tail.insert(EMPTY, new NodeChild(next.id()));

        logger.debug("Extended overflow chain of node {} with node {}", head.id(), next.id());
        return next;
    }

    public record Match(RadixNode node, int index) {
        public byte[] segment() {
            return node.segment(index);
        }

        public Child child() {
            return node.child(index);
        }
    }
}
