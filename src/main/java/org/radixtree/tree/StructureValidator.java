package org.radixtree.tree;

import org.radixtree.CorruptedTreeException;
import org.radixtree.RadixTreeSettings;
import org.radixtree.node.Child;
import org.radixtree.node.NodeChild;
import org.radixtree.node.NodeManager;
import org.radixtree.node.RadixNode;
import org.radixtree.node.SegmentComparator;
import org.radixtree.node.ValueChild;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

import static org.radixtree.node.SegmentComparator.COMPARATOR;

/**
 * Walks the whole tree and checks every structural invariant. The caller holds at least the read lock.
 */
public class StructureValidator {
    private static final HexFormat HEX = HexFormat.of();

    private final NodeManager nodeManager;
    private final RadixTreeSettings settings;

    public StructureValidator(NodeManager nodeManager, RadixTreeSettings settings) {
        this.nodeManager = nodeManager;
        this.settings = settings;
    }

    public TreeStats validate(RadixNode root) {
        if (root == null) {
            return TreeStats.EMPTY;
        }
        Set<Long> visited = new HashSet<>();
        int values = 0;
        int maxDepth = 0;

        Deque<Pending> pending = new ArrayDeque<>();
        visit(root, visited);
        pending.push(new Pending(root, 1));
        while (!pending.isEmpty()) {
            Pending current = pending.pop();
            List<byte[]> chainSegments = new ArrayList<>();
            RadixNode node = current.head();
            while (node != null) {
                checkNode(node);
                RadixNode next = null;
                for (int i = 0; i < node.numSegments(); i++) {
                    byte[] segment = node.segment(i);
                    Child child = node.child(i);
                    if (segment.length > 0) {
                        chainSegments.add(segment);
                    }
                    if (child instanceof ValueChild) {
                        values++;
                        maxDepth = Math.max(maxDepth, current.depth());
                    } else if (child instanceof NodeChild nodeChild) {
                        RadixNode target = nodeManager.readExistingNode(nodeChild.nodeId());
                        visit(target, visited);
                        if (segment.length == 0) {
                            next = target;
                        } else {
                            pending.push(new Pending(target, current.depth() + 1));
                        }
                    } else {
                        throw new CorruptedTreeException("Node " + node.id() + " has no child at index " + i);
                    }
                }
                node = next;
            }
            checkPrefixFree(current.head(), chainSegments);
        }
        return new TreeStats(visited.size(), values, maxDepth);
    }

    private void checkNode(RadixNode node) {
        if (node.numSegments() > settings.radix()) {
            throw new CorruptedTreeException("Node " + node.id() + " holds " + node.numSegments()
                    + " segments, more than radix " + settings.radix());
        }
        for (int i = 0; i < node.numSegments(); i++) {
            byte[] segment = node.segment(i);
            if (segment == null) {
                throw new CorruptedTreeException("Node " + node.id() + " has no segment at index " + i);
            }
            if (segment.length > settings.maxSegmentLength()) {
                throw new CorruptedTreeException("Segment " + HEX.formatHex(segment) + " of node " + node.id()
                        + " is longer than " + settings.maxSegmentLength());
            }
            if (segment.length == 0 && i != 0) {
                throw new CorruptedTreeException("Empty segment at index " + i + " of node " + node.id());
            }
            if (i > 0 && COMPARATOR.compare(node.segment(i - 1), segment) >= 0) {
                throw new CorruptedTreeException("Segments of node " + node.id() + " are not strictly increasing at index " + i);
            }
        }
    }

    private static void checkPrefixFree(RadixNode head, List<byte[]> segments) {
        segments.sort(COMPARATOR);
        // in sorted order a prefix directly precedes one of its extensions
        for (int i = 1; i < segments.size(); i++) {
            if (SegmentComparator.startsWith(segments.get(i), segments.get(i - 1))) {
                throw new CorruptedTreeException("Segment " + HEX.formatHex(segments.get(i - 1))
                        + " collides with " + HEX.formatHex(segments.get(i)) + " in chain of node " + head.id());
            }
        }
    }

    private static void visit(RadixNode node, Set<Long> visited) {
        if (!visited.add(node.id())) {
            throw new CorruptedTreeException("Node " + node.id() + " is referenced more than once");
        }
    }

    private record Pending(RadixNode head, int depth) {
    }
}
