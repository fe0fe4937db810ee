package org.radixtree.tree;

import org.radixtree.RadixTreeSettings;
import org.radixtree.node.Child;
import org.radixtree.node.NodeChild;
import org.radixtree.node.NodeManager;
import org.radixtree.node.RadixNode;
import org.radixtree.node.SegmentChain;
import org.radixtree.node.ValueChild;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Insert-or-update walk. The caller holds the write lock.
 * <p>
 * A key is inserted at the first chain whose segments do not match its remainder; there is no
 * preference for free space in ancestor nodes and no migration between nodes.
 */
public class PutHandler {
    private static final Logger logger = LoggerFactory.getLogger(PutHandler.class);
    private static final byte[] EMPTY = new byte[0];

    private final NodeManager nodeManager;
    private final int maxSegmentLength;

    public PutHandler(NodeManager nodeManager, RadixTreeSettings settings) {
        this.nodeManager = nodeManager;
        this.maxSegmentLength = settings.maxSegmentLength();
    }

    public PutResult put(final RadixNode root, byte[] key, byte[] value) {
        int nodesBefore = nodeManager.nodeCount();
        RadixNode node = root;
        int offset = 0;
        while (true) {
            SegmentChain chain = new SegmentChain(nodeManager, node);
            SegmentChain.Match match = chain.find(key, offset);
            if (match != null) {
                int consumed = offset + match.segment().length;
                Child child = match.child();
                if (child instanceof NodeChild next) {
                    node = nodeManager.readExistingNode(next.nodeId());
                    offset = consumed;
                    continue;
                }
                if (consumed == key.length) {
                    match.node().setChild(match.index(), new ValueChild(value));
                    return result(false, nodesBefore);
                }
                // a shorter key owns this segment, push its value one level down
                logger.debug("Promoting value at segment of length {} in node {}", match.segment().length, match.node().id());
                node = chain.group(match.segment());
                offset = consumed;
                continue;
            }

            if (offset == key.length) {
                chain.insert(EMPTY, new ValueChild(value));
                return result(true, nodesBefore);
            }

            int remaining = key.length - offset;
            if (remaining > maxSegmentLength) {
                node = chain.group(Arrays.copyOfRange(key, offset, offset + maxSegmentLength));
                offset += maxSegmentLength;
                continue;
            }

            byte[] segment = Arrays.copyOfRange(key, offset, key.length);
            if (chain.hasExtensions(segment)) {
                // longer keys already use this remainder as their prefix
                node = chain.group(segment);
                offset = key.length;
                continue;
            }
            if (chain.hasCapacityFor(segment)) {
                chain.insert(segment, new ValueChild(value));
                return result(true, nodesBefore);
            }
            int common = chain.longestCommonPrefix(key, offset);
            if (common > 0) {
                node = chain.group(Arrays.copyOfRange(key, offset, offset + common));
                offset += common;
                continue;
            }
            chain.insert(segment, new ValueChild(value));
            return result(true, nodesBefore);
        }
    }

    private PutResult result(boolean inserted, int nodesBefore) {
        return new PutResult(inserted, nodeManager.nodeCount() - nodesBefore);
    }
}
