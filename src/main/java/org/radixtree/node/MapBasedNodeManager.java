package org.radixtree.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public class MapBasedNodeManager implements NodeManager {
    private static final Logger logger = LoggerFactory.getLogger(MapBasedNodeManager.class);

    private final int radix;
    private final AtomicLong nextId = new AtomicLong(0);
    private final ConcurrentMap<Long, RadixNode> nodes = new ConcurrentHashMap<>();

    public MapBasedNodeManager(int radix) {
        if (radix < 2) {
            throw new IllegalArgumentException("Radix must be at least 2, got " + radix);
        }
        this.radix = radix;
    }

    @Override
    public RadixNode allocateNode() {
        long id = nextId.getAndIncrement();
        RadixNode node = new InMemoryRadixNode(id, radix);
        nodes.put(id, node);
        logger.trace("Allocated node {}", id);
        return node;
    }

    @Override
    public RadixNode readNode(long nodeId) {
        return nodes.get(nodeId);
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public int radix() {
        return radix;
    }

    public Set<Long> getAllAllocatedNodeIds() {
        return nodes.keySet();
    }
}
