package org.radixtree;

import org.radixtree.node.Child;
import org.radixtree.node.MapBasedNodeManager;
import org.radixtree.node.NodeChild;
import org.radixtree.node.NodeManager;
import org.radixtree.node.RadixNode;
import org.radixtree.node.SegmentChain;
import org.radixtree.node.ValueChild;
import org.radixtree.tree.PutHandler;
import org.radixtree.tree.PutResult;
import org.radixtree.tree.StructureValidator;
import org.radixtree.tree.TreeStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Radix tree guarded by a single read/write lock: any number of concurrent {@link #get} calls,
 * one {@link #put} at a time.
 * <p>
 * Values are copied on the way in and on the way out, no array handed to or returned by the tree
 * aliases its internal storage.
 */
public class DefaultRadixTree implements RadixTree {
    private static final Logger logger = LoggerFactory.getLogger(DefaultRadixTree.class);
    private static final HexFormat HEX = HexFormat.of();
    private static final int LOGGED_KEY_PREFIX = 16;
    // deeper levels are printed at this indentation, node ids still tell them apart
    private static final int MAX_PRINTED_INDENT = 32;

    private final NodeManager nodeManager;
    private final PutHandler putHandler;
    private final StructureValidator validator;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    private RadixNode root;
    private int size;
    private volatile Throwable poisonCause;

    public DefaultRadixTree() {
        this(RadixTreeSettings.DEFAULT);
    }

    public DefaultRadixTree(RadixTreeSettings settings) {
        this(new MapBasedNodeManager(settings.radix()), settings);
    }

    public DefaultRadixTree(NodeManager nodeManager, RadixTreeSettings settings) {
        if (nodeManager.radix() != settings.radix()) {
            throw new IllegalArgumentException("Node manager allocates nodes of radix " + nodeManager.radix()
                    + " but settings require radix " + settings.radix());
        }
        this.nodeManager = nodeManager;
        this.putHandler = new PutHandler(nodeManager, settings);
        this.validator = new StructureValidator(nodeManager, settings);
    }

    @Override
    public byte[] get(byte[] key) {
        Objects.requireNonNull(key, "key");
        readLock.lock();
        try {
            checkNotPoisoned();
            return root == null ? null : lookup(key);
        } finally {
            readLock.unlock();
        }
    }

    private byte[] lookup(byte[] key) {
        RadixNode node = root;
        int offset = 0;
        while (true) {
            SegmentChain.Match match = new SegmentChain(nodeManager, node).find(key, offset);
            if (match == null) {
                return null;
            }
            int consumed = offset + match.segment().length;
            Child child = match.child();
            if (child instanceof ValueChild value) {
                // a value under a proper prefix of the key belongs to a different key
                return consumed == key.length ? value.value().clone() : null;
            }
            node = nodeManager.readExistingNode(((NodeChild) child).nodeId());
            offset = consumed;
        }
    }

    @Override
    public void put(byte[] key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        byte[] ownedValue = value.clone();
        writeLock.lock();
        try {
            checkNotPoisoned();
            try {
                if (root == null) {
                    root = nodeManager.allocateNode();
                    logger.debug("Created root node {}", root.id());
                }
                PutResult result = putHandler.put(root, key, ownedValue);
                if (result.inserted()) {
                    size++;
                }
            } catch (RuntimeException | Error e) {
                poisonCause = e;
                logger.error("Put of key {}.. ({} bytes) failed, tree is poisoned",
                        HEX.formatHex(key, 0, Math.min(key.length, LOGGED_KEY_PREFIX)), key.length, e);
                throw e;
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        readLock.lock();
        try {
            return size;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Validates the whole structure.
     *
     * @throws CorruptedTreeException if any structural invariant is broken
     */
    public TreeStats stats() {
        readLock.lock();
        try {
            checkNotPoisoned();
            return validator.validate(root);
        } finally {
            readLock.unlock();
        }
    }

    public boolean isPoisoned() {
        return poisonCause != null;
    }

    private void checkNotPoisoned() {
        Throwable cause = poisonCause;
        if (cause != null) {
            throw new TreePoisonedException(cause);
        }
    }

    // this implementation uses list and not set since it is used for debugging purposes,
    // and part of testing is to make sure no node is referenced twice
    public List<Long> collectReachableNodeIds() {
        readLock.lock();
        try {
            List<Long> visited = new LinkedList<>();
            Deque<RadixNode> pending = new ArrayDeque<>();
            if (root != null) {
                pending.push(root);
            }
            while (!pending.isEmpty()) {
                RadixNode node = pending.pop();
                visited.add(node.id());
                // pushed in reverse so children are visited in segment order
                for (int i = node.numSegments() - 1; i >= 0; i--) {
                    if (node.child(i) instanceof NodeChild child) {
                        pending.push(nodeManager.readExistingNode(child.nodeId()));
                    }
                }
            }
            return visited;
        } finally {
            readLock.unlock();
        }
    }

    public String printStructure() {
        readLock.lock();
        try {
            StringBuilder sb = new StringBuilder();
            sb.append("Radix Tree Structure:\n");
            Deque<PrintFrame> frames = new ArrayDeque<>();
            if (root != null) {
                frames.push(openFrame(root, 0, sb));
            }
            while (!frames.isEmpty()) {
                PrintFrame frame = frames.peek();
                if (frame.nextIndex == frame.node.numSegments()) {
                    frames.pop();
                    continue;
                }
                int i = frame.nextIndex++;
                byte[] segment = frame.node.segment(i);
                Child child = frame.node.child(i);
                sb.append(frame.indent).append("  [").append(HEX.formatHex(segment)).append("] ");
                if (child instanceof ValueChild value) {
                    sb.append("= ").append(HEX.formatHex(value.value())).append('\n');
                } else if (child instanceof NodeChild next) {
                    sb.append(segment.length == 0 ? "overflow" : "->").append('\n');
                    frames.push(openFrame(nodeManager.readExistingNode(next.nodeId()), frame.level + 2, sb));
                }
            }
            sb.append("Radix Tree Structure end.\n");
            return sb.toString();
        } finally {
            readLock.unlock();
        }
    }

    private static PrintFrame openFrame(RadixNode node, int level, StringBuilder sb) {
        PrintFrame frame = new PrintFrame(node, level);
        sb.append(frame.indent).append("node#").append(node.id()).append('\n');
        return frame;
    }

    private static final class PrintFrame {
        private final RadixNode node;
        private final int level;
        private final String indent;
        private int nextIndex;

        private PrintFrame(RadixNode node, int level) {
            this.node = node;
            this.level = level;
            this.indent = "  ".repeat(Math.min(level, MAX_PRINTED_INDENT));
        }
    }

    @Override
    public String toString() {
        return printStructure();
    }
}
