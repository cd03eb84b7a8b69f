package com.raditha.syntax.tree;

import com.raditha.syntax.token.TokenBuffer;
import com.raditha.syntax.token.TokenRange;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The set of pending trees covering the token buffer, keyed by the index of
 * each tree's first token.
 * <p>
 * Starts with one leaf per token (the end marker is never part of a tree).
 * Clients fold ranges of pending trees into new parents until one tree is
 * left. A fold or role assignment must line up with existing tree
 * boundaries; anything else is a violation and throws
 * {@link IllegalStateException}.
 */
public class Forest {
    private static final Logger logger = LoggerFactory.getLogger(Forest.class);

    private final Arena arena;
    private final TokenBuffer buffer;
    private final int eofIndex;
    private final TreeMap<Integer, Node> trees = new TreeMap<>();
    private int foldCount;
    private boolean finalized;

    public Forest(Arena arena) {
        this.arena = arena;
        this.buffer = arena.tokenBuffer();
        this.eofIndex = buffer.eofIndex();
        for (int i = 0; i < eofIndex; i++) {
            Leaf leaf = arena.createLeaf(i);
            leaf.setOriginal(true);
            leaf.setCanModify(leaf.token().modifiable());
            trees.put(i, leaf);
        }
    }

    /**
     * Give a role to the pending tree that covers exactly {@code range}.
     *
     * @throws IllegalStateException if no pending tree has that coverage or it
     *                               already has a role
     */
    public void assignRole(TokenRange range, NodeRole role) {
        checkOpen();
        if (range.isEmpty()) {
            throw new IllegalStateException("cannot assign a role to an empty range " + range);
        }
        Node node = trees.get(range.begin());
        if (node == null) {
            throw violation("no child starts at token " + range.begin() + " for range " + range);
        }
        Integer next = trees.higherKey(range.begin());
        int end = next == null ? eofIndex : next;
        if (end != range.end()) {
            throw violation("no child with the range " + range + ", the child at "
                    + range.begin() + " ends at " + end);
        }
        assignRole(node, role);
    }

    /**
     * Give a role to a node that has not been attached yet.
     *
     * @throws IllegalStateException if the node already has a role
     */
    public void assignRole(Node node, NodeRole role) {
        if (role == NodeRole.DETACHED) {
            throw new IllegalArgumentException("cannot assign the detached role");
        }
        if (!node.isDetached()) {
            throw new IllegalStateException(String.format("re-assigning role for a child: %s already has %s, wanted %s",
                    describeNode(node), node.role().displayName(), role.displayName()));
        }
        node.setRole(role);
        if (logger.isTraceEnabled()) {
            logger.trace("role {} -> {}", role.displayName(), describeNode(node));
        }
    }

    /**
     * Attach the pending trees inside {@code range} to {@code node} and make
     * it the pending tree for the whole range.
     *
     * @throws IllegalStateException if the range crosses the boundary of a
     *                               pending tree or the node already has children
     */
    public void fold(TokenRange range, Tree node) {
        checkOpen();
        if (node.hasChildren()) {
            throw new IllegalStateException("node already has children: " + node);
        }
        if (range.end() > eofIndex) {
            throw new IllegalStateException("range " + range + " reaches past the last token " + eofIndex);
        }
        if (range.isEmpty() && !trees.isEmpty()) {
            throw violation("cannot fold the empty range " + range + " into " + node.kind().displayName());
        }
        if (!range.isEmpty()) {
            if (!trees.containsKey(range.begin())) {
                throw violation("fold crosses boundaries of existing subtrees: no tree starts at "
                        + range.begin() + " when folding " + range + " into " + node.kind().displayName());
            }
            if (range.end() != eofIndex && !trees.containsKey(range.end())) {
                throw violation("fold crosses boundaries of existing subtrees: no tree starts at "
                        + range.end() + " when folding " + range + " into " + node.kind().displayName());
            }
        }

        NavigableMap<Integer, Node> children = trees.subMap(range.begin(), true, range.end(), false);
        for (Node child : children.values()) {
            if (child.isDetached()) {
                child.setRole(NodeRole.UNKNOWN);
            }
            node.appendChild(child);
        }
        node.setOriginal(true);
        node.setCanModify(buffer.spelledForExpanded(range));

        children.clear();
        trees.put(range.begin(), node);
        foldCount++;

        if (logger.isTraceEnabled()) {
            logger.trace("fold {} over {} '{}'", node.kind().displayName(), range, buffer.text(range));
        }
    }

    /**
     * Take the single remaining tree out of the forest.
     *
     * @throws IllegalStateException unless exactly one tree is pending
     */
    public Node finalizeRoot() {
        checkOpen();
        if (trees.size() != 1) {
            throw violation("expected exactly one tree at the end, found " + trees.size());
        }
        Node root = trees.firstEntry().getValue();
        trees.clear();
        finalized = true;
        return root;
    }

    /**
     * Pending tree starting at {@code tokenIndex}, or null.
     */
    public @Nullable Node pendingAt(int tokenIndex) {
        return trees.get(tokenIndex);
    }

    public List<Node> pendingTrees() {
        return new ArrayList<>(trees.values());
    }

    public int pendingCount() {
        return trees.size();
    }

    /**
     * Number of successful folds so far.
     */
    public int foldCount() {
        return foldCount;
    }

    public Arena arena() {
        return arena;
    }

    /**
     * One entry per pending tree, followed by its dump.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Node> entry : trees.entrySet()) {
            Integer next = trees.higherKey(entry.getKey());
            int covered = (next == null ? eofIndex : next) - entry.getKey();
            sb.append(String.format("- '%s' covers '%s'+%d tokens%n",
                    entry.getValue().kind().displayName(), buffer.get(entry.getKey()).text(), covered));
            sb.append(TreeDumper.dump(entry.getValue()));
        }
        return sb.toString();
    }

    private String describeNode(Node node) {
        if (node instanceof Leaf leaf) {
            return leaf.toString();
        }
        return node.kind().displayName() + " at token " + node.firstTokenIndex();
    }

    private IllegalStateException violation(String message) {
        return new IllegalStateException(message + System.lineSeparator() + describe());
    }

    private void checkOpen() {
        if (finalized) {
            throw new IllegalStateException("forest was already finalized");
        }
    }
}
