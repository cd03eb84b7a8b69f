package com.raditha.syntax.tree;

import org.jspecify.annotations.Nullable;

/**
 * A node of the concrete syntax tree: either a {@link Leaf} holding one token
 * or a {@link Tree} with ordered children.
 * <p>
 * Nodes are allocated by an {@link Arena} and identified by their handle in it.
 * Structure and roles are only changed through {@link Forest}.
 */
public abstract class Node {

    private final int id;
    private NodeRole role = NodeRole.DETACHED;
    private boolean original;
    private boolean canModify;
    private @Nullable Tree parent;

    Node(int id) {
        this.id = id;
    }

    /**
     * Handle of this node in its arena.
     */
    public int id() {
        return id;
    }

    public abstract NodeKind kind();

    public NodeRole role() {
        return role;
    }

    /**
     * True if the node was produced from real source content rather than
     * synthesized.
     */
    public boolean isOriginal() {
        return original;
    }

    /**
     * True if every token below this node can be rewritten in the source.
     */
    public boolean canModify() {
        return canModify;
    }

    public @Nullable Tree parent() {
        return parent;
    }

    public boolean isDetached() {
        return role == NodeRole.DETACHED;
    }

    /**
     * Index of the first token covered by this node, or -1 for an empty tree.
     */
    public abstract int firstTokenIndex();

    /**
     * Index of the last token covered by this node, or -1 for an empty tree.
     */
    public abstract int lastTokenIndex();

    void setRole(NodeRole role) {
        this.role = role;
    }

    void setOriginal(boolean original) {
        this.original = original;
    }

    void setCanModify(boolean canModify) {
        this.canModify = canModify;
    }

    void setParent(Tree parent) {
        this.parent = parent;
    }
}
