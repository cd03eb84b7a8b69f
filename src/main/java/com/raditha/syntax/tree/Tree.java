package com.raditha.syntax.tree;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An inner node: a syntactic category plus ordered children, each carrying a
 * role. The children of a tree cover a contiguous run of tokens.
 */
public final class Tree extends Node {

    private final NodeKind kind;
    private final List<Node> children = new ArrayList<>();

    Tree(int id, NodeKind kind) {
        super(id);
        if (kind == null || kind.isLeaf()) {
            throw new IllegalArgumentException("a tree needs a non-leaf kind, got: " + kind);
        }
        this.kind = kind;
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public @Nullable Node firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    public @Nullable Node lastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /**
     * Find the first child with the given role.
     */
    public Optional<Node> findChild(NodeRole role) {
        for (Node child : children) {
            if (child.role() == role) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * All children with the given role, in order.
     */
    public List<Node> findChildren(NodeRole role) {
        List<Node> result = new ArrayList<>();
        for (Node child : children) {
            if (child.role() == role) {
                result.add(child);
            }
        }
        return result;
    }

    public @Nullable Leaf firstLeaf() {
        Node current = this;
        while (current instanceof Tree tree) {
            current = tree.firstChild();
        }
        return (Leaf) current;
    }

    public @Nullable Leaf lastLeaf() {
        Node current = this;
        while (current instanceof Tree tree) {
            current = tree.lastChild();
        }
        return (Leaf) current;
    }

    /**
     * All leaves below this tree, in token order.
     */
    public List<Leaf> leaves() {
        List<Leaf> result = new ArrayList<>();
        collectLeaves(this, result);
        return result;
    }

    private static void collectLeaves(Node node, List<Leaf> result) {
        if (node instanceof Leaf leaf) {
            result.add(leaf);
        } else if (node instanceof Tree tree) {
            for (Node child : tree.children) {
                collectLeaves(child, result);
            }
        }
    }

    @Override
    public int firstTokenIndex() {
        Leaf leaf = firstLeaf();
        return leaf == null ? -1 : leaf.tokenIndex();
    }

    @Override
    public int lastTokenIndex() {
        Leaf leaf = lastLeaf();
        return leaf == null ? -1 : leaf.tokenIndex();
    }

    void appendChild(Node child) {
        if (child.parent() != null) {
            throw new IllegalStateException("node " + child.id() + " already has a parent");
        }
        child.setParent(this);
        children.add(child);
    }

    @Override
    public String toString() {
        return kind.displayName() + "#" + id();
    }
}
