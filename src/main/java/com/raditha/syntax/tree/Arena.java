package com.raditha.syntax.tree;

import com.raditha.syntax.token.TokenBuffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns the token buffer and every node built over it.
 * Allocation only appends; a node's handle is its position in the arena and
 * nothing is ever freed individually. The arena outlives the builder that
 * filled it.
 */
public class Arena {

    private final TokenBuffer tokenBuffer;
    private final List<Node> nodes = new ArrayList<>();

    public Arena(TokenBuffer tokenBuffer) {
        if (tokenBuffer == null) {
            throw new IllegalArgumentException("tokenBuffer cannot be null");
        }
        this.tokenBuffer = tokenBuffer;
    }

    public TokenBuffer tokenBuffer() {
        return tokenBuffer;
    }

    /**
     * Allocate a leaf for the token at {@code tokenIndex}.
     */
    public Leaf createLeaf(int tokenIndex) {
        Leaf leaf = new Leaf(nodes.size(), tokenBuffer.get(tokenIndex), tokenIndex);
        nodes.add(leaf);
        return leaf;
    }

    /**
     * Allocate an empty tree of the given kind.
     */
    public Tree createTree(NodeKind kind) {
        Tree tree = new Tree(nodes.size(), kind);
        nodes.add(tree);
        return tree;
    }

    public Node node(int handle) {
        return nodes.get(handle);
    }

    public Tree tree(int handle) {
        if (nodes.get(handle) instanceof Tree tree) {
            return tree;
        }
        throw new IllegalStateException("handle " + handle + " is not a tree");
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }
}
