package com.raditha.syntax.tree;

import com.raditha.syntax.token.Token;

/**
 * A node wrapping exactly one expanded token.
 */
public final class Leaf extends Node {

    private final Token token;
    private final int tokenIndex;

    Leaf(int id, Token token, int tokenIndex) {
        super(id);
        this.token = token;
        this.tokenIndex = tokenIndex;
    }

    public Token token() {
        return token;
    }

    public int tokenIndex() {
        return tokenIndex;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LEAF;
    }

    @Override
    public int firstTokenIndex() {
        return tokenIndex;
    }

    @Override
    public int lastTokenIndex() {
        return tokenIndex;
    }

    @Override
    public String toString() {
        return "'" + token.text() + "'";
    }
}
