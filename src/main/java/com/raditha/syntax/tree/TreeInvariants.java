package com.raditha.syntax.tree;

import com.raditha.syntax.token.TokenBuffer;

/**
 * Structural self check of a finished tree.
 * <ul>
 *   <li>every child points back to its parent and has a role</li>
 *   <li>children cover adjacent token runs, so a tree covers exactly the
 *       concatenation of its children</li>
 *   <li>only the translation unit of an empty file may have no children</li>
 *   <li>the root covers every token except the end marker, in order</li>
 * </ul>
 */
public final class TreeInvariants {

    private TreeInvariants() {
    }

    /**
     * @throws IllegalStateException on the first violated invariant
     */
    public static void check(Node root, TokenBuffer buffer) {
        if (root.parent() != null) {
            throw new IllegalStateException("root must not have a parent: " + root);
        }
        if (!(root instanceof Tree tree)) {
            throw new IllegalStateException("root must be a tree, got " + root);
        }
        checkRecursive(tree);

        int expected = 0;
        for (Leaf leaf : tree.leaves()) {
            if (leaf.tokenIndex() != expected) {
                throw new IllegalStateException(String.format(
                        "leaf %s has token index %d, expected %d", leaf, leaf.tokenIndex(), expected));
            }
            if (leaf.token() != buffer.get(expected)) {
                throw new IllegalStateException("leaf " + leaf + " does not wrap token " + expected);
            }
            expected++;
        }
        if (expected != buffer.eofIndex()) {
            throw new IllegalStateException(String.format(
                    "root covers %d tokens, the buffer has %d", expected, buffer.eofIndex()));
        }
    }

    /**
     * Check the parent links, roles and contiguity below {@code node}.
     */
    public static void checkRecursive(Node node) {
        if (!(node instanceof Tree tree)) {
            return;
        }
        if (!tree.hasChildren() && tree.kind() != NodeKind.TRANSLATION_UNIT) {
            throw new IllegalStateException(tree + " has no children");
        }
        int previousLast = -1;
        boolean first = true;
        for (Node child : tree.children()) {
            if (child.parent() != tree) {
                throw new IllegalStateException(child + " is not attached to " + tree);
            }
            if (child.isDetached()) {
                throw new IllegalStateException(child + " in " + tree + " has no role");
            }
            if (!first && child.firstTokenIndex() != previousLast + 1) {
                throw new IllegalStateException(String.format(
                        "children of %s are not contiguous: %d follows %d",
                        tree, child.firstTokenIndex(), previousLast));
            }
            checkRecursive(child);
            previousLast = child.lastTokenIndex();
            first = false;
        }
    }
}
