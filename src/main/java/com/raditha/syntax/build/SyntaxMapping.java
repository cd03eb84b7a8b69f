package com.raditha.syntax.build;

import com.raditha.syntax.semantic.NestedNameSpecifierLoc;
import com.raditha.syntax.semantic.SemanticNode;
import com.raditha.syntax.tree.Arena;
import com.raditha.syntax.tree.Tree;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Which syntax tree was built for which semantic node. Keys are compared by
 * identity; values are arena handles.
 */
public class SyntaxMapping {

    private final Arena arena;
    private final Map<SemanticNode, Integer> nodes = new IdentityHashMap<>();
    private final Map<NestedNameSpecifierLoc, Integer> qualifiers = new IdentityHashMap<>();

    public SyntaxMapping(Arena arena) {
        this.arena = arena;
    }

    public void add(SemanticNode from, Tree to) {
        Integer previous = nodes.putIfAbsent(from, to.id());
        if (previous != null) {
            throw new IllegalStateException("semantic node " + describe(from) + " is already mapped to "
                    + arena.node(previous));
        }
    }

    public void add(NestedNameSpecifierLoc from, Tree to) {
        Integer previous = qualifiers.putIfAbsent(from, to.id());
        if (previous != null) {
            throw new IllegalStateException("qualifier " + from.sourceRange() + " is already mapped to "
                    + arena.node(previous));
        }
    }

    public Optional<Tree> find(SemanticNode from) {
        Integer handle = nodes.get(from);
        return handle == null ? Optional.empty() : Optional.of(arena.tree(handle));
    }

    public Optional<Tree> find(NestedNameSpecifierLoc from) {
        Integer handle = qualifiers.get(from);
        return handle == null ? Optional.empty() : Optional.of(arena.tree(handle));
    }

    public Tree require(SemanticNode from) {
        return find(from).orElseThrow(
                () -> new IllegalStateException("no syntax node was built for " + describe(from)));
    }

    public Tree require(NestedNameSpecifierLoc from) {
        return find(from).orElseThrow(
                () -> new IllegalStateException("no syntax node was built for qualifier " + from.sourceRange()));
    }

    public int size() {
        return nodes.size() + qualifiers.size();
    }

    private static String describe(SemanticNode node) {
        return node.getClass().getSimpleName() + " " + node.sourceRange();
    }
}
