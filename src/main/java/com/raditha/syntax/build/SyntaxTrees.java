package com.raditha.syntax.build;

import com.raditha.syntax.config.BuildOptions;
import com.raditha.syntax.semantic.Decl;
import com.raditha.syntax.token.TokenBuffer;
import com.raditha.syntax.tree.Arena;
import com.raditha.syntax.tree.Tree;

/**
 * Entry point: build the syntax tree of a translation unit.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    public static Tree build(TokenBuffer buffer, Decl.TranslationUnit unit) {
        return build(new Arena(buffer), unit, BuildOptions.defaults());
    }

    public static Tree build(TokenBuffer buffer, Decl.TranslationUnit unit, BuildOptions options) {
        return build(new Arena(buffer), unit, options);
    }

    /**
     * Build into an existing arena. The returned tree and all its nodes live
     * in the arena.
     *
     * @throws IllegalStateException         if the semantic tree does not line up
     *                                       with the tokens
     * @throws UnsupportedOperationException for constructs that cannot be built
     */
    public static Tree build(Arena arena, Decl.TranslationUnit unit, BuildOptions options) {
        if (unit == null) {
            throw new IllegalArgumentException("translation unit cannot be null");
        }
        TreeBuilder builder = new TreeBuilder(arena, options);
        new BuildTreeTraversal(builder).traverseTranslationUnit(unit);
        return builder.finalizeTree();
    }
}
