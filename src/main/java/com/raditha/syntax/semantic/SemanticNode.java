package com.raditha.syntax.semantic;

import com.raditha.syntax.token.SourceRange;

/**
 * A node of the semantic tree that may own a concrete syntax node.
 * Implementations are compared by identity when they are mapped to the tree
 * built for them.
 */
public interface SemanticNode {

    /**
     * Range from the first to the last token of the construct, as reported by
     * the front end. Trailing separators are usually not part of it.
     */
    SourceRange sourceRange();
}
