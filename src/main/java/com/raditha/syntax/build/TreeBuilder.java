package com.raditha.syntax.build;

import com.raditha.syntax.config.BuildOptions;
import com.raditha.syntax.semantic.Decl;
import com.raditha.syntax.semantic.Expr;
import com.raditha.syntax.semantic.NestedNameSpecifierLoc;
import com.raditha.syntax.semantic.SemanticNode;
import com.raditha.syntax.semantic.Stmt;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.TokenBuffer;
import com.raditha.syntax.token.TokenLocator;
import com.raditha.syntax.token.TokenRange;
import com.raditha.syntax.tree.Arena;
import com.raditha.syntax.tree.Forest;
import com.raditha.syntax.tree.Node;
import com.raditha.syntax.tree.NodeKind;
import com.raditha.syntax.tree.NodeRole;
import com.raditha.syntax.tree.Tree;
import com.raditha.syntax.tree.TreeInvariants;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a syntax tree bottom-up. Callers mark the children of the next node
 * with roles and then fold a token range into a new node; whatever is left
 * unmarked gets the {@link NodeRole#UNKNOWN} role. A node's children must be
 * built before the node itself, which a post-order walk of the semantic tree
 * guarantees.
 */
public class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final Arena arena;
    private final TokenBuffer buffer;
    private final TokenLocator locator;
    private final RangeResolver resolver;
    private final Forest forest;
    private final SyntaxMapping mapping;
    private final BuildOptions options;
    private boolean finished;

    public TreeBuilder(Arena arena, BuildOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.arena = arena;
        this.buffer = arena.tokenBuffer();
        this.locator = new TokenLocator(buffer);
        this.resolver = new RangeResolver(locator);
        this.forest = new Forest(arena);
        this.mapping = new SyntaxMapping(arena);
        this.options = options;
    }

    public Arena arena() {
        return arena;
    }

    public TokenLocator locator() {
        return locator;
    }

    public RangeResolver resolver() {
        return resolver;
    }

    public Forest forest() {
        return forest;
    }

    public SyntaxMapping mapping() {
        return mapping;
    }

    public BuildOptions options() {
        return options;
    }

    /**
     * Create a node of {@code kind} over {@code range} and, when an owner is
     * given, remember it as the syntax for that semantic node.
     */
    public Tree foldNode(TokenRange range, NodeKind kind, @Nullable SemanticNode owner) {
        Tree node = fold(range, kind);
        if (owner != null) {
            mapping.add(owner, node);
        }
        return node;
    }

    public Tree foldQualifierNode(TokenRange range, NodeKind kind, NestedNameSpecifierLoc owner) {
        Tree node = fold(range, kind);
        mapping.add(owner, node);
        return node;
    }

    private Tree fold(TokenRange range, NodeKind kind) {
        checkOpen();
        Tree node = arena.createTree(kind);
        forest.fold(range, node);
        return node;
    }

    /**
     * Set the role of the leaf at {@code location}; invalid locations are
     * skipped.
     */
    public void markChildToken(SourceLocation location, NodeRole role) {
        markChildToken(locator.findToken(location), role);
    }

    public void markChildToken(int tokenIndex, NodeRole role) {
        if (tokenIndex == TokenLocator.NO_TOKEN) {
            return;
        }
        forest.assignRole(TokenRange.single(tokenIndex), role);
    }

    public void markChild(Node node, NodeRole role) {
        forest.assignRole(node, role);
    }

    public void markChild(SemanticNode owner, NodeRole role) {
        forest.assignRole(mapping.require(owner), role);
    }

    public void markChild(NestedNameSpecifierLoc owner, NodeRole role) {
        forest.assignRole(mapping.require(owner), role);
    }

    /**
     * Set the role of a pending tree by the tokens it covers.
     */
    public void markChild(TokenRange range, NodeRole role) {
        forest.assignRole(range, role);
    }

    /**
     * Set the role of a statement child. An expression in statement position
     * is wrapped into an expression statement that takes its {@code ;}.
     */
    public void markStmtChild(@Nullable Stmt child, NodeRole role) {
        if (child == null) {
            return;
        }
        Tree node;
        if (child instanceof Expr expression) {
            markExprChild(expression, NodeRole.EXPRESSION_STATEMENT_EXPRESSION);
            node = foldNode(resolver.getStmtRange(child), NodeKind.EXPRESSION_STATEMENT, null);
        } else {
            node = mapping.require(child);
        }
        forest.assignRole(node, role);
    }

    public void markExprChild(@Nullable Expr child, NodeRole role) {
        if (child == null) {
            return;
        }
        forest.assignRole(mapping.require(child.ignoreImplicit()), role);
    }

    public void noticeDeclWithoutSemicolon(Decl decl) {
        resolver.noticeDeclWithoutSemicolon(decl);
    }

    /**
     * Whether {@code decl} builds the declaration node of a multi-declarator
     * declaration such as {@code int a, *b;}. All declarators of one
     * declaration share a begin location and the last one builds the node.
     *
     * @param next the declaration following {@code decl} in the same scope
     */
    public boolean isResponsibleForCreatingDeclaration(Decl decl, @Nullable Decl next) {
        if (!(decl instanceof Decl.Declarator) && !(decl instanceof Decl.Typedef)) {
            throw new IllegalArgumentException("only declarators and typedefs share declarations, got "
                    + decl.getClass().getSimpleName());
        }
        if (next == null) {
            return true;
        }
        if (!sameKind(decl, next)) {
            return true;
        }
        return !next.beginLoc().equals(decl.beginLoc());
    }

    private static boolean sameKind(Decl decl, Decl next) {
        if (decl.getClass() != next.getClass()) {
            return false;
        }
        if (decl instanceof Decl.Declarator declarator) {
            return declarator.kind() == ((Decl.Declarator) next).kind();
        }
        return true;
    }

    /**
     * Wrap everything left into the translation unit and return it.
     *
     * @throws IllegalStateException if pending trees do not line up or the
     *                               tree was already finished
     */
    public Tree finalizeTree() {
        checkOpen();
        Tree unit = arena.createTree(NodeKind.TRANSLATION_UNIT);
        forest.fold(new TokenRange(0, buffer.eofIndex()), unit);
        Node root = forest.finalizeRoot();
        finished = true;

        if (options.verifyInvariants()) {
            TreeInvariants.check(root, buffer);
        }
        if (options.logSummary()) {
            logger.info("Built syntax tree: {} tokens, {} nodes, {} folds, {} mapped semantic nodes",
                    buffer.eofIndex(), arena.size(), forest.foldCount(), mapping.size());
        }
        return unit;
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("the syntax tree was already finished");
        }
    }
}
