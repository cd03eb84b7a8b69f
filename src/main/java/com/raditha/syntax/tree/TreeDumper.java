package com.raditha.syntax.tree;

import java.util.List;

/**
 * Debug listing of a syntax tree, one node per line:
 * <pre>
 * TranslationUnit Detached
 * `-SimpleDeclaration
 *   |-'int'
 *   |-SimpleDeclarator SimpleDeclaration_declarator
 *   | `-'a'
 *   `-';'
 * </pre>
 * Unknown roles are not printed. Nodes that cannot be modified are marked.
 */
public final class TreeDumper {

    private TreeDumper() {
    }

    public static String dump(Node root) {
        StringBuilder sb = new StringBuilder();
        appendNode(sb, root);
        appendChildren(sb, root, "");
        return sb.toString();
    }

    private static void appendChildren(StringBuilder sb, Node node, String indent) {
        if (!(node instanceof Tree tree)) {
            return;
        }
        List<Node> children = tree.children();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            boolean last = i == children.size() - 1;
            sb.append(indent).append(last ? "`-" : "|-");
            appendNode(sb, child);
            appendChildren(sb, child, indent + (last ? "  " : "| "));
        }
    }

    private static void appendNode(StringBuilder sb, Node node) {
        if (node instanceof Leaf leaf) {
            sb.append('\'').append(leaf.token().text()).append('\'');
        } else {
            sb.append(node.kind().displayName());
        }
        if (node.role() != NodeRole.UNKNOWN) {
            sb.append(' ').append(node.role().displayName());
        }
        if (!node.isOriginal()) {
            sb.append(" synthesized");
        }
        if (!node.canModify()) {
            sb.append(" unmodifiable");
        }
        sb.append('\n');
    }
}
