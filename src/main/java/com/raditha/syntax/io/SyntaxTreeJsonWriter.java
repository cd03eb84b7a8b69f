package com.raditha.syntax.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.syntax.tree.Leaf;
import com.raditha.syntax.tree.Node;
import com.raditha.syntax.tree.Tree;

/**
 * Writes a syntax tree as nested JSON objects. Trees carry their children,
 * leaves carry their token.
 */
public class SyntaxTreeJsonWriter {

    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toJson(Node node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("kind", node.kind().displayName());
        json.put("role", node.role().displayName());
        json.put("original", node.isOriginal());
        json.put("canModify", node.canModify());
        if (node instanceof Leaf leaf) {
            ObjectNode token = json.putObject("token");
            token.put("text", leaf.token().text());
            token.put("kind", leaf.token().kind().name());
            token.put("index", leaf.tokenIndex());
            token.put("offset", leaf.token().location().offset());
        } else if (node instanceof Tree tree) {
            ArrayNode children = json.putArray("children");
            for (Node child : tree.children()) {
                children.add(toJson(child));
            }
        }
        return json;
    }

    public String write(Node root) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(root));
    }
}
