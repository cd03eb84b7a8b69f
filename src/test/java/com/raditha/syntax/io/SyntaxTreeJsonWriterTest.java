package com.raditha.syntax.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.syntax.build.SyntaxTrees;
import com.raditha.syntax.tree.Tree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeJsonWriterTest {

    @Test
    void testWritesNestedTree() throws Exception {
        SemanticTreeReader.Fixture fixture = new SemanticTreeReader()
                .read(SemanticTreeReaderTest.fixture("simple-declaration.json"));
        Tree root = SyntaxTrees.build(fixture.tokens(), fixture.translationUnit());

        JsonNode json = new ObjectMapper().readTree(new SyntaxTreeJsonWriter().write(root));

        assertEquals("TranslationUnit", json.get("kind").asText());
        assertEquals("Detached", json.get("role").asText());
        JsonNode declaration = json.get("children").get(0);
        assertEquals("SimpleDeclaration", declaration.get("kind").asText());
        assertEquals("Unknown", declaration.get("role").asText());
        assertEquals(3, declaration.get("children").size());

        JsonNode declarator = declaration.get("children").get(1);
        assertEquals("SimpleDeclaration_declarator", declarator.get("role").asText());
        JsonNode name = declarator.get("children").get(0);
        assertEquals("Leaf", name.get("kind").asText());
        assertEquals("a", name.get("token").get("text").asText());
        assertEquals("IDENTIFIER", name.get("token").get("kind").asText());
        assertEquals(1, name.get("token").get("index").asInt());
        assertTrue(name.get("original").asBoolean());
        assertTrue(name.get("canModify").asBoolean());
    }
}
