package com.raditha.syntax.io;

import com.raditha.syntax.build.SyntaxTrees;
import com.raditha.syntax.semantic.Decl;
import com.raditha.syntax.semantic.Expr;
import com.raditha.syntax.semantic.Stmt;
import com.raditha.syntax.semantic.TypeLoc;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.Token;
import com.raditha.syntax.token.TokenKind;
import com.raditha.syntax.tree.TreeDumper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SemanticTreeReaderTest {

    private final SemanticTreeReader reader = new SemanticTreeReader();

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(SemanticTreeReaderTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    void testReadsTokensAtTheirIndex() throws IOException {
        SemanticTreeReader.Fixture fixture = reader.read("""
                {"tokens": ["int", "a", ";"], "decls": []}
                """);

        assertEquals(3, fixture.tokens().eofIndex());
        assertEquals(SourceLocation.of(1), fixture.tokens().get(1).location());
        assertEquals(TokenKind.SEMI, fixture.tokens().get(2).kind());
        assertTrue(fixture.tokens().get(3).is(TokenKind.EOF));
        assertTrue(fixture.translationUnit().decls().isEmpty());
    }

    @Test
    void testReadsTokenObjects() throws IOException {
        SemanticTreeReader.Fixture fixture = reader.read("""
                {
                  "tokens": [
                    {"text": "x", "offset": 4},
                    {"text": "MAX", "offset": 10, "kind": "NUMERIC_CONSTANT", "modifiable": false}
                  ],
                  "decls": []
                }
                """);

        Token first = fixture.tokens().get(0);
        assertEquals(SourceLocation.of(4), first.location());
        assertEquals(TokenKind.IDENTIFIER, first.kind());
        assertTrue(first.modifiable());

        Token second = fixture.tokens().get(1);
        assertEquals(TokenKind.NUMERIC_CONSTANT, second.kind());
        assertFalse(second.modifiable());
    }

    @Test
    void testReadsSemanticNodes() throws IOException {
        SemanticTreeReader.Fixture fixture = reader.read("""
                {
                  "tokens": ["int", "a", "=", "1", ";"],
                  "decls": [
                    {
                      "node": "Declarator",
                      "kind": "VARIABLE",
                      "sourceRange": {"begin": 0, "end": 3},
                      "type": {"node": "TypeSpec", "range": {"begin": 0, "end": 0}},
                      "nameLoc": 1,
                      "init": {"node": "ImplicitExpr", "subExpr": {"node": "IntegerLiteral", "loc": 3}}
                    }
                  ]
                }
                """);

        Decl.Declarator declarator = (Decl.Declarator) fixture.translationUnit().decls().get(0);
        assertEquals(Decl.DeclaratorKind.VARIABLE, declarator.kind());
        assertEquals(SourceLocation.of(1), declarator.nameLoc());
        assertInstanceOf(TypeLoc.TypeSpec.class, declarator.type());
        Expr init = declarator.init();
        assertInstanceOf(Expr.Implicit.class, init);
        assertEquals(new Expr.IntegerLiteral(SourceLocation.of(3)), init.ignoreImplicit());
        assertNull(declarator.body());
        assertFalse(declarator.forRangeDecl());
    }

    @Test
    void testReadsFixtureFile() throws Exception {
        SemanticTreeReader.Fixture fixture = reader.read(fixture("function-definition.json"));

        Decl.Declarator function = (Decl.Declarator) fixture.translationUnit().decls().get(0);
        assertTrue(function.isDefinition());
        Stmt.Compound body = (Stmt.Compound) function.body();
        assertInstanceOf(Stmt.Return.class, body.body().get(0));

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'void'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | |-'f'
                  | `-ParametersAndQualifiers
                  |   |-'(' OpenParen
                  |   `-')' CloseParen
                  `-CompoundStatement
                    |-'{' OpenParen
                    |-ReturnStatement CompoundStatement_statement
                    | |-'return' IntroducerKeyword
                    | `-';'
                    `-'}' CloseParen
                """;
        assertEquals(expected, TreeDumper.dump(SyntaxTrees.build(fixture.tokens(), fixture.translationUnit())));
    }

    @Test
    void testMissingFileFails() {
        IOException e = assertThrows(IOException.class, () -> reader.read(Path.of("does-not-exist.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void testMissingTokensFail() {
        IOException e = assertThrows(IOException.class, () -> reader.read("{\"decls\": []}"));
        assertTrue(e.getMessage().contains("tokens"));
    }

    @Test
    void testDecreasingOffsetsFail() {
        IOException e = assertThrows(IOException.class, () -> reader.read("""
                {"tokens": [{"text": "a", "offset": 5}, {"text": "b", "offset": 2}], "decls": []}
                """));
        assertTrue(e.getMessage().startsWith("Invalid token stream"));
    }

    @Test
    void testUnknownPropertiesAndNodesFail() {
        assertThrows(IOException.class, () -> reader.read("""
                {"tokens": [";"], "decls": [{"node": "EmptyDecl", "sourceRange": {"begin": 0, "end": 0},
                 "extra": true}]}
                """));
        assertThrows(IOException.class, () -> reader.read("""
                {"tokens": [";"], "decls": [{"node": "Lambda"}]}
                """));
    }
}
