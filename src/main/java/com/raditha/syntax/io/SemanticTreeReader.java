package com.raditha.syntax.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.raditha.syntax.semantic.Decl;
import com.raditha.syntax.semantic.Expr;
import com.raditha.syntax.semantic.Stmt;
import com.raditha.syntax.semantic.TypeLoc;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.Token;
import com.raditha.syntax.token.TokenBuffer;
import com.raditha.syntax.token.TokenKind;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a token stream and its semantic tree from JSON.
 * <pre>
 * {
 *   "tokens": ["int", "a", ";"],
 *   "decls": [
 *     { "node": "Declarator", "sourceRange": {"begin": 0, "end": 1},
 *       "type": { "node": "TypeSpec", "range": {"begin": 0, "end": 0} },
 *       "nameLoc": 1 }
 *   ]
 * }
 * </pre>
 * A token is either its text or an object with {@code text} and optional
 * {@code offset}, {@code kind} and {@code modifiable}. Without an offset a
 * token is located at its index, so locations in the tree can be written as
 * token indices. The end marker is appended automatically.
 */
public class SemanticTreeReader {
    private static final Logger logger = LoggerFactory.getLogger(SemanticTreeReader.class);

    private final ObjectMapper mapper;

    public SemanticTreeReader() {
        this.mapper = createMapper();
    }

    /**
     * A token stream together with the semantic tree built over it.
     */
    public record Fixture(TokenBuffer tokens, Decl.TranslationUnit translationUnit) {
    }

    /**
     * One token as written in the fixture.
     */
    public record TokenSpec(
            @JsonProperty("text") String text,
            @JsonProperty("offset") @Nullable Integer offset,
            @JsonProperty("kind") @Nullable TokenKind kind,
            @JsonProperty("modifiable") @Nullable Boolean modifiable) {

        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public TokenSpec {
            if (text == null) {
                throw new IllegalArgumentException("token text cannot be null");
            }
        }

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static TokenSpec of(String text) {
            return new TokenSpec(text, null, null, null);
        }

        Token toToken(int index) {
            TokenKind tokenKind = kind != null ? kind : TokenKind.fromSpelling(text);
            int location = offset != null ? offset : index;
            return new Token(tokenKind, SourceLocation.of(location), text, modifiable == null || modifiable);
        }
    }

    record FixtureDocument(
            @JsonProperty("tokens") List<TokenSpec> tokens,
            @JsonProperty("decls") List<Decl> decls) {
    }

    public Fixture read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Fixture file not found: " + file);
        }
        logger.debug("Reading fixture {}", file);
        return toFixture(mapper.readValue(file.toFile(), FixtureDocument.class));
    }

    public Fixture read(String json) throws IOException {
        return toFixture(mapper.readValue(json, FixtureDocument.class));
    }

    private static Fixture toFixture(FixtureDocument document) throws IOException {
        if (document.tokens() == null) {
            throw new IOException("Fixture has no \"tokens\" array");
        }
        List<Token> tokens = new ArrayList<>(document.tokens().size());
        for (int i = 0; i < document.tokens().size(); i++) {
            tokens.add(document.tokens().get(i).toToken(i));
        }
        TokenBuffer buffer;
        try {
            buffer = TokenBuffer.withEof(tokens);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid token stream: " + e.getMessage(), e);
        }
        return new Fixture(buffer, new Decl.TranslationUnit(document.decls()));
    }

    /**
     * Mapper that knows every semantic node variant by its {@code node} name.
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

        mapper.registerSubtypes(
                new NamedType(Decl.TranslationUnit.class, "TranslationUnit"),
                new NamedType(Decl.Declarator.class, "Declarator"),
                new NamedType(Decl.Typedef.class, "Typedef"),
                new NamedType(Decl.TypeAlias.class, "TypeAlias"),
                new NamedType(Decl.Namespace.class, "Namespace"),
                new NamedType(Decl.NamespaceAlias.class, "NamespaceAlias"),
                new NamedType(Decl.UsingDirective.class, "UsingDirective"),
                new NamedType(Decl.Using.class, "Using"),
                new NamedType(Decl.Empty.class, "EmptyDecl"),
                new NamedType(Decl.StaticAssert.class, "StaticAssert"),
                new NamedType(Decl.LinkageSpec.class, "LinkageSpec"),
                new NamedType(Decl.Template.class, "Template"),
                new NamedType(Decl.Tag.class, "Tag"),
                new NamedType(Decl.Unknown.class, "UnknownDecl"));

        mapper.registerSubtypes(
                new NamedType(Stmt.Compound.class, "CompoundStmt"),
                new NamedType(Stmt.DeclStmt.class, "DeclStmt"),
                new NamedType(Stmt.Null.class, "NullStmt"),
                new NamedType(Stmt.Switch.class, "SwitchStmt"),
                new NamedType(Stmt.Case.class, "CaseStmt"),
                new NamedType(Stmt.Default.class, "DefaultStmt"),
                new NamedType(Stmt.If.class, "IfStmt"),
                new NamedType(Stmt.For.class, "ForStmt"),
                new NamedType(Stmt.While.class, "WhileStmt"),
                new NamedType(Stmt.Continue.class, "ContinueStmt"),
                new NamedType(Stmt.Break.class, "BreakStmt"),
                new NamedType(Stmt.Return.class, "ReturnStmt"),
                new NamedType(Stmt.RangeFor.class, "RangeForStmt"),
                new NamedType(Stmt.Unknown.class, "UnknownStmt"));

        mapper.registerSubtypes(
                new NamedType(Expr.Implicit.class, "ImplicitExpr"),
                new NamedType(Expr.IntegerLiteral.class, "IntegerLiteral"),
                new NamedType(Expr.CharacterLiteral.class, "CharacterLiteral"),
                new NamedType(Expr.FloatingLiteral.class, "FloatingLiteral"),
                new NamedType(Expr.StringLiteral.class, "StringLiteral"),
                new NamedType(Expr.BoolLiteral.class, "BoolLiteral"),
                new NamedType(Expr.NullPtrLiteral.class, "NullPtrLiteral"),
                new NamedType(Expr.UserDefinedLiteral.class, "UserDefinedLiteral"),
                new NamedType(Expr.DeclRef.class, "DeclRefExpr"),
                new NamedType(Expr.Member.class, "MemberExpr"),
                new NamedType(Expr.This.class, "ThisExpr"),
                new NamedType(Expr.Paren.class, "ParenExpr"),
                new NamedType(Expr.UnaryOperator.class, "UnaryOperator"),
                new NamedType(Expr.BinaryOperator.class, "BinaryOperator"),
                new NamedType(Expr.OperatorCall.class, "OperatorCallExpr"),
                new NamedType(Expr.Unknown.class, "UnknownExpr"));

        mapper.registerSubtypes(
                new NamedType(TypeLoc.TypeSpec.class, "TypeSpec"),
                new NamedType(TypeLoc.Decltype.class, "Decltype"),
                new NamedType(TypeLoc.TemplateSpecialization.class, "TemplateSpecialization"),
                new NamedType(TypeLoc.DependentTemplateSpecialization.class, "DependentTemplateSpecialization"),
                new NamedType(TypeLoc.Qualified.class, "Qualified"),
                new NamedType(TypeLoc.Pointer.class, "Pointer"),
                new NamedType(TypeLoc.MemberPointer.class, "MemberPointer"),
                new NamedType(TypeLoc.Paren.class, "ParenType"),
                new NamedType(TypeLoc.Array.class, "ArrayType"),
                new NamedType(TypeLoc.FunctionProto.class, "FunctionProto"));
        return mapper;
    }
}
