package com.raditha.syntax.build;

import com.raditha.syntax.SourceTokens;
import com.raditha.syntax.config.BuildOptions;
import com.raditha.syntax.semantic.Decl;
import com.raditha.syntax.semantic.Expr;
import com.raditha.syntax.semantic.NestedNameSpecifierLoc;
import com.raditha.syntax.semantic.NestedNameSpecifierLoc.NameSpecifierKind;
import com.raditha.syntax.semantic.Stmt;
import com.raditha.syntax.semantic.TemplateParameterList;
import com.raditha.syntax.semantic.TypeLoc;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.tree.Arena;
import com.raditha.syntax.tree.Leaf;
import com.raditha.syntax.tree.Node;
import com.raditha.syntax.tree.NodeKind;
import com.raditha.syntax.tree.NodeRole;
import com.raditha.syntax.tree.Tree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.syntax.SourceTokens.loc;
import static com.raditha.syntax.SourceTokens.range;
import static com.raditha.syntax.build.TraversalSupport.build;
import static com.raditha.syntax.build.TraversalSupport.dump;
import static org.junit.jupiter.api.Assertions.*;

class DeclarationTraversalTest {

    private static TypeLoc.TypeSpec typeSpec(int index) {
        return new TypeLoc.TypeSpec(range(index, index), null);
    }

    private static Decl.Declarator variable(int first, int last, TypeLoc type, int name) {
        return new Decl.Declarator(Decl.DeclaratorKind.VARIABLE, range(first, last), type, loc(name),
                null, null, null, false);
    }

    @Test
    void testSimpleDeclaration() {
        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'int'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | `-'a'
                  `-';'
                """;
        assertEquals(expected, dump("int a ;", variable(0, 1, typeSpec(0), 1)));
    }

    @Test
    void testUnnamedFunctionDeclarationHasNoDeclarator() {
        TypeLoc type = TypeLoc.FunctionProto.of(loc(1), List.of(), loc(2), typeSpec(0));
        Decl function = new Decl.Declarator(Decl.DeclaratorKind.FUNCTION, range(0, 2), type,
                SourceLocation.INVALID, null, null, null, false);

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'int'
                  |-ParametersAndQualifiers
                  | |-'(' OpenParen
                  | `-')' CloseParen
                  `-';'
                """;
        assertEquals(expected, dump("int ( ) ;", function));
    }

    @Test
    void testEmptyTranslationUnit() {
        Tree unit = build("");

        assertEquals(NodeKind.TRANSLATION_UNIT, unit.kind());
        assertFalse(unit.hasChildren());
    }

    @Test
    void testDeclaratorsShareOneDeclaration() {
        Decl first = variable(0, 1, typeSpec(0), 1);
        Decl second = variable(0, 4, new TypeLoc.Pointer(TypeLoc.PointerKind.POINTER, loc(3), typeSpec(0)), 4);

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'int'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | `-'a'
                  |-','
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | |-'*'
                  | `-'b'
                  `-';'
                """;
        assertEquals(expected, dump("int a , * b ;", first, second));
    }

    @Test
    void testArrayOfPointers() {
        TypeLoc type = new TypeLoc.Array(loc(3), new Expr.IntegerLiteral(loc(4)), loc(5),
                new TypeLoc.Pointer(TypeLoc.PointerKind.POINTER, loc(1), typeSpec(0)));

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'int'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | |-'*'
                  | |-'a'
                  | `-ArraySubscript
                  |   |-'[' OpenParen
                  |   |-IntegerLiteralExpression ArraySubscript_sizeExpression
                  |   | `-'10' LiteralToken
                  |   `-']' CloseParen
                  `-';'
                """;
        assertEquals(expected, dump("int * a [ 10 ] ;", variable(0, 5, type, 2)));
    }

    @Test
    void testTrailingReturnType() {
        TypeLoc type = TypeLoc.FunctionProto.trailing(loc(0), loc(2), List.of(), loc(3), typeSpec(5));
        Decl function = new Decl.Declarator(Decl.DeclaratorKind.FUNCTION, range(0, 5), type, loc(1),
                null, null, null, false);

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'auto'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | |-'f'
                  | `-ParametersAndQualifiers
                  |   |-'(' OpenParen
                  |   |-')' CloseParen
                  |   `-TrailingReturnType ParametersAndQualifiers_trailingReturn
                  |     |-'->' ArrowToken
                  |     `-'int'
                  `-';'
                """;
        assertEquals(expected, dump("auto f ( ) -> int ;", function));
    }

    @Test
    void testTrailingReturnTypeWithDeclarator() {
        // auto f ( ) -> int * ;
        TypeLoc returned = new TypeLoc.Pointer(TypeLoc.PointerKind.POINTER, loc(6), typeSpec(5));
        TypeLoc type = TypeLoc.FunctionProto.trailing(loc(0), loc(2), List.of(), loc(3), returned);
        Decl function = new Decl.Declarator(Decl.DeclaratorKind.FUNCTION, range(0, 6), type, loc(1),
                null, null, null, false);

        Tree unit = build("auto f ( ) -> int * ;", function);

        Tree trailing = (Tree) findFirst(unit, NodeKind.TRAILING_RETURN_TYPE);
        assertEquals(NodeRole.PARAMETERS_AND_QUALIFIERS_TRAILING_RETURN, trailing.role());
        Node declarator = trailing.findChild(NodeRole.TRAILING_RETURN_TYPE_DECLARATOR).orElseThrow();
        assertEquals(NodeKind.SIMPLE_DECLARATOR, declarator.kind());
        assertEquals(6, declarator.firstTokenIndex());
    }

    @Test
    void testFunctionDefinition() {
        Decl parameter = new Decl.Declarator(Decl.DeclaratorKind.PARAMETER, range(3, 4), typeSpec(3), loc(4),
                null, null, null, false);
        Stmt body = new Stmt.Compound(loc(6),
                List.of(new Stmt.Return(loc(7), new Expr.Implicit(Expr.DeclRef.simple(loc(8))))), loc(10));
        Decl function = new Decl.Declarator(Decl.DeclaratorKind.FUNCTION, range(0, 10),
                TypeLoc.FunctionProto.of(loc(2), List.of(parameter), loc(5), typeSpec(0)), loc(1),
                null, null, body, false);

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'int'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | |-'f'
                  | `-ParametersAndQualifiers
                  |   |-'(' OpenParen
                  |   |-SimpleDeclaration ParametersAndQualifiers_parameter
                  |   | |-'int'
                  |   | `-SimpleDeclarator SimpleDeclaration_declarator
                  |   |   `-'x'
                  |   `-')' CloseParen
                  `-CompoundStatement
                    |-'{' OpenParen
                    |-ReturnStatement CompoundStatement_statement
                    | |-'return' IntroducerKeyword
                    | |-IdExpression ReturnStatement_value
                    | | `-UnqualifiedId IdExpression_id
                    | |   `-'x'
                    | `-';'
                    `-'}' CloseParen
                """;
        assertEquals(expected, dump("int f ( int x ) { return x ; }", function));
    }

    @Test
    void testUnnamedParameterHasNoDeclarator() {
        // void f ( int ) ;
        Decl parameter = new Decl.Declarator(Decl.DeclaratorKind.PARAMETER, range(3, 3), typeSpec(3),
                null, null, null, null, false);
        Decl function = new Decl.Declarator(Decl.DeclaratorKind.FUNCTION, range(0, 4),
                TypeLoc.FunctionProto.of(loc(2), List.of(parameter), loc(4), typeSpec(0)), loc(1),
                null, null, null, false);

        Tree unit = build("void f ( int ) ;", function);

        Tree parameters = (Tree) findFirst(unit, NodeKind.PARAMETERS_AND_QUALIFIERS);
        Tree parameterDeclaration = (Tree) parameters.findChild(NodeRole.PARAMETERS_AND_QUALIFIERS_PARAMETER)
                .orElseThrow();
        assertEquals(NodeKind.SIMPLE_DECLARATION, parameterDeclaration.kind());
        assertEquals(1, parameterDeclaration.children().size());
        assertInstanceOf(Leaf.class, parameterDeclaration.firstChild());
    }

    @Test
    void testPointerToFunction() {
        // int ( * xp ) ( int ) ;
        Decl parameter = new Decl.Declarator(Decl.DeclaratorKind.PARAMETER, range(6, 6), typeSpec(6),
                null, null, null, null, false);
        TypeLoc proto = TypeLoc.FunctionProto.of(loc(5), List.of(parameter), loc(7), typeSpec(0));
        TypeLoc type = new TypeLoc.Pointer(TypeLoc.PointerKind.POINTER, loc(2),
                new TypeLoc.Paren(loc(1), proto, loc(4)));

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-'int'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | |-ParenDeclarator
                  | | |-'(' OpenParen
                  | | |-'*'
                  | | |-'xp'
                  | | `-')' CloseParen
                  | `-ParametersAndQualifiers
                  |   |-'(' OpenParen
                  |   |-SimpleDeclaration ParametersAndQualifiers_parameter
                  |   | `-'int'
                  |   `-')' CloseParen
                  `-';'
                """;
        assertEquals(expected, dump("int ( * xp ) ( int ) ;", variable(0, 7, type, 3)));
    }

    @Test
    void testVariableInitializerIsPartOfDeclarator() {
        Decl decl = new Decl.Declarator(Decl.DeclaratorKind.VARIABLE, range(0, 3), typeSpec(0), loc(1),
                null, new Expr.IntegerLiteral(loc(3)), null, false);

        Tree unit = build("int a = 1 ;", decl);

        Tree declaration = (Tree) unit.firstChild();
        Tree declarator = (Tree) declaration.findChild(NodeRole.SIMPLE_DECLARATION_DECLARATOR).orElseThrow();
        assertEquals(1, declarator.firstTokenIndex());
        assertEquals(3, declarator.lastTokenIndex());
        assertEquals(NodeKind.INTEGER_LITERAL_EXPRESSION, declarator.lastChild().kind());
    }

    @Test
    void testFieldInitializerIsNotPartOfDeclarator() {
        // struct S { int a = 1 ; } ;
        Decl field = new Decl.Declarator(Decl.DeclaratorKind.FIELD, range(3, 6), typeSpec(3), loc(4),
                null, new Expr.IntegerLiteral(loc(6)), null, false);
        Decl tag = new Decl.Tag(Decl.TagKind.STRUCT, range(0, 8), loc(0), true, List.of(), null,
                List.of(field), null, null);

        Tree unit = build("struct S { int a = 1 ; } ;", tag);

        Tree fieldDeclaration = (Tree) findFirst(unit, NodeKind.SIMPLE_DECLARATION, 3);
        Tree declarator = (Tree) fieldDeclaration.findChild(NodeRole.SIMPLE_DECLARATION_DECLARATOR).orElseThrow();
        assertEquals(4, declarator.firstTokenIndex());
        assertEquals(4, declarator.lastTokenIndex());
        assertEquals(7, fieldDeclaration.lastTokenIndex(), "the field declaration owns its ';'");
    }

    @Test
    void testTypedefs() {
        Decl first = new Decl.Typedef(range(0, 2), typeSpec(1), loc(2));
        Decl second = new Decl.Typedef(range(0, 5), new TypeLoc.Pointer(TypeLoc.PointerKind.POINTER, loc(4),
                typeSpec(1)), loc(5));

        Tree unit = build("typedef int A , * B ;", first, second);

        assertEquals(1, unit.children().size());
        Tree declaration = (Tree) unit.firstChild();
        assertEquals(NodeKind.SIMPLE_DECLARATION, declaration.kind());
        assertEquals(2, declaration.findChildren(NodeRole.SIMPLE_DECLARATION_DECLARATOR).size());
    }

    @Test
    void testQualifiedTypeSpecifier() {
        NestedNameSpecifierLoc std = new NestedNameSpecifierLoc(NameSpecifierKind.NAMESPACE, range(0, 1),
                null, null);
        TypeLoc type = new TypeLoc.TypeSpec(range(0, 2), std);

        String expected = """
                TranslationUnit Detached
                `-SimpleDeclaration
                  |-NestedNameSpecifier
                  | |-IdentifierNameSpecifier List_element
                  | | `-'std'
                  | `-'::' List_delimiter
                  |-'string'
                  |-SimpleDeclarator SimpleDeclaration_declarator
                  | `-'s'
                  `-';'
                """;
        assertEquals(expected, dump("std :: string s ;", variable(0, 3, type, 3)));
    }

    @Test
    void testOutOfLineDefinitionNameIncludesQualifier() {
        // void S :: f ( ) { }
        NestedNameSpecifierLoc qualifier = new NestedNameSpecifierLoc(NameSpecifierKind.TYPE_SPEC, range(1, 2),
                null, typeSpec(1));
        Decl function = new Decl.Declarator(Decl.DeclaratorKind.FUNCTION, range(0, 7),
                TypeLoc.FunctionProto.of(loc(4), List.of(), loc(5), typeSpec(0)), loc(3), qualifier, null,
                new Stmt.Compound(loc(6), List.of(), loc(7)), false);

        Tree unit = build("void S :: f ( ) { }", function);

        Tree declaration = (Tree) unit.firstChild();
        assertEquals(7, declaration.lastTokenIndex());
        Tree declarator = (Tree) declaration.findChild(NodeRole.SIMPLE_DECLARATION_DECLARATOR).orElseThrow();
        assertEquals(1, declarator.firstTokenIndex());
        assertEquals(NodeKind.NESTED_NAME_SPECIFIER, declarator.firstChild().kind());
    }

    @Test
    void testNestedNamespaceIsOwnedByOuterDefinition() {
        Decl inner = new Decl.Namespace(range(2, 8), List.of(variable(5, 6, typeSpec(5), 6)));
        Decl outer = new Decl.Namespace(range(0, 8), List.of(inner));

        String expected = """
                TranslationUnit Detached
                `-NamespaceDefinition
                  |-'namespace'
                  |-'a'
                  |-'::'
                  |-'b'
                  |-'{'
                  |-SimpleDeclaration
                  | |-'int'
                  | |-SimpleDeclarator SimpleDeclaration_declarator
                  | | `-'x'
                  | `-';'
                  `-'}'
                """;
        assertEquals(expected, dump("namespace a :: b { int x ; }", outer));
    }

    @Test
    void testClassTemplate() {
        TemplateParameterList parameters = new TemplateParameterList(loc(0), loc(1),
                List.of(new Decl.Unknown(range(2, 3))), loc(4));
        Decl tag = new Decl.Tag(Decl.TagKind.STRUCT, range(5, 8), loc(5), true, List.of(), null,
                List.of(), null, null);
        Decl template = new Decl.Template(range(0, 8), parameters, tag);

        String expected = """
                TranslationUnit Detached
                `-TemplateDeclaration
                  |-'template' IntroducerKeyword
                  |-'<'
                  |-UnknownDeclaration
                  | |-'class'
                  | `-'T'
                  |-'>'
                  `-SimpleDeclaration TemplateDeclaration_declaration
                    |-'struct'
                    |-'S'
                    |-'{'
                    |-'}'
                    `-';'
                """;
        assertEquals(expected, dump("template < class T > struct S { } ;", template));
    }

    @Test
    void testFunctionTemplateDefinition() {
        TemplateParameterList parameters = new TemplateParameterList(loc(0), loc(1),
                List.of(new Decl.Unknown(range(2, 3))), loc(4));
        Decl function = new Decl.Declarator(Decl.DeclaratorKind.FUNCTION, range(5, 10),
                TypeLoc.FunctionProto.of(loc(7), List.of(), loc(8), typeSpec(5)), loc(6), null, null,
                new Stmt.Compound(loc(9), List.of(), loc(10)), false);
        Decl template = new Decl.Template(range(0, 10), parameters, function);

        Tree unit = build("template < class T > void f ( ) { }", template);

        Tree templateDeclaration = (Tree) unit.firstChild();
        assertEquals(NodeKind.TEMPLATE_DECLARATION, templateDeclaration.kind());
        Node declaration = templateDeclaration.lastChild();
        assertEquals(NodeKind.SIMPLE_DECLARATION, declaration.kind());
        assertEquals(NodeRole.TEMPLATE_DECLARATION_DECLARATION, declaration.role());
    }

    @Test
    void testOutOfLineMemberTemplateHeaders() {
        // template < class T > template < class U > struct A < T > :: B { } ;
        TemplateParameterList outer = new TemplateParameterList(loc(0), loc(1),
                List.of(new Decl.Unknown(range(2, 3))), loc(4));
        TemplateParameterList inner = new TemplateParameterList(loc(5), loc(6),
                List.of(new Decl.Unknown(range(7, 8))), loc(9));
        NestedNameSpecifierLoc qualifier = new NestedNameSpecifierLoc(NameSpecifierKind.TYPE_SPEC, range(11, 15),
                null, new TypeLoc.TemplateSpecialization(range(11, 14), null, List.of(typeSpec(13)), List.of()));
        Decl tag = new Decl.Tag(Decl.TagKind.STRUCT, range(0, 18), loc(10), true, List.of(outer, inner), null,
                List.of(), qualifier, null);

        Tree unit = build("template < class T > template < class U > struct A < T > :: B { } ;", tag);

        Tree outerTemplate = (Tree) unit.firstChild();
        assertEquals(NodeKind.TEMPLATE_DECLARATION, outerTemplate.kind());
        assertEquals(0, outerTemplate.firstTokenIndex());
        Tree innerTemplate = (Tree) outerTemplate.lastChild();
        assertEquals(NodeKind.TEMPLATE_DECLARATION, innerTemplate.kind());
        assertEquals(NodeRole.TEMPLATE_DECLARATION_DECLARATION, innerTemplate.role());
        assertEquals(5, innerTemplate.firstTokenIndex());
        Tree declaration = (Tree) innerTemplate.lastChild();
        assertEquals(NodeKind.SIMPLE_DECLARATION, declaration.kind());
        assertEquals(10, declaration.firstTokenIndex());
        assertEquals(19, declaration.lastTokenIndex());
    }

    @Test
    void testExplicitInstantiation() {
        Decl tag = new Decl.Tag(Decl.TagKind.STRUCT, range(0, 6), loc(2), true, List.of(), null, List.of(),
                null, new Decl.Instantiation(loc(0), loc(1)));

        String expected = """
                TranslationUnit Detached
                `-ExplicitTemplateInstantiation
                  |-'extern' ExternKeyword
                  |-'template' IntroducerKeyword
                  `-SimpleDeclaration ExplicitTemplateInstantiation_declaration
                    |-'struct'
                    |-'S'
                    |-'<'
                    |-'int'
                    |-'>'
                    `-';'
                """;
        assertEquals(expected, dump("extern template struct S < int > ;", tag));
    }

    @Test
    void testExplicitInstantiationNeedsTemplateKeyword() {
        Decl tag = new Decl.Tag(Decl.TagKind.STRUCT, range(0, 5), loc(1), true, List.of(), null, List.of(),
                null, new Decl.Instantiation(null, loc(0)));

        assertThrows(IllegalStateException.class, () -> build("extern struct S < int > ;", tag));
    }

    @Test
    void testClassInsideDeclarationIsNotFolded() {
        // struct S { } s ;
        Decl tag = new Decl.Tag(Decl.TagKind.STRUCT, range(0, 3), loc(0), false, List.of(), null, List.of(),
                null, null);
        Decl variable = variable(0, 4, new TypeLoc.TypeSpec(range(0, 3), null), 4);

        Tree unit = build("struct S { } s ;", tag, variable);

        assertEquals(1, unit.children().size());
        assertEquals(NodeKind.SIMPLE_DECLARATION, unit.firstChild().kind());
    }

    @Test
    void testEmbeddedClassWithTemplateHeadersFails() {
        Decl tag = new Decl.Tag(Decl.TagKind.STRUCT, range(0, 8), loc(5), false,
                List.of(new TemplateParameterList(loc(0), loc(1), List.of(), loc(4))), null, List.of(), null, null);

        assertThrows(IllegalStateException.class, () -> build("template < class T > struct S { } ;", tag));
    }

    @Test
    void testSimpleDeclarationKinds() {
        Decl linkage = new Decl.LinkageSpec(range(0, 6), List.of(variable(3, 4, typeSpec(3), 4)));
        Decl directive = new Decl.UsingDirective(range(7, 9), null);
        Decl staticAssert = new Decl.StaticAssert(range(11, 16), new Expr.BoolLiteral(loc(13)),
                new Expr.StringLiteral(range(15, 15)));
        Decl empty = new Decl.Empty(range(18, 18));
        Decl alias = new Decl.TypeAlias(range(19, 22), typeSpec(22));

        Tree unit = build("extern \"C\" { int a ; } using namespace std ; static_assert ( true , \"m\" ) ; ; "
                + "using T = int ;", linkage, directive, staticAssert, empty, alias);

        List<NodeKind> kinds = unit.children().stream().map(Node::kind).toList();
        assertEquals(List.of(NodeKind.LINKAGE_SPECIFICATION_DECLARATION, NodeKind.USING_NAMESPACE_DIRECTIVE,
                NodeKind.STATIC_ASSERT_DECLARATION, NodeKind.EMPTY_DECLARATION, NodeKind.TYPE_ALIAS_DECLARATION),
                kinds);

        Tree assertion = (Tree) unit.children().get(2);
        assertEquals(NodeKind.BOOL_LITERAL_EXPRESSION,
                assertion.findChild(NodeRole.STATIC_ASSERT_DECLARATION_CONDITION).orElseThrow().kind());
        assertEquals(NodeKind.STRING_LITERAL_EXPRESSION,
                assertion.findChild(NodeRole.STATIC_ASSERT_DECLARATION_MESSAGE).orElseThrow().kind());
        assertEquals(17, assertion.lastTokenIndex());
    }

    @Test
    void testSemanticNodesAreMapped() {
        Decl decl = variable(0, 1, typeSpec(0), 1);
        TreeBuilder builder = new TreeBuilder(new Arena(SourceTokens.lex("int a ;")), BuildOptions.defaults());

        new BuildTreeTraversal(builder).traverseTranslationUnit(new Decl.TranslationUnit(List.of(decl)));
        Tree unit = builder.finalizeTree();

        Tree declaration = builder.mapping().require(decl);
        assertSame(unit.firstChild(), declaration);
        assertEquals(1, builder.mapping().size());
        assertThrows(IllegalStateException.class, builder::finalizeTree);
    }

    @Test
    void testMisalignedRangeFails() {
        Decl decl = variable(0, 7, typeSpec(0), 1);
        assertThrows(IllegalStateException.class, () -> build("int a ;", decl));
    }

    @Test
    void testOverlappingDeclarationsFail() {
        Decl decl = variable(0, 1, typeSpec(0), 1);
        Decl overlapping = new Decl.Unknown(range(1, 2));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> build("int a ;", decl, overlapping));
        assertTrue(e.getMessage().contains("crosses boundaries"));
    }

    @Test
    void testNestedTranslationUnitIsRejected() {
        Decl nested = new Decl.TranslationUnit(List.of());
        assertThrows(IllegalArgumentException.class, () -> build("", nested));
    }

    @Test
    void testTemplateWithoutKeywordFails() {
        TemplateParameterList parameters = new TemplateParameterList(loc(0), loc(1), List.of(), loc(2));
        Decl template = new Decl.Template(range(0, 4), parameters, variable(3, 4, typeSpec(3), 4));

        assertThrows(IllegalStateException.class, () -> build("typename < > int a ;", template));
    }

    private static Node findFirst(Node node, NodeKind kind) {
        return findFirst(node, kind, -1);
    }

    /**
     * Pre-order search; a non-negative {@code firstToken} also has to match.
     */
    private static Node findFirst(Node node, NodeKind kind, int firstToken) {
        if (node.kind() == kind && (firstToken < 0 || node.firstTokenIndex() == firstToken)) {
            return node;
        }
        if (node instanceof Tree tree) {
            for (Node child : tree.children()) {
                Node found = findFirst(child, kind, firstToken);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
