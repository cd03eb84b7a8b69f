package com.raditha.syntax.build;

import com.raditha.syntax.semantic.Decl;
import com.raditha.syntax.semantic.Expr;
import com.raditha.syntax.semantic.NestedNameSpecifierLoc;
import com.raditha.syntax.semantic.Stmt;
import com.raditha.syntax.semantic.TemplateParameterList;
import com.raditha.syntax.semantic.TypeLoc;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import com.raditha.syntax.token.TokenBuffer;
import com.raditha.syntax.token.TokenKind;
import com.raditha.syntax.token.TokenLocator;
import com.raditha.syntax.token.TokenRange;
import com.raditha.syntax.tree.NodeKind;
import com.raditha.syntax.tree.NodeRole;
import com.raditha.syntax.tree.Tree;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks the semantic tree in post-order and tells the {@link TreeBuilder}
 * which tokens form which syntax nodes. Children are always visited before
 * their parent, so by the time a node is folded every child it marks already
 * exists as a pending tree.
 * <p>
 * Paren and member pointer declarator chunks are the exception: their own
 * node is folded before the chunks they wrap, so that {@code (Y::*mp)} ends
 * up containing {@code Y::*}.
 */
public class BuildTreeTraversal {
    private static final Logger logger = LoggerFactory.getLogger(BuildTreeTraversal.class);

    private final TreeBuilder builder;
    private final RangeResolver resolver;
    private final TokenLocator locator;
    private final TokenBuffer buffer;
    /** Declaration that follows each declaration in its scope. */
    private final Map<Decl, Decl> nextSibling = new IdentityHashMap<>();

    public BuildTreeTraversal(TreeBuilder builder) {
        this.builder = builder;
        this.resolver = builder.resolver();
        this.locator = builder.locator();
        this.buffer = locator.buffer();
    }

    public void traverseTranslationUnit(Decl.TranslationUnit unit) {
        traverseDeclList(unit.decls());
    }

    // ---------------------------------------------------------------- declarations

    private void traverseDeclList(List<Decl> decls) {
        for (int i = 0; i + 1 < decls.size(); i++) {
            nextSibling.put(decls.get(i), decls.get(i + 1));
        }
        for (Decl decl : decls) {
            traverseDecl(decl);
        }
    }

    void traverseDecl(@Nullable Decl decl) {
        if (decl == null) {
            return;
        }
        if (decl instanceof Decl.Declarator declarator) {
            traverseDeclarator(declarator);
        } else if (decl instanceof Decl.Typedef typedef) {
            traverseType(typedef.type());
            processDeclaratorAndDeclaration(typedef, typedef.type(), typedef.nameLoc(), SourceRange.INVALID);
        } else if (decl instanceof Decl.TypeAlias alias) {
            traverseType(alias.type());
            foldDeclaration(alias, NodeKind.TYPE_ALIAS_DECLARATION);
        } else if (decl instanceof Decl.Namespace namespace) {
            traverseNamespace(namespace);
        } else if (decl instanceof Decl.NamespaceAlias alias) {
            traverseQualifier(alias.qualifier());
            foldDeclaration(alias, NodeKind.NAMESPACE_ALIAS_DEFINITION);
        } else if (decl instanceof Decl.UsingDirective directive) {
            traverseQualifier(directive.qualifier());
            foldDeclaration(directive, NodeKind.USING_NAMESPACE_DIRECTIVE);
        } else if (decl instanceof Decl.Using using) {
            traverseQualifier(using.qualifier());
            foldDeclaration(using, NodeKind.USING_DECLARATION);
        } else if (decl instanceof Decl.Empty empty) {
            foldDeclaration(empty, NodeKind.EMPTY_DECLARATION);
        } else if (decl instanceof Decl.StaticAssert staticAssert) {
            traverseStmt(staticAssert.condition());
            traverseStmt(staticAssert.message());
            builder.markExprChild(staticAssert.condition(), NodeRole.STATIC_ASSERT_DECLARATION_CONDITION);
            builder.markExprChild(staticAssert.message(), NodeRole.STATIC_ASSERT_DECLARATION_MESSAGE);
            foldDeclaration(staticAssert, NodeKind.STATIC_ASSERT_DECLARATION);
        } else if (decl instanceof Decl.LinkageSpec linkage) {
            traverseDeclList(linkage.decls());
            foldDeclaration(linkage, NodeKind.LINKAGE_SPECIFICATION_DECLARATION);
        } else if (decl instanceof Decl.Template template) {
            traverseTemplate(template);
        } else if (decl instanceof Decl.Tag tag) {
            traverseTag(tag);
        } else if (decl instanceof Decl.Unknown unknown) {
            foldDeclaration(unknown, NodeKind.UNKNOWN_DECLARATION);
        } else if (decl instanceof Decl.TranslationUnit) {
            throw new IllegalArgumentException("a translation unit cannot be nested in another declaration");
        } else {
            throw new IllegalArgumentException("unsupported declaration " + decl.getClass().getName());
        }
    }

    private Tree foldDeclaration(Decl decl, NodeKind kind) {
        return builder.foldNode(resolver.getDeclarationRange(decl), kind, decl);
    }

    private void traverseDeclarator(Decl.Declarator declarator) {
        traverseQualifier(declarator.qualifier());
        traverseType(declarator.type());
        if (!declarator.forRangeDecl()) {
            traverseStmt(declarator.init());
        }
        traverseStmt(declarator.body());

        SourceLocation nameStart = SourceLocation.INVALID;
        if (declarator.nameLoc().isValid()) {
            nameStart = declarator.qualifier() != null ? declarator.qualifier().beginLoc() : declarator.nameLoc();
        }
        processDeclaratorAndDeclaration(declarator, declarator.type(), nameStart, initializerRange(declarator));
    }

    /**
     * Only variables and parameters own their initializer; a range-based for
     * variable is initialized by the loop.
     */
    private static SourceRange initializerRange(Decl.Declarator declarator) {
        boolean variable = declarator.kind() == Decl.DeclaratorKind.VARIABLE
                || declarator.kind() == Decl.DeclaratorKind.PARAMETER;
        if (variable && declarator.init() != null && !declarator.forRangeDecl()) {
            return declarator.init().sourceRange();
        }
        return SourceRange.INVALID;
    }

    private void processDeclaratorAndDeclaration(Decl decl, TypeLoc type, SourceLocation nameStart,
                                                 SourceRange initializer) {
        SourceRange range = RangeResolver.getDeclaratorRange(type, nameStart, initializer);
        // 'void foo(int)' declares a parameter without a declarator
        if (range.begin().isValid()) {
            Tree declarator = builder.foldNode(resolver.getRange(range), NodeKind.SIMPLE_DECLARATOR, null);
            builder.markChild(declarator, NodeRole.SIMPLE_DECLARATION_DECLARATOR);
        }
        if (builder.isResponsibleForCreatingDeclaration(decl, nextSibling.get(decl))) {
            foldDeclaration(decl, NodeKind.SIMPLE_DECLARATION);
        }
    }

    private void traverseNamespace(Decl.Namespace namespace) {
        traverseDeclList(namespace.decls());
        TokenRange tokens = resolver.getDeclarationRange(namespace);
        if (buffer.get(tokens.begin()).is(TokenKind.COLONCOLON)) {
            // inner part of 'namespace a::b {}', owned by the outer definition
            logger.debug("Skipping nested namespace definition at {}", namespace.sourceRange());
            return;
        }
        builder.foldNode(tokens, NodeKind.NAMESPACE_DEFINITION, namespace);
    }

    private void traverseTemplate(Decl.Template template) {
        traverseTemplateParameters(template.parameters());
        traverseDecl(template.templated());
        foldTemplateDeclaration(
                resolver.getDeclarationRange(template),
                locator.findToken(template.parameters().templateLoc()),
                resolver.getDeclarationRange(template.templated()),
                template);
    }

    private void traverseTemplateParameters(@Nullable TemplateParameterList parameters) {
        if (parameters == null) {
            return;
        }
        for (Decl parameter : parameters.parameters()) {
            traverseDecl(parameter);
        }
    }

    private Tree foldTemplateDeclaration(TokenRange range, int templateKeyword, TokenRange templatedDeclaration,
                                         @Nullable Decl owner) {
        if (templateKeyword == TokenLocator.NO_TOKEN || !buffer.get(templateKeyword).is(TokenKind.KW_TEMPLATE)) {
            throw new IllegalStateException("template declaration " + range + " does not start with 'template'");
        }
        builder.markChildToken(templateKeyword, NodeRole.INTRODUCER_KEYWORD);
        builder.markChild(templatedDeclaration, NodeRole.TEMPLATE_DECLARATION_DECLARATION);
        return builder.foldNode(range, NodeKind.TEMPLATE_DECLARATION, owner);
    }

    private void traverseTag(Decl.Tag tag) {
        if (tag.isExplicitInstantiation()) {
            traverseExplicitInstantiation(tag);
            return;
        }
        for (TemplateParameterList parameters : tag.templateParameterLists()) {
            traverseTemplateParameters(parameters);
        }
        traverseTemplateParameters(tag.partialSpecializationParameters());
        traverseQualifier(tag.qualifier());
        traverseDeclList(tag.members());

        if (!tag.freeStanding()) {
            // part of another declaration, e.g. 'struct S {} s;'
            if (!tag.templateParameterLists().isEmpty()) {
                throw new IllegalStateException("class declared inside another declaration has template headers: "
                        + tag.sourceRange());
            }
            return;
        }
        handleFreeStandingTagDecl(tag);
    }

    /**
     * A class declared on its own needs a declaration node around it, and a
     * template declaration for each template header in front of it.
     */
    private Tree handleFreeStandingTagDecl(Decl.Tag tag) {
        TokenRange declarationRange = resolver.getDeclarationRange(tag);
        Tree result = builder.foldNode(declarationRange, NodeKind.SIMPLE_DECLARATION, null);

        if (tag.partialSpecializationParameters() != null) {
            int keyword = locator.findToken(tag.partialSpecializationParameters().templateLoc());
            TokenRange range = new TokenRange(keyword, declarationRange.end());
            result = foldTemplateDeclaration(range, keyword, declarationRange, null);
            declarationRange = range;
        }
        List<TemplateParameterList> headers = tag.templateParameterLists();
        for (int i = headers.size() - 1; i >= 0; i--) {
            int keyword = locator.findToken(headers.get(i).templateLoc());
            TokenRange range = new TokenRange(keyword, declarationRange.end());
            result = foldTemplateDeclaration(range, keyword, declarationRange, null);
            declarationRange = range;
        }
        return result;
    }

    private void traverseExplicitInstantiation(Decl.Tag tag) {
        traverseQualifier(tag.qualifier());
        Tree declaration = handleFreeStandingTagDecl(tag);
        Decl.Instantiation instantiation = tag.instantiation();

        int externKeyword = locator.findToken(instantiation.externLoc());
        if (externKeyword != TokenLocator.NO_TOKEN && !buffer.get(externKeyword).is(TokenKind.KW_EXTERN)) {
            throw new IllegalStateException("expected 'extern' at " + instantiation.externLoc()
                    + ", found '" + buffer.get(externKeyword).text() + "'");
        }
        int templateKeyword = locator.findToken(instantiation.templateKeywordLoc());
        if (templateKeyword == TokenLocator.NO_TOKEN || !buffer.get(templateKeyword).is(TokenKind.KW_TEMPLATE)) {
            throw new IllegalStateException("explicit instantiation " + tag.sourceRange()
                    + " has no 'template' keyword");
        }
        builder.markChildToken(externKeyword, NodeRole.EXTERN_KEYWORD);
        builder.markChildToken(templateKeyword, NodeRole.INTRODUCER_KEYWORD);
        builder.markChild(declaration, NodeRole.EXPLICIT_TEMPLATE_INSTANTIATION_DECLARATION);
        builder.foldNode(resolver.getTemplateRange(tag), NodeKind.EXPLICIT_TEMPLATE_INSTANTIATION, tag);
    }

    // ---------------------------------------------------------------- types

    void traverseType(@Nullable TypeLoc type) {
        if (type == null) {
            return;
        }
        if (type instanceof TypeLoc.Paren paren) {
            builder.markChildToken(paren.lParen(), NodeRole.OPEN_PAREN);
            builder.markChildToken(paren.rParen(), NodeRole.CLOSE_PAREN);
            builder.foldNode(resolver.getRange(paren.lParen(), paren.rParen()), NodeKind.PAREN_DECLARATOR, null);
            traverseType(paren.inner());
        } else if (type instanceof TypeLoc.MemberPointer memberPointer) {
            builder.foldNode(resolver.getRange(memberPointer.localRange()), NodeKind.MEMBER_POINTER, null);
            traverseType(memberPointer.pointee());
        } else if (type instanceof TypeLoc.Array array) {
            traverseType(array.element());
            traverseStmt(array.size());
            builder.markChildToken(array.lBracket(), NodeRole.OPEN_PAREN);
            builder.markExprChild(array.size(), NodeRole.ARRAY_SUBSCRIPT_SIZE_EXPRESSION);
            builder.markChildToken(array.rBracket(), NodeRole.CLOSE_PAREN);
            builder.foldNode(resolver.getRange(array.lBracket(), array.rBracket()), NodeKind.ARRAY_SUBSCRIPT, null);
        } else if (type instanceof TypeLoc.FunctionProto proto) {
            traverseFunctionProto(proto);
        } else if (type instanceof TypeLoc.Pointer || type instanceof TypeLoc.Qualified) {
            traverseType(type.nextTypeLoc());
        } else if (type instanceof TypeLoc.TypeSpec spec) {
            traverseQualifier(spec.qualifier());
        } else if (type instanceof TypeLoc.TemplateSpecialization specialization) {
            traverseQualifier(specialization.qualifier());
            for (TypeLoc argument : specialization.typeArguments()) {
                traverseType(argument);
            }
            for (Expr argument : specialization.expressionArguments()) {
                traverseStmt(argument);
            }
        } else if (type instanceof TypeLoc.Decltype decltype) {
            traverseStmt(decltype.expression());
        } else if (type instanceof TypeLoc.DependentTemplateSpecialization dependent) {
            traverseQualifier(dependent.qualifier());
        } else {
            throw new IllegalArgumentException("unsupported type location " + type.getClass().getName());
        }
    }

    private void traverseFunctionProto(TypeLoc.FunctionProto proto) {
        traverseType(proto.returnType());
        for (Decl parameter : proto.params()) {
            traverseDecl(parameter);
        }
        if (proto.trailingReturn()) {
            Tree trailingReturn = buildTrailingReturn(proto);
            builder.markChild(trailingReturn, NodeRole.PARAMETERS_AND_QUALIFIERS_TRAILING_RETURN);
        }
        builder.markChildToken(proto.lParen(), NodeRole.OPEN_PAREN);
        for (Decl parameter : proto.params()) {
            builder.markChild(parameter, NodeRole.PARAMETERS_AND_QUALIFIERS_PARAMETER);
        }
        builder.markChildToken(proto.rParen(), NodeRole.CLOSE_PAREN);
        builder.foldNode(resolver.getRange(proto.lParen(), TypeLocRanges.end(proto)),
                NodeKind.PARAMETERS_AND_QUALIFIERS, null);
    }

    /**
     * Build {@code -> int *} of {@code auto f() -> int *}, with a declarator
     * node for the pointer part.
     */
    private Tree buildTrailingReturn(TypeLoc.FunctionProto proto) {
        TypeLoc returnType = proto.returnType();
        SourceRange declaratorRange = new SourceRange(DeclaratorStart.visit(returnType), TypeLocRanges.end(returnType));
        Tree declarator = null;
        if (declaratorRange.isValid()) {
            declarator = builder.foldNode(resolver.getRange(declaratorRange), NodeKind.SIMPLE_DECLARATOR, null);
        }

        TokenRange returned = resolver.getRange(TypeLocRanges.range(returnType));
        int arrow = returned.begin() - 1;
        if (arrow < 0 || !buffer.get(arrow).is(TokenKind.ARROW)) {
            throw new IllegalStateException("trailing return type " + returned + " is not preceded by '->'");
        }
        builder.markChildToken(arrow, NodeRole.ARROW_TOKEN);
        if (declarator != null) {
            builder.markChild(declarator, NodeRole.TRAILING_RETURN_TYPE_DECLARATOR);
        }
        return builder.foldNode(new TokenRange(arrow, returned.end()), NodeKind.TRAILING_RETURN_TYPE, null);
    }

    // ---------------------------------------------------------------- qualifiers

    void traverseQualifier(@Nullable NestedNameSpecifierLoc qualifier) {
        if (qualifier == null) {
            return;
        }
        for (NestedNameSpecifierLoc segment = qualifier; segment != null; segment = segment.prefix()) {
            Tree specifier = buildNameSpecifier(segment);
            if (specifier != null) {
                builder.markChild(specifier, NodeRole.LIST_ELEMENT);
            }
            builder.markChildToken(segment.endLoc(), NodeRole.LIST_DELIMITER);
        }
        builder.foldQualifierNode(resolver.getRange(qualifier.sourceRange()), NodeKind.NESTED_NAME_SPECIFIER,
                qualifier);
    }

    /**
     * Node for one qualifier segment without its {@code ::}. The global
     * qualifier has no tokens besides the {@code ::} and gets no node.
     */
    private @Nullable Tree buildNameSpecifier(NestedNameSpecifierLoc segment) {
        TokenRange tokens = resolver.getRange(RangeResolver.getLocalSourceRange(segment)).dropBack();
        switch (segment.kind()) {
            case GLOBAL:
                return null;
            case NAMESPACE:
            case NAMESPACE_ALIAS:
            case IDENTIFIER:
                if (tokens.size() != 1) {
                    throw new IllegalStateException("identifier name specifier must be a single token, got "
                            + tokens + " '" + buffer.text(tokens) + "'");
                }
                builder.markChildToken(tokens.begin(), NodeRole.UNKNOWN);
                return builder.foldNode(tokens, NodeKind.IDENTIFIER_NAME_SPECIFIER, null);
            case TYPE_SPEC: {
                TypeLoc type = segment.typeLoc();
                if (type instanceof TypeLoc.Decltype decltype) {
                    traverseStmt(decltype.expression());
                    return builder.foldNode(tokens, NodeKind.DECLTYPE_NAME_SPECIFIER, null);
                }
                if (type instanceof TypeLoc.TemplateSpecialization
                        || type instanceof TypeLoc.DependentTemplateSpecialization) {
                    return builder.foldNode(tokens, NodeKind.SIMPLE_TEMPLATE_NAME_SPECIFIER, null);
                }
                return builder.foldNode(tokens, NodeKind.IDENTIFIER_NAME_SPECIFIER, null);
            }
            case TYPE_SPEC_WITH_TEMPLATE:
                return builder.foldNode(tokens, NodeKind.SIMPLE_TEMPLATE_NAME_SPECIFIER, null);
            case SUPER:
            default:
                throw new UnsupportedOperationException("the __super specifier is not supported: "
                        + segment.localRange());
        }
    }

    // ---------------------------------------------------------------- statements

    void traverseStmt(@Nullable Stmt stmt) {
        if (stmt == null) {
            return;
        }
        if (stmt instanceof Expr expression) {
            traverseExpr(expression.ignoreImplicit());
            return;
        }
        if (stmt instanceof Stmt.Compound compound) {
            for (Stmt child : compound.body()) {
                traverseStmt(child);
            }
            builder.markChildToken(compound.lBrace(), NodeRole.OPEN_PAREN);
            for (Stmt child : compound.body()) {
                builder.markStmtChild(child, NodeRole.COMPOUND_STATEMENT_STATEMENT);
            }
            builder.markChildToken(compound.rBrace(), NodeRole.CLOSE_PAREN);
            foldStatement(compound, NodeKind.COMPOUND_STATEMENT);
        } else if (stmt instanceof Stmt.DeclStmt declStmt) {
            // the statement owns the ';'
            for (Decl decl : declStmt.decls()) {
                builder.noticeDeclWithoutSemicolon(decl);
            }
            traverseDeclList(declStmt.decls());
            foldStatement(declStmt, NodeKind.DECLARATION_STATEMENT);
        } else if (stmt instanceof Stmt.Null nullStmt) {
            foldStatement(nullStmt, NodeKind.EMPTY_STATEMENT);
        } else if (stmt instanceof Stmt.Switch switchStmt) {
            traverseStmt(switchStmt.init());
            traverseCondition(switchStmt.conditionVariable(), switchStmt.condition());
            traverseStmt(switchStmt.body());
            builder.markChildToken(switchStmt.switchLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markStmtChild(switchStmt.body(), NodeRole.BODY_STATEMENT);
            foldStatement(switchStmt, NodeKind.SWITCH_STATEMENT);
        } else if (stmt instanceof Stmt.Case caseStmt) {
            traverseStmt(caseStmt.value());
            traverseStmt(caseStmt.rhs());
            traverseStmt(caseStmt.subStmt());
            builder.markChildToken(caseStmt.keywordLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markExprChild(caseStmt.value(), NodeRole.CASE_STATEMENT_VALUE);
            builder.markStmtChild(caseStmt.subStmt(), NodeRole.BODY_STATEMENT);
            foldStatement(caseStmt, NodeKind.CASE_STATEMENT);
        } else if (stmt instanceof Stmt.Default defaultStmt) {
            traverseStmt(defaultStmt.subStmt());
            builder.markChildToken(defaultStmt.keywordLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markStmtChild(defaultStmt.subStmt(), NodeRole.BODY_STATEMENT);
            foldStatement(defaultStmt, NodeKind.DEFAULT_STATEMENT);
        } else if (stmt instanceof Stmt.If ifStmt) {
            traverseStmt(ifStmt.init());
            traverseCondition(ifStmt.conditionVariable(), ifStmt.condition());
            traverseStmt(ifStmt.then());
            traverseStmt(ifStmt.elseStmt());
            builder.markChildToken(ifStmt.ifLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markStmtChild(ifStmt.then(), NodeRole.IF_STATEMENT_THEN_STATEMENT);
            builder.markChildToken(ifStmt.elseLoc(), NodeRole.IF_STATEMENT_ELSE_KEYWORD);
            builder.markStmtChild(ifStmt.elseStmt(), NodeRole.IF_STATEMENT_ELSE_STATEMENT);
            foldStatement(ifStmt, NodeKind.IF_STATEMENT);
        } else if (stmt instanceof Stmt.For forStmt) {
            traverseStmt(forStmt.init());
            traverseStmt(forStmt.condition());
            traverseStmt(forStmt.increment());
            traverseStmt(forStmt.body());
            builder.markChildToken(forStmt.forLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markStmtChild(forStmt.body(), NodeRole.BODY_STATEMENT);
            foldStatement(forStmt, NodeKind.FOR_STATEMENT);
        } else if (stmt instanceof Stmt.While whileStmt) {
            traverseCondition(whileStmt.conditionVariable(), whileStmt.condition());
            traverseStmt(whileStmt.body());
            builder.markChildToken(whileStmt.whileLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markStmtChild(whileStmt.body(), NodeRole.BODY_STATEMENT);
            foldStatement(whileStmt, NodeKind.WHILE_STATEMENT);
        } else if (stmt instanceof Stmt.Continue continueStmt) {
            builder.markChildToken(continueStmt.loc(), NodeRole.INTRODUCER_KEYWORD);
            foldStatement(continueStmt, NodeKind.CONTINUE_STATEMENT);
        } else if (stmt instanceof Stmt.Break breakStmt) {
            builder.markChildToken(breakStmt.loc(), NodeRole.INTRODUCER_KEYWORD);
            foldStatement(breakStmt, NodeKind.BREAK_STATEMENT);
        } else if (stmt instanceof Stmt.Return returnStmt) {
            traverseStmt(returnStmt.value());
            builder.markChildToken(returnStmt.returnLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markExprChild(returnStmt.value(), NodeRole.RETURN_STATEMENT_VALUE);
            foldStatement(returnStmt, NodeKind.RETURN_STATEMENT);
        } else if (stmt instanceof Stmt.RangeFor rangeFor) {
            // the loop variable is a declaration, not a statement
            traverseStmt(rangeFor.init());
            traverseDecl(rangeFor.loopVariable());
            traverseStmt(rangeFor.rangeInit());
            traverseStmt(rangeFor.body());
            builder.markChildToken(rangeFor.forLoc(), NodeRole.INTRODUCER_KEYWORD);
            builder.markStmtChild(rangeFor.body(), NodeRole.BODY_STATEMENT);
            foldStatement(rangeFor, NodeKind.RANGE_BASED_FOR_STATEMENT);
        } else if (stmt instanceof Stmt.Unknown unknown) {
            for (Stmt child : unknown.children()) {
                traverseStmt(child);
            }
            foldStatement(unknown, NodeKind.UNKNOWN_STATEMENT);
        } else {
            throw new IllegalArgumentException("unsupported statement " + stmt.getClass().getName());
        }
    }

    /**
     * A condition that declares a variable refers to it through an implicit
     * expression, so only the declaration is visited.
     */
    private void traverseCondition(Stmt.@Nullable DeclStmt variable, @Nullable Expr condition) {
        if (variable != null) {
            traverseStmt(variable);
        } else {
            traverseStmt(condition);
        }
    }

    private Tree foldStatement(Stmt stmt, NodeKind kind) {
        return builder.foldNode(resolver.getStmtRange(stmt), kind, stmt);
    }

    // ---------------------------------------------------------------- expressions

    private void traverseExpr(Expr expr) {
        if (expr instanceof Expr.IntegerLiteral literal) {
            foldLiteral(literal, literal.loc(), NodeKind.INTEGER_LITERAL_EXPRESSION);
        } else if (expr instanceof Expr.CharacterLiteral literal) {
            foldLiteral(literal, literal.loc(), NodeKind.CHARACTER_LITERAL_EXPRESSION);
        } else if (expr instanceof Expr.FloatingLiteral literal) {
            foldLiteral(literal, literal.loc(), NodeKind.FLOATING_LITERAL_EXPRESSION);
        } else if (expr instanceof Expr.StringLiteral literal) {
            // adjacent string literals: only the first token is the literal token
            foldLiteral(literal, literal.sourceRange().begin(), NodeKind.STRING_LITERAL_EXPRESSION);
        } else if (expr instanceof Expr.BoolLiteral literal) {
            foldLiteral(literal, literal.loc(), NodeKind.BOOL_LITERAL_EXPRESSION);
        } else if (expr instanceof Expr.NullPtrLiteral literal) {
            foldLiteral(literal, literal.loc(), NodeKind.CXX_NULL_PTR_EXPRESSION);
        } else if (expr instanceof Expr.UserDefinedLiteral literal) {
            int token = locator.findToken(literal.loc());
            NodeKind kind = NumericLiterals.userDefinedLiteralKind(literal.literalKind(), buffer.get(token).text());
            foldLiteral(literal, literal.loc(), kind);
        } else if (expr instanceof Expr.DeclRef declRef) {
            traverseQualifier(declRef.qualifier());
            buildIdExpression(declRef.qualifier(), declRef.templateKeywordLoc(),
                    new SourceRange(declRef.nameLoc(), declRef.endLoc()), declRef);
        } else if (expr instanceof Expr.Member member) {
            traverseMember(member);
        } else if (expr instanceof Expr.This thisExpr) {
            if (!thisExpr.implicit()) {
                builder.markChildToken(thisExpr.loc(), NodeRole.INTRODUCER_KEYWORD);
                foldExpression(thisExpr, NodeKind.THIS_EXPRESSION);
            }
        } else if (expr instanceof Expr.Paren paren) {
            traverseStmt(paren.subExpr());
            builder.markChildToken(paren.lParen(), NodeRole.OPEN_PAREN);
            builder.markExprChild(paren.subExpr(), NodeRole.PAREN_EXPRESSION_SUB_EXPRESSION);
            builder.markChildToken(paren.rParen(), NodeRole.CLOSE_PAREN);
            foldExpression(paren, NodeKind.PAREN_EXPRESSION);
        } else if (expr instanceof Expr.UnaryOperator unary) {
            traverseStmt(unary.operand());
            builder.markChildToken(unary.operatorLoc(), NodeRole.OPERATOR_EXPRESSION_OPERATOR_TOKEN);
            builder.markExprChild(unary.operand(), NodeRole.UNARY_OPERATOR_EXPRESSION_OPERAND);
            foldExpression(unary, unary.postfix()
                    ? NodeKind.POSTFIX_UNARY_OPERATOR_EXPRESSION
                    : NodeKind.PREFIX_UNARY_OPERATOR_EXPRESSION);
        } else if (expr instanceof Expr.BinaryOperator binary) {
            traverseStmt(binary.lhs());
            traverseStmt(binary.rhs());
            markBinary(binary.lhs(), binary.operatorLoc(), binary.rhs());
            foldExpression(binary, NodeKind.BINARY_OPERATOR_EXPRESSION);
        } else if (expr instanceof Expr.OperatorCall call) {
            traverseOperatorCall(call);
        } else if (expr instanceof Expr.Unknown unknown) {
            for (Stmt child : unknown.children()) {
                traverseStmt(child);
            }
            foldExpression(unknown, NodeKind.UNKNOWN_EXPRESSION);
        } else if (expr instanceof Expr.Implicit implicit) {
            traverseStmt(implicit.subExpr());
        } else {
            throw new IllegalArgumentException("unsupported expression " + expr.getClass().getName());
        }
    }

    private Tree foldExpression(Expr expr, NodeKind kind) {
        return builder.foldNode(resolver.getRange(expr.sourceRange()), kind, expr);
    }

    private void foldLiteral(Expr literal, SourceLocation literalToken, NodeKind kind) {
        builder.markChildToken(literalToken, NodeRole.LITERAL_TOKEN);
        foldExpression(literal, kind);
    }

    private void markBinary(Expr lhs, SourceLocation operatorLoc, Expr rhs) {
        builder.markExprChild(lhs, NodeRole.BINARY_OPERATOR_EXPRESSION_LEFT_HAND_SIDE);
        builder.markChildToken(operatorLoc, NodeRole.OPERATOR_EXPRESSION_OPERATOR_TOKEN);
        builder.markExprChild(rhs, NodeRole.BINARY_OPERATOR_EXPRESSION_RIGHT_HAND_SIDE);
    }

    /**
     * {@code qualifier template name<args>} as an id-expression with an
     * unqualified-id child.
     */
    private Tree buildIdExpression(@Nullable NestedNameSpecifierLoc qualifier, SourceLocation templateKeyword,
                                   SourceRange unqualifiedId, @Nullable Expr owner) {
        if (qualifier != null) {
            builder.markChild(qualifier, NodeRole.ID_EXPRESSION_QUALIFIER);
            builder.markChildToken(templateKeyword, NodeRole.TEMPLATE_KEYWORD);
        }
        Tree unqualified = builder.foldNode(resolver.getRange(unqualifiedId), NodeKind.UNQUALIFIED_ID, null);
        builder.markChild(unqualified, NodeRole.ID_EXPRESSION_ID);

        SourceLocation begin = qualifier != null ? qualifier.beginLoc() : unqualifiedId.begin();
        return builder.foldNode(resolver.getRange(begin, unqualifiedId.end()), NodeKind.ID_EXPRESSION, owner);
    }

    private void traverseMember(Expr.Member member) {
        traverseQualifier(member.qualifier());
        traverseStmt(member.base());
        SourceRange unqualifiedId = new SourceRange(member.memberLoc(), member.endLoc());
        if (member.implicitAccess()) {
            // 'x' meaning 'this->x' is a plain id-expression
            buildIdExpression(member.qualifier(), member.templateKeywordLoc(), unqualifiedId, member);
            return;
        }
        Tree idExpression = buildIdExpression(member.qualifier(), member.templateKeywordLoc(), unqualifiedId, null);
        builder.markChild(idExpression, NodeRole.MEMBER_EXPRESSION_MEMBER);
        builder.markExprChild(member.base(), NodeRole.MEMBER_EXPRESSION_OBJECT);
        builder.markChildToken(member.operatorLoc(), NodeRole.MEMBER_EXPRESSION_ACCESS_TOKEN);
        foldExpression(member, NodeKind.MEMBER_EXPRESSION);
    }

    /**
     * Overloaded operators get the same shape as built-in ones; the callee is
     * just the operator token.
     */
    private void traverseOperatorCall(Expr.OperatorCall call) {
        NodeKind kind = OperatorKinds.getOperatorNodeKind(call.operator(), call.arguments().size());
        for (Expr argument : call.arguments()) {
            if (!argument.sourceRange().isValid()) {
                // unwritten second operand of postfix ++ and --
                if (kind != NodeKind.POSTFIX_UNARY_OPERATOR_EXPRESSION) {
                    throw new IllegalStateException("operator " + call.operator()
                            + " has an argument without a source range");
                }
                continue;
            }
            traverseStmt(argument);
        }
        List<Expr> arguments = call.arguments();
        switch (kind) {
            case BINARY_OPERATOR_EXPRESSION:
                markBinary(arguments.get(0), call.operatorLoc(), arguments.get(1));
                break;
            case PREFIX_UNARY_OPERATOR_EXPRESSION:
            case POSTFIX_UNARY_OPERATOR_EXPRESSION:
                builder.markChildToken(call.operatorLoc(), NodeRole.OPERATOR_EXPRESSION_OPERATOR_TOKEN);
                builder.markExprChild(arguments.get(0), NodeRole.UNARY_OPERATOR_EXPRESSION_OPERAND);
                break;
            case UNKNOWN_EXPRESSION:
                logger.debug("Operator {} at {} is kept as an unknown expression", call.operator(),
                        call.operatorLoc());
                break;
            default:
                throw new IllegalStateException("unexpected operator node kind " + kind);
        }
        foldExpression(call, kind);
    }
}
