package com.raditha.syntax.build;

import com.raditha.syntax.semantic.Decl;
import com.raditha.syntax.semantic.NestedNameSpecifierLoc;
import com.raditha.syntax.semantic.Stmt;
import com.raditha.syntax.semantic.TypeLoc;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import com.raditha.syntax.token.TokenBuffer;
import com.raditha.syntax.token.TokenKind;
import com.raditha.syntax.token.TokenLocator;
import com.raditha.syntax.token.TokenRange;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Turns the ranges reported by the semantic tree into the token ranges that
 * syntax nodes cover. Semantic ranges usually stop before a trailing
 * {@code ;} and start declarations at their specifiers; syntax nodes own the
 * semicolon and split declarators off the specifiers.
 */
public class RangeResolver {

    private final TokenLocator locator;
    private final TokenBuffer buffer;
    private final Set<Decl> declsWithoutSemicolon = Collections.newSetFromMap(new IdentityHashMap<>());

    public RangeResolver(TokenLocator locator) {
        this.locator = locator;
        this.buffer = locator.buffer();
    }

    public TokenLocator locator() {
        return locator;
    }

    public TokenRange getRange(SourceRange range) {
        return locator.getRange(range);
    }

    public TokenRange getRange(SourceLocation first, SourceLocation last) {
        return locator.getRange(first, last);
    }

    /**
     * Record that the declaration's {@code ;} belongs to an enclosing
     * statement, as for the declarations of a declaration statement.
     */
    public void noticeDeclWithoutSemicolon(Decl decl) {
        declsWithoutSemicolon.add(decl);
    }

    /**
     * Tokens of a statement, including the {@code ;} that the semantic tree
     * leaves out of expressions, {@code return}, {@code break} and the like.
     */
    public TokenRange getStmtRange(Stmt stmt) {
        TokenRange tokens = getRange(stmt.sourceRange());
        if (stmt instanceof Stmt.Compound) {
            return tokens;
        }
        return withTrailingSemicolon(tokens);
    }

    /**
     * Tokens of a declaration. Class declarations start at the class key,
     * leaving template headers to the enclosing template declaration.
     */
    public TokenRange getDeclarationRange(Decl decl) {
        TokenRange tokens;
        if (decl instanceof Decl.Tag tag) {
            tokens = getRange(tag.typeBeginLoc(), tag.sourceRange().end());
        } else {
            tokens = getRange(decl.sourceRange());
        }
        return maybeAppendSemicolon(tokens, decl);
    }

    /**
     * Tokens of an explicit instantiation, from {@code extern} or
     * {@code template} to the {@code ;}.
     */
    public TokenRange getTemplateRange(Decl.Tag instantiation) {
        return maybeAppendSemicolon(getRange(instantiation.sourceRange()), instantiation);
    }

    TokenRange maybeAppendSemicolon(TokenRange tokens, Decl decl) {
        if (decl instanceof Decl.Namespace) {
            return tokens;
        }
        if (declsWithoutSemicolon.contains(decl)) {
            return tokens;
        }
        if (isDefinitionWithBody(decl)) {
            return tokens;
        }
        return withTrailingSemicolon(tokens);
    }

    private static boolean isDefinitionWithBody(Decl decl) {
        if (decl instanceof Decl.Declarator declarator) {
            return declarator.isDefinition();
        }
        if (decl instanceof Decl.Template template) {
            return isDefinitionWithBody(template.templated());
        }
        return false;
    }

    /**
     * Extend the range by the next token if it is a {@code ;} and the range
     * does not already end with one. The end marker is never consumed.
     */
    public TokenRange withTrailingSemicolon(TokenRange tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalStateException("cannot extend an empty range " + tokens);
        }
        if (buffer.get(tokens.last()).is(TokenKind.EOF)) {
            throw new IllegalStateException("range " + tokens + " already contains the end marker");
        }
        if (!buffer.get(tokens.last()).is(TokenKind.SEMI) && buffer.get(tokens.end()).is(TokenKind.SEMI)) {
            return tokens.withEnd(tokens.end() + 1);
        }
        return tokens;
    }

    /**
     * Range of the declarator in a declaration: pointer sigils, parens, the
     * name, array and function suffixes and the initializer.
     *
     * @param type        written type of the declaration
     * @param name        start of the (possibly qualified) name, invalid if
     *                    unnamed
     * @param initializer initializer range, invalid if none
     * @return the range, with an invalid begin when there is no declarator
     */
    public static SourceRange getDeclaratorRange(TypeLoc type, SourceLocation name, SourceRange initializer) {
        SourceLocation start = DeclaratorStart.visit(type);
        SourceLocation end = TypeLocRanges.end(type);
        if (name.isValid()) {
            if (start.isInvalid()) {
                start = name;
            }
            if (end.isInvalid() || end.isBefore(name)) {
                end = name;
            }
        }
        if (initializer.isValid()) {
            SourceLocation initializerEnd = initializer.end();
            if (end.isValid() && initializerEnd.isBefore(end)) {
                throw new IllegalStateException("initializer ends at " + initializerEnd
                        + " before the declarator end " + end);
            }
            end = initializerEnd;
        }
        return new SourceRange(start, end);
    }

    /**
     * Tokens owned by one qualifier segment, including its {@code ::}. A
     * dependent template segment starts at its own {@code template} keyword.
     */
    public static SourceRange getLocalSourceRange(NestedNameSpecifierLoc qualifier) {
        SourceRange local = qualifier.localRange();
        if (qualifier.typeLoc() instanceof TypeLoc.DependentTemplateSpecialization dependent
                && dependent.templateKeywordLoc().isValid()) {
            return local.withBegin(dependent.templateKeywordLoc());
        }
        return local;
    }
}
