package com.raditha.syntax.build;

import com.raditha.syntax.semantic.TypeLoc;
import com.raditha.syntax.token.SourceLocation;

/**
 * Finds where the declarator part of a declaration starts, i.e. the first
 * token after the declaration specifiers. In {@code int *a[10]} that is the
 * {@code *}; in {@code int a} there is none and the name starts it.
 */
final class DeclaratorStart {

    private DeclaratorStart() {
    }

    static SourceLocation visit(TypeLoc type) {
        if (type instanceof TypeLoc.Paren paren) {
            SourceLocation inner = visit(paren.inner());
            return inner.isValid() ? inner : paren.lParen();
        }
        if (type instanceof TypeLoc.Pointer || type instanceof TypeLoc.MemberPointer) {
            SourceLocation pointee = visit(type.nextTypeLoc());
            return pointee.isValid() ? pointee : type.localSourceRange().begin();
        }
        if (type instanceof TypeLoc.FunctionProto proto && proto.trailingReturn()) {
            // the leading 'auto' is a declaration specifier
            return SourceLocation.INVALID;
        }
        TypeLoc next = type.nextTypeLoc();
        if (next == null) {
            return SourceLocation.INVALID;
        }
        return visit(next);
    }
}
