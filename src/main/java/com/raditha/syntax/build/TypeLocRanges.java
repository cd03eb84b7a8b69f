package com.raditha.syntax.build;

import com.raditha.syntax.semantic.TypeLoc;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import org.jspecify.annotations.Nullable;

/**
 * Full source range of a type written as an inside-out chain of chunks.
 * <p>
 * The first token belongs to the leftmost chunk that has tokens of its own;
 * array, function and qualifier chunks are suffixes or carry no tokens, so
 * they never provide it. The last token belongs to the outermost suffix chunk
 * (array, function, paren) or, when there is none, to the first prefix chunk
 * (pointer-like) or the type specifier. A trailing return type ends the type.
 */
public final class TypeLocRanges {

    private TypeLocRanges() {
    }

    public static SourceLocation begin(TypeLoc type) {
        TypeLoc leftmost = null;
        TypeLoc current = type;
        while (current != null) {
            if (current instanceof TypeLoc.FunctionProto proto) {
                if (proto.trailingReturn()) {
                    leftmost = current;
                    break;
                }
                current = current.nextTypeLoc();
                continue;
            }
            if (current instanceof TypeLoc.Array || current instanceof TypeLoc.Qualified) {
                current = current.nextTypeLoc();
                continue;
            }
            if (current.localSourceRange().begin().isValid()) {
                leftmost = current;
            }
            current = current.nextTypeLoc();
        }
        return leftmost == null ? SourceLocation.INVALID : leftmost.localSourceRange().begin();
    }

    public static SourceLocation end(TypeLoc type) {
        TypeLoc last = null;
        TypeLoc current = type;
        while (current != null) {
            if (current instanceof TypeLoc.Paren || current instanceof TypeLoc.Array) {
                last = current;
            } else if (current instanceof TypeLoc.FunctionProto proto) {
                // the return type comes after the parameters
                last = proto.trailingReturn() ? null : current;
            } else if (current instanceof TypeLoc.Pointer || current instanceof TypeLoc.MemberPointer) {
                if (last == null) {
                    last = current;
                }
            } else if (!(current instanceof TypeLoc.Qualified)) {
                if (last == null) {
                    last = current;
                }
                return last.localSourceRange().end();
            }
            current = current.nextTypeLoc();
        }
        return last == null ? SourceLocation.INVALID : last.localSourceRange().end();
    }

    public static SourceRange range(@Nullable TypeLoc type) {
        if (type == null) {
            return SourceRange.INVALID;
        }
        return new SourceRange(begin(type), end(type));
    }
}
