package com.raditha.syntax.semantic;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Written form of a type, stored inside out: the outermost object is the last
 * declarator chunk applied and {@link #nextTypeLoc()} leads towards the type
 * specifier. In {@code int *a[10]} the chain is array, then pointer, then
 * {@code int}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
public interface TypeLoc {

    /**
     * Tokens written for this chunk alone; invalid when the chunk has none.
     */
    SourceRange localSourceRange();

    /**
     * The type this chunk applies to, or null at the end of the chain.
     */
    @Nullable TypeLoc nextTypeLoc();

    /**
     * Type specifier such as {@code int}, {@code unsigned long} or
     * {@code ns::Widget}.
     *
     * @param range     all tokens of the specifier, qualifier included
     * @param qualifier scope qualifier written before the name
     */
    record TypeSpec(SourceRange range, @Nullable NestedNameSpecifierLoc qualifier) implements TypeLoc {
        public TypeSpec {
            range = range == null ? SourceRange.INVALID : range;
        }

        @Override
        public SourceRange localSourceRange() {
            return range;
        }

        @Override
        public @Nullable TypeLoc nextTypeLoc() {
            return null;
        }
    }

    /**
     * {@code decltype(expression)}.
     */
    record Decltype(SourceRange range, @Nullable Expr expression) implements TypeLoc {
        public Decltype {
            range = range == null ? SourceRange.INVALID : range;
        }

        @Override
        public SourceRange localSourceRange() {
            return range;
        }

        @Override
        public @Nullable TypeLoc nextTypeLoc() {
            return null;
        }
    }

    /**
     * A template-id used as a type, e.g. {@code std::vector<int>}.
     */
    record TemplateSpecialization(
            SourceRange range,
            @Nullable NestedNameSpecifierLoc qualifier,
            List<TypeLoc> typeArguments,
            List<Expr> expressionArguments) implements TypeLoc {
        public TemplateSpecialization {
            range = range == null ? SourceRange.INVALID : range;
            typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
            expressionArguments = expressionArguments == null ? List.of() : List.copyOf(expressionArguments);
        }

        @Override
        public SourceRange localSourceRange() {
            return range;
        }

        @Override
        public @Nullable TypeLoc nextTypeLoc() {
            return null;
        }
    }

    /**
     * A template-id that depends on a template parameter, e.g.
     * {@code T::template X<U>}. Its range covers the qualifier too.
     */
    record DependentTemplateSpecialization(
            SourceRange range,
            @Nullable NestedNameSpecifierLoc qualifier,
            SourceLocation templateKeywordLoc) implements TypeLoc {
        public DependentTemplateSpecialization {
            range = range == null ? SourceRange.INVALID : range;
            templateKeywordLoc = SourceLocation.orInvalid(templateKeywordLoc);
        }

        @Override
        public SourceRange localSourceRange() {
            return range;
        }

        @Override
        public @Nullable TypeLoc nextTypeLoc() {
            return null;
        }
    }

    /**
     * cv-qualified type. Qualifiers carry no locations of their own.
     */
    record Qualified(TypeLoc unqualified) implements TypeLoc {
        public Qualified {
            if (unqualified == null) {
                throw new IllegalArgumentException("qualified type needs an unqualified type");
            }
        }

        @Override
        public SourceRange localSourceRange() {
            return SourceRange.INVALID;
        }

        @Override
        public TypeLoc nextTypeLoc() {
            return unqualified;
        }
    }

    enum PointerKind {
        POINTER,
        LVALUE_REFERENCE,
        RVALUE_REFERENCE,
        BLOCK_POINTER
    }

    /**
     * Pointer-like chunk spelled with a single sigil: {@code *}, {@code &},
     * {@code &&} or {@code ^}.
     */
    record Pointer(PointerKind pointerKind, SourceLocation sigilLoc, TypeLoc pointee) implements TypeLoc {
        public Pointer {
            pointerKind = pointerKind == null ? PointerKind.POINTER : pointerKind;
            sigilLoc = SourceLocation.orInvalid(sigilLoc);
            if (pointee == null) {
                throw new IllegalArgumentException("pointer needs a pointee");
            }
        }

        @Override
        public SourceRange localSourceRange() {
            return SourceRange.at(sigilLoc);
        }

        @Override
        public TypeLoc nextTypeLoc() {
            return pointee;
        }
    }

    /**
     * Pointer to member, {@code Class::*}.
     */
    record MemberPointer(SourceRange localRange, TypeLoc pointee) implements TypeLoc {
        public MemberPointer {
            localRange = localRange == null ? SourceRange.INVALID : localRange;
            if (pointee == null) {
                throw new IllegalArgumentException("member pointer needs a pointee");
            }
        }

        @Override
        public SourceRange localSourceRange() {
            return localRange;
        }

        @Override
        public TypeLoc nextTypeLoc() {
            return pointee;
        }
    }

    /**
     * Parenthesized declarator part, e.g. the parens in {@code int (*f)(int)}.
     */
    record Paren(SourceLocation lParen, TypeLoc inner, SourceLocation rParen) implements TypeLoc {
        public Paren {
            lParen = SourceLocation.orInvalid(lParen);
            rParen = SourceLocation.orInvalid(rParen);
            if (inner == null) {
                throw new IllegalArgumentException("paren type needs an inner type");
            }
        }

        @Override
        public SourceRange localSourceRange() {
            return new SourceRange(lParen, rParen);
        }

        @Override
        public TypeLoc nextTypeLoc() {
            return inner;
        }
    }

    /**
     * Array chunk {@code [size]}; the size is absent for {@code []}.
     */
    record Array(SourceLocation lBracket, @Nullable Expr size, SourceLocation rBracket, TypeLoc element)
            implements TypeLoc {
        public Array {
            lBracket = SourceLocation.orInvalid(lBracket);
            rBracket = SourceLocation.orInvalid(rBracket);
            if (element == null) {
                throw new IllegalArgumentException("array needs an element type");
            }
        }

        @Override
        public SourceRange localSourceRange() {
            return new SourceRange(lBracket, rBracket);
        }

        @Override
        public TypeLoc nextTypeLoc() {
            return element;
        }
    }

    /**
     * Function declarator chunk: parameters, qualifiers and, for
     * {@code auto f() -> T}, a trailing return type.
     *
     * @param localBegin     first token of the chunk; the leading {@code auto}
     *                       when the return type is trailing
     * @param lParen         opening parenthesis of the parameter list
     * @param params         parameter declarations
     * @param rParen         closing parenthesis
     * @param localEnd       last token of the chunk (closing parenthesis or last
     *                       qualifier)
     * @param returnType     the return type
     * @param trailingReturn true if the return type is written after {@code ->}
     */
    record FunctionProto(
            SourceLocation localBegin,
            SourceLocation lParen,
            List<Decl> params,
            SourceLocation rParen,
            SourceLocation localEnd,
            TypeLoc returnType,
            boolean trailingReturn) implements TypeLoc {
        public FunctionProto {
            localBegin = SourceLocation.orInvalid(localBegin);
            lParen = SourceLocation.orInvalid(lParen);
            rParen = SourceLocation.orInvalid(rParen);
            localEnd = SourceLocation.orInvalid(localEnd);
            params = params == null ? List.of() : List.copyOf(params);
            if (returnType == null) {
                throw new IllegalArgumentException("function type needs a return type");
            }
        }

        /**
         * Prototype with the return type written in front.
         */
        public static FunctionProto of(SourceLocation lParen, List<Decl> params, SourceLocation rParen,
                                       TypeLoc returnType) {
            return new FunctionProto(lParen, lParen, params, rParen, rParen, returnType, false);
        }

        /**
         * Prototype of the form {@code auto (params) -> returnType}.
         */
        public static FunctionProto trailing(SourceLocation autoLoc, SourceLocation lParen, List<Decl> params,
                                             SourceLocation rParen, TypeLoc returnType) {
            return new FunctionProto(autoLoc, lParen, params, rParen, rParen, returnType, true);
        }

        @Override
        public SourceRange localSourceRange() {
            return new SourceRange(localBegin, localEnd);
        }

        @Override
        public TypeLoc nextTypeLoc() {
            return returnType;
        }
    }
}
