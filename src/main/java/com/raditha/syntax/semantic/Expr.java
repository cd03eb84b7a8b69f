package com.raditha.syntax.semantic;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Expressions of the semantic tree. An expression is also a statement when
 * it appears in statement position.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
public interface Expr extends Stmt {

    /**
     * Skip compiler-inserted wrappers such as implicit conversions.
     */
    default Expr ignoreImplicit() {
        Expr current = this;
        while (current instanceof Implicit implicit) {
            current = implicit.subExpr();
        }
        return current;
    }

    /**
     * Compiler-inserted node that is not written in the source.
     */
    record Implicit(Expr subExpr) implements Expr {
        public Implicit {
            if (subExpr == null) {
                throw new IllegalArgumentException("implicit expression needs a sub-expression");
            }
        }

        @Override
        public SourceRange sourceRange() {
            return subExpr.sourceRange();
        }
    }

    record IntegerLiteral(SourceLocation loc) implements Expr {
        public IntegerLiteral {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    record CharacterLiteral(SourceLocation loc) implements Expr {
        public CharacterLiteral {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    record FloatingLiteral(SourceLocation loc) implements Expr {
        public FloatingLiteral {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    /**
     * String literal; adjacent literals are concatenated into one range.
     */
    record StringLiteral(SourceRange sourceRange) implements Expr {
        public StringLiteral {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    record BoolLiteral(SourceLocation loc) implements Expr {
        public BoolLiteral {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    record NullPtrLiteral(SourceLocation loc) implements Expr {
        public NullPtrLiteral {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    /**
     * Which literal operator a user-defined literal calls. RAW and TEMPLATE
     * operators receive the spelling, so the literal's category has to be
     * read from the token.
     */
    enum LiteralOperatorKind {
        INTEGER,
        FLOATING,
        CHARACTER,
        STRING,
        RAW,
        TEMPLATE
    }

    record UserDefinedLiteral(SourceLocation loc, LiteralOperatorKind literalKind) implements Expr {
        public UserDefinedLiteral {
            loc = SourceLocation.orInvalid(loc);
            if (literalKind == null) {
                throw new IllegalArgumentException("user-defined literal needs a literal kind");
            }
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    /**
     * Reference to a declared entity, possibly qualified.
     *
     * @param qualifier          scope qualifier
     * @param templateKeywordLoc {@code template} after the qualifier
     * @param nameLoc            first token of the unqualified name
     * @param endLoc             last token of the unqualified name (closing
     *                           angle bracket of explicit template arguments)
     * @param dependentScope     true when the name could not be resolved
     */
    record DeclRef(
            @Nullable NestedNameSpecifierLoc qualifier,
            SourceLocation templateKeywordLoc,
            SourceLocation nameLoc,
            SourceLocation endLoc,
            boolean dependentScope) implements Expr {
        public DeclRef {
            templateKeywordLoc = SourceLocation.orInvalid(templateKeywordLoc);
            nameLoc = SourceLocation.orInvalid(nameLoc);
            endLoc = endLoc == null || endLoc.isInvalid() ? nameLoc : endLoc;
        }

        public static DeclRef simple(SourceLocation nameLoc) {
            return new DeclRef(null, SourceLocation.INVALID, nameLoc, nameLoc, false);
        }

        @Override
        public SourceRange sourceRange() {
            SourceLocation begin = qualifier != null ? qualifier.beginLoc() : nameLoc;
            return new SourceRange(begin, endLoc);
        }
    }

    /**
     * Member access {@code base.member} or {@code base->member}. With
     * {@code implicitAccess} the base is an implicit {@code this} and only the
     * member name is written.
     */
    record Member(
            Expr base,
            SourceLocation operatorLoc,
            @Nullable NestedNameSpecifierLoc qualifier,
            SourceLocation templateKeywordLoc,
            SourceLocation memberLoc,
            SourceLocation endLoc,
            boolean implicitAccess) implements Expr {
        public Member {
            if (base == null) {
                throw new IllegalArgumentException("member expression needs a base");
            }
            operatorLoc = SourceLocation.orInvalid(operatorLoc);
            templateKeywordLoc = SourceLocation.orInvalid(templateKeywordLoc);
            memberLoc = SourceLocation.orInvalid(memberLoc);
            endLoc = endLoc == null || endLoc.isInvalid() ? memberLoc : endLoc;
        }

        @Override
        public SourceRange sourceRange() {
            SourceLocation begin;
            if (!implicitAccess) {
                begin = base.sourceRange().begin();
            } else {
                begin = qualifier != null ? qualifier.beginLoc() : memberLoc;
            }
            return new SourceRange(begin, endLoc);
        }
    }

    record This(SourceLocation loc, boolean implicit) implements Expr {
        public This {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    record Paren(SourceLocation lParen, Expr subExpr, SourceLocation rParen) implements Expr {
        public Paren {
            lParen = SourceLocation.orInvalid(lParen);
            rParen = SourceLocation.orInvalid(rParen);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(lParen, rParen);
        }
    }

    record UnaryOperator(boolean postfix, SourceLocation operatorLoc, Expr operand) implements Expr {
        public UnaryOperator {
            operatorLoc = SourceLocation.orInvalid(operatorLoc);
            if (operand == null) {
                throw new IllegalArgumentException("unary operator needs an operand");
            }
        }

        @Override
        public SourceRange sourceRange() {
            if (postfix) {
                return new SourceRange(operand.sourceRange().begin(), operatorLoc);
            }
            return new SourceRange(operatorLoc, operand.sourceRange().end());
        }
    }

    record BinaryOperator(Expr lhs, SourceLocation operatorLoc, Expr rhs) implements Expr {
        public BinaryOperator {
            operatorLoc = SourceLocation.orInvalid(operatorLoc);
            if (lhs == null || rhs == null) {
                throw new IllegalArgumentException("binary operator needs both operands");
            }
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(lhs.sourceRange().begin(), rhs.sourceRange().end());
        }
    }

    /**
     * Call to an overloaded operator. Postfix {@code ++}/{@code --} carry a
     * second, unwritten argument with an invalid range.
     */
    record OperatorCall(
            OverloadedOperator operator,
            SourceLocation operatorLoc,
            List<Expr> arguments,
            SourceRange sourceRange) implements Expr {
        public OperatorCall {
            if (operator == null) {
                throw new IllegalArgumentException("operator call needs an operator");
            }
            operatorLoc = SourceLocation.orInvalid(operatorLoc);
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    /**
     * Expression kinds without a dedicated shape (calls, casts, lambdas, ...).
     */
    record Unknown(SourceRange sourceRange, List<Stmt> children) implements Expr {
        public Unknown {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            children = children == null ? List.of() : List.copyOf(children);
        }
    }
}
