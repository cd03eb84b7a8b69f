package com.raditha.syntax.semantic;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Statements of the semantic tree. Reported ranges stop before a trailing
 * {@code ;} for most statement kinds.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
public interface Stmt extends SemanticNode {

    private static SourceLocation endOf(@Nullable Stmt stmt, SourceLocation fallback) {
        if (stmt == null || !stmt.sourceRange().isValid()) {
            return fallback;
        }
        return stmt.sourceRange().end();
    }

    record Compound(SourceLocation lBrace, List<Stmt> body, SourceLocation rBrace) implements Stmt {
        public Compound {
            lBrace = SourceLocation.orInvalid(lBrace);
            rBrace = SourceLocation.orInvalid(rBrace);
            body = body == null ? List.of() : List.copyOf(body);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(lBrace, rBrace);
        }
    }

    /**
     * Declarations in statement position; the range includes the {@code ;}.
     */
    record DeclStmt(SourceRange sourceRange, List<Decl> decls) implements Stmt {
        public DeclStmt {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            decls = decls == null ? List.of() : List.copyOf(decls);
        }
    }

    record Null(SourceLocation semiLoc) implements Stmt {
        public Null {
            semiLoc = SourceLocation.orInvalid(semiLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(semiLoc);
        }
    }

    record Switch(
            SourceLocation switchLoc,
            @Nullable Stmt init,
            @Nullable DeclStmt conditionVariable,
            @Nullable Expr condition,
            Stmt body) implements Stmt {
        public Switch {
            switchLoc = SourceLocation.orInvalid(switchLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(switchLoc, endOf(body, switchLoc));
        }
    }

    /**
     * {@code case value:} with an optional GNU range end {@code case a ... b:}.
     */
    record Case(
            SourceLocation keywordLoc,
            Expr value,
            @Nullable Expr rhs,
            SourceLocation colonLoc,
            @Nullable Stmt subStmt) implements Stmt {
        public Case {
            keywordLoc = SourceLocation.orInvalid(keywordLoc);
            colonLoc = SourceLocation.orInvalid(colonLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(keywordLoc, endOf(subStmt, colonLoc));
        }
    }

    record Default(SourceLocation keywordLoc, SourceLocation colonLoc, @Nullable Stmt subStmt) implements Stmt {
        public Default {
            keywordLoc = SourceLocation.orInvalid(keywordLoc);
            colonLoc = SourceLocation.orInvalid(colonLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(keywordLoc, endOf(subStmt, colonLoc));
        }
    }

    record If(
            SourceLocation ifLoc,
            @Nullable Stmt init,
            @Nullable DeclStmt conditionVariable,
            @Nullable Expr condition,
            Stmt then,
            SourceLocation elseLoc,
            @Nullable Stmt elseStmt) implements Stmt {
        public If {
            ifLoc = SourceLocation.orInvalid(ifLoc);
            elseLoc = SourceLocation.orInvalid(elseLoc);
        }

        @Override
        public SourceRange sourceRange() {
            SourceLocation end = elseStmt != null ? endOf(elseStmt, elseLoc) : endOf(then, ifLoc);
            return new SourceRange(ifLoc, end);
        }
    }

    record For(
            SourceLocation forLoc,
            @Nullable Stmt init,
            @Nullable Expr condition,
            @Nullable Expr increment,
            Stmt body) implements Stmt {
        public For {
            forLoc = SourceLocation.orInvalid(forLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(forLoc, endOf(body, forLoc));
        }
    }

    record While(
            SourceLocation whileLoc,
            @Nullable DeclStmt conditionVariable,
            @Nullable Expr condition,
            Stmt body) implements Stmt {
        public While {
            whileLoc = SourceLocation.orInvalid(whileLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(whileLoc, endOf(body, whileLoc));
        }
    }

    record Continue(SourceLocation loc) implements Stmt {
        public Continue {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    record Break(SourceLocation loc) implements Stmt {
        public Break {
            loc = SourceLocation.orInvalid(loc);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.at(loc);
        }
    }

    record Return(SourceLocation returnLoc, @Nullable Expr value) implements Stmt {
        public Return {
            returnLoc = SourceLocation.orInvalid(returnLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(returnLoc, endOf(value, returnLoc));
        }
    }

    /**
     * {@code for (init; T x : range) body}.
     */
    record RangeFor(
            SourceLocation forLoc,
            @Nullable Stmt init,
            Decl loopVariable,
            Expr rangeInit,
            Stmt body) implements Stmt {
        public RangeFor {
            forLoc = SourceLocation.orInvalid(forLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(forLoc, endOf(body, forLoc));
        }
    }

    /**
     * Statement kinds without a dedicated shape (try, do, goto, ...).
     */
    record Unknown(SourceRange sourceRange, List<Stmt> children) implements Stmt {
        public Unknown {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            children = children == null ? List.of() : List.copyOf(children);
        }
    }
}
