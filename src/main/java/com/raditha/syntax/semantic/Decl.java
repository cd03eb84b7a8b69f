package com.raditha.syntax.semantic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Declarations of the semantic tree.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
public interface Decl extends SemanticNode {

    default SourceLocation beginLoc() {
        return sourceRange().begin();
    }

    /**
     * Root of the semantic tree. Its node is built when the tree is finished,
     * so it has no range of its own.
     */
    record TranslationUnit(List<Decl> decls) implements Decl {
        public TranslationUnit {
            decls = decls == null ? List.of() : List.copyOf(decls);
        }

        @Override
        public SourceRange sourceRange() {
            return SourceRange.INVALID;
        }
    }

    enum DeclaratorKind {
        VARIABLE,
        FUNCTION,
        FIELD,
        PARAMETER
    }

    /**
     * A named entity declared with a declarator: variable, function, field or
     * parameter.
     *
     * @param kind         entity kind
     * @param sourceRange  whole declaration, starting at the declaration specifiers
     * @param type         written type, inside out
     * @param nameLoc      the name, invalid for unnamed parameters
     * @param qualifier    scope qualifier of an out-of-line definition
     * @param init         initializer or default argument
     * @param body         function body
     * @param forRangeDecl true for the loop variable of a range-based for
     */
    record Declarator(
            DeclaratorKind kind,
            SourceRange sourceRange,
            TypeLoc type,
            SourceLocation nameLoc,
            @Nullable NestedNameSpecifierLoc qualifier,
            @Nullable Expr init,
            @Nullable Stmt body,
            boolean forRangeDecl) implements Decl {
        public Declarator {
            kind = kind == null ? DeclaratorKind.VARIABLE : kind;
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            nameLoc = SourceLocation.orInvalid(nameLoc);
            if (type == null) {
                throw new IllegalArgumentException("declarator needs a type");
            }
        }

        /**
         * True for a function with a body.
         */
        @JsonIgnore
        public boolean isDefinition() {
            return kind == DeclaratorKind.FUNCTION && body != null;
        }
    }

    /**
     * {@code typedef T name;}
     */
    record Typedef(SourceRange sourceRange, TypeLoc type, SourceLocation nameLoc) implements Decl {
        public Typedef {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            nameLoc = SourceLocation.orInvalid(nameLoc);
            if (type == null) {
                throw new IllegalArgumentException("typedef needs a type");
            }
        }
    }

    /**
     * {@code using name = T;}
     */
    record TypeAlias(SourceRange sourceRange, TypeLoc type) implements Decl {
        public TypeAlias {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    /**
     * {@code namespace n { ... }}. For {@code namespace a::b {}} the inner
     * namespace starts at the {@code ::}.
     */
    record Namespace(SourceRange sourceRange, List<Decl> decls) implements Decl {
        public Namespace {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            decls = decls == null ? List.of() : List.copyOf(decls);
        }
    }

    /**
     * {@code namespace n = a::b;}
     */
    record NamespaceAlias(SourceRange sourceRange, @Nullable NestedNameSpecifierLoc qualifier) implements Decl {
        public NamespaceAlias {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    /**
     * {@code using namespace n;}
     */
    record UsingDirective(SourceRange sourceRange, @Nullable NestedNameSpecifierLoc qualifier) implements Decl {
        public UsingDirective {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    /**
     * {@code using a::b;}, resolved or not.
     */
    record Using(SourceRange sourceRange, @Nullable NestedNameSpecifierLoc qualifier) implements Decl {
        public Using {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    /**
     * A lone {@code ;} at namespace scope.
     */
    record Empty(SourceRange sourceRange) implements Decl {
        public Empty {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    record StaticAssert(SourceRange sourceRange, Expr condition, @Nullable Expr message) implements Decl {
        public StaticAssert {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }

    /**
     * {@code extern "C" ...}, with or without braces.
     */
    record LinkageSpec(SourceRange sourceRange, List<Decl> decls) implements Decl {
        public LinkageSpec {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            decls = decls == null ? List.of() : List.copyOf(decls);
        }
    }

    /**
     * Function, class, variable or alias template. The range starts at the
     * {@code template} keyword.
     */
    record Template(SourceRange sourceRange, TemplateParameterList parameters, Decl templated) implements Decl {
        public Template {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            if (parameters == null || templated == null) {
                throw new IllegalArgumentException("template needs parameters and a templated declaration");
            }
        }
    }

    enum TagKind {
        STRUCT,
        CLASS,
        UNION,
        ENUM
    }

    /**
     * Where an explicit instantiation puts its keywords.
     *
     * @param externLoc          {@code extern}, invalid for a definition
     * @param templateKeywordLoc {@code template}
     */
    record Instantiation(SourceLocation externLoc, SourceLocation templateKeywordLoc) {
        public Instantiation {
            externLoc = SourceLocation.orInvalid(externLoc);
            templateKeywordLoc = SourceLocation.orInvalid(templateKeywordLoc);
        }
    }

    /**
     * Class, struct, union or enum declaration.
     *
     * @param tagKind                        the keyword
     * @param sourceRange                    whole declaration, including
     *                                       template headers
     * @param typeBeginLoc                   the tag keyword
     * @param freeStanding                   true if the declaration is a
     *                                       statement of its own rather than
     *                                       part of another declaration
     * @param templateParameterLists         outer {@code template <...>}
     *                                       headers, outermost first
     * @param partialSpecializationParameters parameters of a partial
     *                                       specialization
     * @param members                        member declarations
     * @param qualifier                      qualifier of the tag name
     * @param instantiation                  keywords of an explicit
     *                                       instantiation, or null
     */
    record Tag(
            TagKind tagKind,
            SourceRange sourceRange,
            SourceLocation typeBeginLoc,
            boolean freeStanding,
            List<TemplateParameterList> templateParameterLists,
            @Nullable TemplateParameterList partialSpecializationParameters,
            List<Decl> members,
            @Nullable NestedNameSpecifierLoc qualifier,
            @Nullable Instantiation instantiation) implements Decl {
        public Tag {
            tagKind = tagKind == null ? TagKind.STRUCT : tagKind;
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
            typeBeginLoc = typeBeginLoc == null || typeBeginLoc.isInvalid() ? sourceRange.begin() : typeBeginLoc;
            templateParameterLists = templateParameterLists == null ? List.of() : List.copyOf(templateParameterLists);
            members = members == null ? List.of() : List.copyOf(members);
        }

        @JsonIgnore
        public boolean isExplicitInstantiation() {
            return instantiation != null;
        }
    }

    /**
     * Any declaration without a dedicated shape, e.g. a template type
     * parameter or a friend declaration.
     */
    record Unknown(SourceRange sourceRange) implements Decl {
        public Unknown {
            sourceRange = sourceRange == null ? SourceRange.INVALID : sourceRange;
        }
    }
}
