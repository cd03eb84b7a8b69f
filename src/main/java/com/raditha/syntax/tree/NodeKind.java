package com.raditha.syntax.tree;

import java.util.Locale;

/**
 * Syntactic category of a concrete syntax tree node.
 */
public enum NodeKind {
    LEAF,
    TRANSLATION_UNIT,

    // Expressions
    UNKNOWN_EXPRESSION,
    PAREN_EXPRESSION,
    THIS_EXPRESSION,
    INTEGER_LITERAL_EXPRESSION,
    CHARACTER_LITERAL_EXPRESSION,
    FLOATING_LITERAL_EXPRESSION,
    STRING_LITERAL_EXPRESSION,
    BOOL_LITERAL_EXPRESSION,
    CXX_NULL_PTR_EXPRESSION,
    INTEGER_USER_DEFINED_LITERAL_EXPRESSION,
    FLOAT_USER_DEFINED_LITERAL_EXPRESSION,
    CHAR_USER_DEFINED_LITERAL_EXPRESSION,
    STRING_USER_DEFINED_LITERAL_EXPRESSION,
    PREFIX_UNARY_OPERATOR_EXPRESSION,
    POSTFIX_UNARY_OPERATOR_EXPRESSION,
    BINARY_OPERATOR_EXPRESSION,
    ID_EXPRESSION,
    MEMBER_EXPRESSION,
    UNQUALIFIED_ID,

    // Name specifiers
    NESTED_NAME_SPECIFIER,
    GLOBAL_NAME_SPECIFIER,
    DECLTYPE_NAME_SPECIFIER,
    IDENTIFIER_NAME_SPECIFIER,
    SIMPLE_TEMPLATE_NAME_SPECIFIER,

    // Statements
    UNKNOWN_STATEMENT,
    DECLARATION_STATEMENT,
    EMPTY_STATEMENT,
    SWITCH_STATEMENT,
    CASE_STATEMENT,
    DEFAULT_STATEMENT,
    IF_STATEMENT,
    FOR_STATEMENT,
    WHILE_STATEMENT,
    CONTINUE_STATEMENT,
    BREAK_STATEMENT,
    RETURN_STATEMENT,
    RANGE_BASED_FOR_STATEMENT,
    EXPRESSION_STATEMENT,
    COMPOUND_STATEMENT,

    // Declarations
    UNKNOWN_DECLARATION,
    EMPTY_DECLARATION,
    STATIC_ASSERT_DECLARATION,
    LINKAGE_SPECIFICATION_DECLARATION,
    SIMPLE_DECLARATION,
    TEMPLATE_DECLARATION,
    EXPLICIT_TEMPLATE_INSTANTIATION,
    NAMESPACE_DEFINITION,
    NAMESPACE_ALIAS_DEFINITION,
    USING_NAMESPACE_DIRECTIVE,
    USING_DECLARATION,
    TYPE_ALIAS_DECLARATION,

    // Declarators
    SIMPLE_DECLARATOR,
    PAREN_DECLARATOR,
    ARRAY_SUBSCRIPT,
    TRAILING_RETURN_TYPE,
    PARAMETERS_AND_QUALIFIERS,
    MEMBER_POINTER;

    private final String displayName;

    NodeKind() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        this.displayName = sb.toString();
    }

    public boolean isLeaf() {
        return this == LEAF;
    }

    /**
     * CamelCase name used in dumps, e.g. {@code SimpleDeclaration}.
     */
    public String displayName() {
        return displayName;
    }
}
