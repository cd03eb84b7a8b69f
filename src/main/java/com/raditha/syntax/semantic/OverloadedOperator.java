package com.raditha.syntax.semantic;

/**
 * Operator named by a call to an overloaded operator function.
 */
public enum OverloadedOperator {
    NEW,
    DELETE,
    ARRAY_NEW,
    ARRAY_DELETE,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    CARET,
    AMP,
    PIPE,
    TILDE,
    EXCLAIM,
    EQUAL,
    LESS,
    GREATER,
    PLUS_EQUAL,
    MINUS_EQUAL,
    STAR_EQUAL,
    SLASH_EQUAL,
    PERCENT_EQUAL,
    CARET_EQUAL,
    AMP_EQUAL,
    PIPE_EQUAL,
    LESS_LESS,
    GREATER_GREATER,
    LESS_LESS_EQUAL,
    GREATER_GREATER_EQUAL,
    EQUAL_EQUAL,
    EXCLAIM_EQUAL,
    LESS_EQUAL,
    GREATER_EQUAL,
    SPACESHIP,
    AMP_AMP,
    PIPE_PIPE,
    PLUS_PLUS,
    MINUS_MINUS,
    COMMA,
    ARROW_STAR,
    ARROW,
    CALL,
    SUBSCRIPT,
    /** {@code ?:} cannot be overloaded; present so front ends can report it */
    CONDITIONAL,
    COAWAIT
}
