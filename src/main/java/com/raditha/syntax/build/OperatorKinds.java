package com.raditha.syntax.build;

import com.raditha.syntax.semantic.OverloadedOperator;
import com.raditha.syntax.tree.NodeKind;

/**
 * Syntax node kind for a call to an overloaded operator, by operator and
 * number of arguments. A postfix increment or decrement carries an extra
 * unwritten argument, which is how it is told apart from the prefix form.
 */
public final class OperatorKinds {

    private OperatorKinds() {
    }

    public static NodeKind getOperatorNodeKind(OverloadedOperator operator, int argumentCount) {
        return switch (operator) {
            // comparison
            case EQUAL_EQUAL, EXCLAIM_EQUAL, GREATER, GREATER_EQUAL, LESS, LESS_EQUAL, SPACESHIP,
                    // assignment
                    EQUAL, SLASH_EQUAL, PERCENT_EQUAL, CARET_EQUAL, PIPE_EQUAL, LESS_LESS_EQUAL,
                    GREATER_GREATER_EQUAL, PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, AMP_EQUAL,
                    // binary computation
                    SLASH, PERCENT, CARET, PIPE, LESS_LESS, GREATER_GREATER, AMP_AMP, PIPE_PIPE,
                    ARROW_STAR, COMMA -> NodeKind.BINARY_OPERATOR_EXPRESSION;
            case TILDE, EXCLAIM -> NodeKind.PREFIX_UNARY_OPERATOR_EXPRESSION;
            case PLUS_PLUS, MINUS_MINUS -> switch (argumentCount) {
                case 1 -> NodeKind.PREFIX_UNARY_OPERATOR_EXPRESSION;
                case 2 -> NodeKind.POSTFIX_UNARY_OPERATOR_EXPRESSION;
                default -> throw invalidArity(operator, argumentCount);
            };
            case PLUS, MINUS, STAR, AMP -> switch (argumentCount) {
                case 1 -> NodeKind.PREFIX_UNARY_OPERATOR_EXPRESSION;
                case 2 -> NodeKind.BINARY_OPERATOR_EXPRESSION;
                default -> throw invalidArity(operator, argumentCount);
            };
            // not modelled yet
            case NEW, DELETE, ARRAY_NEW, ARRAY_DELETE, COAWAIT, CALL, SUBSCRIPT, ARROW ->
                    NodeKind.UNKNOWN_EXPRESSION;
            case CONDITIONAL -> throw new IllegalStateException("operator ?: cannot be overloaded");
        };
    }

    private static IllegalStateException invalidArity(OverloadedOperator operator, int argumentCount) {
        return new IllegalStateException("invalid number of arguments " + argumentCount + " for operator "
                + operator);
    }
}
