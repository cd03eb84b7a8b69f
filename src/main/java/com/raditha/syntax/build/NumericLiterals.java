package com.raditha.syntax.build;

import com.raditha.syntax.semantic.Expr;
import com.raditha.syntax.tree.NodeKind;

import java.util.Locale;

/**
 * Classifies user-defined literals. Raw and template literal operators get
 * the spelling of the literal, so whether {@code 12_km} or {@code 1.2_km} is
 * an integer or a floating literal has to be read from the token.
 */
public final class NumericLiterals {

    private NumericLiterals() {
    }

    public static NodeKind userDefinedLiteralKind(Expr.LiteralOperatorKind literalKind, String spelling) {
        return switch (literalKind) {
            case INTEGER -> NodeKind.INTEGER_USER_DEFINED_LITERAL_EXPRESSION;
            case FLOATING -> NodeKind.FLOAT_USER_DEFINED_LITERAL_EXPRESSION;
            case CHARACTER -> NodeKind.CHAR_USER_DEFINED_LITERAL_EXPRESSION;
            case STRING -> NodeKind.STRING_USER_DEFINED_LITERAL_EXPRESSION;
            case RAW, TEMPLATE -> isFloating(spelling)
                    ? NodeKind.FLOAT_USER_DEFINED_LITERAL_EXPRESSION
                    : NodeKind.INTEGER_USER_DEFINED_LITERAL_EXPRESSION;
        };
    }

    /**
     * Whether a numeric literal, with or without a ud-suffix, is a floating
     * literal.
     */
    public static boolean isFloating(String spelling) {
        String number = stripSuffix(spelling).toLowerCase(Locale.ROOT);
        if (number.startsWith("0x")) {
            return number.indexOf('.') >= 0 || number.indexOf('p') >= 0;
        }
        if (number.startsWith("0b")) {
            return false;
        }
        return number.indexOf('.') >= 0 || number.indexOf('e') >= 0;
    }

    static String stripSuffix(String spelling) {
        int underscore = spelling.indexOf('_');
        return underscore < 0 ? spelling : spelling.substring(0, underscore);
    }
}
