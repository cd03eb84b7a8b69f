package com.raditha.syntax.tree;

/**
 * Structural position of a child within its parent.
 * Roles are only meaningful relative to the parent's kind: several kinds
 * share the generic roles such as {@link #OPEN_PAREN}.
 */
public enum NodeRole {
    /** Not attached to a parent yet */
    DETACHED("Detached"),
    /** Attached, but nobody gave it a role */
    UNKNOWN("Unknown"),

    OPEN_PAREN("OpenParen"),
    CLOSE_PAREN("CloseParen"),
    INTRODUCER_KEYWORD("IntroducerKeyword"),
    LITERAL_TOKEN("LiteralToken"),
    ARROW_TOKEN("ArrowToken"),
    EXTERN_KEYWORD("ExternKeyword"),
    TEMPLATE_KEYWORD("TemplateKeyword"),
    BODY_STATEMENT("BodyStatement"),
    LIST_ELEMENT("List_element"),
    LIST_DELIMITER("List_delimiter"),

    OPERATOR_EXPRESSION_OPERATOR_TOKEN("OperatorExpression_operatorToken"),
    UNARY_OPERATOR_EXPRESSION_OPERAND("UnaryOperatorExpression_operand"),
    BINARY_OPERATOR_EXPRESSION_LEFT_HAND_SIDE("BinaryOperatorExpression_leftHandSide"),
    BINARY_OPERATOR_EXPRESSION_RIGHT_HAND_SIDE("BinaryOperatorExpression_rightHandSide"),
    CASE_STATEMENT_VALUE("CaseStatement_value"),
    IF_STATEMENT_THEN_STATEMENT("IfStatement_thenStatement"),
    IF_STATEMENT_ELSE_KEYWORD("IfStatement_elseKeyword"),
    IF_STATEMENT_ELSE_STATEMENT("IfStatement_elseStatement"),
    RETURN_STATEMENT_VALUE("ReturnStatement_value"),
    EXPRESSION_STATEMENT_EXPRESSION("ExpressionStatement_expression"),
    COMPOUND_STATEMENT_STATEMENT("CompoundStatement_statement"),
    STATIC_ASSERT_DECLARATION_CONDITION("StaticAssertDeclaration_condition"),
    STATIC_ASSERT_DECLARATION_MESSAGE("StaticAssertDeclaration_message"),
    SIMPLE_DECLARATION_DECLARATOR("SimpleDeclaration_declarator"),
    TEMPLATE_DECLARATION_DECLARATION("TemplateDeclaration_declaration"),
    EXPLICIT_TEMPLATE_INSTANTIATION_DECLARATION("ExplicitTemplateInstantiation_declaration"),
    ARRAY_SUBSCRIPT_SIZE_EXPRESSION("ArraySubscript_sizeExpression"),
    TRAILING_RETURN_TYPE_DECLARATOR("TrailingReturnType_declarator"),
    PARAMETERS_AND_QUALIFIERS_PARAMETER("ParametersAndQualifiers_parameter"),
    PARAMETERS_AND_QUALIFIERS_TRAILING_RETURN("ParametersAndQualifiers_trailingReturn"),
    ID_EXPRESSION_ID("IdExpression_id"),
    ID_EXPRESSION_QUALIFIER("IdExpression_qualifier"),
    MEMBER_EXPRESSION_OBJECT("MemberExpression_object"),
    MEMBER_EXPRESSION_ACCESS_TOKEN("MemberExpression_accessToken"),
    MEMBER_EXPRESSION_MEMBER("MemberExpression_member"),
    PAREN_EXPRESSION_SUB_EXPRESSION("ParenExpression_subExpression");

    private final String displayName;

    NodeRole(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
