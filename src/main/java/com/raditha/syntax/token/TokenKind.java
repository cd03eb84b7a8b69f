package com.raditha.syntax.token;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical category of an expanded token.
 * The tree builder only inspects a handful of these (separators, the arrow,
 * scope qualifiers and the keywords that introduce template instantiations);
 * the rest exist so that token dumps stay readable.
 */
public enum TokenKind {
    /** Identifier that is not a keyword */
    IDENTIFIER,

    /** Any keyword without a dedicated kind */
    KEYWORD,

    /** {@code extern} */
    KW_EXTERN,

    /** {@code template} */
    KW_TEMPLATE,

    /** Integer or floating literal, with or without a user-defined suffix */
    NUMERIC_CONSTANT,

    /** Character literal */
    CHAR_CONSTANT,

    /** String literal, including raw and prefixed forms */
    STRING_LITERAL,

    /** {@code ;} */
    SEMI,

    /** {@code ->} */
    ARROW,

    /** {@code ::} */
    COLONCOLON,

    L_PAREN,
    R_PAREN,
    L_BRACE,
    R_BRACE,
    L_SQUARE,
    R_SQUARE,
    COMMA,

    /** Operator or punctuator without a dedicated kind */
    PUNCTUATOR,

    /** End of the expanded token stream; never part of a syntax tree */
    EOF;

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\.?[0-9].*");
    private static final Pattern CHAR_PATTERN = Pattern.compile("(u8|u|U|L)?'.*");
    private static final Pattern STRING_PATTERN = Pattern.compile("(u8|u|U|L)?R?\".*", Pattern.DOTALL);

    private static final Map<String, TokenKind> PUNCTUATION = Map.of(
            ";", SEMI,
            "->", ARROW,
            "::", COLONCOLON,
            "(", L_PAREN,
            ")", R_PAREN,
            "{", L_BRACE,
            "}", R_BRACE,
            "[", L_SQUARE,
            "]", R_SQUARE,
            ",", COMMA);

    private static final Set<String> KEYWORDS = Set.of(
            "alignas", "alignof", "asm", "auto", "bool", "break", "case", "catch", "char", "char8_t",
            "char16_t", "char32_t", "class", "co_await", "co_return", "co_yield", "concept", "const",
            "consteval", "constexpr", "constinit", "const_cast", "continue", "decltype", "default",
            "delete", "do", "double", "dynamic_cast", "else", "enum", "explicit", "export", "false",
            "float", "for", "friend", "goto", "if", "inline", "int", "long", "mutable", "namespace",
            "new", "noexcept", "nullptr", "operator", "private", "protected", "public", "register",
            "reinterpret_cast", "requires", "restrict", "return", "short", "signed", "sizeof", "static",
            "static_assert", "static_cast", "struct", "switch", "this", "thread_local", "throw", "true",
            "try", "typedef", "typeid", "typename", "union", "unsigned", "using", "virtual", "void",
            "volatile", "wchar_t", "while", "__super");

    /**
     * Classify spelled token text.
     *
     * @param spelling the token text as written; empty text is the end marker
     * @return the best matching kind
     */
    public static TokenKind fromSpelling(String spelling) {
        if (spelling == null || spelling.isEmpty()) {
            return EOF;
        }
        TokenKind punctuation = PUNCTUATION.get(spelling);
        if (punctuation != null) {
            return punctuation;
        }
        if (spelling.equals("extern")) {
            return KW_EXTERN;
        }
        if (spelling.equals("template")) {
            return KW_TEMPLATE;
        }
        // Prefixed literals look like identifiers at first, so test them first.
        if (STRING_PATTERN.matcher(spelling).matches()) {
            return STRING_LITERAL;
        }
        if (CHAR_PATTERN.matcher(spelling).matches()) {
            return CHAR_CONSTANT;
        }
        if (NUMBER_PATTERN.matcher(spelling).matches()) {
            return NUMERIC_CONSTANT;
        }
        if (IDENTIFIER_PATTERN.matcher(spelling).matches()) {
            return KEYWORDS.contains(spelling) ? KEYWORD : IDENTIFIER;
        }
        return PUNCTUATOR;
    }
}
