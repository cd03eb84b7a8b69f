package com.raditha.syntax.token;

/**
 * An expanded token, as produced by the lexing and preprocessing stage.
 * Tokens are read-only to the tree builder: it never creates or deletes them.
 *
 * @param kind       lexical category
 * @param location   location of the first character
 * @param text       spelled text
 * @param modifiable true if the token maps one-to-one to spelled source text
 *                   (false for tokens produced by macro expansion)
 */
public record Token(
        TokenKind kind,
        SourceLocation location,
        String text,
        boolean modifiable) {

    public Token {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (location == null || location.isInvalid()) {
            throw new IllegalArgumentException("token '" + text + "' needs a valid location");
        }
        if (text == null) {
            text = "";
        }
    }

    /**
     * Create a token spelled directly in the source.
     */
    public Token(TokenKind kind, SourceLocation location, String text) {
        this(kind, location, text, true);
    }

    /**
     * Create a spelled token, classifying it from its text.
     */
    public static Token spelled(String text, int offset) {
        return new Token(TokenKind.fromSpelling(text), SourceLocation.of(offset), text, true);
    }

    /**
     * Create the end-of-stream marker.
     */
    public static Token eof(int offset) {
        return new Token(TokenKind.EOF, SourceLocation.of(offset), "", true);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind == TokenKind.EOF ? "<eof>" : text;
    }
}
