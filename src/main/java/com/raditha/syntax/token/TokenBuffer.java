package com.raditha.syntax.token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The expanded token stream of one translation unit.
 * Always terminated by exactly one {@link TokenKind#EOF} token; locations
 * strictly increase along the stream.
 */
public class TokenBuffer {

    private final List<Token> expandedTokens;

    /**
     * @param expandedTokens tokens in source order, the last one being the end marker
     * @throws IllegalArgumentException if the stream is malformed
     */
    public TokenBuffer(List<Token> expandedTokens) {
        if (expandedTokens == null || expandedTokens.isEmpty()) {
            throw new IllegalArgumentException("token stream cannot be empty");
        }
        int last = expandedTokens.size() - 1;
        if (!expandedTokens.get(last).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("token stream must end with an eof token");
        }
        for (int i = 0; i < last; i++) {
            Token token = expandedTokens.get(i);
            if (token.is(TokenKind.EOF)) {
                throw new IllegalArgumentException("eof token in the middle of the stream at index " + i);
            }
            if (!token.location().isBefore(expandedTokens.get(i + 1).location())) {
                throw new IllegalArgumentException(
                        String.format("token locations must increase: '%s' %s is followed by %s",
                                token.text(), token.location(), expandedTokens.get(i + 1).location()));
            }
        }
        this.expandedTokens = List.copyOf(expandedTokens);
    }

    /**
     * Build a buffer from tokens that do not include the end marker.
     */
    public static TokenBuffer withEof(List<Token> tokens) {
        List<Token> all = new ArrayList<>(tokens);
        int eofOffset = 0;
        if (!tokens.isEmpty()) {
            Token last = tokens.get(tokens.size() - 1);
            eofOffset = last.location().offset() + Math.max(1, last.text().length());
        }
        all.add(Token.eof(eofOffset));
        return new TokenBuffer(all);
    }

    public List<Token> expandedTokens() {
        return expandedTokens;
    }

    /**
     * Number of expanded tokens, including the end marker.
     */
    public int size() {
        return expandedTokens.size();
    }

    /**
     * Index of the end marker, which is also the number of tokens that end up
     * in a syntax tree.
     */
    public int eofIndex() {
        return expandedTokens.size() - 1;
    }

    public Token get(int index) {
        return expandedTokens.get(index);
    }

    public List<Token> tokens(TokenRange range) {
        return expandedTokens.subList(range.begin(), range.end());
    }

    /**
     * Check whether every token in the range has a spelled counterpart, so the
     * whole range can be rewritten in the source.
     */
    public boolean spelledForExpanded(TokenRange range) {
        for (int i = range.begin(); i < range.end(); i++) {
            if (!expandedTokens.get(i).modifiable()) {
                return false;
            }
        }
        return true;
    }

    public String text(TokenRange range) {
        return tokens(range).stream().map(Token::text).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return text(new TokenRange(0, eofIndex()));
    }
}
