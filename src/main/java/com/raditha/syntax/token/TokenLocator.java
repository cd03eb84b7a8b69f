package com.raditha.syntax.token;

import java.util.HashMap;
import java.util.Map;

/**
 * Finds the token that starts at a given source location.
 * Built once per token buffer.
 */
public class TokenLocator {

    /** Index returned for invalid locations. */
    public static final int NO_TOKEN = -1;

    private final TokenBuffer buffer;
    private final Map<Integer, Integer> locationToToken;

    public TokenLocator(TokenBuffer buffer) {
        this.buffer = buffer;
        this.locationToToken = new HashMap<>(buffer.size() * 2);
        for (int i = 0; i < buffer.size(); i++) {
            locationToToken.put(buffer.get(i).location().offset(), i);
        }
    }

    public TokenBuffer buffer() {
        return buffer;
    }

    /**
     * Find the token starting at {@code location}.
     *
     * @return the token index, or {@link #NO_TOKEN} if the location is invalid
     * @throws IllegalStateException if the location is valid but no token starts there
     */
    public int findToken(SourceLocation location) {
        if (location == null || location.isInvalid()) {
            return NO_TOKEN;
        }
        Integer index = locationToToken.get(location.offset());
        if (index == null) {
            throw new IllegalStateException("no token starts at " + location);
        }
        return index;
    }

    /**
     * Token range for a semantic source range (both ends inclusive).
     */
    public TokenRange getRange(SourceRange range) {
        if (!range.isValid()) {
            throw new IllegalStateException("cannot map invalid source range " + range);
        }
        return getRange(range.begin(), range.end());
    }

    /**
     * Token range from the token starting at {@code first} up to and including
     * the token starting at {@code last}.
     */
    public TokenRange getRange(SourceLocation first, SourceLocation last) {
        if (first.isInvalid() || last.isInvalid()) {
            throw new IllegalStateException("cannot map invalid locations " + first + ", " + last);
        }
        if (!first.equals(last) && !first.isBefore(last)) {
            throw new IllegalStateException("range begins after it ends: " + first + " > " + last);
        }
        return new TokenRange(findToken(first), findToken(last) + 1);
    }
}
