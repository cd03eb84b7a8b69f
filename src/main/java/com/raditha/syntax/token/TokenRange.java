package com.raditha.syntax.token;

/**
 * Half-open range {@code [begin, end)} of indices into a {@link TokenBuffer}.
 *
 * @param begin index of the first token
 * @param end   index one past the last token
 */
public record TokenRange(int begin, int end) {

    public TokenRange {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("invalid token range [" + begin + ", " + end + ")");
        }
    }

    public static TokenRange single(int index) {
        return new TokenRange(index, index + 1);
    }

    public boolean isEmpty() {
        return begin == end;
    }

    public int size() {
        return end - begin;
    }

    /**
     * Index of the last token in the range.
     */
    public int last() {
        if (isEmpty()) {
            throw new IllegalStateException("empty range has no last token");
        }
        return end - 1;
    }

    public boolean contains(int index) {
        return index >= begin && index < end;
    }

    public boolean contains(TokenRange other) {
        return other.begin >= begin && other.end <= end;
    }

    public TokenRange dropBack() {
        return new TokenRange(begin, Math.max(begin, end - 1));
    }

    public TokenRange withBegin(int newBegin) {
        return new TokenRange(newBegin, end);
    }

    public TokenRange withEnd(int newEnd) {
        return new TokenRange(begin, newEnd);
    }

    @Override
    public String toString() {
        return "[" + begin + ", " + end + ")";
    }
}
