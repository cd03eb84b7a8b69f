package com.raditha.syntax.token;

/**
 * Range of source covered by a semantic construct.
 * Both ends name the start of a token: {@code begin} is the first token and
 * {@code end} is the last token of the construct (inclusive).
 *
 * @param begin location of the first token
 * @param end   location of the last token
 */
public record SourceRange(SourceLocation begin, SourceLocation end) {

    public static final SourceRange INVALID = new SourceRange(SourceLocation.INVALID, SourceLocation.INVALID);

    public SourceRange {
        begin = SourceLocation.orInvalid(begin);
        end = SourceLocation.orInvalid(end);
    }

    /**
     * Range consisting of a single token.
     */
    public static SourceRange at(SourceLocation location) {
        return new SourceRange(location, location);
    }

    public static SourceRange of(int begin, int end) {
        return new SourceRange(SourceLocation.of(begin), SourceLocation.of(end));
    }

    public boolean isValid() {
        return begin.isValid() && end.isValid();
    }

    public SourceRange withBegin(SourceLocation newBegin) {
        return new SourceRange(newBegin, end);
    }

    public SourceRange withEnd(SourceLocation newEnd) {
        return new SourceRange(begin, newEnd);
    }

    @Override
    public String toString() {
        return "<" + begin + ", " + end + ">";
    }
}
