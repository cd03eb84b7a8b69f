package com.raditha.syntax.token;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Position of the first character of a token in the translation unit.
 * Locations of a single buffer are totally ordered by their offset.
 *
 * @param offset character offset, or -1 for an invalid location
 */
public record SourceLocation(int offset) implements Comparable<SourceLocation> {

    /** Location that does not point anywhere (absent keyword, implicit node). */
    public static final SourceLocation INVALID = new SourceLocation(-1);

    public SourceLocation {
        if (offset < -1) {
            throw new IllegalArgumentException("offset must be >= -1, got: " + offset);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SourceLocation of(int offset) {
        return offset < 0 ? INVALID : new SourceLocation(offset);
    }

    /**
     * Null-tolerant helper used by records whose optional locations may be
     * omitted.
     */
    public static SourceLocation orInvalid(SourceLocation location) {
        return location == null ? INVALID : location;
    }

    @Override
    @JsonValue
    public int offset() {
        return offset;
    }

    public boolean isValid() {
        return offset >= 0;
    }

    public boolean isInvalid() {
        return offset < 0;
    }

    /**
     * Check whether this location comes strictly before {@code other} in the
     * translation unit. Both locations must be valid.
     */
    public boolean isBefore(SourceLocation other) {
        if (isInvalid() || other.isInvalid()) {
            throw new IllegalStateException("cannot order invalid locations: " + this + ", " + other);
        }
        return offset < other.offset;
    }

    @Override
    public int compareTo(SourceLocation other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return isValid() ? "@" + offset : "@invalid";
    }
}
