package com.raditha.syntax.semantic;

import com.raditha.syntax.token.SourceLocation;
import com.raditha.syntax.token.SourceRange;
import org.jspecify.annotations.Nullable;

/**
 * One segment of a scope qualifier such as {@code std::vector<int>::}, linked
 * to the segments on its left through {@code prefix}. The outermost object
 * stands for the whole qualifier.
 *
 * @param kind       what the segment names
 * @param localRange tokens of this segment, including its trailing {@code ::}
 * @param prefix     the qualifier to the left, or null for the first segment
 * @param typeLoc    the written type for type segments
 */
public record NestedNameSpecifierLoc(
        NameSpecifierKind kind,
        SourceRange localRange,
        @Nullable NestedNameSpecifierLoc prefix,
        @Nullable TypeLoc typeLoc) {

    public enum NameSpecifierKind {
        GLOBAL,
        NAMESPACE,
        NAMESPACE_ALIAS,
        IDENTIFIER,
        TYPE_SPEC,
        TYPE_SPEC_WITH_TEMPLATE,
        /** Microsoft {@code __super} */
        SUPER
    }

    public NestedNameSpecifierLoc {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (localRange == null || !localRange.isValid()) {
            throw new IllegalArgumentException("name specifier needs a valid local range");
        }
    }

    /**
     * First token of the whole qualifier.
     */
    public SourceLocation beginLoc() {
        NestedNameSpecifierLoc first = this;
        while (first.prefix != null) {
            first = first.prefix;
        }
        return first.localRange.begin();
    }

    /**
     * The trailing {@code ::} of this segment.
     */
    public SourceLocation endLoc() {
        return localRange.end();
    }

    public SourceRange sourceRange() {
        return new SourceRange(beginLoc(), endLoc());
    }
}
