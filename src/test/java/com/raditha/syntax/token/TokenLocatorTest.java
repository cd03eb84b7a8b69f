package com.raditha.syntax.token;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenLocatorTest {

    private TokenLocator locator;

    @BeforeEach
    void setUp() {
        // int a = 10 ;
        // 0   4 6 8  11
        TokenBuffer buffer = TokenBuffer.withEof(List.of(
                Token.spelled("int", 0),
                Token.spelled("a", 4),
                Token.spelled("=", 6),
                Token.spelled("10", 8),
                Token.spelled(";", 11)));
        locator = new TokenLocator(buffer);
    }

    @Test
    void testFindToken() {
        assertEquals(0, locator.findToken(SourceLocation.of(0)));
        assertEquals(3, locator.findToken(SourceLocation.of(8)));
        assertEquals(5, locator.findToken(SourceLocation.of(12)), "end marker is found too");
    }

    @Test
    void testInvalidLocationHasNoToken() {
        assertEquals(TokenLocator.NO_TOKEN, locator.findToken(SourceLocation.INVALID));
        assertEquals(TokenLocator.NO_TOKEN, locator.findToken(null));
    }

    @Test
    void testLocationInsideTokenFails() {
        assertThrows(IllegalStateException.class, () -> locator.findToken(SourceLocation.of(9)));
    }

    @Test
    void testRangeIncludesLastToken() {
        assertEquals(new TokenRange(1, 4), locator.getRange(SourceRange.of(4, 8)));
        assertEquals(TokenRange.single(2), locator.getRange(SourceRange.of(6, 6)));
    }

    @Test
    void testReversedRangeFails() {
        assertThrows(IllegalStateException.class, () -> locator.getRange(SourceRange.of(8, 4)));
    }

    @Test
    void testInvalidRangeFails() {
        assertThrows(IllegalStateException.class, () -> locator.getRange(SourceRange.INVALID));
        assertThrows(IllegalStateException.class,
                () -> locator.getRange(SourceLocation.of(0), SourceLocation.INVALID));
    }

    @Test
    void testTokenRangeHelpers() {
        TokenRange range = new TokenRange(2, 5);

        assertEquals(3, range.size());
        assertEquals(4, range.last());
        assertEquals(new TokenRange(2, 4), range.dropBack());
        assertTrue(range.contains(new TokenRange(3, 5)));
        assertFalse(range.contains(5));
        assertTrue(new TokenRange(2, 2).isEmpty());
        assertThrows(IllegalStateException.class, () -> new TokenRange(2, 2).last());
        assertThrows(IllegalArgumentException.class, () -> new TokenRange(3, 2));
    }

    @Test
    void testSourceLocationOrdering() {
        assertTrue(SourceLocation.of(1).isBefore(SourceLocation.of(2)));
        assertFalse(SourceLocation.of(2).isBefore(SourceLocation.of(2)));
        assertThrows(IllegalStateException.class, () -> SourceLocation.INVALID.isBefore(SourceLocation.of(0)));
        assertSame(SourceLocation.INVALID, SourceLocation.of(-5));
    }
}
