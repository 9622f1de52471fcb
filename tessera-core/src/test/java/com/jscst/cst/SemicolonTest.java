package com.jscst.cst;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SemicolonTest {

    @Test
    void implicitHasNoWidth() {
        assertEquals(0, Semicolon.IMPLICIT.offset());
        assertEquals(Optional.empty(), Semicolon.IMPLICIT.span());
    }

    @Test
    void explicitSpanExcludesTrivia() {
        // "a ; " with the semicolon at offset 2
        Semicolon semi = new Semicolon.Explicit(new LiteralWhitespace(new Span(1, 2), new Span(3, 4)));
        assertEquals(1, semi.offset());
        assertEquals(Optional.of(new Span(2, 3)), semi.span());
    }

    @Test
    void implicitInstancesAreEqual() {
        assertEquals(Semicolon.IMPLICIT, new Semicolon.Implicit());
    }

    @Test
    void spanRejectsNegativeOrReversedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new Span(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 4));
        assertEquals(0, Span.empty(7).length());
    }

    @Test
    void spanUnionAndContainment() {
        Span a = new Span(2, 5);
        Span b = new Span(8, 9);
        assertEquals(new Span(2, 9), a.union(b));
        assertTrue(a.union(b).contains(b));
        assertFalse(a.contains(b));
        assertTrue(a.contains(Span.empty(5)));
        assertEquals("llo", new Span(2, 5).slice("hello"));
    }

    @Test
    void whitespaceSplitsAroundToken() {
        LiteralWhitespace ws = new LiteralWhitespace(new Span(0, 3), new Span(6, 7));
        assertEquals(new Span(3, 6), ws.tokenSpan());
        assertEquals(new Span(0, 7), ws.fullSpan());
        assertThrows(IllegalArgumentException.class,
            () -> new LiteralWhitespace(new Span(0, 5), new Span(4, 6)));
    }

    @Test
    void placeholderWhitespaceIsEmpty() {
        LiteralWhitespace missing = LiteralWhitespace.empty(4);
        assertEquals(Span.empty(4), missing.tokenSpan());
        assertEquals(Span.empty(4), missing.fullSpan());
    }
}
