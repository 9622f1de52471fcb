package com.jscst.cst;

import java.util.Optional;

/**
 * How a semicolon-terminated statement ended: by automatic semicolon insertion
 * or by a {@code ;} that is present in the source.
 */
public sealed interface Semicolon permits Semicolon.Implicit, Semicolon.Explicit {

    Implicit IMPLICIT = new Implicit();

    /**
     * The span of the {@code ;} glyph, excluding its trivia; empty for an implicit semicolon.
     */
    Optional<Span> span();

    /**
     * Width the terminator contributes to the source: 0 when implicit, 1 when explicit.
     */
    int offset();

    record Implicit() implements Semicolon {
        @Override
        public Optional<Span> span() {
            return Optional.empty();
        }

        @Override
        public int offset() {
            return 0;
        }
    }

    record Explicit(LiteralWhitespace whitespace) implements Semicolon {
        @Override
        public Optional<Span> span() {
            return Optional.of(new Span(whitespace.before().end(), whitespace.after().start()));
        }

        @Override
        public int offset() {
            return 1;
        }
    }
}
