package com.jscst.cst;

/**
 * Trivia (whitespace and comments) captured around one significant token.
 *
 * <p>{@code before.end} is where the token starts and {@code after.start} is where it
 * ends, so emitting {@code before + token + after} for every token of a tree in order
 * reproduces the source.</p>
 */
public record LiteralWhitespace(Span before, Span after) {
    public LiteralWhitespace {
        if (before.end() > after.start()) {
            throw new IllegalArgumentException("Trivia overlaps its token: " + before + " / " + after);
        }
    }

    /**
     * Zero-width trivia at {@code offset}, used in place of a token that was missing.
     */
    public static LiteralWhitespace empty(int offset) {
        Span at = Span.empty(offset);
        return new LiteralWhitespace(at, at);
    }

    /**
     * The span of the token itself, excluding its trivia.
     */
    public Span tokenSpan() {
        return new Span(before.end(), after.start());
    }

    /**
     * The token together with its leading and trailing trivia.
     */
    public Span fullSpan() {
        return new Span(before.start(), after.end());
    }
}
