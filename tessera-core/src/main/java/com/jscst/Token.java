package com.jscst;

import com.jscst.cst.LiteralWhitespace;
import com.jscst.cst.Span;

/**
 * A lexed token with the trivia on either side of it.
 *
 * <p>Leading trivia runs from the end of the previous token's trailing trivia up to this
 * token and may contain line terminators. Trailing trivia stops before the next line
 * terminator.</p>
 */
public record Token(
    TokenType type,
    String lexeme,
    Span span,
    Span leading,
    Span trailing,
    boolean lineBreakBefore
) {
    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }

    public LiteralWhitespace whitespace() {
        return new LiteralWhitespace(leading, trailing);
    }

    String describe() {
        return switch (type) {
            case IDENTIFIER, NUMBER, STRING, INVALID -> "'" + lexeme + "'";
            default -> type.describe();
        };
    }
}
