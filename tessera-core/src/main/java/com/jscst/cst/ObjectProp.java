package com.jscst.cst;

/**
 * {@code key: value}, or the shorthand {@code key} where colon and value are null.
 */
public record ObjectProp(
    Span span,
    Expr key,
    LiteralWhitespace colonWhitespace,  // Can be null
    Expr value                          // Can be null
) implements Node {
}
