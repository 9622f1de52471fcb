package com.jscst.cst;

/**
 * Placeholder for an expression that could not be parsed. Its span covers the offending
 * token when one was consumed, otherwise it is empty.
 */
public record InvalidExpr(
    Span span,
    LiteralWhitespace whitespace  // Can be null when nothing was consumed
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.INVALID;
    }
}
