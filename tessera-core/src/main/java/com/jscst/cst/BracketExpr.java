package com.jscst.cst;

public record BracketExpr(
    Span span,
    Expr object,
    LiteralWhitespace openBracketWhitespace,
    Expr property,
    LiteralWhitespace closeBracketWhitespace
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.BRACKET;
    }
}
