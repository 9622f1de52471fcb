package com.jscst.cst;

public record ConditionalExpr(
    Span span,
    Expr test,
    LiteralWhitespace questionWhitespace,
    Expr cons,
    LiteralWhitespace colonWhitespace,
    Expr alt
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.CONDITIONAL;
    }
}
