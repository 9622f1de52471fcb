package com.jscst.cst;

public record MemberExpr(
    Span span,
    Expr object,
    LiteralWhitespace dotWhitespace,
    LiteralExpr property
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.MEMBER;
    }
}
