package com.jscst.cst;

import java.util.List;

public record SequenceExpr(
    Span span,
    List<Expr> exprs,
    List<LiteralWhitespace> commaWhitespaces
) implements Expr {
    public SequenceExpr {
        exprs = List.copyOf(exprs);
        commaWhitespaces = List.copyOf(commaWhitespaces);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SEQUENCE;
    }
}
