package com.jscst.cst;

import java.util.List;

public record ObjectExpr(
    Span span,
    LiteralWhitespace openBraceWhitespace,
    List<ObjectProp> props,
    List<LiteralWhitespace> commaWhitespaces,
    LiteralWhitespace closeBraceWhitespace
) implements Expr {
    public ObjectExpr {
        props = List.copyOf(props);
        commaWhitespaces = List.copyOf(commaWhitespaces);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.OBJECT;
    }
}
