package com.jscst.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record ArrayExpr(
    Span span,
    LiteralWhitespace openBracketWhitespace,
    List<Expr> elements,  // null entries are holes: [a, , b]
    List<LiteralWhitespace> commaWhitespaces,
    LiteralWhitespace closeBracketWhitespace
) implements Expr {
    public ArrayExpr {
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
        commaWhitespaces = List.copyOf(commaWhitespaces);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARRAY;
    }
}
