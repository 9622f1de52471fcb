package com.jscst.cst;

import java.util.List;

public record Parameters(
    Span span,
    LiteralWhitespace openParenWhitespace,
    List<LiteralExpr> params,
    List<LiteralWhitespace> commaWhitespaces,
    LiteralWhitespace closeParenWhitespace
) implements Node {
    public Parameters {
        params = List.copyOf(params);
        commaWhitespaces = List.copyOf(commaWhitespaces);
    }
}
