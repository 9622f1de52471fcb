package com.jscst.cst;

import java.util.List;

public record Arguments(
    Span span,
    LiteralWhitespace openParenWhitespace,
    List<Expr> args,
    List<LiteralWhitespace> commaWhitespaces,
    LiteralWhitespace closeParenWhitespace
) implements Node {
    public Arguments {
        args = List.copyOf(args);
        commaWhitespaces = List.copyOf(commaWhitespaces);
    }
}
