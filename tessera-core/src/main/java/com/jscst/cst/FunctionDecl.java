package com.jscst.cst;

public record FunctionDecl(
    Span span,
    LiteralWhitespace functionWhitespace,
    LiteralExpr name,
    Parameters params,
    BlockStmt body
) implements Declaration {
}
