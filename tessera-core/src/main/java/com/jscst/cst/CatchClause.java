package com.jscst.cst;

public record CatchClause(
    Span span,
    LiteralWhitespace catchWhitespace,
    LiteralWhitespace openParenWhitespace,   // null for `catch {}`
    LiteralExpr param,                       // null for `catch {}`
    LiteralWhitespace closeParenWhitespace,  // null for `catch {}`
    BlockStmt body
) implements Node {
}
