package com.jscst.cst;

/**
 * Initializer of a {@code for} head or left-hand side of a {@code for-in}: an expression
 * or a variable statement (whose own semicolon is always implicit).
 */
public sealed interface ForStmtInit extends Node permits Expr, VarStmt {
}
