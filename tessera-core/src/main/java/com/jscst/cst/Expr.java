package com.jscst.cst;

/**
 * Expression nodes. Every token an expression spans is kept as {@link LiteralWhitespace}
 * on the node that owns it.
 */
public sealed interface Expr extends Node, ForStmtInit permits
    LiteralExpr,
    ArrayExpr,
    ObjectExpr,
    GroupingExpr,
    MemberExpr,
    BracketExpr,
    CallExpr,
    NewExpr,
    UpdateExpr,
    UnaryExpr,
    BinaryExpr,
    ConditionalExpr,
    AssignExpr,
    SequenceExpr,
    FunctionExpr,
    InvalidExpr {

    ExprKind kind();
}
