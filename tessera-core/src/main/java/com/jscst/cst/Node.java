package com.jscst.cst;

/**
 * Base interface for all concrete syntax tree nodes
 */
public sealed interface Node permits
    Script,
    StmtListItem,
    Expr,
    ForStmtInit,
    Declarator,
    Case,
    CatchClause,
    Parameters,
    Arguments,
    ObjectProp {

    Span span();
}
