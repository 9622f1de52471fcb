package com.jscst.cst;

public enum StmtKind {
    VARIABLE,
    EMPTY,
    BLOCK,
    EXPR,
    IF,
    SWITCH,
    THROW,
    WHILE,
    DO_WHILE,
    LABELLED,
    BREAK,
    CONTINUE,
    RETURN,
    TRY,
    FOR,
    FOR_IN,
    WITH
}
