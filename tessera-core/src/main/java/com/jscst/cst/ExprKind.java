package com.jscst.cst;

public enum ExprKind {
    LITERAL,
    ARRAY,
    OBJECT,
    GROUPING,
    MEMBER,
    BRACKET,
    CALL,
    NEW,
    UPDATE,
    UNARY,
    BINARY,
    CONDITIONAL,
    ASSIGN,
    SEQUENCE,
    FUNCTION,
    INVALID
}
