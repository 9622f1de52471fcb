package com.jscst.cst;

public enum LiteralKind {
    IDENTIFIER,
    THIS,
    NULL,
    TRUE,
    FALSE,
    NUMBER,
    STRING,
    REGEX,
    TEMPLATE,
    DEBUGGER
}
