package com.jscst.cst;

public enum VarKind {
    VAR("var"),
    LET("let"),
    CONST("const");

    private final String keyword;

    VarKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
