package com.jscst.cst;

public enum AssignOp {
    ASSIGN("="),
    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    DIV_ASSIGN("/="),
    MOD_ASSIGN("%="),
    EXP_ASSIGN("**="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    USHR_ASSIGN(">>>="),
    BIT_AND_ASSIGN("&="),
    BIT_OR_ASSIGN("|="),
    BIT_XOR_ASSIGN("^="),
    AND_ASSIGN("&&="),
    OR_ASSIGN("||="),
    NULLISH_ASSIGN("??=");

    private final String text;

    AssignOp(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
