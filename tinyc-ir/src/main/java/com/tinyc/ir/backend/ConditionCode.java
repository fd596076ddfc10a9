package com.tinyc.ir.backend;

import com.tinyc.compiler.ast.expr.BinaryExpr.BinaryOp;

/**
 * 比较运算符对应的条件跳转与条件置位指令。
 */
public enum ConditionCode {
    EQ("je", "sete"),
    NE("jne", "setne"),
    LT("jl", "setl"),
    LE("jle", "setle"),
    GT("jg", "setg"),
    GE("jge", "setge");

    private final String jump;
    private final String set;

    ConditionCode(String jump, String set) {
        this.jump = jump;
        this.set = set;
    }

    public String getJump() {
        return jump;
    }

    public String getSet() {
        return set;
    }

    /** 非比较运算符返回 null */
    public static ConditionCode of(BinaryOp op) {
        switch (op) {
            case EQ: return EQ;
            case NE: return NE;
            case LT: return LT;
            case LE: return LE;
            case GT: return GT;
            case GE: return GE;
            default: return null;
        }
    }
}
