package com.tinyc.ir.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * 汇编文本缓冲：标签顶格，指令缩进两格。
 */
public class AsmWriter {

    private static final String INDENT = "  ";

    private final List<String> lines = new ArrayList<>();

    public void label(String name) {
        lines.add(name + ":");
    }

    public void emit(String opcode) {
        lines.add(INDENT + opcode);
    }

    public void emit(String opcode, Object operand) {
        lines.add(INDENT + opcode + " " + operand);
    }

    public void emit(String opcode, Object dst, Object src) {
        lines.add(INDENT + opcode + " " + dst + ", " + src);
    }

    public void comment(String text) {
        lines.add(INDENT + "; " + text);
    }

    public void blank() {
        lines.add("");
    }

    @Override
    public String toString() {
        return String.join("\n", lines);
    }
}
