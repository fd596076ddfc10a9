package com.tinyc.compiler.ast.expr;

import com.tinyc.compiler.ast.ExpressionVisitor;
import com.tinyc.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 逻辑（非短路）
        AND("&&"),
        OR("||"),

        // 赋值
        ASSIGN("=");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isComparison() {
            switch (this) {
                case EQ:
                case NE:
                case LT:
                case GT:
                case LE:
                case GE:
                    return true;
                default:
                    return false;
            }
        }

        /** 按源码符号查找，未知时返回 null */
        public static BinaryOp fromSource(String symbol) {
            for (BinaryOp op : values()) {
                if (op.source.equals(symbol)) return op;
            }
            return null;
        }
    }
}
