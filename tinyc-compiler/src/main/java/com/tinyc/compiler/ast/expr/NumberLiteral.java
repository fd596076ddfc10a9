package com.tinyc.compiler.ast.expr;

import com.tinyc.compiler.ast.ExpressionVisitor;
import com.tinyc.compiler.ast.SourceLocation;

/**
 * 整数字面量
 */
public class NumberLiteral extends Expression {
    private final int value;

    public NumberLiteral(SourceLocation location, int value) {
        super(location);
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitNumberLiteral(this, context);
    }
}
