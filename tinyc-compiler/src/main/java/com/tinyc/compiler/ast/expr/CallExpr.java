package com.tinyc.compiler.ast.expr;

import com.tinyc.compiler.ast.ExpressionVisitor;
import com.tinyc.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用：callee(arg1, arg2, ...)
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, String callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = arguments != null ? arguments : Collections.<Expression>emptyList();
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
