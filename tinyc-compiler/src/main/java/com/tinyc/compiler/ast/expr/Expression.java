package com.tinyc.compiler.ast.expr;

import com.tinyc.compiler.ast.AstNode;
import com.tinyc.compiler.ast.ExpressionVisitor;
import com.tinyc.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
