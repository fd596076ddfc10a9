package com.tinyc.compiler.ast;

import com.tinyc.compiler.ast.expr.*;

/**
 * 表达式访问者
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface ExpressionVisitor<R, C> {

    R visitNumberLiteral(NumberLiteral node, C context);

    R visitIdentifier(Identifier node, C context);

    R visitBinaryExpr(BinaryExpr node, C context);

    R visitUnaryExpr(UnaryExpr node, C context);

    R visitCallExpr(CallExpr node, C context);
}
