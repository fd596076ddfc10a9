package com.tinyc.compiler.ast;

import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.stmt.*;

/**
 * 语句访问者。
 *
 * <p>所有方法均为抽象方法：新增语句种类时，每个实现都必须显式处理。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface StatementVisitor<R, C> {

    R visitFunctionDecl(FunctionDecl node, C context);

    R visitBlock(Block node, C context);

    R visitIfStmt(IfStmt node, C context);

    R visitWhileStmt(WhileStmt node, C context);

    R visitForStmt(ForStmt node, C context);

    R visitReturnStmt(ReturnStmt node, C context);

    R visitVarDeclStmt(VarDeclStmt node, C context);

    R visitAssignStmt(AssignStmt node, C context);

    R visitExpressionStmt(ExpressionStmt node, C context);

    R visitBreakStmt(BreakStmt node, C context);

    R visitContinueStmt(ContinueStmt node, C context);

    R visitEmptyStmt(EmptyStmt node, C context);

    // ============ 作用域检查点 ============

    R visitStartCheckpoint(StartCheckpoint node, C context);

    R visitEndCheckpoint(EndCheckpoint node, C context);
}
