package com.tinyc.compiler.ast;

import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.decl.Parameter;
import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.compiler.ast.expr.*;
import com.tinyc.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tinyc.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.tinyc.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 无源码位置的 AST 构造快捷方法。
 *
 * <p>供合成节点（如 CFG 条件块中的表达式语句）与测试使用。</p>
 */
public final class AstFactory {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private AstFactory() {
    }

    // ============ 声明 ============

    public static Program program(Statement... statements) {
        return new Program(LOC, new ArrayList<>(Arrays.asList(statements)));
    }

    public static FunctionDecl function(String name, List<String> paramNames, Statement... body) {
        List<Parameter> params = new ArrayList<>();
        for (String p : paramNames) {
            params.add(new Parameter(LOC, p, "int"));
        }
        return new FunctionDecl(LOC, name, "int", params, block(body));
    }

    public static FunctionDecl function(String name, Statement... body) {
        return function(name, new ArrayList<String>(), body);
    }

    // ============ 语句 ============

    public static Block block(Statement... statements) {
        return new Block(LOC, new ArrayList<>(Arrays.asList(statements)));
    }

    public static IfStmt ifStmt(Expression condition, Statement thenBranch) {
        return new IfStmt(LOC, condition, thenBranch, null);
    }

    public static IfStmt ifStmt(Expression condition, Statement thenBranch, Statement elseBranch) {
        return new IfStmt(LOC, condition, thenBranch, elseBranch);
    }

    public static WhileStmt whileStmt(Expression condition, Statement body) {
        return new WhileStmt(LOC, condition, body);
    }

    public static ForStmt forStmt(Statement init, Expression condition, Statement update, Statement body) {
        return new ForStmt(LOC, init, condition, update, body);
    }

    public static ReturnStmt ret(Expression value) {
        return new ReturnStmt(LOC, value);
    }

    public static ReturnStmt ret() {
        return new ReturnStmt(LOC, null);
    }

    public static VarDeclStmt varDecl(String name, Expression initializer) {
        return new VarDeclStmt(LOC, name, "int", initializer);
    }

    public static VarDeclStmt varDecl(String name) {
        return new VarDeclStmt(LOC, name, "int", null);
    }

    public static AssignStmt assign(String target, Expression value) {
        return new AssignStmt(LOC, target, value);
    }

    public static ExpressionStmt exprStmt(Expression expression) {
        return new ExpressionStmt(LOC, expression);
    }

    public static BreakStmt breakStmt() {
        return new BreakStmt(LOC);
    }

    public static ContinueStmt continueStmt() {
        return new ContinueStmt(LOC);
    }

    public static EmptyStmt empty() {
        return new EmptyStmt(LOC);
    }

    // ============ 表达式 ============

    public static NumberLiteral num(int value) {
        return new NumberLiteral(LOC, value);
    }

    public static Identifier id(String name) {
        return new Identifier(LOC, name);
    }

    public static BinaryExpr binary(Expression left, BinaryOp op, Expression right) {
        return new BinaryExpr(LOC, left, op, right);
    }

    public static BinaryExpr binary(Expression left, String op, Expression right) {
        BinaryOp resolved = BinaryOp.fromSource(op);
        if (resolved == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + op);
        }
        return new BinaryExpr(LOC, left, resolved, right);
    }

    public static UnaryExpr unary(UnaryOp op, Expression operand) {
        return new UnaryExpr(LOC, op, operand);
    }

    public static CallExpr call(String callee, Expression... arguments) {
        return new CallExpr(LOC, callee, new ArrayList<>(Arrays.asList(arguments)));
    }
}
