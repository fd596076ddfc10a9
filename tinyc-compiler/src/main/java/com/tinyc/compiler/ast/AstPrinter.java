package com.tinyc.compiler.ast;

import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.expr.*;
import com.tinyc.compiler.ast.stmt.*;

import java.util.List;

/**
 * 单行渲染语句和表达式，用于 CFG 转储、汇编注释与日志。
 *
 * <p>复合语句（if/while/for/块）只渲染头部，不展开子语句。</p>
 */
public final class AstPrinter implements StatementVisitor<String, Void>, ExpressionVisitor<String, Void> {

    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {
    }

    public static String print(Statement stmt) {
        return stmt == null ? "<null>" : stmt.accept(INSTANCE, null);
    }

    public static String print(Expression expr) {
        return expr == null ? "<null>" : expr.accept(INSTANCE, null);
    }

    // ============ 语句 ============

    @Override
    public String visitFunctionDecl(FunctionDecl node, Void ctx) {
        return "fn " + node.getName() + "(" + String.join(", ", node.getParamNames()) + ")";
    }

    @Override
    public String visitBlock(Block node, Void ctx) {
        return "{ " + node.getStatements().size() + " stmts }";
    }

    @Override
    public String visitIfStmt(IfStmt node, Void ctx) {
        return "if (" + print(node.getCondition()) + ")" + (node.hasElse() ? " else" : "");
    }

    @Override
    public String visitWhileStmt(WhileStmt node, Void ctx) {
        return "while (" + print(node.getCondition()) + ")";
    }

    @Override
    public String visitForStmt(ForStmt node, Void ctx) {
        return "for (" + (node.getInit() != null ? print(node.getInit()) : "")
                + "; " + (node.getCondition() != null ? print(node.getCondition()) : "")
                + "; " + (node.getUpdate() != null ? print(node.getUpdate()) : "") + ")";
    }

    @Override
    public String visitReturnStmt(ReturnStmt node, Void ctx) {
        return node.hasValue() ? "return " + print(node.getValue()) : "return";
    }

    @Override
    public String visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        String type = node.getDataType() != null ? node.getDataType() : "int";
        return node.hasInitializer()
                ? type + " " + node.getName() + " = " + print(node.getInitializer())
                : type + " " + node.getName();
    }

    @Override
    public String visitAssignStmt(AssignStmt node, Void ctx) {
        return node.getTarget() + " = " + print(node.getValue());
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return print(node.getExpression());
    }

    @Override
    public String visitBreakStmt(BreakStmt node, Void ctx) {
        return "break";
    }

    @Override
    public String visitContinueStmt(ContinueStmt node, Void ctx) {
        return "continue";
    }

    @Override
    public String visitEmptyStmt(EmptyStmt node, Void ctx) {
        return ";";
    }

    @Override
    public String visitStartCheckpoint(StartCheckpoint node, Void ctx) {
        return "START " + node.getScopeId() + " depth=" + node.getDepth() + " " + names(node.getVariableNames());
    }

    @Override
    public String visitEndCheckpoint(EndCheckpoint node, Void ctx) {
        return "END " + node.getScopeId() + " depth=" + node.getDepth() + " " + names(node.getVariableNames());
    }

    private static String names(List<String> names) {
        return "[" + String.join(", ", names) + "]";
    }

    // ============ 表达式 ============

    @Override
    public String visitNumberLiteral(NumberLiteral node, Void ctx) {
        return String.valueOf(node.getValue());
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return node.getName();
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return operand(node.getLeft()) + " " + node.getOperator().toSourceString() + " " + operand(node.getRight());
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        return node.getOperator().toSourceString() + operand(node.getOperand());
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        StringBuilder sb = new StringBuilder(node.getCallee()).append('(');
        List<Expression> args = node.getArguments();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(print(args.get(i)));
        }
        return sb.append(')').toString();
    }

    private String operand(Expression expr) {
        String text = print(expr);
        return expr instanceof BinaryExpr ? "(" + text + ")" : text;
    }
}
