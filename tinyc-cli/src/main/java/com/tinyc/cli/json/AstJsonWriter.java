package com.tinyc.cli.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.tinyc.compiler.ast.ExpressionVisitor;
import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.decl.Parameter;
import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.compiler.ast.expr.*;
import com.tinyc.compiler.ast.stmt.*;

import java.util.List;

/**
 * 把 AST（通常是标注后的）写回 JSON，格式与 {@link AstJsonReader} 对称。
 */
public class AstJsonWriter implements StatementVisitor<JsonObject, Void>, ExpressionVisitor<JsonObject, Void> {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public String write(Program program) {
        return gson.toJson(toJson(program));
    }

    public JsonObject toJson(Program program) {
        JsonObject obj = node("Program");
        obj.add("statements", statements(program.getStatements()));
        return obj;
    }

    private static JsonObject node(String type) {
        JsonObject obj = new JsonObject();
        obj.addProperty("type", type);
        return obj;
    }

    private JsonArray statements(List<Statement> stmts) {
        JsonArray array = new JsonArray();
        for (Statement stmt : stmts) {
            array.add(stmt.accept(this, null));
        }
        return array;
    }

    private void putStatement(JsonObject obj, String field, Statement stmt) {
        if (stmt != null) obj.add(field, stmt.accept(this, null));
    }

    private void putExpression(JsonObject obj, String field, Expression expr) {
        if (expr != null) obj.add(field, expr.accept(this, null));
    }

    // ============ 语句 ============

    @Override
    public JsonObject visitFunctionDecl(FunctionDecl node, Void ctx) {
        JsonObject obj = node("FunctionDeclaration");
        obj.addProperty("name", node.getName());
        obj.addProperty("returnType", node.getReturnType());
        JsonArray params = new JsonArray();
        for (Parameter p : node.getParams()) {
            JsonObject param = new JsonObject();
            param.addProperty("name", p.getName());
            param.addProperty("type", p.getDataType());
            params.add(param);
        }
        obj.add("parameters", params);
        putStatement(obj, "body", node.getBody());
        return obj;
    }

    @Override
    public JsonObject visitBlock(Block node, Void ctx) {
        JsonObject obj = node("BlockStatement");
        obj.add("statements", statements(node.getStatements()));
        return obj;
    }

    @Override
    public JsonObject visitIfStmt(IfStmt node, Void ctx) {
        JsonObject obj = node("IfStatement");
        putExpression(obj, "condition", node.getCondition());
        putStatement(obj, "thenBranch", node.getThenBranch());
        putStatement(obj, "elseBranch", node.getElseBranch());
        return obj;
    }

    @Override
    public JsonObject visitWhileStmt(WhileStmt node, Void ctx) {
        JsonObject obj = node("WhileStatement");
        putExpression(obj, "condition", node.getCondition());
        putStatement(obj, "body", node.getBody());
        return obj;
    }

    @Override
    public JsonObject visitForStmt(ForStmt node, Void ctx) {
        JsonObject obj = node("ForStatement");
        putStatement(obj, "init", node.getInit());
        putExpression(obj, "condition", node.getCondition());
        putStatement(obj, "update", node.getUpdate());
        putStatement(obj, "body", node.getBody());
        return obj;
    }

    @Override
    public JsonObject visitReturnStmt(ReturnStmt node, Void ctx) {
        JsonObject obj = node("ReturnStatement");
        putExpression(obj, "value", node.getValue());
        return obj;
    }

    @Override
    public JsonObject visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        JsonObject obj = node("VariableDeclaration");
        obj.addProperty("name", node.getName());
        obj.addProperty("dataType", node.getDataType());
        putExpression(obj, "initializer", node.getInitializer());
        return obj;
    }

    @Override
    public JsonObject visitAssignStmt(AssignStmt node, Void ctx) {
        JsonObject obj = node("AssignmentStatement");
        JsonObject target = node("Identifier");
        target.addProperty("name", node.getTarget());
        obj.add("target", target);
        putExpression(obj, "value", node.getValue());
        return obj;
    }

    @Override
    public JsonObject visitExpressionStmt(ExpressionStmt node, Void ctx) {
        JsonObject obj = node("ExpressionStatement");
        putExpression(obj, "expression", node.getExpression());
        return obj;
    }

    @Override
    public JsonObject visitBreakStmt(BreakStmt node, Void ctx) {
        return node("BreakStatement");
    }

    @Override
    public JsonObject visitContinueStmt(ContinueStmt node, Void ctx) {
        return node("ContinueStatement");
    }

    @Override
    public JsonObject visitEmptyStmt(EmptyStmt node, Void ctx) {
        return node("EmptyStatement");
    }

    @Override
    public JsonObject visitStartCheckpoint(StartCheckpoint node, Void ctx) {
        return checkpoint(node("StartCheckPoint"), node);
    }

    @Override
    public JsonObject visitEndCheckpoint(EndCheckpoint node, Void ctx) {
        return checkpoint(node("EndCheckPoint"), node);
    }

    private static JsonObject checkpoint(JsonObject obj, ScopeCheckpoint node) {
        obj.addProperty("scopeId", node.getScopeId());
        obj.addProperty("depth", node.getDepth());
        JsonArray names = new JsonArray();
        for (String name : node.getVariableNames()) {
            names.add(name);
        }
        obj.add("variableNames", names);
        return obj;
    }

    // ============ 表达式 ============

    @Override
    public JsonObject visitNumberLiteral(NumberLiteral node, Void ctx) {
        JsonObject obj = node("NumberLiteral");
        obj.addProperty("value", node.getValue());
        return obj;
    }

    @Override
    public JsonObject visitIdentifier(Identifier node, Void ctx) {
        JsonObject obj = node("Identifier");
        obj.addProperty("name", node.getName());
        return obj;
    }

    @Override
    public JsonObject visitBinaryExpr(BinaryExpr node, Void ctx) {
        JsonObject obj = node("BinaryExpression");
        obj.addProperty("operator", node.getOperator().toSourceString());
        putExpression(obj, "left", node.getLeft());
        putExpression(obj, "right", node.getRight());
        return obj;
    }

    @Override
    public JsonObject visitUnaryExpr(UnaryExpr node, Void ctx) {
        JsonObject obj = node("UnaryExpression");
        obj.addProperty("operator", node.getOperator().toSourceString());
        putExpression(obj, "operand", node.getOperand());
        return obj;
    }

    @Override
    public JsonObject visitCallExpr(CallExpr node, Void ctx) {
        JsonObject obj = node("FunctionCall");
        JsonObject callee = node("Identifier");
        callee.addProperty("name", node.getCallee());
        obj.add("callee", callee);
        JsonArray args = new JsonArray();
        for (Expression arg : node.getArguments()) {
            args.add(arg.accept(this, null));
        }
        obj.add("arguments", args);
        return obj;
    }
}
