package com.tinyc.cli.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.decl.Parameter;
import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.compiler.ast.expr.*;
import com.tinyc.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tinyc.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.tinyc.compiler.ast.stmt.*;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取解析器输出的 JSON AST。
 *
 * <p>每个节点是带 {@code type} 字段的对象，例如：</p>
 * <pre>
 * {"type": "Program", "statements": [
 *   {"type": "FunctionDeclaration", "name": "main", "returnType": "int", "parameters": [],
 *    "body": {"type": "BlockStatement", "statements": [
 *      {"type": "ReturnStatement", "value": {"type": "NumberLiteral", "value": 0}}]}}]}
 * </pre>
 * <p>可选的 {@code line}/{@code column} 字段用作源码位置。{@code ParenthesizedExpression} 直接展开为内部表达式，
 * {@code LetDeclaration} 按 {@code VariableDeclaration} 读取。</p>
 */
public class AstJsonReader {

    private final String fileName;

    public AstJsonReader() {
        this("<json>");
    }

    public AstJsonReader(String fileName) {
        this.fileName = fileName;
    }

    public Program read(String json) {
        return readProgram(parse(json));
    }

    public Program read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new AstFormatException("$", "invalid JSON: " + e.getMessage(), e);
        }
        return readProgram(root);
    }

    private static JsonElement parse(String json) {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new AstFormatException("$", "invalid JSON: " + e.getMessage(), e);
        }
    }

    private Program readProgram(JsonElement root) {
        JsonObject obj = asObject(root, "$");
        String type = typeOf(obj, "$");
        if (!"Program".equals(type)) {
            throw new AstFormatException("$", "expected Program but got " + type);
        }
        return new Program(location(obj, "$"), readStatements(obj, "statements", "$"));
    }

    // ============ 语句 ============

    private List<Statement> readStatements(JsonObject obj, String field, String path) {
        List<Statement> result = new ArrayList<>();
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            return result;
        }
        JsonArray array = asArray(obj.get(field), path + "." + field);
        for (int i = 0; i < array.size(); i++) {
            result.add(readStatement(array.get(i), path + "." + field + "[" + i + "]"));
        }
        return result;
    }

    private Statement optionalStatement(JsonObject obj, String field, String path) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) return null;
        return readStatement(obj.get(field), path + "." + field);
    }

    Statement readStatement(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        String type = typeOf(obj, path);
        SourceLocation loc = location(obj, path);
        switch (type) {
            case "FunctionDeclaration":
                return readFunction(obj, path);
            case "BlockStatement":
                return new Block(loc, readStatements(obj, "statements", path));
            case "IfStatement":
                return new IfStmt(loc, expression(obj, "condition", path),
                        statement(obj, "thenBranch", path),
                        optionalStatement(obj, "elseBranch", path));
            case "WhileStatement":
                return new WhileStmt(loc, expression(obj, "condition", path), statement(obj, "body", path));
            case "ForStatement":
                return new ForStmt(loc, optionalStatement(obj, "init", path),
                        optionalExpression(obj, "condition", path),
                        optionalStatement(obj, "update", path),
                        statement(obj, "body", path));
            case "ReturnStatement":
                return new ReturnStmt(loc, optionalExpression(obj, "value", path));
            case "VariableDeclaration":
            case "LetDeclaration":
                return new VarDeclStmt(loc, string(obj, "name", path), optionalString(obj, "dataType", "int"),
                        optionalExpression(obj, "initializer", path));
            case "AssignmentStatement":
                return new AssignStmt(loc, assignTarget(obj, path), expression(obj, "value", path));
            case "ExpressionStatement":
                return new ExpressionStmt(loc, expression(obj, "expression", path));
            case "BreakStatement":
                return new BreakStmt(loc);
            case "ContinueStatement":
                return new ContinueStmt(loc);
            case "EmptyStatement":
                return new EmptyStmt(loc);
            case "StartCheckPoint":
                return new StartCheckpoint(loc, string(obj, "scopeId", path), integer(obj, "depth", path),
                        strings(obj, "variableNames", path));
            case "EndCheckPoint":
                return new EndCheckpoint(loc, string(obj, "scopeId", path), integer(obj, "depth", path),
                        strings(obj, "variableNames", path));
            default:
                throw new AstFormatException(path, "unknown statement type '" + type + "'");
        }
    }

    private FunctionDecl readFunction(JsonObject obj, String path) {
        List<Parameter> params = new ArrayList<>();
        if (obj.has("parameters") && !obj.get("parameters").isJsonNull()) {
            JsonArray array = asArray(obj.get("parameters"), path + ".parameters");
            for (int i = 0; i < array.size(); i++) {
                String paramPath = path + ".parameters[" + i + "]";
                JsonObject p = asObject(array.get(i), paramPath);
                params.add(new Parameter(location(p, paramPath), string(p, "name", paramPath), optionalString(p, "type", "int")));
            }
        }
        Statement body = statement(obj, "body", path);
        if (!(body instanceof Block)) {
            throw new AstFormatException(path + ".body", "function body must be a BlockStatement");
        }
        return new FunctionDecl(location(obj, path), string(obj, "name", path), optionalString(obj, "returnType", "int"),
                params, (Block) body);
    }

    private String assignTarget(JsonObject obj, String path) {
        JsonElement target = required(obj, "target", path);
        if (target.isJsonPrimitive()) {
            return target.getAsString();
        }
        return string(asObject(target, path + ".target"), "name", path + ".target");
    }

    private Statement statement(JsonObject obj, String field, String path) {
        return readStatement(required(obj, field, path), path + "." + field);
    }

    // ============ 表达式 ============

    private Expression expression(JsonObject obj, String field, String path) {
        return readExpression(required(obj, field, path), path + "." + field);
    }

    private Expression optionalExpression(JsonObject obj, String field, String path) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) return null;
        return readExpression(obj.get(field), path + "." + field);
    }

    Expression readExpression(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        String type = typeOf(obj, path);
        SourceLocation loc = location(obj, path);
        switch (type) {
            case "NumberLiteral":
                return new NumberLiteral(loc, integer(obj, "value", path));
            case "Identifier":
                return new Identifier(loc, string(obj, "name", path));
            case "BinaryExpression": {
                String symbol = string(obj, "operator", path);
                BinaryOp op = BinaryOp.fromSource(symbol);
                if (op == null) {
                    throw new AstFormatException(path + ".operator", "unknown binary operator '" + symbol + "'");
                }
                return new BinaryExpr(loc, expression(obj, "left", path), op, expression(obj, "right", path));
            }
            case "UnaryExpression": {
                String symbol = string(obj, "operator", path);
                UnaryOp op = UnaryOp.fromSource(symbol);
                if (op == null) {
                    throw new AstFormatException(path + ".operator", "unknown unary operator '" + symbol + "'");
                }
                return new UnaryExpr(loc, op, expression(obj, "operand", path));
            }
            case "ParenthesizedExpression":
                return expression(obj, "expression", path);
            case "FunctionCall": {
                List<Expression> args = new ArrayList<>();
                if (obj.has("arguments") && !obj.get("arguments").isJsonNull()) {
                    JsonArray array = asArray(obj.get("arguments"), path + ".arguments");
                    for (int i = 0; i < array.size(); i++) {
                        args.add(readExpression(array.get(i), path + ".arguments[" + i + "]"));
                    }
                }
                return new CallExpr(loc, callee(obj, path), args);
            }
            default:
                throw new AstFormatException(path, "unknown expression type '" + type + "'");
        }
    }

    private String callee(JsonObject obj, String path) {
        JsonElement callee = required(obj, "callee", path);
        if (callee.isJsonPrimitive()) {
            return callee.getAsString();
        }
        return string(asObject(callee, path + ".callee"), "name", path + ".callee");
    }

    // ============ 基础字段 ============

    private SourceLocation location(JsonObject obj, String path) {
        if (!obj.has("line") || obj.get("line").isJsonNull()) return SourceLocation.UNKNOWN;
        int column = obj.has("column") && !obj.get("column").isJsonNull() ? integer(obj, "column", path) : 0;
        return new SourceLocation(fileName, integer(obj, "line", path), column);
    }

    private static String typeOf(JsonObject obj, String path) {
        return string(obj, "type", path);
    }

    private static JsonElement required(JsonObject obj, String field, String path) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            throw new AstFormatException(path, "missing field '" + field + "'");
        }
        return obj.get(field);
    }

    private static String string(JsonObject obj, String field, String path) {
        JsonElement value = required(obj, field, path);
        if (!value.isJsonPrimitive()) {
            throw new AstFormatException(path + "." + field, "expected string");
        }
        return value.getAsString();
    }

    private static String optionalString(JsonObject obj, String field, String defaultValue) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) return defaultValue;
        return obj.get(field).getAsString();
    }

    private static int integer(JsonObject obj, String field, String path) {
        JsonElement value = required(obj, field, path);
        try {
            if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
                double d = value.getAsDouble();
                if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                    return (int) d;
                }
            } else if (value.isJsonPrimitive()) {
                return Integer.parseInt(value.getAsString().trim());
            }
        } catch (NumberFormatException e) {
            throw new AstFormatException(path + "." + field, "expected integer but got " + value, e);
        }
        throw new AstFormatException(path + "." + field, "expected integer but got " + value);
    }

    private static List<String> strings(JsonObject obj, String field, String path) {
        List<String> result = new ArrayList<>();
        if (!obj.has(field) || obj.get(field).isJsonNull()) return result;
        JsonArray array = asArray(obj.get(field), path + "." + field);
        for (JsonElement e : array) {
            result.add(e.getAsString());
        }
        return result;
    }

    private static JsonObject asObject(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new AstFormatException(path, "expected object");
        }
        return element.getAsJsonObject();
    }

    private static JsonArray asArray(JsonElement element, String path) {
        if (element == null || !element.isJsonArray()) {
            throw new AstFormatException(path, "expected array");
        }
        return element.getAsJsonArray();
    }
}
