package com.tinyc.cli.json;

import com.tinyc.compiler.ast.AstPrinter;
import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.compiler.ast.expr.BinaryExpr;
import com.tinyc.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tinyc.compiler.ast.expr.CallExpr;
import com.tinyc.compiler.ast.stmt.*;
import com.tinyc.ir.CompilationResult;
import com.tinyc.ir.TinycCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON AST 读写测试
 */
class AstJsonReaderTest {

    private static Program readResource(String name) throws Exception {
        InputStream in = AstJsonReaderTest.class.getResourceAsStream("/programs/" + name);
        assertNotNull(in, name);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new AstJsonReader(name).read(reader);
        }
    }

    private static AstFormatException readError(String json) {
        return assertThrows(AstFormatException.class, () -> new AstJsonReader().read(json));
    }

    private static String function(String... bodyStatements) {
        return "{\"type\": \"Program\", \"statements\": [{\"type\": \"FunctionDeclaration\", \"name\": \"f\", "
                + "\"body\": {\"type\": \"BlockStatement\", \"statements\": ["
                + String.join(", ", bodyStatements) + "]}}]}";
    }

    // ============ 读取 ============

    @Nested
    @DisplayName("读取")
    class ReadTests {

        @Test
        @DisplayName("读取完整程序")
        void testReadProgram() throws Exception {
            Program program = readResource("for_loop.json");

            assertEquals(2, program.getFunctions().size());
            FunctionDecl f = program.getFunctions().get(0);
            assertEquals("f", f.getName());
            assertEquals("int", f.getReturnType());
            assertEquals(3, f.getBody().getStatements().size());

            ForStmt loop = (ForStmt) f.getBody().getStatements().get(1);
            assertTrue(loop.declaresLoopVariable());
            assertEquals("i < 3", AstPrinter.print(loop.getCondition()));
            assertEquals("i = i + 1", AstPrinter.print(loop.getUpdate()));

            Block body = (Block) loop.getBody();
            assertEquals("s = s + i", AstPrinter.print(body.getStatements().get(0)));
        }

        @Test
        @DisplayName("line/column 作为源码位置")
        void testLocations() throws Exception {
            Program program = readResource("for_loop.json");
            Statement decl = program.getFunctions().get(0).getBody().getStatements().get(0);

            assertEquals("for_loop.json", decl.getLocation().getFile());
            assertEquals(2, decl.getLocation().getLine());
            assertEquals(5, decl.getLocation().getColumn());
        }

        @Test
        @DisplayName("callee 与 target 可以是字符串或带 name 的对象")
        void testNameForms() {
            Program program = new AstJsonReader().read(function(
                    "{\"type\": \"ExpressionStatement\", \"expression\": {\"type\": \"FunctionCall\", "
                            + "\"callee\": {\"type\": \"Identifier\", \"name\": \"g\"}, "
                            + "\"arguments\": [{\"type\": \"NumberLiteral\", \"value\": \"42\"}]}}",
                    "{\"type\": \"AssignmentStatement\", \"target\": \"x\", "
                            + "\"value\": {\"type\": \"UnaryExpression\", \"operator\": \"-\", "
                            + "\"operand\": {\"type\": \"NumberLiteral\", \"value\": 1}}}"));

            Block body = program.getFunctions().get(0).getBody();
            CallExpr call = (CallExpr) ((ExpressionStmt) body.getStatements().get(0)).getExpression();
            assertEquals("g", call.getCallee());
            assertEquals("g(42)", AstPrinter.print(call));
            assertEquals("x = -1", AstPrinter.print(body.getStatements().get(1)));
        }

        @Test
        @DisplayName("读取检查点与空语句")
        void testCheckpoints() {
            Program program = new AstJsonReader().read(function(
                    "{\"type\": \"StartCheckPoint\", \"scopeId\": \"scope_0\", \"depth\": 0, \"variableNames\": [\"a\", \"b\"]}",
                    "{\"type\": \"EmptyStatement\"}",
                    "{\"type\": \"EndCheckPoint\", \"scopeId\": \"scope_0\", \"depth\": 0, \"variableNames\": [\"a\", \"b\"]}"));

            Block body = program.getFunctions().get(0).getBody();
            StartCheckpoint start = (StartCheckpoint) body.getStatements().get(0);
            assertEquals("scope_0", start.getScopeId());
            assertEquals(Arrays.asList("a", "b"), start.getVariableNames());
            assertThat(body.getStatements().get(1)).isInstanceOf(EmptyStmt.class);
            assertThat(body.getStatements().get(2)).isInstanceOf(EndCheckpoint.class);
        }
        @Test
        @DisplayName("括号表达式展开为内部表达式")
        void testParenthesizedExpression() {
            Program program = new AstJsonReader().read(function(
                    "{\"type\": \"ReturnStatement\", \"value\": {\"type\": \"BinaryExpression\", \"operator\": \"*\", "
                            + "\"left\": {\"type\": \"ParenthesizedExpression\", \"expression\": "
                            + "{\"type\": \"BinaryExpression\", \"operator\": \"+\", "
                            + "\"left\": {\"type\": \"NumberLiteral\", \"value\": 1}, "
                            + "\"right\": {\"type\": \"NumberLiteral\", \"value\": 2}}}, "
                            + "\"right\": {\"type\": \"NumberLiteral\", \"value\": 3}}}"));

            ReturnStmt ret = (ReturnStmt) program.getFunctions().get(0).getBody().getStatements().get(0);
            BinaryExpr mul = (BinaryExpr) ret.getValue();
            assertEquals(BinaryOp.MUL, mul.getOperator());
            assertThat(mul.getLeft()).isInstanceOf(BinaryExpr.class);
            assertEquals(BinaryOp.ADD, ((BinaryExpr) mul.getLeft()).getOperator());
        }

        @Test
        @DisplayName("let 声明按变量声明读取，包括 for 初始化")
        void testLetDeclaration() {
            Program program = new AstJsonReader().read(function(
                    "{\"type\": \"LetDeclaration\", \"name\": \"s\", \"initializer\": {\"type\": \"NumberLiteral\", \"value\": 0}}",
                    "{\"type\": \"ForStatement\", "
                            + "\"init\": {\"type\": \"LetDeclaration\", \"name\": \"i\", \"dataType\": \"int\", "
                            + "\"initializer\": {\"type\": \"NumberLiteral\", \"value\": 0}}, "
                            + "\"condition\": {\"type\": \"BinaryExpression\", \"operator\": \"<\", "
                            + "\"left\": {\"type\": \"Identifier\", \"name\": \"i\"}, "
                            + "\"right\": {\"type\": \"NumberLiteral\", \"value\": 3}}, "
                            + "\"body\": {\"type\": \"BlockStatement\", \"statements\": []}}"));

            Block body = program.getFunctions().get(0).getBody();
            VarDeclStmt decl = (VarDeclStmt) body.getStatements().get(0);
            assertEquals("s", decl.getName());
            assertEquals("int", decl.getDataType());
            ForStmt loop = (ForStmt) body.getStatements().get(1);
            assertTrue(loop.declaresLoopVariable());
            assertEquals("i", ((VarDeclStmt) loop.getInit()).getName());
        }

        @Test
        @DisplayName("line 为 null 时位置未知")
        void testNullLine() {
            Program program = new AstJsonReader().read("{\"type\": \"Program\", \"line\": null, \"statements\": []}");

            assertSame(SourceLocation.UNKNOWN, program.getLocation());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("格式错误")
    class ErrorTests {

        @Test
        @DisplayName("非法 JSON")
        void testInvalidJson() {
            assertEquals("$", readError("{\"type\": ").getPath());
        }

        @Test
        @DisplayName("根节点不是 Program")
        void testWrongRoot() {
            AstFormatException e = readError("{\"type\": \"BlockStatement\"}");
            assertEquals("$", e.getPath());
            assertThat(e.getMessage()).contains("expected Program");
        }

        @Test
        @DisplayName("未知语句类型带完整路径")
        void testUnknownStatement() {
            AstFormatException e = readError(function("{\"type\": \"ReturnStatement\"}", "{\"type\": \"GotoStatement\"}"));

            assertEquals("$.statements[0].body.statements[1]", e.getPath());
            assertThat(e.getMessage()).contains("GotoStatement");
        }

        @Test
        @DisplayName("缺少必需字段")
        void testMissingField() {
            AstFormatException e = readError(function("{\"type\": \"WhileStatement\", \"body\": {\"type\": \"EmptyStatement\"}}"));

            assertEquals("$.statements[0].body.statements[0]", e.getPath());
            assertThat(e.getMessage()).contains("condition");
        }

        @Test
        @DisplayName("未知运算符")
        void testUnknownOperator() {
            AstFormatException e = readError(function("{\"type\": \"ReturnStatement\", \"value\": "
                    + "{\"type\": \"BinaryExpression\", \"operator\": \"**\", "
                    + "\"left\": {\"type\": \"NumberLiteral\", \"value\": 2}, "
                    + "\"right\": {\"type\": \"NumberLiteral\", \"value\": 3}}}"));

            assertEquals("$.statements[0].body.statements[0].value.operator", e.getPath());
        }

        @Test
        @DisplayName("非整数字面量")
        void testNonIntegerLiteral() {
            AstFormatException e = readError(function("{\"type\": \"ReturnStatement\", \"value\": "
                    + "{\"type\": \"NumberLiteral\", \"value\": 1.5}}"));

            assertEquals("$.statements[0].body.statements[0].value.value", e.getPath());
        }

        @Test
        @DisplayName("非数字的 line/column")
        void testNonNumericLocation() {
            AstFormatException line = readError("{\"type\": \"Program\", \"line\": \"abc\", \"statements\": []}");
            assertEquals("$.line", line.getPath());

            AstFormatException column = readError(function(
                    "{\"type\": \"EmptyStatement\", \"line\": 3, \"column\": {\"x\": 1}}"));
            assertEquals("$.statements[0].body.statements[0].column", column.getPath());
        }

        @Test
        @DisplayName("函数体必须是块语句")
        void testFunctionBodyNotBlock() {
            AstFormatException e = readError("{\"type\": \"Program\", \"statements\": [{\"type\": \"FunctionDeclaration\", "
                    + "\"name\": \"f\", \"body\": {\"type\": \"ReturnStatement\"}}]}");

            assertEquals("$.statements[0].body", e.getPath());
        }
    }

    // ============ 写回 ============

    @Test
    @DisplayName("标注后的 AST 写回 JSON 再读入，编译结果不变")
    void testAnnotatedRoundTrip() throws Exception {
        TinycCompiler compiler = new TinycCompiler();
        CompilationResult direct = compiler.compile(readResource("for_loop.json"));

        String json = new AstJsonWriter().write(direct.getAnnotatedProgram());
        assertThat(json).contains("\"StartCheckPoint\"").contains("\"EndCheckPoint\"");

        Program reread = new AstJsonReader().read(new StringReader(json));
        CompilationResult again = compiler.compileAnnotated(reread);

        assertEquals(direct.getProgramText(), again.getProgramText());
        assertEquals(direct.dumpCfgs(), again.dumpCfgs());
    }
}
