package com.tinyc.ir.backend;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.stmt.EndCheckpoint;
import com.tinyc.compiler.ast.stmt.StartCheckpoint;
import com.tinyc.compiler.scope.ScopeCheckpointAnnotator;
import com.tinyc.ir.CfgGenerator;
import com.tinyc.ir.CompilerOptions;
import com.tinyc.ir.cfg.BasicBlock;
import com.tinyc.ir.cfg.ControlFlowGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.tinyc.compiler.ast.AstFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 汇编生成测试
 */
class AssemblyGeneratorTest {

    private static ControlFlowGraph cfgOf(FunctionDecl function) {
        return new CfgGenerator().generate(new ScopeCheckpointAnnotator().annotate(program(function))).get(0);
    }

    private static String asm(FunctionDecl function) {
        return new AssemblyGenerator().generate(cfgOf(function));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    /** 每个 call 指令之前加载参数的那一行 */
    private static List<String> argumentLoads(String asm, String callee) {
        List<String> all = Arrays.asList(asm.split("\n"));
        List<String> loads = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            if (all.get(i).equals("  call " + callee)) {
                loads.add(all.get(i - 2).trim());
            }
        }
        return loads;
    }

    // ============ 帧与返回 ============

    @Nested
    @DisplayName("帧布局")
    class FrameTests {

        @Test
        @DisplayName("顺序代码的完整输出")
        void testStraightLineListing() {
            String asm = asm(function("f",
                    varDecl("a", num(1)), varDecl("b", num(2)), ret(binary(id("a"), "+", id("b")))));

            assertEquals(lines(
                    "f:",
                    "  push ebp",
                    "  mov ebp, esp",
                    "  sub esp, 2",
                    "  mov eax, 1",
                    "  si -1",
                    "  mov eax, 2",
                    "  si -2",
                    "  li -1",
                    "  push eax",
                    "  li -2",
                    "  mov ebx, eax",
                    "  pop eax",
                    "  add eax, ebx",
                    "  add esp, 2",
                    "  pop ebp",
                    "  mov ebx, 0",
                    "  ret"), asm);
        }

        @Test
        @DisplayName("入口函数 main 没有帧序言，也不恢复 ebp")
        void testEntryFunctionHasNoPrologue() {
            assertEquals(lines(
                    "main:",
                    "  mov eax, 0",
                    "  mov ebx, 0",
                    "  ret"), asm(function("main", ret(num(0)))));
        }

        @Test
        @DisplayName("入口函数名可配置")
        void testConfigurableEntryName() {
            CompilerOptions options = new CompilerOptions();
            options.setEntryFunctionName("start");

            String asm = new AssemblyGenerator(options).generate(cfgOf(function("main", ret(num(0)))));

            assertThat(asm).contains("  push ebp\n  mov ebp, esp");
        }

        @Test
        @DisplayName("参数从 ebp+2 开始")
        void testParameterOffsets() {
            String asm = asm(function("add", Arrays.asList("a", "b"), ret(binary(id("a"), "+", id("b")))));

            assertEquals(lines(
                    "add:",
                    "  push ebp",
                    "  mov ebp, esp",
                    "  li 2",
                    "  push eax",
                    "  li 3",
                    "  mov ebx, eax",
                    "  pop eax",
                    "  add eax, ebx",
                    "  pop ebp",
                    "  mov ebx, 0",
                    "  ret"), asm);
        }

        @Test
        @DisplayName("没有 return 时出口块返回 0")
        void testFallOffReturnsZero() {
            String asm = asm(function("g", varDecl("z", num(5))));

            assertThat(asm).contains("  add esp, 1\n  jmp g_block_0");
            assertThat(asm).contains("g_block_0:\n  mov eax, 0\n  pop ebp\n  mov ebx, 0\n  ret");
        }

        @Test
        @DisplayName("调用：参数从右向左压栈，返回后由调用者清理")
        void testCallSequence() {
            String asm = asm(function("main", ret(call("add", num(2), num(3)))));

            assertThat(asm).contains(lines(
                    "  mov eax, 3",
                    "  push eax",
                    "  mov eax, 2",
                    "  push eax",
                    "  call add",
                    "  add esp, 2"));
        }
    }

    // ============ 条件 ============

    @Nested
    @DisplayName("条件跳转")
    class ConditionTests {

        @Test
        @DisplayName("比较条件直接生成条件跳转，真分支为第一个后继")
        void testRawComparisonBranch() {
            ControlFlowGraph cfg = cfgOf(function("f",
                    ifStmt(binary(num(1), ">", num(0)), block(ret(num(10))), block(ret(num(20))))));
            List<BasicBlock> succs = cfg.successorsOf(cfg.getEntryBlock());

            String asm = new AssemblyGenerator().generate(cfg);

            assertThat(asm).contains(lines(
                    "  cmp eax, ebx",
                    "  jg " + succs.get(0).getId(),
                    "  jmp " + succs.get(1).getId()));
            assertThat(asm).doesNotContain("setg");
        }

        @Test
        @DisplayName("值条件与 0 比较")
        void testValueCondition() {
            String asm = asm(function("main",
                    varDecl("n", num(3)),
                    whileStmt(id("n"), block(assign("n", binary(id("n"), "-", num(1))))),
                    ret(id("n"))));

            assertThat(asm).contains("  li -1\n  cmp eax, 0\n  jne ");
        }

        @Test
        @DisplayName("表达式中的比较物化为 0/1")
        void testMaterializedComparison() {
            String asm = asm(function("main",
                    varDecl("c", binary(num(1), "<", num(2))), ret(id("c"))));

            assertThat(asm).contains("  cmp eax, ebx\n  setl al\n  and eax, 1\n  si -1");
        }
    }

    // ============ 变量解析 ============

    @Nested
    @DisplayName("变量解析")
    class ResolutionTests {

        @Test
        @DisplayName("内层声明遮蔽外层，离开后恢复")
        void testShadowing() {
            String asm = asm(function("main",
                    varDecl("x", num(1)),
                    block(varDecl("x", num(2)), exprStmt(call("use", id("x")))),
                    exprStmt(call("use", id("x"))),
                    ret(num(0))));

            assertEquals(Arrays.asList("li -2", "li -1"), argumentLoads(asm, "use"));
        }

        @Test
        @DisplayName("内层变量声明之前仍解析到外层变量")
        void testDeclarationOrder() {
            String asm = asm(function("main",
                    varDecl("x", num(1)),
                    block(exprStmt(call("use", id("x"))), varDecl("x", num(2)), exprStmt(call("use", id("x")))),
                    ret(num(0))));

            assertEquals(Arrays.asList("li -1", "li -2"), argumentLoads(asm, "use"));
        }

        @Test
        @DisplayName("未解析的标识符取 0")
        void testUnresolvedIdentifier() {
            assertEquals(lines(
                    "main:",
                    "  mov eax, 0",
                    "  mov ebx, 0",
                    "  ret"), asm(function("main", ret(id("missing")))));
        }

        @Test
        @DisplayName("for 循环变量与循环体使用不同的帧")
        void testLoopFrames() {
            ControlFlowGraph cfg = cfgOf(function("f",
                    varDecl("s", num(0)),
                    forStmt(varDecl("i", num(0)), binary(id("i"), "<", num(3)), assign("i", binary(id("i"), "+", num(1))),
                            block(varDecl("t", id("i")), assign("s", binary(id("s"), "+", id("t"))))),
                    ret(id("s"))));

            String asm = new AssemblyGenerator().generate(cfg);

            // s → -1，i → -2，t → -3
            assertThat(asm).contains("  mov eax, 0\n  si -2");
            assertThat(asm).contains("  li -2\n  si -3");
            // 所有路径都 return，出口块不会被访问
            for (BasicBlock block : cfg.getBlocks()) {
                if (block.isExit()) continue;
                assertNotNull(block.getScopeSnapshot(), block.getId());
            }
        }
    }

    // ============ 检查点不匹配 ============

    @Test
    @DisplayName("END 跳过未关闭的内层作用域时一并释放其槽位")
    void testUnwindsUnclosedScopes() {
        ControlFlowGraph cfg = new ControlFlowGraph("main", Collections.<String>emptyList());
        BasicBlock entry = cfg.getEntryBlock();
        StartCheckpoint outer = new StartCheckpoint(SourceLocation.UNKNOWN, "scope_1", 0, Collections.singletonList("a"));
        StartCheckpoint inner = new StartCheckpoint(SourceLocation.UNKNOWN, "scope_0", 1, Collections.singletonList("b"));
        entry.addStatement(outer);
        entry.addStatement(inner);
        entry.addStatement(outer.toEnd());
        entry.addStatement(ret(num(0)));
        cfg.connect(entry, cfg.getExitBlock());

        String asm = new AssemblyGenerator().generate(cfg);

        assertEquals(lines(
                "main:",
                "  sub esp, 1",
                "  sub esp, 1",
                "  add esp, 2",
                "  mov eax, 0",
                "  mov ebx, 0",
                "  ret"), asm);
    }

    @Test
    @DisplayName("没有匹配作用域的 END 不生成代码")
    void testUnmatchedEndIgnored() {
        ControlFlowGraph cfg = new ControlFlowGraph("main", Collections.<String>emptyList());
        BasicBlock entry = cfg.getEntryBlock();
        entry.addStatement(new EndCheckpoint(SourceLocation.UNKNOWN, "scope_9", 0, Collections.singletonList("q")));
        entry.addStatement(ret(num(1)));
        cfg.connect(entry, cfg.getExitBlock());

        assertEquals(lines(
                "main:",
                "  mov eax, 1",
                "  mov ebx, 0",
                "  ret"), new AssemblyGenerator().generate(cfg));
    }

    @Test
    @DisplayName("注释选项输出函数头与语句")
    void testComments() {
        CompilerOptions options = new CompilerOptions();
        options.setEmitComments(true);

        String asm = new AssemblyGenerator(options).generate(cfgOf(function("f",
                Collections.singletonList("p"), varDecl("a", id("p")), ret(id("a")))));

        assertThat(asm).contains("  ; function f(p)");
        assertThat(asm).contains("  ; int a = p");
        assertThat(asm).contains("  ; enter ");
        assertThat(asm).contains("  ; return a");
    }
}
