package com.tinyc.ir.pass;

import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.scope.ScopeCheckpointAnnotator;
import com.tinyc.ir.cfg.BasicBlock;
import com.tinyc.ir.cfg.ControlFlowGraph;
import com.tinyc.ir.lowering.AstToCfgLowering;
import org.junit.jupiter.api.BeforeEach;
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
 * CFG 优化 pass 测试
 */
class CfgPassTest {

    private ControlFlowGraph cfg;
    private BasicBlock entry;
    private BasicBlock exit;

    @BeforeEach
    void setUp() {
        cfg = new ControlFlowGraph("f", Collections.<String>emptyList());
        entry = cfg.getEntryBlock();
        exit = cfg.getExitBlock();
    }

    private BasicBlock marked(int marker) {
        BasicBlock b = cfg.newBlock();
        b.addStatement(exprStmt(num(marker)));
        return b;
    }

    private BasicBlock conditionBlock() {
        BasicBlock b = cfg.newBlock();
        b.addStatement(exprStmt(binary(id("x"), ">", num(0))));
        return b;
    }

    // ============ 空块消除 ============

    @Nested
    @DisplayName("EmptyBlockElimination")
    class EmptyBlockTests {

        @Test
        @DisplayName("删除空块时保持条件块的真/假分支顺序")
        void testPreservesBranchOrder() {
            BasicBlock cond = conditionBlock();
            BasicBlock empty = cfg.newBlock();
            BasicBlock elseBlock = marked(2);
            BasicBlock target = marked(1);
            cfg.connect(entry, cond);
            cfg.connect(cond, empty);
            cfg.connect(cond, elseBlock);
            cfg.connect(empty, target);
            cfg.connect(target, exit);
            cfg.connect(elseBlock, exit);

            new EmptyBlockElimination().run(cfg);

            assertFalse(cfg.contains(empty.getId()));
            assertEquals(Arrays.asList(target.getId(), elseBlock.getId()), cond.getSuccessors());
            assertEquals(Collections.singletonList(cond.getId()), target.getPredecessors());
        }

        @Test
        @DisplayName("单前驱（其唯一后继是空块）时继承空块的多个后继")
        void testSinglePredecessorInheritsSuccessors() {
            BasicBlock empty = cfg.newBlock();
            BasicBlock a = marked(1);
            BasicBlock b = marked(2);
            cfg.connect(entry, empty);
            cfg.connect(empty, a);
            cfg.connect(empty, b);
            cfg.connect(a, exit);
            cfg.connect(b, exit);

            new EmptyBlockElimination().run(cfg);

            assertFalse(cfg.contains(empty.getId()));
            assertEquals(Arrays.asList(a.getId(), b.getId()), entry.getSuccessors());
        }

        @Test
        @DisplayName("多前驱且多后继的空块保持不变")
        void testKeepsMultiWayEmptyBlock() {
            BasicBlock cond = conditionBlock();
            BasicBlock a = marked(1);
            BasicBlock b = marked(2);
            BasicBlock empty = cfg.newBlock();
            BasicBlock x = marked(3);
            BasicBlock y = marked(4);
            cfg.connect(entry, cond);
            cfg.connect(cond, a);
            cfg.connect(cond, b);
            cfg.connect(a, empty);
            cfg.connect(b, empty);
            cfg.connect(empty, x);
            cfg.connect(empty, y);
            cfg.connect(x, exit);
            cfg.connect(y, exit);

            new EmptyBlockElimination().run(cfg);

            assertTrue(cfg.contains(empty.getId()));
        }

        @Test
        @DisplayName("空的自循环块不被删除")
        void testKeepsSelfLoop() {
            BasicBlock spin = cfg.newBlock();
            cfg.connect(entry, spin);
            cfg.connect(spin, spin);

            new EmptyBlockElimination().run(cfg);

            assertTrue(cfg.contains(spin.getId()));
            assertEquals(Collections.singletonList(spin.getId()), spin.getSuccessors());
        }

        @Test
        @DisplayName("入口与出口块即使为空也保留")
        void testKeepsSentinels() {
            cfg.connect(entry, exit);

            new EmptyBlockElimination().run(cfg);

            assertEquals(2, cfg.size());
        }
    }

    // ============ 不可达块删除 ============

    @Nested
    @DisplayName("UnreachableBlockElimination")
    class UnreachableTests {

        @Test
        @DisplayName("删除不可达块并清理其出边")
        void testRemovesUnreachable() {
            BasicBlock loop = marked(1);
            BasicBlock orphan = marked(2);
            cfg.connect(entry, loop);
            cfg.connect(loop, loop);
            cfg.connect(orphan, loop);

            new UnreachableBlockElimination().run(cfg);

            assertFalse(cfg.contains(orphan.getId()));
            assertEquals(Arrays.asList(entry.getId(), loop.getId()), loop.getPredecessors());
        }

        @Test
        @DisplayName("出口块不可达时仍然保留")
        void testKeepsUnreachableExit() {
            BasicBlock loop = marked(1);
            cfg.connect(entry, loop);
            cfg.connect(loop, loop);

            new UnreachableBlockElimination().run(cfg);

            assertTrue(cfg.contains(exit.getId()));
            assertEquals(3, cfg.size());
        }
    }

    // ============ 块合并 ============

    @Nested
    @DisplayName("BlockMerging")
    class MergingTests {

        @Test
        @DisplayName("单前驱/单后继链合并到不动点")
        void testMergesChain() {
            BasicBlock a = marked(1);
            BasicBlock b = marked(2);
            cfg.connect(entry, a);
            cfg.connect(a, b);
            cfg.connect(b, exit);

            new BlockMerging().run(cfg);

            assertEquals(2, cfg.size());
            assertEquals(2, entry.getStatements().size());
            assertEquals(Collections.singletonList(exit.getId()), entry.getSuccessors());
            assertEquals(Collections.singletonList(entry.getId()), exit.getPredecessors());
        }

        @Test
        @DisplayName("多前驱的汇合块不被合并")
        void testKeepsJoinBlock() {
            BasicBlock cond = conditionBlock();
            BasicBlock a = marked(1);
            BasicBlock b = marked(2);
            BasicBlock join = marked(3);
            cfg.connect(entry, cond);
            cfg.connect(cond, a);
            cfg.connect(cond, b);
            cfg.connect(a, join);
            cfg.connect(b, join);
            cfg.connect(join, exit);

            new BlockMerging().run(cfg);

            assertTrue(cfg.contains(join.getId()));
            assertTrue(cfg.contains(a.getId()));
            assertThat(join.getPredecessors()).containsExactly(a.getId(), b.getId());
            // cond 被并入入口块
            assertFalse(cfg.contains(cond.getId()));
            assertEquals(Arrays.asList(a.getId(), b.getId()), entry.getSuccessors());
        }

        @Test
        @DisplayName("出口块不被并入 return 块")
        void testNeverMergesExit() {
            BasicBlock returnBlock = cfg.newBlock();
            returnBlock.addStatement(ret(num(0)));
            cfg.connect(entry, returnBlock);
            cfg.connect(returnBlock, exit);

            new BlockMerging().run(cfg);

            assertTrue(cfg.contains(exit.getId()));
            assertTrue(entry.endsWithReturn());
            assertEquals(Collections.singletonList(exit.getId()), entry.getSuccessors());
        }

        @Test
        @DisplayName("回边指向的块不并入自身")
        void testKeepsSelfLoop() {
            BasicBlock loop = marked(1);
            cfg.connect(entry, loop);
            cfg.connect(loop, loop);

            new BlockMerging().run(cfg);

            assertTrue(cfg.contains(loop.getId()));
            assertEquals(Collections.singletonList(loop.getId()), loop.getSuccessors());
        }
    }

    // ============ 管线 ============

    @Nested
    @DisplayName("PassPipeline")
    class PipelineTests {

        private ControlFlowGraph lowered(FunctionDecl function) {
            return new AstToCfgLowering().lowerFunction(new ScopeCheckpointAnnotator().annotate(function));
        }

        private FunctionDecl loopy() {
            return function("f", Arrays.asList("n"),
                    varDecl("s", num(0)),
                    forStmt(varDecl("i", num(0)), binary(id("i"), "<", id("n")), assign("i", binary(id("i"), "+", num(1))),
                            block(ifStmt(binary(id("i"), "==", num(2)), block(continueStmt())),
                                    whileStmt(binary(id("s"), ">", num(100)), block(breakStmt())),
                                    assign("s", binary(id("s"), "+", id("i"))))),
                    ifStmt(binary(id("s"), ">", num(3)), block(ret(id("s"))), block(ret(num(0)))));
        }

        @Test
        @DisplayName("默认管线的 pass 顺序")
        void testDefaultOrder() {
            List<String> names = new ArrayList<>();
            for (CfgPass pass : PassPipeline.createDefault().getPasses()) {
                names.add(pass.getName());
            }
            assertEquals(Arrays.asList("UnreachableBlockElimination", "EmptyBlockElimination", "BlockMerging"), names);
            assertEquals(1, PassPipeline.createUnoptimized().getPasses().size());
        }

        @Test
        @DisplayName("管线是幂等的")
        void testIdempotent() {
            PassPipeline pipeline = PassPipeline.createDefault();
            ControlFlowGraph once = pipeline.run(lowered(loopy()));
            String dump = once.toString();

            ControlFlowGraph twice = pipeline.run(once);

            assertEquals(dump, twice.toString());
        }

        @Test
        @DisplayName("优化不增加块数，不可达占位块被删除")
        void testShrinks() {
            ControlFlowGraph raw = lowered(loopy());
            int before = raw.size();

            ControlFlowGraph optimized = PassPipeline.createDefault().run(raw);

            assertThat(optimized.size()).isLessThan(before);
            for (BasicBlock block : optimized.getBlocks()) {
                if (block.isEntry()) continue;
                assertThat(block.getPredecessors()).as(block.getId()).isNotEmpty();
            }
        }
    }
}
