package com.tinyc.ir.lowering;

import com.tinyc.compiler.ast.AstFactory;
import com.tinyc.compiler.ast.AstPrinter;
import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.compiler.ast.expr.Expression;
import com.tinyc.compiler.ast.stmt.*;
import com.tinyc.ir.cfg.BasicBlock;
import com.tinyc.ir.cfg.ControlFlowGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 已标注 AST → CFG 降级。
 *
 * <p>每个 visit 方法接收当前块作为上下文，返回降级后的新当前块。
 * 普通语句直接追加到当前块；if/while/for 结束后总是开启新块，使后续语句处于正确的位置。
 * return 单独成块并连接到出口块，同一序列中其后的语句被跳过。</p>
 *
 * <p>只做结构降级，不做优化；不可达块、空块由 {@code PassPipeline} 清理。</p>
 */
public class AstToCfgLowering implements StatementVisitor<BasicBlock, BasicBlock> {

    private static final Logger LOG = Logger.getLogger(AstToCfgLowering.class.getName());

    // 当前函数的 CFG
    private ControlFlowGraph cfg;

    // 循环上下文栈：break/continue 跳转目标
    private final Deque<LoopContext> loopStack = new ArrayDeque<>();

    // 已进入、尚未结束的作用域检查点（栈顶为最内层）
    private final Deque<StartCheckpoint> openScopes = new ArrayDeque<>();

    private static final class LoopContext {
        final BasicBlock breakTarget;
        final BasicBlock continueTarget;
        final int scopeDepth;  // 进入循环体时 openScopes 的深度

        LoopContext(BasicBlock breakTarget, BasicBlock continueTarget, int scopeDepth) {
            this.breakTarget = breakTarget;
            this.continueTarget = continueTarget;
            this.scopeDepth = scopeDepth;
        }
    }

    /**
     * 为每个顶层函数生成一张 CFG，按声明顺序。
     */
    public List<ControlFlowGraph> lower(Program program) {
        Objects.requireNonNull(program, "program");
        List<ControlFlowGraph> result = new ArrayList<>();
        for (FunctionDecl function : program.getFunctions()) {
            result.add(lowerFunction(function));
        }
        return result;
    }

    public ControlFlowGraph lowerFunction(FunctionDecl function) {
        cfg = new ControlFlowGraph(function.getName(), function.getParamNames());
        loopStack.clear();
        openScopes.clear();

        Block body = function.getBody() != null
                ? function.getBody()
                : new Block(function.getLocation(), Collections.<Statement>emptyList());
        BasicBlock last = visitBlock(body, cfg.getEntryBlock());
        if (!last.isTerminated()) {
            // 隐式落出函数末尾
            cfg.connect(last, cfg.getExitBlock());
        }

        ControlFlowGraph result = cfg;
        cfg = null;
        return result;
    }

    // ============ 序列 ============

    private BasicBlock lowerSequence(List<Statement> statements, BasicBlock current) {
        for (Statement stmt : statements) {
            if (stmt == null) continue;
            if (current.isTerminated()) {
                // return/break/continue 之后的语句不可达
                break;
            }
            current = stmt.accept(this, current);
        }
        return current;
    }

    /** 分支或循环体：块语句内联降级，单条语句按序列处理 */
    private BasicBlock lowerBranch(Statement branch, BasicBlock entry) {
        if (branch == null) return entry;
        return lowerSequence(Collections.singletonList(branch), entry);
    }

    /** 控制结构之后开启新块 */
    private BasicBlock openNext(BasicBlock exit) {
        if (exit.isTerminated()) return exit;
        BasicBlock next = cfg.newBlock();
        cfg.connect(exit, next);
        return next;
    }

    private BasicBlock newConditionBlock(Expression condition) {
        BasicBlock block = cfg.newBlock();
        block.addStatement(AstFactory.exprStmt(condition != null ? condition : AstFactory.num(1)));
        return block;
    }

    private void truncateOpenScopes(int depth) {
        while (openScopes.size() > depth) {
            openScopes.pop();
        }
    }

    // ============ 复合语句 ============

    @Override
    public BasicBlock visitBlock(Block node, BasicBlock current) {
        int mark = openScopes.size();
        BasicBlock result = lowerSequence(node.getStatements(), current);
        // 提前 return/break 时块尾 END 不会被追加
        truncateOpenScopes(mark);
        return result;
    }

    @Override
    public BasicBlock visitIfStmt(IfStmt node, BasicBlock current) {
        BasicBlock conditionBlock = newConditionBlock(node.getCondition());
        cfg.connect(current, conditionBlock);

        BasicBlock thenEntry = cfg.newBlock();
        cfg.connect(conditionBlock, thenEntry);
        BasicBlock thenExit = lowerBranch(node.getThenBranch(), thenEntry);

        BasicBlock elseExit = conditionBlock;
        if (node.hasElse()) {
            BasicBlock elseEntry = cfg.newBlock();
            cfg.connect(conditionBlock, elseEntry);
            elseExit = lowerBranch(node.getElseBranch(), elseEntry);
        }

        boolean thenJumps = thenExit.isTerminated();
        boolean elseJumps = node.hasElse() && elseExit.isTerminated();

        if (thenJumps && elseJumps) {
            // 两个分支都跳走：不建合并块，出口为不可达的占位块
            ensureOnlyExitConnection(thenExit);
            ensureOnlyExitConnection(elseExit);
            return cfg.newBlock();
        }
        if (thenJumps) {
            ensureOnlyExitConnection(thenExit);
            return openNext(elseExit);
        }
        if (elseJumps) {
            ensureOnlyExitConnection(elseExit);
            return openNext(thenExit);
        }

        BasicBlock merge = cfg.newBlock();
        cfg.connect(thenExit, merge);
        cfg.connect(elseExit, merge);
        return merge;
    }

    /**
     * return 结尾的块只允许以出口块为唯一后继。
     */
    private void ensureOnlyExitConnection(BasicBlock block) {
        if (!block.endsWithReturn()) return;
        BasicBlock exit = cfg.getExitBlock();
        for (BasicBlock succ : cfg.successorsOf(block)) {
            if (succ != exit) {
                cfg.disconnect(block, succ);
            }
        }
        cfg.connect(block, exit);
    }

    @Override
    public BasicBlock visitWhileStmt(WhileStmt node, BasicBlock current) {
        BasicBlock header = newConditionBlock(node.getCondition());
        cfg.connect(current, header);

        BasicBlock bodyEntry = cfg.newBlock();
        BasicBlock loopExit = cfg.newBlock();

        // 先连 header → body，保证真分支是第一个后继
        cfg.connect(header, bodyEntry);
        loopStack.push(new LoopContext(loopExit, header, openScopes.size()));
        BasicBlock bodyExit;
        try {
            bodyExit = lowerBranch(node.getBody(), bodyEntry);
        } finally {
            loopStack.pop();
        }
        if (!bodyExit.isTerminated()) {
            cfg.connect(bodyExit, header);
        }
        cfg.connect(header, loopExit);
        return openNext(loopExit);
    }

    @Override
    public BasicBlock visitForStmt(ForStmt node, BasicBlock current) {
        int mark = openScopes.size();

        // 标注器为循环变量包的外层作用域：START 放进初始化块，END 放进循环出口块
        StartCheckpoint loopScopeStart = null;
        EndCheckpoint loopScopeEnd = null;
        Statement body = node.getBody();
        if (node.declaresLoopVariable() && body instanceof Block) {
            List<Statement> stmts = ((Block) body).getStatements();
            if (stmts.size() >= 2
                    && stmts.get(0) instanceof StartCheckpoint
                    && stmts.get(stmts.size() - 1) instanceof EndCheckpoint
                    && ((StartCheckpoint) stmts.get(0)).getScopeId()
                        .equals(((EndCheckpoint) stmts.get(stmts.size() - 1)).getScopeId())) {
                loopScopeStart = (StartCheckpoint) stmts.get(0);
                loopScopeEnd = (EndCheckpoint) stmts.get(stmts.size() - 1);
                body = new Block(body.getLocation(), new ArrayList<>(stmts.subList(1, stmts.size() - 1)));
            }
        }

        BasicBlock initExit = current;
        if (loopScopeStart != null || node.getInit() != null) {
            BasicBlock initBlock = cfg.newBlock();
            cfg.connect(current, initBlock);
            if (loopScopeStart != null) {
                initBlock.addStatement(loopScopeStart);
                openScopes.push(loopScopeStart);
            }
            initExit = node.getInit() != null ? node.getInit().accept(this, initBlock) : initBlock;
        }

        BasicBlock header = newConditionBlock(node.getCondition());
        cfg.connect(initExit, header);

        BasicBlock bodyEntry = cfg.newBlock();
        BasicBlock loopExit = cfg.newBlock();
        BasicBlock updateBlock = cfg.newBlock();

        cfg.connect(header, bodyEntry);
        // continue 跳到更新块，而非直接跳 header（否则跳过 i = i + 1）
        loopStack.push(new LoopContext(loopExit, updateBlock, openScopes.size()));
        BasicBlock bodyExit;
        try {
            bodyExit = lowerBranch(body, bodyEntry);
        } finally {
            loopStack.pop();
        }

        if (loopScopeEnd != null) {
            loopExit.insertStatement(0, loopScopeEnd);
        }
        if (node.getUpdate() != null) {
            node.getUpdate().accept(this, updateBlock);
        }

        if (!bodyExit.isTerminated()) {
            cfg.connect(bodyExit, updateBlock);
        }
        cfg.connect(updateBlock, header);
        cfg.connect(header, loopExit);

        truncateOpenScopes(mark);
        return openNext(loopExit);
    }

    // ============ 跳转语句 ============

    @Override
    public BasicBlock visitReturnStmt(ReturnStmt node, BasicBlock current) {
        BasicBlock returnBlock = cfg.newBlock();
        returnBlock.addStatement(node);
        cfg.connect(current, returnBlock);
        cfg.connect(returnBlock, cfg.getExitBlock());
        return returnBlock;
    }

    @Override
    public BasicBlock visitBreakStmt(BreakStmt node, BasicBlock current) {
        return lowerJump(node, current, true);
    }

    @Override
    public BasicBlock visitContinueStmt(ContinueStmt node, BasicBlock current) {
        return lowerJump(node, current, false);
    }

    /**
     * break/continue：跳转块先关闭循环体内打开的作用域（由内向外），
     * 使跳转目标看到与正常路径一致的作用域栈。
     */
    private BasicBlock lowerJump(Statement node, BasicBlock current, boolean isBreak) {
        LoopContext target = loopStack.peek();
        if (target == null) {
            LOG.warning((isBreak ? "break" : "continue") + " outside of loop in "
                    + cfg.getFunctionName() + ", ignored");
            return current;
        }
        BasicBlock jumpBlock = cfg.newBlock();
        int toClose = openScopes.size() - target.scopeDepth;
        Iterator<StartCheckpoint> it = openScopes.iterator();
        for (int i = 0; i < toClose && it.hasNext(); i++) {
            jumpBlock.addStatement(it.next().toEnd());
        }
        jumpBlock.addStatement(node);
        cfg.connect(current, jumpBlock);
        cfg.connect(jumpBlock, isBreak ? target.breakTarget : target.continueTarget);
        return jumpBlock;
    }

    // ============ 普通语句 ============

    @Override
    public BasicBlock visitVarDeclStmt(VarDeclStmt node, BasicBlock current) {
        current.addStatement(node);
        return current;
    }

    @Override
    public BasicBlock visitAssignStmt(AssignStmt node, BasicBlock current) {
        current.addStatement(node);
        return current;
    }

    @Override
    public BasicBlock visitExpressionStmt(ExpressionStmt node, BasicBlock current) {
        current.addStatement(node);
        return current;
    }

    @Override
    public BasicBlock visitEmptyStmt(EmptyStmt node, BasicBlock current) {
        return current;
    }

    @Override
    public BasicBlock visitStartCheckpoint(StartCheckpoint node, BasicBlock current) {
        current.addStatement(node);
        openScopes.push(node);
        return current;
    }

    @Override
    public BasicBlock visitEndCheckpoint(EndCheckpoint node, BasicBlock current) {
        current.addStatement(node);
        StartCheckpoint top = openScopes.peek();
        if (top != null && top.getScopeId().equals(node.getScopeId())) {
            openScopes.pop();
        } else {
            LOG.fine("Unbalanced checkpoint in " + cfg.getFunctionName() + ": " + AstPrinter.print(node));
        }
        return current;
    }

    @Override
    public BasicBlock visitFunctionDecl(FunctionDecl node, BasicBlock current) {
        LOG.warning("Nested function " + node.getName() + " in " + cfg.getFunctionName() + " is not supported, skipped");
        return current;
    }
}
