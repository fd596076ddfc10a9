package com.tinyc.compiler.scope;

import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 作用域检查点标注器。
 *
 * <p>为每个代码块的语句列表首尾插入一对 {@link StartCheckpoint} / {@link EndCheckpoint}，
 * 记录作用域 ID、嵌套深度以及该块直接声明的变量名。先处理嵌套语句，再为当前块生成 ID，
 * 因此内层块的 ID 编号小于外层块。</p>
 *
 * <p>for 循环的初始化部分若为变量声明，则在（已标注的）循环体外再包一层块，
 * 使循环变量拥有覆盖整个循环的独立作用域。</p>
 *
 * <p>纯变换：返回新树，不修改输入。每次 {@link #annotate(Program)} 调用都会重置 ID 计数器。</p>
 */
public class ScopeCheckpointAnnotator implements StatementVisitor<Statement, Integer> {

    public static final String SCOPE_ID_PREFIX = "scope_";

    private int scopeCounter;

    public Program annotate(Program program) {
        Objects.requireNonNull(program, "program");
        scopeCounter = 0;
        List<Statement> result = new ArrayList<>(program.getStatements().size());
        for (Statement stmt : program.getStatements()) {
            result.add(transform(stmt, 0));
        }
        return new Program(program.getLocation(), result);
    }

    /** 单独标注一个函数（ID 计数器同样重置） */
    public FunctionDecl annotate(FunctionDecl function) {
        Objects.requireNonNull(function, "function");
        scopeCounter = 0;
        return (FunctionDecl) visitFunctionDecl(function, 0);
    }

    private Statement transform(Statement stmt, int depth) {
        return stmt == null ? null : stmt.accept(this, depth);
    }

    private String nextScopeId() {
        return SCOPE_ID_PREFIX + scopeCounter++;
    }

    // ============ 需要变换的语句 ============

    @Override
    public Statement visitFunctionDecl(FunctionDecl node, Integer depth) {
        Block body = node.getBody() != null
                ? node.getBody()
                : new Block(node.getLocation(), Collections.<Statement>emptyList());
        // 函数体总是深度 0
        return node.withBody((Block) visitBlock(body, 0));
    }

    @Override
    public Statement visitBlock(Block node, Integer depth) {
        List<Statement> children = new ArrayList<>();
        for (Statement stmt : node.getStatements()) {
            if (stmt != null) {
                children.add(transform(stmt, depth + 1));
            }
        }

        // 只收集直接子声明；嵌套块已有自己的检查点
        Set<String> declared = new LinkedHashSet<>();
        for (Statement stmt : children) {
            if (stmt instanceof VarDeclStmt) {
                declared.add(((VarDeclStmt) stmt).getName());
            }
        }

        StartCheckpoint start = new StartCheckpoint(node.getLocation(), nextScopeId(), depth,
                new ArrayList<>(declared));
        List<Statement> wrapped = new ArrayList<>(children.size() + 2);
        wrapped.add(start);
        wrapped.addAll(children);
        wrapped.add(start.toEnd());
        return new Block(node.getLocation(), wrapped);
    }

    @Override
    public Statement visitIfStmt(IfStmt node, Integer depth) {
        return new IfStmt(node.getLocation(), node.getCondition(),
                transform(node.getThenBranch(), depth),
                transform(node.getElseBranch(), depth));
    }

    @Override
    public Statement visitWhileStmt(WhileStmt node, Integer depth) {
        return new WhileStmt(node.getLocation(), node.getCondition(), transform(node.getBody(), depth));
    }

    @Override
    public Statement visitForStmt(ForStmt node, Integer depth) {
        if (!node.declaresLoopVariable()) {
            return new ForStmt(node.getLocation(), node.getInit(), node.getCondition(), node.getUpdate(),
                    transform(node.getBody(), depth));
        }

        // 循环变量作用域包住整个循环体，循环体深一层
        Statement body = transform(node.getBody(), depth + 1);
        String loopVar = ((VarDeclStmt) node.getInit()).getName();
        StartCheckpoint start = new StartCheckpoint(node.getLocation(), nextScopeId(), depth,
                Collections.singletonList(loopVar));
        List<Statement> wrapped = new ArrayList<>(3);
        wrapped.add(start);
        if (body != null) {
            wrapped.add(body);
        }
        wrapped.add(start.toEnd());
        return new ForStmt(node.getLocation(), node.getInit(), node.getCondition(), node.getUpdate(),
                new Block(node.getLocation(), wrapped));
    }

    // ============ 原样保留的语句 ============

    @Override
    public Statement visitReturnStmt(ReturnStmt node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitVarDeclStmt(VarDeclStmt node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitAssignStmt(AssignStmt node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitExpressionStmt(ExpressionStmt node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitBreakStmt(BreakStmt node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitContinueStmt(ContinueStmt node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitEmptyStmt(EmptyStmt node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitStartCheckpoint(StartCheckpoint node, Integer depth) {
        return node;
    }

    @Override
    public Statement visitEndCheckpoint(EndCheckpoint node, Integer depth) {
        return node;
    }
}
