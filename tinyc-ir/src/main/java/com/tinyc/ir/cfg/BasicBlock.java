package com.tinyc.ir.cfg;

import com.tinyc.compiler.ast.AstPrinter;
import com.tinyc.compiler.ast.stmt.BreakStmt;
import com.tinyc.compiler.ast.stmt.ContinueStmt;
import com.tinyc.compiler.ast.stmt.ReturnStmt;
import com.tinyc.compiler.ast.stmt.Statement;
import com.tinyc.ir.scope.ScopeSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CFG 基本块。
 *
 * <p>块由 {@link ControlFlowGraph} 持有；前驱/后继以块 ID 记录，边的增删统一经由图完成。
 * 后继顺序有意义：双后继块的第一个后继是条件为真的目标。</p>
 */
public class BasicBlock {

    private final String id;
    private final boolean entry;
    private final boolean exit;
    private final List<Statement> statements = new ArrayList<>();
    final List<String> predecessors = new ArrayList<>();
    final List<String> successors = new ArrayList<>();
    /** 汇编生成后记录的作用域快照（诊断用） */
    private ScopeSnapshot scopeSnapshot;

    BasicBlock(String id, boolean entry, boolean exit) {
        this.id = id;
        this.entry = entry;
        this.exit = exit;
    }

    public String getId() { return id; }

    public boolean isEntry() { return entry; }

    public boolean isExit() { return exit; }

    public List<Statement> getStatements() { return statements; }

    public void addStatement(Statement stmt) {
        statements.add(stmt);
    }

    public void addStatements(List<Statement> stmts) {
        statements.addAll(stmts);
    }

    public void insertStatement(int index, Statement stmt) {
        statements.add(index, stmt);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public Statement getLastStatement() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    public boolean endsWithReturn() {
        return getLastStatement() instanceof ReturnStmt;
    }

    /** 以 return/break/continue 结尾：同一语句序列中其后的语句不可达 */
    public boolean isTerminated() {
        Statement last = getLastStatement();
        return last instanceof ReturnStmt || last instanceof BreakStmt || last instanceof ContinueStmt;
    }

    public List<String> getPredecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    public List<String> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public ScopeSnapshot getScopeSnapshot() { return scopeSnapshot; }

    public void setScopeSnapshot(ScopeSnapshot scopeSnapshot) {
        this.scopeSnapshot = scopeSnapshot;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id);
        if (entry) sb.append(" [entry]");
        if (exit) sb.append(" [exit]");
        sb.append(":\n");
        for (Statement stmt : statements) {
            sb.append("  ").append(AstPrinter.print(stmt)).append('\n');
        }
        sb.append("  preds: ").append(predecessors).append('\n');
        sb.append("  succs: ").append(successors).append('\n');
        return sb.toString();
    }
}
