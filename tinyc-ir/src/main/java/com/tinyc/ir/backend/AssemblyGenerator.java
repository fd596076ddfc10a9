package com.tinyc.ir.backend;

import com.tinyc.compiler.ast.AstPrinter;
import com.tinyc.compiler.ast.ExpressionVisitor;
import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.decl.FunctionDecl;
import com.tinyc.compiler.ast.expr.*;
import com.tinyc.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tinyc.compiler.ast.stmt.*;
import com.tinyc.ir.CompilerOptions;
import com.tinyc.ir.cfg.BasicBlock;
import com.tinyc.ir.cfg.ControlFlowGraph;
import com.tinyc.ir.scope.ScopeFrame;
import com.tinyc.ir.scope.ScopeManager;
import com.tinyc.ir.scope.ScopeSnapshot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CFG → 栈机汇编。
 *
 * <p>从入口块做深度优先遍历，每个块只生成一次（先到先得）。每条边都传递当前作用域栈的深拷贝，
 * 块进入时恢复该快照，使块内代码与其静态位置对应的活跃变量一致。</p>
 *
 * <p>寄存器约定：eax 为累加器，ebx 为第二操作数，ebp 为帧指针，esp 为栈指针。
 * {@code si n} 把 eax 存到 ebp+n，{@code li n} 从 ebp+n 读入 eax。</p>
 *
 * <p>所有错误都降级处理：作用域不匹配记警告并回退，未解析的标识符取 0，不支持的结构跳过。</p>
 */
public class AssemblyGenerator implements StatementVisitor<Void, Void>, ExpressionVisitor<Void, Boolean> {

    private static final Logger LOG = Logger.getLogger(AssemblyGenerator.class.getName());

    private static final String EAX = "eax";
    private static final String EBX = "ebx";
    private static final String ESP = "esp";
    private static final String EBP = "ebp";

    private final CompilerOptions options;

    // 单次 generate 调用内的状态
    private ControlFlowGraph cfg;
    private ScopeManager scopes;
    private AsmWriter out;
    private Set<String> visited;
    private boolean entryFunction;
    /** 当前语句是否是双后继块的末尾条件（比较结果直接交给条件跳转） */
    private boolean branchCondition;

    public AssemblyGenerator() {
        this(new CompilerOptions());
    }

    public AssemblyGenerator(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * 为单个函数生成汇编文本。
     */
    public String generate(ControlFlowGraph cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.cfg = cfg;
        this.scopes = new ScopeManager();
        this.out = new AsmWriter();
        this.visited = new HashSet<>();
        this.entryFunction = cfg.getFunctionName().equals(options.getEntryFunctionName());
        try {
            visitBlock(cfg.getEntryBlock(), ScopeSnapshot.EMPTY);
            return out.toString();
        } finally {
            this.cfg = null;
            this.scopes = null;
            this.out = null;
            this.visited = null;
        }
    }

    // ============ 块遍历 ============

    private void visitBlock(BasicBlock block, ScopeSnapshot incoming) {
        if (!visited.add(block.getId())) return;
        scopes.restoreSnapshot(incoming);

        out.label(block.getId());
        if (block.isEntry()) {
            if (options.isEmitComments()) {
                out.comment("function " + cfg.getFunctionName() + "(" + String.join(", ", cfg.getParameters()) + ")");
            }
            if (!entryFunction) {
                out.emit("push", EBP);
                out.emit("mov", EBP, ESP);
            }
            scopes.setFunctionParameters(cfg.getParameters());
        }

        List<Statement> statements = block.getStatements();
        int conditionIndex = block.getSuccessors().size() == 2 ? statements.size() - 1 : -1;
        boolean returned = false;
        for (int i = 0; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            branchCondition = i == conditionIndex;
            stmt.accept(this, null);
            if (stmt instanceof ReturnStmt) {
                // 其后的语句（如永不执行的 END）不生成
                returned = true;
                break;
            }
        }
        branchCondition = false;

        ScopeSnapshot snapshot = scopes.getSnapshot();
        block.setScopeSnapshot(snapshot);

        if (returned) {
            out.blank();
            return;
        }
        if (block.isExit()) {
            // 隐式落出函数末尾
            out.emit("mov", EAX, 0);
            emitEpilogue();
            out.blank();
            return;
        }

        List<BasicBlock> successors = cfg.successorsOf(block);
        emitControlTransfer(block, successors);
        out.blank();
        for (BasicBlock succ : successors) {
            visitBlock(succ, snapshot.copy());
        }
    }

    private void emitControlTransfer(BasicBlock block, List<BasicBlock> successors) {
        if (successors.size() == 2) {
            String trueLabel = successors.get(0).getId();
            String falseLabel = successors.get(1).getId();
            ConditionCode cc = rawCondition(block.getLastStatement());
            if (cc != null) {
                out.emit(cc.getJump(), trueLabel);
            } else {
                // 条件已物化为 0/1
                out.emit("cmp", EAX, 0);
                out.emit("jne", trueLabel);
            }
            out.emit("jmp", falseLabel);
        } else if (successors.size() == 1) {
            out.emit("jmp", successors.get(0).getId());
        } else {
            LOG.warning("Block " + block.getId() + " in " + cfg.getFunctionName() + " has no successor");
        }
    }

    /** 条件语句若为比较表达式，返回其条件码；否则 null */
    private static ConditionCode rawCondition(Statement stmt) {
        if (!(stmt instanceof ExpressionStmt)) return null;
        Expression expr = ((ExpressionStmt) stmt).getExpression();
        if (!(expr instanceof BinaryExpr)) return null;
        BinaryOp op = ((BinaryExpr) expr).getOperator();
        return op.isComparison() ? ConditionCode.of(op) : null;
    }

    private void emitEpilogue() {
        int total = scopes.getTotalLocalSlotCount();
        if (total > 0) {
            out.emit("add", ESP, total);
        }
        if (!entryFunction) {
            out.emit("pop", EBP);
        }
        out.emit("mov", EBX, 0);
        out.emit("ret");
    }

    private void emitStore(String name) {
        OptionalInt offset = scopes.getVariableOffset(name);
        if (offset.isPresent()) {
            out.emit("si", offset.getAsInt());
        } else {
            LOG.warning("Store to unresolved variable '" + name + "' in " + cfg.getFunctionName() + " dropped");
        }
    }

    private void emitExpr(Expression expr) {
        if (expr == null) {
            out.emit("mov", EAX, 0);
            return;
        }
        expr.accept(this, Boolean.FALSE);
    }

    private void commentStatement(Statement stmt) {
        if (options.isEmitComments()) {
            out.comment(AstPrinter.print(stmt));
        }
    }

    // ============ 作用域检查点 ============

    @Override
    public Void visitStartCheckpoint(StartCheckpoint node, Void ctx) {
        List<String> names = node.getVariableNames();
        boolean rootWithParams = scopes.isEmpty() && !cfg.getParameters().isEmpty();
        if (rootWithParams) {
            // 根作用域与参数共用一帧
            List<String> merged = new ArrayList<>(cfg.getParameters());
            for (String name : names) {
                if (!merged.contains(name)) merged.add(name);
            }
            names = merged;
        }
        scopes.enterScope(node.getScopeId(), names);
        if (rootWithParams) {
            for (String param : cfg.getParameters()) {
                scopes.markVariableInitialized(param);
            }
        }

        ScopeFrame frame = scopes.getCurrentScope();
        if (options.isEmitComments()) {
            out.comment("enter " + frame);
        }
        int locals = frame.getLocalSlotCount();
        if (locals > 0) {
            out.emit("sub", ESP, locals);
        }
        return null;
    }

    @Override
    public Void visitEndCheckpoint(EndCheckpoint node, Void ctx) {
        int index = scopes.findScope(node.getScopeId());
        if (index < 0) {
            index = scopes.findScopeByLocals(node.getVariableNames());
        }
        if (index < 0) {
            LOG.warning("No open scope matches " + AstPrinter.print(node) + " in " + cfg.getFunctionName());
            return null;
        }
        // 未关闭的内层帧一并弹出，其槽位随本次 add esp 释放
        int locals = 0;
        while (scopes.getDepth() - 1 > index) {
            ScopeFrame dropped = scopes.exitScope();
            locals += dropped.getLocalSlotCount();
            LOG.warning("Unwinding unclosed scope " + dropped.getScopeId() + " before " + node.getScopeId()
                    + " in " + cfg.getFunctionName());
        }
        ScopeFrame frame = scopes.exitScope();
        if (options.isEmitComments()) {
            out.comment("exit " + frame.getScopeId());
        }
        locals += frame.getLocalSlotCount();
        if (locals > 0) {
            out.emit("add", ESP, locals);
        }
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        commentStatement(node);
        scopes.markVariableInitialized(node.getName());
        if (node.hasInitializer()) {
            emitExpr(node.getInitializer());
        } else {
            out.emit("mov", EAX, 0);
        }
        emitStore(node.getName());
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        commentStatement(node);
        emitExpr(node.getValue());
        emitStore(node.getTarget());
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        commentStatement(node);
        Expression expr = node.getExpression();
        if (expr == null) return null;
        expr.accept(this, branchCondition);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        commentStatement(node);
        emitExpr(node.getValue());
        emitEpilogue();
        return null;
    }

    // 跳转由块的后继边生成
    @Override
    public Void visitBreakStmt(BreakStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitEmptyStmt(EmptyStmt node, Void ctx) {
        return null;
    }

    // 以下结构在降级后不应出现在基本块内

    @Override
    public Void visitBlock(Block node, Void ctx) {
        return unsupported(node);
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        return unsupported(node);
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        return unsupported(node);
    }

    @Override
    public Void visitForStmt(ForStmt node, Void ctx) {
        return unsupported(node);
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, Void ctx) {
        return unsupported(node);
    }

    private Void unsupported(Statement node) {
        LOG.warning("Unsupported statement in basic block skipped: " + AstPrinter.print(node));
        return null;
    }

    // ============ 表达式（结果在 eax） ============

    @Override
    public Void visitNumberLiteral(NumberLiteral node, Boolean raw) {
        out.emit("mov", EAX, node.getValue());
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, Boolean raw) {
        OptionalInt offset = scopes.getVariableOffset(node.getName());
        if (offset.isPresent()) {
            out.emit("li", offset.getAsInt());
        } else {
            LOG.warning("Unresolved identifier '" + node.getName() + "' in " + cfg.getFunctionName()
                    + ", defaults to 0");
            out.emit("mov", EAX, 0);
        }
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Boolean raw) {
        BinaryOp op = node.getOperator();
        if (op == BinaryOp.ASSIGN) {
            emitAssignExpr(node);
            return null;
        }
        if (op == BinaryOp.AND || op == BinaryOp.OR) {
            emitLogical(node);
            return null;
        }

        emitExpr(node.getLeft());
        out.emit("push", EAX);
        emitExpr(node.getRight());
        out.emit("mov", EBX, EAX);
        out.emit("pop", EAX);

        switch (op) {
            case ADD:
                out.emit("add", EAX, EBX);
                break;
            case SUB:
                out.emit("sub", EAX, EBX);
                break;
            case MUL:
                out.emit("imul", EAX, EBX);
                break;
            case DIV:
                out.emit("idiv", EAX, EBX);
                break;
            case MOD:
                // a % b = a - (a / b) * b
                out.emit("push", EAX);
                out.emit("idiv", EAX, EBX);
                out.emit("imul", EAX, EBX);
                out.emit("mov", EBX, EAX);
                out.emit("pop", EAX);
                out.emit("sub", EAX, EBX);
                break;
            default:
                ConditionCode cc = ConditionCode.of(op);
                out.emit("cmp", EAX, EBX);
                if (!Boolean.TRUE.equals(raw)) {
                    out.emit(cc.getSet(), "al");
                    out.emit("and", EAX, 1);
                }
                break;
        }
        return null;
    }

    private void emitAssignExpr(BinaryExpr node) {
        emitExpr(node.getRight());
        if (node.getLeft() instanceof Identifier) {
            emitStore(((Identifier) node.getLeft()).getName());
        } else {
            LOG.warning("Assignment target is not a variable: " + AstPrinter.print(node));
        }
    }

    /** && / || 不短路：两侧都归一化为 0/1 */
    private void emitLogical(BinaryExpr node) {
        emitExpr(node.getLeft());
        emitNormalize();
        out.emit("push", EAX);
        emitExpr(node.getRight());
        emitNormalize();
        out.emit("mov", EBX, EAX);
        out.emit("pop", EAX);
        if (node.getOperator() == BinaryOp.AND) {
            out.emit("imul", EAX, EBX);
        } else {
            out.emit("add", EAX, EBX);
            emitNormalize();
        }
    }

    private void emitNormalize() {
        out.emit("cmp", EAX, 0);
        out.emit("setne", "al");
        out.emit("and", EAX, 1);
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Boolean raw) {
        emitExpr(node.getOperand());
        switch (node.getOperator()) {
            case NEG:
                out.emit("mov", EBX, EAX);
                out.emit("mov", EAX, 0);
                out.emit("sub", EAX, EBX);
                break;
            case NOT:
                out.emit("cmp", EAX, 0);
                out.emit("sete", "al");
                out.emit("and", EAX, 1);
                break;
            default:
                break;
        }
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Boolean raw) {
        List<Expression> args = node.getArguments();
        // 参数从右向左压栈，第一个参数离帧指针最近
        for (int i = args.size() - 1; i >= 0; i--) {
            emitExpr(args.get(i));
            out.emit("push", EAX);
        }
        out.emit("call", node.getCallee());
        if (!args.isEmpty()) {
            out.emit("add", ESP, args.size());
        }
        return null;
    }
}
