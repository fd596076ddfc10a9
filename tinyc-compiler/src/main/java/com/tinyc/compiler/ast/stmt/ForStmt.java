package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.expr.Expression;

/**
 * C 风格 for 循环：for (init; condition; update) body
 */
public class ForStmt extends Statement {
    private final Statement init;         // 可选，声明或赋值
    private final Expression condition;   // 可选，缺省为恒真
    private final Statement update;       // 可选
    private final Statement body;

    public ForStmt(SourceLocation location, Statement init, Expression condition,
                   Statement update, Statement body) {
        super(location);
        this.init = init;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public Statement getInit() {
        return init;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getUpdate() {
        return update;
    }

    public Statement getBody() {
        return body;
    }

    /** 初始化部分是否声明了循环变量 */
    public boolean declaresLoopVariable() {
        return init instanceof VarDeclStmt;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
