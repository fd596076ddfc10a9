package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.expr.Expression;

/**
 * 赋值语句：target = value;
 */
public class AssignStmt extends Statement {
    private final String target;
    private final Expression value;

    public AssignStmt(SourceLocation location, String target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public String getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
