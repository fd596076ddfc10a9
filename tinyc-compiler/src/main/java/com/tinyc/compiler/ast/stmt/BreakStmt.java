package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
