package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;

/**
 * Continue 语句
 */
public class ContinueStmt extends Statement {

    public ContinueStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStmt(this, context);
    }
}
