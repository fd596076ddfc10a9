package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;

/**
 * 空语句（单独的分号）
 */
public class EmptyStmt extends Statement {

    public EmptyStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitEmptyStmt(this, context);
    }
}
