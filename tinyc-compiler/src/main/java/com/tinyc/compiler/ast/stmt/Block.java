package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    /** 语句列表；上游缺失时返回空列表 */
    public List<Statement> getStatements() {
        return statements != null ? statements : Collections.<Statement>emptyList();
    }

    public boolean isEmpty() {
        return getStatements().isEmpty();
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
