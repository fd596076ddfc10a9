package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.AstNode;
import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StatementVisitor<R, C> visitor, C context);
}
