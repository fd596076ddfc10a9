package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;

import java.util.List;

/**
 * 作用域结束标记
 */
public class EndCheckpoint extends ScopeCheckpoint {

    public EndCheckpoint(SourceLocation location, String scopeId, int depth, List<String> variableNames) {
        super(location, scopeId, depth, variableNames);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitEndCheckpoint(this, context);
    }
}
