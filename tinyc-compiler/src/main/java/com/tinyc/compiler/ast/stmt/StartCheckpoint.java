package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;

import java.util.List;

/**
 * 作用域开始标记
 */
public class StartCheckpoint extends ScopeCheckpoint {

    public StartCheckpoint(SourceLocation location, String scopeId, int depth, List<String> variableNames) {
        super(location, scopeId, depth, variableNames);
    }

    /** 与之配对的结束标记 */
    public EndCheckpoint toEnd() {
        return new EndCheckpoint(location, getScopeId(), getDepth(), getVariableNames());
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitStartCheckpoint(this, context);
    }
}
