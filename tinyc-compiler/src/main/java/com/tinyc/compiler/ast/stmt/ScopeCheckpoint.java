package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 作用域检查点基类。
 *
 * <p>检查点以成对语句的形式插入到代码块首尾，降级到 CFG 后仍保持位置，
 * 汇编生成阶段据此进入/退出作用域并分配栈槽。</p>
 */
public abstract class ScopeCheckpoint extends Statement {
    private final String scopeId;
    private final int depth;
    private final List<String> variableNames;

    protected ScopeCheckpoint(SourceLocation location, String scopeId, int depth, List<String> variableNames) {
        super(location);
        this.scopeId = scopeId;
        this.depth = depth;
        this.variableNames = variableNames != null
                ? Collections.unmodifiableList(new ArrayList<String>(variableNames))
                : Collections.<String>emptyList();
    }

    public String getScopeId() {
        return scopeId;
    }

    public int getDepth() {
        return depth;
    }

    /** 该块直接声明的变量名，按首次声明顺序 */
    public List<String> getVariableNames() {
        return variableNames;
    }
}
