package com.tinyc.compiler.ast.decl;

import com.tinyc.compiler.ast.AstNode;
import com.tinyc.compiler.ast.SourceLocation;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final String dataType;

    public Parameter(SourceLocation location, String name, String dataType) {
        super(location);
        this.name = name;
        this.dataType = dataType;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }
}
