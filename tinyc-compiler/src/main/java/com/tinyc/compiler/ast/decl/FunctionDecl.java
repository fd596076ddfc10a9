package com.tinyc.compiler.ast.decl;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.stmt.Block;
import com.tinyc.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明
 */
public class FunctionDecl extends Statement {
    private final String name;
    private final String returnType;
    private final List<Parameter> params;
    private final Block body;

    public FunctionDecl(SourceLocation location, String name, String returnType,
                        List<Parameter> params, Block body) {
        super(location);
        this.name = name;
        this.returnType = returnType;
        this.params = params != null ? params : Collections.<Parameter>emptyList();
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public String getReturnType() {
        return returnType;
    }

    public List<Parameter> getParams() {
        return params;
    }

    /** 参数名列表，按声明位置 */
    public List<String> getParamNames() {
        List<String> names = new ArrayList<>(params.size());
        for (Parameter p : params) {
            names.add(p.getName());
        }
        return names;
    }

    public Block getBody() {
        return body;
    }

    /** 返回替换了函数体的副本 */
    public FunctionDecl withBody(Block newBody) {
        return new FunctionDecl(location, name, returnType, params, newBody);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
