package com.tinyc.compiler.ast.stmt;

import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.StatementVisitor;
import com.tinyc.compiler.ast.expr.Expression;

/**
 * 变量声明：int x = expr;
 */
public class VarDeclStmt extends Statement {
    private final String name;
    private final String dataType;
    private final Expression initializer;  // 可选

    public VarDeclStmt(SourceLocation location, String name, String dataType, Expression initializer) {
        super(location);
        this.name = name;
        this.dataType = dataType;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVarDeclStmt(this, context);
    }
}
