package com.tinyc.compiler.ast.decl;

import com.tinyc.compiler.ast.AstNode;
import com.tinyc.compiler.ast.SourceLocation;
import com.tinyc.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）根节点
 */
public class Program extends AstNode {
    private final List<Statement> statements;

    public Program(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements != null ? statements : Collections.<Statement>emptyList();
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /** 顶层函数声明，按出现顺序 */
    public List<FunctionDecl> getFunctions() {
        List<FunctionDecl> result = new ArrayList<>();
        for (Statement stmt : statements) {
            if (stmt instanceof FunctionDecl) {
                result.add((FunctionDecl) stmt);
            }
        }
        return result;
    }
}
