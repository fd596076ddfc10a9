package com.tinyc.ir;

import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.ir.cfg.ControlFlowGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次编译的全部产物：已标注 AST、各函数 CFG 与汇编。
 */
public class CompilationResult {
    private final Program annotatedProgram;
    private final List<ControlFlowGraph> cfgs;
    // 函数名 → 汇编，按声明顺序
    private final Map<String, String> assembly;

    public CompilationResult(Program annotatedProgram, List<ControlFlowGraph> cfgs, Map<String, String> assembly) {
        this.annotatedProgram = annotatedProgram;
        this.cfgs = Collections.unmodifiableList(cfgs);
        this.assembly = Collections.unmodifiableMap(new LinkedHashMap<>(assembly));
    }

    public Program getAnnotatedProgram() {
        return annotatedProgram;
    }

    public List<ControlFlowGraph> getCfgs() {
        return cfgs;
    }

    /** 同名函数取最后一个定义，与 {@link #getAssembly(String)} 一致 */
    public ControlFlowGraph getCfg(String functionName) {
        for (int i = cfgs.size() - 1; i >= 0; i--) {
            if (cfgs.get(i).getFunctionName().equals(functionName)) return cfgs.get(i);
        }
        return null;
    }

    public Map<String, String> getAssembly() {
        return assembly;
    }

    public String getAssembly(String functionName) {
        return assembly.get(functionName);
    }

    /** 完整程序文本：各函数按声明顺序，以空行分隔 */
    public String getProgramText() {
        return String.join("\n\n", assembly.values());
    }

    /** 所有 CFG 的文本转储 */
    public String dumpCfgs() {
        StringBuilder sb = new StringBuilder();
        for (ControlFlowGraph cfg : cfgs) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(cfg);
        }
        return sb.toString();
    }
}
