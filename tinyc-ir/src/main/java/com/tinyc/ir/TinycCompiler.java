package com.tinyc.ir;

import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.compiler.scope.ScopeCheckpointAnnotator;
import com.tinyc.ir.backend.AssemblyGenerator;
import com.tinyc.ir.cfg.ControlFlowGraph;
import com.tinyc.ir.pass.PassPipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 编译器门面。
 * 管线：AST → 作用域检查点标注 → CFG（降级 + 优化）→ 栈机汇编。
 */
public class TinycCompiler {

    private static final Logger LOG = Logger.getLogger(TinycCompiler.class.getName());

    private final CompilerOptions options;

    public TinycCompiler() {
        this(new CompilerOptions());
    }

    public TinycCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * 编译未标注的程序。
     */
    public CompilationResult compile(Program program) {
        Objects.requireNonNull(program, "program");
        Program annotated = new ScopeCheckpointAnnotator().annotate(program);
        return compileAnnotated(annotated);
    }

    /**
     * 编译已由标注器处理过的程序。
     */
    public CompilationResult compileAnnotated(Program annotated) {
        PassPipeline pipeline = options.isOptimize()
                ? PassPipeline.createDefault()
                : PassPipeline.createUnoptimized();
        List<ControlFlowGraph> cfgs = new CfgGenerator(pipeline).generate(annotated);

        AssemblyGenerator generator = new AssemblyGenerator(options);
        Map<String, String> assembly = new LinkedHashMap<>();
        for (ControlFlowGraph cfg : cfgs) {
            if (assembly.containsKey(cfg.getFunctionName())) {
                LOG.warning("Duplicate function " + cfg.getFunctionName() + ", later definition wins");
            }
            assembly.put(cfg.getFunctionName(), generator.generate(cfg));
        }
        LOG.fine("Compiled " + cfgs.size() + " functions");
        return new CompilationResult(annotated, cfgs, assembly);
    }
}
