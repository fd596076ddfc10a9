package com.tinyc.ir;

import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.ir.cfg.ControlFlowGraph;
import com.tinyc.ir.lowering.AstToCfgLowering;
import com.tinyc.ir.pass.PassPipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 已标注程序 → 每个函数一张 CFG（降级 + 优化 pass）。
 */
public class CfgGenerator {

    private final PassPipeline pipeline;

    public CfgGenerator() {
        this(PassPipeline.createDefault());
    }

    public CfgGenerator(PassPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    public List<ControlFlowGraph> generate(Program annotatedProgram) {
        List<ControlFlowGraph> lowered = new AstToCfgLowering().lower(annotatedProgram);
        List<ControlFlowGraph> result = new ArrayList<>(lowered.size());
        for (ControlFlowGraph cfg : lowered) {
            result.add(pipeline.run(cfg));
        }
        return result;
    }
}
