package com.tinyc.ir.pass;

import com.tinyc.ir.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * CFG 优化 Pass 管线。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<CfgPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线：不可达块删除 → 空块消除 → 块合并。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new UnreachableBlockElimination());
        pipeline.addPass(new EmptyBlockElimination());
        pipeline.addPass(new BlockMerging());
        return pipeline;
    }

    /**
     * 只删除不可达块，保留降级产生的原始块结构。
     */
    public static PassPipeline createUnoptimized() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new UnreachableBlockElimination());
        return pipeline;
    }

    public void addPass(CfgPass pass) {
        passes.add(pass);
    }

    public List<CfgPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public ControlFlowGraph run(ControlFlowGraph cfg) {
        for (CfgPass pass : passes) {
            int before = cfg.size();
            cfg = pass.run(cfg);
            LOG.fine(pass.getName() + " on " + cfg.getFunctionName() + ": " + before + " -> " + cfg.size() + " blocks");
        }
        return cfg;
    }
}
