package com.tinyc.ir.pass;

import com.tinyc.ir.cfg.ControlFlowGraph;

/**
 * CFG 优化 pass 接口。
 */
public interface CfgPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对单个函数的 CFG 执行变换（原地修改）。
     */
    ControlFlowGraph run(ControlFlowGraph cfg);
}
