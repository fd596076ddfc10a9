package com.tinyc.ir.pass;

import com.tinyc.ir.cfg.BasicBlock;
import com.tinyc.ir.cfg.ControlFlowGraph;

import java.util.List;
import java.util.logging.Logger;

/**
 * 合并单前驱/单后继基本块。
 * 如果块 A 的唯一后继是块 B，且 B 的唯一前驱是 A，则把 B 的语句和后继并入 A，反复执行直到不动点。
 *
 * <p>出口块与入口块不参与被合并（出口块保持空哨兵，return 块的唯一后继仍是出口块）。</p>
 */
public class BlockMerging implements CfgPass {

    private static final Logger LOG = Logger.getLogger(BlockMerging.class.getName());

    @Override
    public String getName() {
        return "BlockMerging";
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph cfg) {
        boolean changed = true;
        int merged = 0;
        while (changed) {
            changed = false;
            for (BasicBlock block : cfg.getBlocks()) {
                if (!cfg.contains(block.getId()) || block.isExit()) continue;
                if (tryMerge(cfg, block)) {
                    changed = true;
                    merged++;
                }
            }
        }
        if (merged > 0) {
            LOG.fine("Merged " + merged + " blocks in " + cfg.getFunctionName());
        }
        return cfg;
    }

    private boolean tryMerge(ControlFlowGraph cfg, BasicBlock block) {
        List<BasicBlock> succs = cfg.successorsOf(block);
        if (succs.size() != 1) return false;
        BasicBlock next = succs.get(0);
        if (next == block || next.isExit() || next.isEntry()) return false;
        if (next.getPredecessors().size() != 1) return false;

        block.addStatements(next.getStatements());
        List<BasicBlock> nextSuccs = cfg.successorsOf(next);
        cfg.removeBlock(next);
        for (BasicBlock succ : nextSuccs) {
            cfg.connect(block, succ);
        }
        return true;
    }
}
