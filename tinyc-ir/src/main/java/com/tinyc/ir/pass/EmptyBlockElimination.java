package com.tinyc.ir.pass;

import com.tinyc.ir.cfg.BasicBlock;
import com.tinyc.ir.cfg.ControlFlowGraph;

import java.util.List;

/**
 * 消除空块：没有语句的非入口/出口块，把前驱直接接到后继上。
 *
 * <p>替换边时保持其在前驱后继列表中的位置，条件块的真/假分支顺序不会被交换。
 * 多前驱且多后继的空块无法拼接，保持不变。</p>
 */
public class EmptyBlockElimination implements CfgPass {

    @Override
    public String getName() {
        return "EmptyBlockElimination";
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph cfg) {
        for (BasicBlock block : cfg.getBlocks()) {
            if (block.isEntry() || block.isExit() || !block.isEmpty()) continue;
            if (!cfg.contains(block.getId())) continue;

            List<BasicBlock> preds = cfg.predecessorsOf(block);
            List<BasicBlock> succs = cfg.successorsOf(block);
            if (succs.contains(block) || preds.contains(block)) continue;

            if (succs.size() == 1) {
                BasicBlock target = succs.get(0);
                for (BasicBlock pred : preds) {
                    cfg.replaceSuccessor(pred, block, target);
                }
                cfg.removeBlock(block);
            } else if (preds.size() == 1 && succs.size() > 1) {
                BasicBlock pred = preds.get(0);
                if (pred.getSuccessors().size() != 1) continue;
                // 前驱唯一后继即本块：直接继承本块的后继列表
                cfg.disconnect(pred, block);
                for (BasicBlock succ : succs) {
                    cfg.connect(pred, succ);
                }
                cfg.removeBlock(block);
            } else if (succs.isEmpty() && preds.isEmpty()) {
                cfg.removeBlock(block);
            }
        }
        return cfg;
    }
}
