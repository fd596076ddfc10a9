package com.tinyc.ir.pass;

import com.tinyc.ir.cfg.BasicBlock;
import com.tinyc.ir.cfg.ControlFlowGraph;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;

/**
 * 删除不可达基本块。
 * 从入口块开始做 BFS 可达性分析，移除所有不可达的块。出口块作为哨兵始终保留。
 */
public class UnreachableBlockElimination implements CfgPass {

    @Override
    public String getName() {
        return "UnreachableBlockElimination";
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph cfg) {
        Set<String> reachable = new HashSet<>();
        Queue<BasicBlock> worklist = new ArrayDeque<>();

        BasicBlock entry = cfg.getEntryBlock();
        reachable.add(entry.getId());
        worklist.add(entry);

        while (!worklist.isEmpty()) {
            BasicBlock block = worklist.poll();
            for (BasicBlock succ : cfg.successorsOf(block)) {
                if (reachable.add(succ.getId())) {
                    worklist.add(succ);
                }
            }
        }

        for (BasicBlock block : cfg.getBlocks()) {
            if (!reachable.contains(block.getId()) && !block.isExit()) {
                cfg.removeBlock(block);
            }
        }
        return cfg;
    }
}
