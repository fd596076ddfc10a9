package com.tinyc.ir.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个函数的控制流图。
 *
 * <p>块按 ID 存放在有序表中（创建顺序），边只保存 ID，不持有块引用，回边不会形成对象环。
 * 入口块 ID 即函数名，其余块为 {@code <函数名>_block_<n>}，出口块是第一个生成的编号块。</p>
 */
public class ControlFlowGraph {

    private final String functionName;
    private final List<String> parameters;
    private final Map<String, BasicBlock> blocks = new LinkedHashMap<>();
    private final String entryId;
    private final String exitId;
    private int blockCounter = 0;

    public ControlFlowGraph(String functionName, List<String> parameters) {
        this.functionName = functionName;
        this.parameters = parameters != null
                ? Collections.unmodifiableList(new ArrayList<>(parameters))
                : Collections.<String>emptyList();
        BasicBlock entry = new BasicBlock(functionName, true, false);
        blocks.put(entry.getId(), entry);
        this.entryId = entry.getId();
        BasicBlock exit = new BasicBlock(nextBlockId(), false, true);
        blocks.put(exit.getId(), exit);
        this.exitId = exit.getId();
    }

    private String nextBlockId() {
        return functionName + "_block_" + blockCounter++;
    }

    /** 创建并登记一个新的空块 */
    public BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(nextBlockId(), false, false);
        blocks.put(block.getId(), block);
        return block;
    }

    public String getFunctionName() { return functionName; }

    public List<String> getParameters() { return parameters; }

    public BasicBlock getEntryBlock() { return blocks.get(entryId); }

    public BasicBlock getExitBlock() { return blocks.get(exitId); }

    public boolean contains(String id) {
        return blocks.containsKey(id);
    }

    /** 所有块，按创建顺序 */
    public List<BasicBlock> getBlocks() {
        return new ArrayList<>(blocks.values());
    }

    public int size() {
        return blocks.size();
    }

    public List<BasicBlock> successorsOf(BasicBlock block) {
        List<BasicBlock> result = new ArrayList<>(block.successors.size());
        for (String id : block.successors) {
            result.add(blocks.get(id));
        }
        return result;
    }

    public List<BasicBlock> predecessorsOf(BasicBlock block) {
        List<BasicBlock> result = new ArrayList<>(block.predecessors.size());
        for (String id : block.predecessors) {
            result.add(blocks.get(id));
        }
        return result;
    }

    // ============ 边操作 ============

    /** 追加边 from → to；已存在时忽略 */
    public void connect(BasicBlock from, BasicBlock to) {
        if (!from.successors.contains(to.getId())) {
            from.successors.add(to.getId());
        }
        if (!to.predecessors.contains(from.getId())) {
            to.predecessors.add(from.getId());
        }
    }

    public void disconnect(BasicBlock from, BasicBlock to) {
        from.successors.remove(to.getId());
        to.predecessors.remove(from.getId());
    }

    /**
     * 把 from 指向 oldTarget 的边改为指向 newTarget，保持其在后继列表中的位置。
     * 若 newTarget 已是后继，则只删除旧边。
     */
    public void replaceSuccessor(BasicBlock from, BasicBlock oldTarget, BasicBlock newTarget) {
        int index = from.successors.indexOf(oldTarget.getId());
        if (index < 0) return;
        from.successors.remove(index);
        oldTarget.predecessors.remove(from.getId());
        if (!from.successors.contains(newTarget.getId())) {
            from.successors.add(index, newTarget.getId());
        }
        if (!newTarget.predecessors.contains(from.getId())) {
            newTarget.predecessors.add(from.getId());
        }
    }

    /** 删除块及其所有关联边；入口/出口块不可删除 */
    public void removeBlock(BasicBlock block) {
        if (block.isEntry() || block.isExit()) {
            throw new IllegalArgumentException("Cannot remove sentinel block: " + block.getId());
        }
        for (String succ : new ArrayList<>(block.successors)) {
            BasicBlock target = blocks.get(succ);
            if (target != null) {
                target.predecessors.remove(block.getId());
            }
        }
        for (String pred : new ArrayList<>(block.predecessors)) {
            BasicBlock source = blocks.get(pred);
            if (source != null) {
                source.successors.remove(block.getId());
            }
        }
        block.successors.clear();
        block.predecessors.clear();
        blocks.remove(block.getId());
    }

    /** 去重后的边列表，按块创建顺序与后继顺序 */
    public List<CfgEdge> getEdges() {
        List<CfgEdge> edges = new ArrayList<>();
        for (BasicBlock block : blocks.values()) {
            for (String succ : block.successors) {
                CfgEdge edge = new CfgEdge(block.getId(), succ);
                if (!edges.contains(edge)) {
                    edges.add(edge);
                }
            }
        }
        return edges;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("cfg ").append(functionName).append('(').append(String.join(", ", parameters)).append(")\n");
        for (BasicBlock block : blocks.values()) {
            sb.append(block);
        }
        return sb.toString();
    }
}
