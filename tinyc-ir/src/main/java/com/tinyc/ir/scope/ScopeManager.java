package com.tinyc.ir.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * 词法作用域栈与栈帧偏移分配。
 *
 * <p>帧布局（栈向低地址增长）：参数 i 位于 {@code ebp + 2 + i}（中间隔着返回地址和保存的 ebp），
 * 局部变量从 {@code ebp - 1} 开始依次向下分配，偏移 = -(外层已分配局部槽数 + 本层已分配数 + 1)。</p>
 *
 * <p>变量只有在声明语句处理后才算已初始化；查找时跳过内层未初始化的同名槽，
 * 落到外层已初始化的声明上，即按声明顺序而非纯词法块决定遮蔽。</p>
 *
 * <p>实例只属于一次汇编生成调用，不是线程安全的。</p>
 */
public class ScopeManager {

    private static final Logger LOG = Logger.getLogger(ScopeManager.class.getName());

    // 栈底在前
    private List<ScopeFrame> frames = new ArrayList<>();
    private List<String> parameters = Collections.emptyList();

    public void setFunctionParameters(List<String> names) {
        this.parameters = names != null ? new ArrayList<>(names) : Collections.<String>emptyList();
    }

    public List<String> getFunctionParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public boolean isParameter(String name) {
        return parameters.contains(name);
    }

    /**
     * 压入新帧并分配偏移。名单中的参数名取参数偏移且视为已初始化，其余为局部变量，未初始化。
     */
    public void enterScope(String scopeId, List<String> names) {
        ScopeFrame frame = new ScopeFrame(scopeId);
        int allocatedBefore = getTotalLocalSlotCount();
        int localIndex = 0;
        for (String name : names) {
            if (frame.find(name) != null) continue;
            int paramIndex = parameters.indexOf(name);
            if (paramIndex >= 0) {
                frame.addSlot(new VariableSlot(name, paramIndex + 2, true));
            } else {
                frame.addSlot(new VariableSlot(name, -(allocatedBefore + localIndex + 1), false));
                localIndex++;
            }
        }
        frames.add(frame);
    }

    /**
     * 弹出栈顶帧。栈为空时记录警告并忽略。
     */
    public ScopeFrame exitScope() {
        if (frames.isEmpty()) {
            LOG.warning("exitScope on empty scope stack");
            return null;
        }
        return frames.remove(frames.size() - 1);
    }

    /** 由内向外查找第一个同名槽并标记为已初始化 */
    public void markVariableInitialized(String name) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            VariableSlot slot = frames.get(i).find(name);
            if (slot != null) {
                slot.markInitialized();
                return;
            }
        }
    }

    /**
     * 解析变量偏移：参数优先；否则由内向外返回第一个已初始化的同名槽。
     */
    public OptionalInt getVariableOffset(String name) {
        int paramIndex = parameters.indexOf(name);
        if (paramIndex >= 0) {
            return OptionalInt.of(paramIndex + 2);
        }
        for (int i = frames.size() - 1; i >= 0; i--) {
            VariableSlot slot = frames.get(i).find(name);
            if (slot != null && slot.isInitialized()) {
                return OptionalInt.of(slot.getOffset());
            }
        }
        return OptionalInt.empty();
    }

    /** 所有帧的局部槽总数，用于 return 前释放栈空间 */
    public int getTotalLocalSlotCount() {
        int total = 0;
        for (ScopeFrame frame : frames) {
            total += frame.getLocalSlotCount();
        }
        return total;
    }

    public int getDepth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public ScopeFrame getCurrentScope() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    /** 栈底在前的帧列表（只读视图） */
    public List<ScopeFrame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * 自栈顶向下查找 scopeId 对应帧的下标（栈底为 0），找不到返回 -1。
     */
    public int findScope(String scopeId) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).getScopeId().equals(scopeId)) return i;
        }
        return -1;
    }

    /**
     * 自栈顶向下查找局部变量名单完全一致的帧，找不到返回 -1。
     */
    public int findScopeByLocals(List<String> localNames) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).getLocalNames().equals(localNames)) return i;
        }
        return -1;
    }

    public ScopeSnapshot getSnapshot() {
        return new ScopeSnapshot(frames);
    }

    public void restoreSnapshot(ScopeSnapshot snapshot) {
        this.frames = snapshot != null ? snapshot.restoreFrames() : new ArrayList<ScopeFrame>();
    }

    @Override
    public String toString() {
        return "ScopeManager" + frames;
    }
}
