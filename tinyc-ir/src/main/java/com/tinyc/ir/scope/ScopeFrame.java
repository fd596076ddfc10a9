package com.tinyc.ir.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 作用域栈中的一帧，对应一对作用域检查点。
 */
public final class ScopeFrame {
    private final String scopeId;
    private final List<VariableSlot> slots = new ArrayList<>();

    public ScopeFrame(String scopeId) {
        this.scopeId = scopeId;
    }

    public String getScopeId() { return scopeId; }

    public List<VariableSlot> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    void addSlot(VariableSlot slot) {
        slots.add(slot);
    }

    public VariableSlot find(String name) {
        for (VariableSlot slot : slots) {
            if (slot.getName().equals(name)) return slot;
        }
        return null;
    }

    /** 本帧占用的局部栈槽数（不含参数） */
    public int getLocalSlotCount() {
        int count = 0;
        for (VariableSlot slot : slots) {
            if (slot.isLocal()) count++;
        }
        return count;
    }

    /** 本帧局部变量名，按分配顺序 */
    public List<String> getLocalNames() {
        List<String> names = new ArrayList<>();
        for (VariableSlot slot : slots) {
            if (slot.isLocal()) names.add(slot.getName());
        }
        return names;
    }

    ScopeFrame copy() {
        ScopeFrame frame = new ScopeFrame(scopeId);
        for (VariableSlot slot : slots) {
            frame.slots.add(slot.copy());
        }
        return frame;
    }

    @Override
    public String toString() {
        return scopeId + slots;
    }
}
