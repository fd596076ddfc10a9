package com.tinyc.ir.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 作用域栈的不可变深拷贝。
 *
 * <p>汇编生成沿 CFG 的每条边传递一份独立快照，兄弟分支互不可见对方的作用域变化。</p>
 */
public final class ScopeSnapshot {

    public static final ScopeSnapshot EMPTY = new ScopeSnapshot(Collections.<ScopeFrame>emptyList());

    // 栈底在前
    private final List<ScopeFrame> frames;

    ScopeSnapshot(List<ScopeFrame> frames) {
        List<ScopeFrame> copied = new ArrayList<>(frames.size());
        for (ScopeFrame frame : frames) {
            copied.add(frame.copy());
        }
        this.frames = Collections.unmodifiableList(copied);
    }

    /** 栈底在前的帧列表（只读视图） */
    public List<ScopeFrame> getFrames() {
        return frames;
    }

    public int depth() {
        return frames.size();
    }

    /** 再做一次深拷贝 */
    public ScopeSnapshot copy() {
        return new ScopeSnapshot(frames);
    }

    List<ScopeFrame> restoreFrames() {
        List<ScopeFrame> result = new ArrayList<>(frames.size());
        for (ScopeFrame frame : frames) {
            result.add(frame.copy());
        }
        return result;
    }

    @Override
    public String toString() {
        return frames.toString();
    }
}
