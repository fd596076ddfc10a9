package com.tinyc.ir.scope;

/**
 * 作用域中的一个变量槽：名称、相对帧指针的偏移、是否已初始化。
 * 正偏移为调用方传入的参数，负偏移为局部变量。
 */
public final class VariableSlot {
    private final String name;
    private final int offset;
    private boolean initialized;

    public VariableSlot(String name, int offset, boolean initialized) {
        this.name = name;
        this.offset = offset;
        this.initialized = initialized;
    }

    public String getName() { return name; }

    public int getOffset() { return offset; }

    public boolean isInitialized() { return initialized; }

    void markInitialized() {
        this.initialized = true;
    }

    public boolean isParameter() {
        return offset > 0;
    }

    public boolean isLocal() {
        return offset < 0;
    }

    VariableSlot copy() {
        return new VariableSlot(name, offset, initialized);
    }

    @Override
    public String toString() {
        return name + ":" + offset + (initialized ? "*" : "");
    }
}
