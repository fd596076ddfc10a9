package com.tinyc.ir;

/**
 * 编译选项
 */
public class CompilerOptions {
    private boolean optimize = true;
    private boolean emitComments = false;
    private String entryFunctionName = "main";

    public CompilerOptions() {
    }

    /** 降级后是否执行空块消除与块合并（不可达块删除总是执行） */
    public boolean isOptimize() {
        return optimize;
    }

    public void setOptimize(boolean optimize) {
        this.optimize = optimize;
    }

    /** 是否在汇编中输出注释行 */
    public boolean isEmitComments() {
        return emitComments;
    }

    public void setEmitComments(boolean emitComments) {
        this.emitComments = emitComments;
    }

    /** 程序入口函数名：不生成帧序言，也不恢复 ebp */
    public String getEntryFunctionName() {
        return entryFunctionName;
    }

    public void setEntryFunctionName(String entryFunctionName) {
        this.entryFunctionName = entryFunctionName;
    }
}
