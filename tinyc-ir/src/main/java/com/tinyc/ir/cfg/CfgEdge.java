package com.tinyc.ir.cfg;

import java.util.Objects;

/**
 * CFG 有向边（按块 ID）。
 */
public final class CfgEdge {
    private final String from;
    private final String to;

    public CfgEdge(String from, String to) {
        this.from = from;
        this.to = to;
    }

    public String getFrom() { return from; }

    public String getTo() { return to; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CfgEdge)) return false;
        CfgEdge other = (CfgEdge) o;
        return from.equals(other.from) && to.equals(other.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
