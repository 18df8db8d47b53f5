package com.pyastng.compiler.ast;

/**
 * 闭区间行号范围
 */
public final class LineRange {
    private final int from;
    private final int to;

    public LineRange(int from, int to) {
        this.from = from;
        this.to = to;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public boolean contains(int lineno) {
        return lineno >= from && lineno <= to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineRange)) return false;
        LineRange other = (LineRange) o;
        return from == other.from && to == other.to;
    }

    @Override
    public int hashCode() {
        return 31 * from + to;
    }

    @Override
    public String toString() {
        return from + "-" + to;
    }
}
