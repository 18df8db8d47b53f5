package com.pyastng.compiler.analysis;

/**
 * "无法确定，可能是任何值" 哨兵
 */
public final class Unknown implements InferredValue {

    public static final Unknown INSTANCE = new Unknown();

    private Unknown() {
    }

    @Override
    public String pytype() {
        return "Unknown";
    }

    @Override
    public String qualifiedName() {
        return "Unknown";
    }

    @Override
    public boolean isUnknown() {
        return true;
    }

    @Override
    public String toString() {
        return "Unknown";
    }
}
