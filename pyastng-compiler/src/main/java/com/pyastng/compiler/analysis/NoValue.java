package com.pyastng.compiler.analysis;

/**
 * 裸 return 的结果
 */
public final class NoValue implements InferredValue {

    public static final NoValue INSTANCE = new NoValue();

    private NoValue() {
    }

    @Override
    public String pytype() {
        return Builtins.qualify("NoneType");
    }

    @Override
    public String qualifiedName() {
        return "None";
    }

    @Override
    public String toString() {
        return "NoValue";
    }
}
