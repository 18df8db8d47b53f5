package com.pyastng.compiler.analysis;

/**
 * 推断结果中的一个候选值：语法节点、实例、方法视图或 {@link Unknown}
 */
public interface InferredValue {

    /** 值的类型的限定名，如 {@code __builtin__.int} */
    String pytype();

    /** 值本身的限定名 */
    String qualifiedName();

    default boolean isUnknown() {
        return false;
    }
}
