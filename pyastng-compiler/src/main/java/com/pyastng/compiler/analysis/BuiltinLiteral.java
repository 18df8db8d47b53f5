package com.pyastng.compiler.analysis;

/**
 * 其值是某个内建类实例的字面量节点
 */
public interface BuiltinLiteral extends InferredValue {

    /** 内建模块中对应类的名称 */
    String builtinClassName();
}
