package com.pyastng.compiler.analysis;

import com.pyastng.compiler.ast.AstNode;

import java.util.Iterator;

/**
 * 可调用的推断值
 */
public interface CallableValue extends InferredValue {

    /**
     * 惰性推断调用结果
     *
     * @param caller 调用表达式，可为 null
     */
    Iterator<InferredValue> inferCallResult(AstNode caller, InferenceContext context);
}
