package com.pyastng.compiler.analysis;

import java.util.Iterator;

/**
 * 可以在其上推断属性的值
 */
public interface AttributeOwner extends InferredValue {

    /**
     * 惰性推断属性的候选值
     *
     * @throws InferenceException 属性不存在或无法推断
     */
    Iterator<InferredValue> inferAttribute(String name, InferenceContext context);
}
