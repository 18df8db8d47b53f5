package com.pyastng.compiler.ast;

import com.pyastng.compiler.analysis.AttributeOwner;
import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.analysis.NotFoundException;

import java.util.Iterator;
import java.util.List;

/**
 * 作用域节点：模块、类、函数/lambda 以及推导式作用域。
 *
 * <p>每个作用域持有自己的 {@link LocalsTable}。</p>
 */
public interface ScopeNode extends AttributeOwner {

    String getName();

    LocalsTable getLocals();

    /** 作用域对应的语法节点（即自身） */
    AstNode asNode();

    /** 登记一个局部绑定 */
    default void setLocal(String name, AstNode binding) {
        getLocals().add(name, binding);
    }

    /**
     * 从 {@code node} 出发在本作用域查找名称；
     * {@code offset} 为 -1 时表示实际查找位置在外层 frame（如基类、默认值表达式）。
     */
    LookupResult scopeLookup(AstNode node, String name, int offset);

    /** 本作用域可见的原始绑定，不存在时返回空列表 */
    List<AstNode> getLocalDefinitions(String name, InferenceContext context);

    /** 属性定义节点，不存在时抛出 {@link NotFoundException} */
    List<AstNode> getAttribute(String name, InferenceContext context);

    /** 惰性推断属性的候选值 */
    @Override
    Iterator<InferredValue> inferAttribute(String name, InferenceContext context);
}
