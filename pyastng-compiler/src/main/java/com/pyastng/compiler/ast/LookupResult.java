package com.pyastng.compiler.ast;

import java.util.Collections;
import java.util.List;

/**
 * 名称查找结果：找到绑定的作用域及其中可见的绑定节点
 */
public final class LookupResult {

    private final ScopeNode scope;
    private final List<AstNode> bindings;

    public LookupResult(ScopeNode scope, List<AstNode> bindings) {
        this.scope = scope;
        this.bindings = bindings == null ? Collections.<AstNode>emptyList() : bindings;
    }

    public ScopeNode getScope() {
        return scope;
    }

    public List<AstNode> getBindings() {
        return bindings;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }
}
