package com.pyastng.compiler.analysis;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.decl.FunctionDecl;

import java.util.Iterator;
import java.util.Objects;

/**
 * 绑定到实例（普通方法）或类（classmethod）的方法视图
 */
public class BoundMethod extends UnboundMethod {

    private final InferredValue bound;

    public BoundMethod(FunctionDecl function, InferredValue bound) {
        super(function);
        this.bound = bound;
    }

    /** 绑定的接收者：{@link Instance} 或类节点 */
    public InferredValue getBound() {
        return bound;
    }

    @Override
    public boolean isBound() {
        return true;
    }

    @Override
    public Iterator<InferredValue> inferCallResult(AstNode caller, InferenceContext context) {
        return getFunction().inferCallResult(caller, context);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(bound, ((BoundMethod) o).bound);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(bound);
    }

    @Override
    public String toString() {
        return "BoundMethod " + getFunction().getName() + " of " + bound;
    }
}
