package com.pyastng.compiler.analysis;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.decl.ClassDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 某个类的实例
 */
public class Instance implements AttributeOwner, CallableValue {

    private final ClassDecl proxied;

    public Instance(ClassDecl proxied) {
        this.proxied = proxied;
    }

    /** 实例所属的类 */
    public ClassDecl getProxied() {
        return proxied;
    }

    @Override
    public String pytype() {
        return proxied.qualifiedName();
    }

    @Override
    public String qualifiedName() {
        return proxied.qualifiedName();
    }

    /**
     * 实例属性定义。
     *
     * @param lookupClass 是否同时返回类上的定义
     * @throws NotFoundException 属性不存在
     */
    public List<AstNode> getAttribute(String name, InferenceContext context, boolean lookupClass) {
        List<AstNode> values;
        try {
            values = proxied.instanceAttr(name, context);
        } catch (NotFoundException e) {
            if ("__class__".equals(name)) {
                return Collections.<AstNode>singletonList(proxied);
            }
            if ("__name__".equals(name)) {
                throw e;
            }
            if (lookupClass) {
                return proxied.getAttribute(name, context);
            }
            throw e;
        }
        if (!lookupClass) {
            return values;
        }
        List<AstNode> merged = new ArrayList<AstNode>(values);
        merged.addAll(proxied.findAttribute(name, context));
        return merged;
    }

    @Override
    public Iterator<InferredValue> inferAttribute(String name, InferenceContext context) {
        final InferenceContext ctx = InferenceContext.orNew(context).withLookupName(name);
        List<AstNode> attributes;
        try {
            attributes = getAttribute(name, ctx, false);
        } catch (NotFoundException e) {
            // 回退到类上的推断，它会处理描述符
            return wrapAttributes(proxied.inferAttribute(name, ctx), ctx);
        }
        return wrapAttributes(Inference.inferStatements(attributes, ctx, this), ctx);
    }

    /** 方法绑定到本实例；property 直接取其调用结果 */
    private Iterator<InferredValue> wrapAttributes(Iterator<InferredValue> values, final InferenceContext ctx) {
        return Iterators.concat(Iterators.transform(values, value -> {
            if (value instanceof UnboundMethod && !(value instanceof BoundMethod)) {
                final UnboundMethod method = (UnboundMethod) value;
                if (method.getFunction().decoratorNames().contains(Builtins.PROPERTY)) {
                    return Inference.orUnknown(() -> method.inferCallResult(null, ctx));
                }
                return Inference.single(new BoundMethod(method.getFunction(), Instance.this));
            }
            return Inference.single(value);
        }));
    }

    /** 通过类的 {@code __call__} 推断调用结果 */
    @Override
    public Iterator<InferredValue> inferCallResult(final AstNode caller, final InferenceContext context) {
        final Iterator<InferredValue> callables = proxied.inferAttribute("__call__", context);
        return new AbstractIterator<InferredValue>() {
            private Iterator<InferredValue> current = Collections.emptyIterator();
            private boolean inferred;

            @Override
            protected InferredValue computeNext() {
                while (true) {
                    if (current.hasNext()) {
                        inferred = true;
                        return current.next();
                    }
                    if (!callables.hasNext()) {
                        if (!inferred) {
                            throw new InferenceException(qualifiedName() + " 的实例不可调用");
                        }
                        return endOfData();
                    }
                    InferredValue callable = callables.next();
                    if (callable instanceof CallableValue) {
                        current = ((CallableValue) callable).inferCallResult(caller, context);
                    }
                }
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return proxied == ((Instance) o).proxied;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(proxied);
    }

    @Override
    public String toString() {
        return "Instance of " + proxied.qualifiedName();
    }
}
