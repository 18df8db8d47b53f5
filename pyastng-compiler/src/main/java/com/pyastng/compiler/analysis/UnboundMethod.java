package com.pyastng.compiler.analysis;

import com.google.common.collect.Iterators;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.expr.CallExpr;

import java.util.Iterator;

/**
 * 通过类访问得到的方法视图
 */
public class UnboundMethod implements AttributeOwner, CallableValue {

    private final FunctionDecl function;

    public UnboundMethod(FunctionDecl function) {
        this.function = function;
    }

    public FunctionDecl getFunction() {
        return function;
    }

    public boolean isBound() {
        return false;
    }

    @Override
    public String pytype() {
        return Builtins.qualify("instancemethod");
    }

    @Override
    public String qualifiedName() {
        return function.qualifiedName();
    }

    @Override
    public Iterator<InferredValue> inferAttribute(String name, InferenceContext context) {
        if ("im_func".equals(name)) {
            return Inference.single(function);
        }
        return function.inferAttribute(name, context);
    }

    @Override
    public Iterator<InferredValue> inferCallResult(AstNode caller, InferenceContext context) {
        // object.__new__(cls) 得到 cls 的实例
        if ("__new__".equals(function.getName()) && caller instanceof CallExpr
                && !((CallExpr) caller).getArgs().isEmpty()
                && Builtins.qualify("object").equals(function.getParent().frame().asNode().qualifiedName())) {
            AstNode firstArg = ((CallExpr) caller).getArgs().get(0);
            return Iterators.transform(firstArg.infer(context),
                    value -> value instanceof ClassDecl ? new Instance((ClassDecl) value) : value);
        }
        return function.inferCallResult(caller, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return function == ((UnboundMethod) o).function;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(function);
    }

    @Override
    public String toString() {
        return "UnboundMethod " + function.getName();
    }
}
