package com.pyastng.compiler.analysis;

import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;

import java.util.Iterator;

/**
 * 调用生成器函数得到的生成器对象
 */
public class GeneratorValue implements AttributeOwner {

    private final FunctionDecl function;

    public GeneratorValue(FunctionDecl function) {
        this.function = function;
    }

    /** 产生本生成器的函数 */
    public FunctionDecl getFunction() {
        return function;
    }

    @Override
    public String pytype() {
        return Builtins.qualify("generator");
    }

    @Override
    public String qualifiedName() {
        return pytype();
    }

    @Override
    public Iterator<InferredValue> inferAttribute(String name, InferenceContext context) {
        ClassDecl generatorClass = Builtins.findClass(function, "generator");
        if (generatorClass == null) {
            throw new InferenceException("内建模块中没有 generator 类");
        }
        return new Instance(generatorClass).inferAttribute(name, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GeneratorValue && ((GeneratorValue) o).function == function;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(function);
    }

    @Override
    public String toString() {
        return "Generator of " + function.getName();
    }
}
