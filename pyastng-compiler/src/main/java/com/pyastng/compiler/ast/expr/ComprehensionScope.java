package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.InferenceException;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.analysis.NotFoundException;
import com.pyastng.compiler.analysis.ScopeLookup;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.LocalsTable;
import com.pyastng.compiler.ast.LookupResult;
import com.pyastng.compiler.ast.ScopeNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 拥有独立作用域的推导式（生成器表达式、集合推导式、字典推导式）
 */
public abstract class ComprehensionScope extends Expression implements ScopeNode {
    private final LocalsTable locals = new LocalsTable();
    private final List<Comprehension> generators = new ArrayList<Comprehension>();

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public LocalsTable getLocals() {
        return locals;
    }

    @Override
    public AstNode asNode() {
        return this;
    }

    @Override
    public LookupResult scopeLookup(AstNode node, String name, int offset) {
        return ScopeLookup.lookupLocals(this, node, name, offset);
    }

    @Override
    public List<AstNode> getLocalDefinitions(String name, InferenceContext context) {
        return locals.get(name);
    }

    @Override
    public List<AstNode> getAttribute(String name, InferenceContext context) {
        throw new NotFoundException(name);
    }

    @Override
    public Iterator<InferredValue> inferAttribute(String name, InferenceContext context) {
        throw new InferenceException("推导式没有属性: " + name);
    }
}
