package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 列表推导式；循环变量绑定在外层作用域
 */
public class ListCompExpr extends Expression {
    private AstNode elt;
    private final List<Comprehension> generators = new ArrayList<Comprehension>();

    public AstNode getElt() {
        return elt;
    }

    public void setElt(AstNode elt) {
        this.elt = elt;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public String pytype() {
        return Builtins.qualify("list");
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, elt);
        children.addAll(generators);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListCompExpr(this, context);
    }
}
