package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 集合推导式
 */
public class SetCompExpr extends ComprehensionScope {
    private AstNode elt;

    public AstNode getElt() {
        return elt;
    }

    public void setElt(AstNode elt) {
        this.elt = elt;
    }

    @Override
    public String getName() {
        return "<setcomp>";
    }

    @Override
    public String pytype() {
        return Builtins.qualify("set");
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, elt);
        children.addAll(getGenerators());
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSetCompExpr(this, context);
    }
}
