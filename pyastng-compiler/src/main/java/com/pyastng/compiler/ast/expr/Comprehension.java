package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 推导式中的一个 {@code for target in iter if cond...} 子句
 */
public class Comprehension extends AstNode {
    private AstNode target;
    private AstNode iter;
    private final List<AstNode> ifs = new ArrayList<AstNode>();

    public AstNode getTarget() {
        return target;
    }

    public void setTarget(AstNode target) {
        this.target = target;
    }

    public AstNode getIter() {
        return iter;
    }

    public void setIter(AstNode iter) {
        this.iter = iter;
    }

    public List<AstNode> getIfs() {
        return ifs;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, target);
        addChild(children, iter);
        children.addAll(ifs);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehension(this, context);
    }
}
