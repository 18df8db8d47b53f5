package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * for 循环
 */
public class ForStmt extends Statement {
    private AstNode target;
    private AstNode iter;
    private final List<AstNode> body = new ArrayList<AstNode>();
    private final List<AstNode> orelse = new ArrayList<AstNode>();

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

    public List<AstNode> getBody() {
        return body;
    }

    public List<AstNode> getOrelse() {
        return orelse;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, target);
        addChild(children, iter);
        children.addAll(body);
        children.addAll(orelse);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild) || replaceIn(orelse, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
