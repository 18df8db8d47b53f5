package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * while 循环
 */
public class WhileStmt extends Statement {
    private AstNode test;
    private final List<AstNode> body = new ArrayList<AstNode>();
    private final List<AstNode> orelse = new ArrayList<AstNode>();

    public AstNode getTest() {
        return test;
    }

    public void setTest(AstNode test) {
        this.test = test;
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
        addChild(children, test);
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
        return visitor.visitWhileStmt(this, context);
    }
}
