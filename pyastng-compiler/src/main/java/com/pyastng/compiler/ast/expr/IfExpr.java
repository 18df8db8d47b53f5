package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 条件表达式：{@code body if test else orelse}
 */
public class IfExpr extends Expression {
    private AstNode test;
    private AstNode body;
    private AstNode orelse;

    public AstNode getTest() {
        return test;
    }

    public void setTest(AstNode test) {
        this.test = test;
    }

    public AstNode getBody() {
        return body;
    }

    public void setBody(AstNode body) {
        this.body = body;
    }

    public AstNode getOrelse() {
        return orelse;
    }

    public void setOrelse(AstNode orelse) {
        this.orelse = orelse;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, test);
        addChild(children, body);
        addChild(children, orelse);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }
}
