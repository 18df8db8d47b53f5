package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 属性删除：{@code del expr.attrname}
 */
public class DeleteAttr extends Expression {
    private AstNode expr;
    private final String attrname;

    public DeleteAttr(String attrname) {
        this.attrname = attrname;
    }

    /** 接收者表达式 */
    public AstNode getExpr() {
        return expr;
    }

    public void setExpr(AstNode expr) {
        this.expr = expr;
    }

    public String getAttrname() {
        return attrname;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, expr);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeleteAttr(this, context);
    }
}
