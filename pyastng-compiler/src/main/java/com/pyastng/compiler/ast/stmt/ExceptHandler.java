package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * except 子句：{@code except type, name:}
 */
public class ExceptHandler extends Statement {
    private AstNode type;
    private AstNode name;
    private final List<AstNode> body = new ArrayList<AstNode>();

    public AstNode getType() {
        return type;
    }

    public void setType(AstNode type) {
        this.type = type;
    }

    /** 捕获目标（赋值上下文中的名称或属性），可为 null */
    public AstNode getName() {
        return name;
    }

    public void setName(AstNode name) {
        this.name = name;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, type);
        addChild(children, name);
        children.addAll(body);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExceptHandler(this, context);
    }
}
