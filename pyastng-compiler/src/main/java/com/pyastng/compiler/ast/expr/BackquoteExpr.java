package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 反引号 repr：{@code `value`}
 */
public class BackquoteExpr extends Expression {
    private AstNode value;

    public AstNode getValue() {
        return value;
    }

    public void setValue(AstNode value) {
        this.value = value;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, value);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBackquoteExpr(this, context);
    }
}
