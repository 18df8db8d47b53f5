package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 下标：{@code value[slice]}，slice 为 {@link IndexSlice}、{@link SliceExpr} 或 {@link ExtSliceExpr}
 */
public class SubscriptExpr extends Expression {
    private AstNode value;
    private AstNode slice;

    public AstNode getValue() {
        return value;
    }

    public void setValue(AstNode value) {
        this.value = value;
    }

    public AstNode getSlice() {
        return slice;
    }

    public void setSlice(AstNode slice) {
        this.slice = slice;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, value);
        addChild(children, slice);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSubscriptExpr(this, context);
    }
}
