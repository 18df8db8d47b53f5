package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 切片 {@code lower:upper:step}，三部分均可为 null
 */
public class SliceExpr extends Expression {
    private AstNode lower;
    private AstNode upper;
    private AstNode step;

    public AstNode getLower() {
        return lower;
    }

    public void setLower(AstNode lower) {
        this.lower = lower;
    }

    public AstNode getUpper() {
        return upper;
    }

    public void setUpper(AstNode upper) {
        this.upper = upper;
    }

    public AstNode getStep() {
        return step;
    }

    public void setStep(AstNode step) {
        this.step = step;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, lower);
        addChild(children, upper);
        addChild(children, step);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSliceExpr(this, context);
    }
}
