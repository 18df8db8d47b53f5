package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 多维下标，每一维是 {@link IndexSlice} 或 {@link SliceExpr}
 */
public class ExtSliceExpr extends Expression {
    private final List<AstNode> dims = new ArrayList<AstNode>();

    public List<AstNode> getDims() {
        return dims;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<AstNode>(dims);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExtSliceExpr(this, context);
    }
}
