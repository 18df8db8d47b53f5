package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 下标中的 {@code ...}
 */
public class EllipsisExpr extends Expression {

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEllipsisExpr(this, context);
    }
}
