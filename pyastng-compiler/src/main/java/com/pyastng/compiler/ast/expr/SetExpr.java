package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstVisitor;

/**
 * 集合字面量
 */
public class SetExpr extends CollectionExpr {

    @Override
    public String builtinClassName() {
        return "set";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSetExpr(this, context);
    }
}
