package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstVisitor;

/**
 * 元组字面量；在赋值上下文中为解包目标
 */
public class TupleExpr extends CollectionExpr {

    @Override
    public String builtinClassName() {
        return "tuple";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleExpr(this, context);
    }
}
