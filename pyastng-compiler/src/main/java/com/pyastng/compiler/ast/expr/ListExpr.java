package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstVisitor;

/**
 * 列表字面量；在赋值上下文中为解包目标
 */
public class ListExpr extends CollectionExpr {

    @Override
    public String builtinClassName() {
        return "list";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListExpr(this, context);
    }
}
