package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 名称删除（del 目标）
 */
public class DeleteName extends Expression {
    private final String name;

    public DeleteName(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeleteName(this, context);
    }

    @Override
    public String toString() {
        return "DeleteName(" + name + ")@" + getLineno();
    }
}
