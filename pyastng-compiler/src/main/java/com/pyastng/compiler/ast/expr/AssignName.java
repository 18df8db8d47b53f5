package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 名称绑定（赋值目标、参数、循环变量等）
 */
public class AssignName extends Expression {
    private final String name;

    public AssignName(String name) {
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
        return visitor.visitAssignName(this, context);
    }

    @Override
    public String toString() {
        return "AssignName(" + name + ")@" + getLineno();
    }
}
