package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 赋值语句：{@code t1 = t2 = value}
 */
public class AssignStmt extends Statement {
    private final List<AstNode> targets = new ArrayList<AstNode>();
    private AstNode value;

    public List<AstNode> getTargets() {
        return targets;
    }

    public AstNode getValue() {
        return value;
    }

    public void setValue(AstNode value) {
        this.value = value;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>(targets);
        addChild(children, value);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
