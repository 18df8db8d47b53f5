package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * del 语句
 */
public class DeleteStmt extends Statement {
    private final List<AstNode> targets = new ArrayList<AstNode>();

    public List<AstNode> getTargets() {
        return targets;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<AstNode>(targets);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeleteStmt(this, context);
    }
}
