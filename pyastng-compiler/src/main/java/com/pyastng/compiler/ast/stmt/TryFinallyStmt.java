package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * try/finally 语句；带 except 的形式在 body 中嵌套一个 {@link TryExceptStmt}
 */
public class TryFinallyStmt extends Statement {
    private final List<AstNode> body = new ArrayList<AstNode>();
    private final List<AstNode> finalbody = new ArrayList<AstNode>();

    public List<AstNode> getBody() {
        return body;
    }

    public List<AstNode> getFinalbody() {
        return finalbody;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>(body);
        children.addAll(finalbody);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild) || replaceIn(finalbody, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryFinallyStmt(this, context);
    }
}
