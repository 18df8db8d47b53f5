package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * try/except[/else] 语句
 */
public class TryExceptStmt extends Statement {
    private final List<AstNode> body = new ArrayList<AstNode>();
    private final List<ExceptHandler> handlers = new ArrayList<ExceptHandler>();
    private final List<AstNode> orelse = new ArrayList<AstNode>();

    public List<AstNode> getBody() {
        return body;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<AstNode> getOrelse() {
        return orelse;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>(body);
        children.addAll(handlers);
        children.addAll(orelse);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild) || replaceIn(orelse, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryExceptStmt(this, context);
    }
}
