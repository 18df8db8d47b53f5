package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * with 语句：{@code with expr as vars:}
 */
public class WithStmt extends Statement {
    private AstNode expr;
    private AstNode vars;
    private final List<AstNode> body = new ArrayList<AstNode>();

    public AstNode getExpr() {
        return expr;
    }

    public void setExpr(AstNode expr) {
        this.expr = expr;
    }

    public AstNode getVars() {
        return vars;
    }

    public void setVars(AstNode vars) {
        this.vars = vars;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, expr);
        addChild(children, vars);
        children.addAll(body);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWithStmt(this, context);
    }
}
