package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * exec 语句：{@code exec expr in globals, locals}
 */
public class ExecStmt extends Statement {
    private AstNode expr;
    private AstNode globals;
    private AstNode locals;

    public AstNode getExpr() {
        return expr;
    }

    public void setExpr(AstNode expr) {
        this.expr = expr;
    }

    public AstNode getGlobals() {
        return globals;
    }

    public void setGlobals(AstNode globals) {
        this.globals = globals;
    }

    public AstNode getLocals() {
        return locals;
    }

    public void setLocals(AstNode locals) {
        this.locals = locals;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, expr);
        addChild(children, globals);
        addChild(children, locals);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExecStmt(this, context);
    }
}
