package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * assert 语句
 */
public class AssertStmt extends Statement {
    private AstNode test;
    private AstNode fail;

    public AstNode getTest() {
        return test;
    }

    public void setTest(AstNode test) {
        this.test = test;
    }

    public AstNode getFail() {
        return fail;
    }

    public void setFail(AstNode fail) {
        this.fail = fail;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, test);
        addChild(children, fail);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertStmt(this, context);
    }
}
