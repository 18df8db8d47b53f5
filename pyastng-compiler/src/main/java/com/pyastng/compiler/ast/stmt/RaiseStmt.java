package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * raise 语句：{@code raise type, value, traceback}，三个部分都可省略
 */
public class RaiseStmt extends Statement {
    private AstNode exceptionType;
    private AstNode exceptionValue;
    private AstNode traceback;

    public AstNode getExceptionType() {
        return exceptionType;
    }

    public void setExceptionType(AstNode exceptionType) {
        this.exceptionType = exceptionType;
    }

    public AstNode getExceptionValue() {
        return exceptionValue;
    }

    public void setExceptionValue(AstNode exceptionValue) {
        this.exceptionValue = exceptionValue;
    }

    public AstNode getTraceback() {
        return traceback;
    }

    public void setTraceback(AstNode traceback) {
        this.traceback = traceback;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, exceptionType);
        addChild(children, exceptionValue);
        addChild(children, traceback);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRaiseStmt(this, context);
    }
}
