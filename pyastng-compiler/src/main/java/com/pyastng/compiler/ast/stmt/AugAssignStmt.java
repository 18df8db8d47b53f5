package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.expr.BinaryExpr.BinaryOp;

import java.util.ArrayList;
import java.util.List;

/**
 * 增量赋值：{@code target op= value}
 */
public class AugAssignStmt extends Statement {
    private AstNode target;
    private BinaryOp operator;
    private AstNode value;

    public AstNode getTarget() {
        return target;
    }

    public void setTarget(AstNode target) {
        this.target = target;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public void setOperator(BinaryOp operator) {
        this.operator = operator;
    }

    public AstNode getValue() {
        return value;
    }

    public void setValue(AstNode value) {
        this.value = value;
    }

    /** 源码中的运算符，如 {@code +=} */
    public String getOperatorSymbol() {
        return operator.toSourceString() + "=";
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, target);
        addChild(children, value);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssignStmt(this, context);
    }
}
