package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 布尔运算：{@code a and b and c}
 */
public class BoolExpr extends Expression {
    private final BoolOp operator;
    private final List<AstNode> values = new ArrayList<AstNode>();

    public BoolExpr(BoolOp operator) {
        this.operator = operator;
    }

    public BoolOp getOperator() {
        return operator;
    }

    public List<AstNode> getValues() {
        return values;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<AstNode>(values);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBoolExpr(this, context);
    }

    public enum BoolOp {
        AND("and"),
        OR("or");

        private final String source;

        BoolOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
