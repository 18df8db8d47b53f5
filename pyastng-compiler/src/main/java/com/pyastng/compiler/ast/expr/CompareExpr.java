package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 比较链：{@code left op1 c1 op2 c2 ...}
 *
 * <p>{@code operators} 与 {@code comparators} 一一对应。</p>
 */
public class CompareExpr extends Expression {
    private AstNode left;
    private final List<CompareOp> operators = new ArrayList<CompareOp>();
    private final List<AstNode> comparators = new ArrayList<AstNode>();

    public AstNode getLeft() {
        return left;
    }

    public void setLeft(AstNode left) {
        this.left = left;
    }

    public List<CompareOp> getOperators() {
        return operators;
    }

    public List<AstNode> getComparators() {
        return comparators;
    }

    public void addComparison(CompareOp operator, AstNode comparator) {
        operators.add(operator);
        comparators.add(comparator);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, left);
        children.addAll(comparators);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompareExpr(this, context);
    }

    public enum CompareOp {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        IS("is"),
        IS_NOT("is not"),
        IN("in"),
        NOT_IN("not in");

        private final String source;

        CompareOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public static CompareOp fromSymbol(String symbol) {
            if ("<>".equals(symbol)) {
                return NE;
            }
            for (CompareOp op : values()) {
                if (op.source.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("未知的比较运算符: " + symbol);
        }
    }
}
