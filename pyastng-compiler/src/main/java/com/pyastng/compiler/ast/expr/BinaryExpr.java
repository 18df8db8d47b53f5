package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 二元表达式；同类位运算链被折叠为左结合的二叉树
 */
public class BinaryExpr extends Expression {
    private AstNode left;
    private final BinaryOp operator;
    private AstNode right;

    public BinaryExpr(BinaryOp operator) {
        this.operator = operator;
    }

    public AstNode getLeft() {
        return left;
    }

    public void setLeft(AstNode left) {
        this.left = left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public AstNode getRight() {
        return right;
    }

    public void setRight(AstNode right) {
        this.right = right;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, left);
        addChild(children, right);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        FLOOR_DIV("//"),
        MOD("%"),
        POW("**"),

        // 移位与位运算
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public static BinaryOp fromSymbol(String symbol) {
            for (BinaryOp op : values()) {
                if (op.source.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("未知的二元运算符: " + symbol);
        }
    }
}
