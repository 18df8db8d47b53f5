package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * print 语句：{@code print >>dest, values}；{@code newline} 为 false 表示以逗号结尾
 */
public class PrintStmt extends Statement {
    private AstNode dest;
    private final List<AstNode> values = new ArrayList<AstNode>();
    private boolean newline = true;

    public AstNode getDest() {
        return dest;
    }

    public void setDest(AstNode dest) {
        this.dest = dest;
    }

    public List<AstNode> getValues() {
        return values;
    }

    public boolean isNewline() {
        return newline;
    }

    public void setNewline(boolean newline) {
        this.newline = newline;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, dest);
        children.addAll(values);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrintStmt(this, context);
    }
}
