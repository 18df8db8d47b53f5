package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.LineRange;

import java.util.ArrayList;
import java.util.List;

/**
 * if 语句
 *
 * <p>elif 链被规范化为嵌套：每个 elif 是前一个 if 的 {@code orelse} 中唯一的 {@link IfStmt}。</p>
 */
public class IfStmt extends Statement {
    private AstNode test;
    private final List<AstNode> body = new ArrayList<AstNode>();
    private final List<AstNode> orelse = new ArrayList<AstNode>();

    public AstNode getTest() {
        return test;
    }

    public void setTest(AstNode test) {
        this.test = test;
    }

    public List<AstNode> getBody() {
        return body;
    }

    public List<AstNode> getOrelse() {
        return orelse;
    }

    /** 条件头部结束的行号 */
    public int getBlockStartToLineno() {
        return test != null ? test.getToLineno() : getFromLineno();
    }

    /**
     * 条件头部的行只是自身；if 体中的行到 if 体末尾；
     * else 分支中的行到 else 末尾，if 体与 else 之间的行到 else 之前。
     */
    @Override
    public LineRange blockRange(int lineno) {
        if (lineno <= getBlockStartToLineno()) {
            return new LineRange(lineno, lineno);
        }
        if (!body.isEmpty() && lineno <= body.get(body.size() - 1).getToLineno()) {
            return new LineRange(lineno, body.get(body.size() - 1).getToLineno());
        }
        if (orelse.isEmpty()) {
            return new LineRange(lineno, getToLineno());
        }
        if (lineno >= orelse.get(0).getFromLineno()) {
            return new LineRange(lineno, orelse.get(orelse.size() - 1).getToLineno());
        }
        return new LineRange(lineno, orelse.get(0).getFromLineno() - 1);
    }

    /** orelse 是否是一个 elif 链接 */
    public boolean hasElif() {
        return orelse.size() == 1 && orelse.get(0) instanceof IfStmt;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, test);
        children.addAll(body);
        children.addAll(orelse);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild) || replaceIn(orelse, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
