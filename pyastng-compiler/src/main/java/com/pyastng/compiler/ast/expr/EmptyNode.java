package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 占位节点：没有可用信息的绑定（无法识别的原始节点、内建的哑属性等）
 */
public class EmptyNode extends Expression {
    private final String origin;
    private boolean statementPosition;

    public EmptyNode() {
        this(null);
    }

    /**
     * @param origin 占位来源的描述（如无法识别的原始节点类型），可为 null
     */
    public EmptyNode(String origin) {
        this.origin = origin;
    }

    public String getOrigin() {
        return origin;
    }

    /** 标记占位节点位于语句体中 */
    public void setStatementPosition(boolean statementPosition) {
        this.statementPosition = statementPosition;
    }

    @Override
    public boolean isStatement() {
        return statementPosition;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEmptyNode(this, context);
    }
}
