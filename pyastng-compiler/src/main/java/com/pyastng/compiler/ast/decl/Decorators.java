package com.pyastng.compiler.ast.decl;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 函数的装饰器表达式，按源码顺序排列
 */
public class Decorators extends AstNode {
    private final List<AstNode> nodes = new ArrayList<AstNode>();

    public List<AstNode> getNodes() {
        return nodes;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<AstNode>(nodes);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDecorators(this, context);
    }
}
