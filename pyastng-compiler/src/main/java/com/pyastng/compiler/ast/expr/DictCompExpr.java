package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 字典推导式
 */
public class DictCompExpr extends ComprehensionScope {
    private AstNode key;
    private AstNode value;

    public AstNode getKey() {
        return key;
    }

    public void setKey(AstNode key) {
        this.key = key;
    }

    public AstNode getValue() {
        return value;
    }

    public void setValue(AstNode value) {
        this.value = value;
    }

    @Override
    public String getName() {
        return "<dictcomp>";
    }

    @Override
    public String pytype() {
        return Builtins.qualify("dict");
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, key);
        addChild(children, value);
        children.addAll(getGenerators());
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictCompExpr(this, context);
    }
}
