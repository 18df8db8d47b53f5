package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.analysis.BuiltinLiteral;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 字典字面量；{@code keys} 与 {@code values} 一一对应
 */
public class DictExpr extends Expression implements BuiltinLiteral {
    private final List<AstNode> keys = new ArrayList<AstNode>();
    private final List<AstNode> values = new ArrayList<AstNode>();

    public List<AstNode> getKeys() {
        return keys;
    }

    public List<AstNode> getValues() {
        return values;
    }

    public void addItem(AstNode key, AstNode value) {
        keys.add(key);
        values.add(value);
    }

    @Override
    public String builtinClassName() {
        return "dict";
    }

    @Override
    public String pytype() {
        return Builtins.qualify(builtinClassName());
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        for (int i = 0; i < keys.size(); i++) {
            addChild(children, keys.get(i));
            addChild(children, values.get(i));
        }
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictExpr(this, context);
    }
}
