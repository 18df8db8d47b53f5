package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.analysis.BuiltinLiteral;
import com.pyastng.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 列表、元组、集合字面量的公共部分
 */
public abstract class CollectionExpr extends Expression implements BuiltinLiteral {
    private final List<AstNode> elts = new ArrayList<AstNode>();

    public List<AstNode> getElts() {
        return elts;
    }

    @Override
    public String pytype() {
        return Builtins.qualify(builtinClassName());
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<AstNode>(elts);
    }
}
