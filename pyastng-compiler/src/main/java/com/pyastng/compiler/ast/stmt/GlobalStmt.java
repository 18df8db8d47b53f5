package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * global 声明
 */
public class GlobalStmt extends Statement {
    private final List<String> names = new ArrayList<String>();

    public List<String> getNames() {
        return names;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalStmt(this, context);
    }
}
