package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstNode;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    @Override
    public boolean isStatement() {
        return true;
    }
}
