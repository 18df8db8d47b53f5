package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
}
