package com.pyastng.compiler.ast.decl;

/**
 * 函数的角色，在重建时由所在作用域和装饰器决定
 */
public enum FunctionRole {
    FUNCTION,
    METHOD,
    CLASSMETHOD,
    STATICMETHOD
}
