package com.pyastng.compiler.ast.decl;

/**
 * 类的种类
 */
public enum ClassKind {
    CLASS,
    METACLASS,
    INTERFACE,
    EXCEPTION
}
