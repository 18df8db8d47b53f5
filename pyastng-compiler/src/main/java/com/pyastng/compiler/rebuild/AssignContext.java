package com.pyastng.compiler.rebuild;

/**
 * 重建时的赋值上下文：决定名称与属性访问被解释为读取、绑定还是删除
 */
public enum AssignContext {
    /** 语句位置；此处出现的绑定形式表示删除 */
    NONE,
    ASSIGN,
    AUG_ASSIGN,
    DELETE,
    /** 普通读取 */
    DISCARD;

    public boolean isBinding() {
        return this == ASSIGN || this == AUG_ASSIGN;
    }
}
