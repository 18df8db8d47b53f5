package com.pyastng.compiler.analysis;

/**
 * 名称在词法作用域链和内建模块中都没有绑定
 */
public class UnresolvedNameException extends InferenceException {

    public UnresolvedNameException(String name) {
        super("名称无法解析: " + name);
    }
}
