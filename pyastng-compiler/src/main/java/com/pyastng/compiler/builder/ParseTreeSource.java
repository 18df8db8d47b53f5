package com.pyastng.compiler.builder;

import com.pyastng.compiler.parsetree.ParseTree;

/**
 * 按绝对模块名提供解析树
 */
@FunctionalInterface
public interface ParseTreeSource {

    /**
     * @return 模块的解析树；不存在时返回 null
     * @throws BuildException 解析树存在但不可读
     */
    ParseTree find(String modname);
}
