package com.pyastng.compiler.builder;

/**
 * 模块构建失败：解析树不可读、格式错误，或找不到模块
 *
 * <p>只中止当前模块的构建。</p>
 */
public class BuildException extends RuntimeException {

    public BuildException(String message) {
        super(message);
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
