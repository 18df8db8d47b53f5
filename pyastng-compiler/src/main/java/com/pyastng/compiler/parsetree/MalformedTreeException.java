package com.pyastng.compiler.parsetree;

import com.pyastng.compiler.builder.BuildException;

/**
 * 解析树的结构与前端约定不符
 */
public class MalformedTreeException extends BuildException {

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
