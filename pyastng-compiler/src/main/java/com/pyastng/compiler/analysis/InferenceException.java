package com.pyastng.compiler.analysis;

/**
 * 推断步骤失败（名称无法解析、递归被截断等）
 *
 * <p>"可能是任何值" 不是异常，而是 {@link Unknown} 值。</p>
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
