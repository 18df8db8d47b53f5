package com.pyastng.compiler.analysis;

/**
 * 名称在查找链中不存在
 */
public class NotFoundException extends RuntimeException {
    private final String name;

    public NotFoundException(String name) {
        super(name);
        this.name = name;
    }

    public NotFoundException(String name, String message) {
        super(message);
        this.name = name;
    }

    /** 未找到的名称 */
    public String getName() {
        return name;
    }
}
