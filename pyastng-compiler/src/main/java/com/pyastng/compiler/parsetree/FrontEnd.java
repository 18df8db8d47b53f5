package com.pyastng.compiler.parsetree;

/**
 * 解析树的来源前端
 */
public enum FrontEnd {
    /** {@code compiler} 包形状：Module.node 是 Stmt */
    COMPILER("compiler"),
    /** {@code _ast} 形状：Module.body 是语句列表 */
    AST("ast");

    private final String id;

    FrontEnd(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static FrontEnd fromId(String id) {
        for (FrontEnd frontEnd : values()) {
            if (frontEnd.id.equals(id)) {
                return frontEnd;
            }
        }
        throw new MalformedTreeException("未知的前端: " + id);
    }

    /** 由模块节点的字段判断前端 */
    public static FrontEnd detect(RawNode module) {
        if (!"Module".equals(module.getType())) {
            throw new MalformedTreeException("解析树根节点必须是 Module: " + module.getType());
        }
        if (module.has("node")) {
            return COMPILER;
        }
        if (module.has("body")) {
            return AST;
        }
        throw new MalformedTreeException("无法判断解析树的前端: " + module);
    }
}
