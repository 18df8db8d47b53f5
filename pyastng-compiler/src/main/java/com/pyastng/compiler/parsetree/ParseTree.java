package com.pyastng.compiler.parsetree;

/**
 * 一棵已经解析好的模块解析树
 */
public final class ParseTree {

    private final FrontEnd frontEnd;
    private final RawNode root;
    private final String path;

    public ParseTree(FrontEnd frontEnd, RawNode root, String path) {
        this.frontEnd = frontEnd;
        this.root = root;
        this.path = path;
    }

    /** 前端由根节点推断 */
    public ParseTree(RawNode root, String path) {
        this(FrontEnd.detect(root), root, path);
    }

    public FrontEnd getFrontEnd() {
        return frontEnd;
    }

    public RawNode getRoot() {
        return root;
    }

    /** 来源路径，仅作信息用途；以 {@code __init__} 命名的文件表示包 */
    public String getPath() {
        return path;
    }

    public boolean isPackageInit() {
        if (path == null) {
            return false;
        }
        String normalized = path.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = fileName.indexOf('.');
        String stem = dot < 0 ? fileName : fileName.substring(0, dot);
        return "__init__".equals(stem);
    }
}
