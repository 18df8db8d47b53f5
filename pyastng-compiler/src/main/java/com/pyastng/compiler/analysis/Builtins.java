package com.pyastng.compiler.analysis;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.builder.ModuleResolver;

/**
 * 内建模块相关常量与查找
 */
public final class Builtins {

    public static final String MODULE_NAME = "__builtin__";

    public static final String CLASSMETHOD = qualify("classmethod");
    public static final String STATICMETHOD = qualify("staticmethod");
    public static final String PROPERTY = qualify("property");

    private Builtins() {
    }

    /** 内建名称的限定名 */
    public static String qualify(String name) {
        return MODULE_NAME + "." + name;
    }

    /**
     * 通过 {@code from} 所属模块的解析器找到内建模块。
     *
     * @return 内建模块；模块没有解析器时返回 null
     */
    public static ModuleDecl module(AstNode from) {
        ModuleDecl root = from.root();
        if (root == null) {
            return null;
        }
        ModuleResolver resolver = root.getResolver();
        return resolver != null ? resolver.builtinsModule() : null;
    }

    /** 内建模块中名为 {@code name} 的类，找不到返回 null */
    public static ClassDecl findClass(AstNode from, String name) {
        ModuleDecl builtins = module(from);
        if (builtins == null) {
            return null;
        }
        AstNode binding = builtins.getLocals().first(name);
        return binding instanceof ClassDecl ? (ClassDecl) binding : null;
    }
}
