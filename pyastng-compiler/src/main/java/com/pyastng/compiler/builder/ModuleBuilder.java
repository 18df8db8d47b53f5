package com.pyastng.compiler.builder;

import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.parsetree.ParseTree;
import com.pyastng.compiler.parsetree.RawNode;
import com.pyastng.compiler.rebuild.AstTreeRebuilder;
import com.pyastng.compiler.rebuild.CompilerTreeRebuilder;
import com.pyastng.compiler.rebuild.TreeRebuilder;

/**
 * 构建入口：按前端选择重建器，把解析树重建为模块节点
 *
 * <p>每次构建使用新的重建器实例，重建会话不跨模块共享。</p>
 */
public class ModuleBuilder {

    private final ModuleResolver resolver;
    private final BuilderConfig config;

    public ModuleBuilder(ModuleResolver resolver) {
        this(resolver, new BuilderConfig());
    }

    public ModuleBuilder(ModuleResolver resolver, BuilderConfig config) {
        this.resolver = resolver;
        this.config = config != null ? config : new BuilderConfig();
    }

    /**
     * @throws BuildException 解析树格式错误
     */
    public ModuleDecl build(ParseTree tree, String modname) {
        return rebuilderFor(tree).build(tree.getRoot(), modname, tree.getPath(), tree.isPackageInit());
    }

    /** 前端由根节点推断，没有来源路径 */
    public ModuleDecl build(RawNode root, String modname) {
        return build(new ParseTree(root, null), modname);
    }

    private TreeRebuilder rebuilderFor(ParseTree tree) {
        switch (tree.getFrontEnd()) {
            case COMPILER:
                return new CompilerTreeRebuilder(resolver, config);
            case AST:
                return new AstTreeRebuilder(resolver, config);
            default:
                throw new BuildException("不支持的前端: " + tree.getFrontEnd());
        }
    }
}
