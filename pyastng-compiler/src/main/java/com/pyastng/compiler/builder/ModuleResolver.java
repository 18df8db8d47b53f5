package com.pyastng.compiler.builder;

import com.pyastng.compiler.ast.decl.ModuleDecl;

/**
 * 模块解析协作者
 *
 * <p>实现必须按绝对模块名缓存，并在模块开始构建时就让同名请求看到这个
 * 尚未构建完成的模块，以此打断循环导入。</p>
 */
public interface ModuleResolver {

    /**
     * 解析模块。
     *
     * @param name       模块名
     * @param relativeTo 发起导入的模块；非 null 时先尝试相对于它的名称
     * @param level      相对导入层级，0 表示隐式
     * @throws BuildException 模块无法找到或构建
     */
    ModuleDecl resolveModule(String name, ModuleDecl relativeTo, int level);

    /** 内建模块 */
    ModuleDecl builtinsModule();

    /** 重建器在访问模块体之前调用 */
    void beginBuilding(ModuleDecl module);
}
