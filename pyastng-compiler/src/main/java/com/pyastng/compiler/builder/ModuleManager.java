package com.pyastng.compiler.builder;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.parsetree.ParseTree;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 按绝对模块名缓存的模块解析器
 *
 * <p>模块在重建器开始访问模块体之前就放入缓存，构建过程中对同名模块的再次请求
 * 得到这个尚未构建完成的模块，循环导入因此终止。构建失败的模块从缓存中移除，
 * 其余模块只在 {@link #clear()} 时丢弃。</p>
 */
public class ModuleManager implements ModuleResolver {
    private static final Logger LOG = Logger.getLogger(ModuleManager.class.getName());

    private final ParseTreeSource source;
    private final BuilderConfig config;
    private final Cache<String, ModuleDecl> cache;
    private ModuleDecl builtins;

    public ModuleManager(ParseTreeSource source) {
        this(source, new BuilderConfig());
    }

    public ModuleManager(ParseTreeSource source, BuilderConfig config) {
        this.source = source;
        this.config = config != null ? config : new BuilderConfig();
        // 不设容量上限：已交出的模块与正在构建的模块都必须保持同一实例
        this.cache = Caffeine.newBuilder()
                .recordStats()
                .build();
    }

    public BuilderConfig getConfig() {
        return config;
    }

    /**
     * 先尝试相对于 {@code relativeTo} 的名称；显式相对导入（{@code level > 0}）
     * 或启用绝对导入时只有一种候选。
     */
    @Override
    public ModuleDecl resolveModule(String name, ModuleDecl relativeTo, int level) {
        if (relativeTo != null && (level > 0 || !relativeTo.absoluteImportActivated())) {
            String relative = relativeTo.absoluteModname(name, level);
            if (level > 0 || !relative.equals(name)) {
                ModuleDecl module = tryModule(relative);
                if (module != null || level > 0) {
                    return require(module, relative);
                }
            }
        }
        return require(tryModule(name), name);
    }

    /** 按绝对模块名取得模块 */
    public ModuleDecl module(String modname) {
        return resolveModule(modname, null, 0);
    }

    /**
     * 直接构建一棵解析树，结果以 {@code modname} 登记在缓存中。
     */
    public ModuleDecl build(ParseTree tree, String modname) {
        try {
            return new ModuleBuilder(this, config).build(tree, modname);
        } catch (RuntimeException e) {
            cache.invalidate(modname);
            throw e;
        }
    }

    @Override
    public synchronized ModuleDecl builtinsModule() {
        if (builtins == null) {
            builtins = new BuiltinsLoader(config.getBuiltinsResource()).load(this);
            cache.put(builtins.getName(), builtins);
        }
        return builtins;
    }

    @Override
    public void beginBuilding(ModuleDecl module) {
        cache.put(module.getName(), module);
    }

    /** 已缓存的模块，不触发构建 */
    public ModuleDecl cached(String modname) {
        return cache.getIfPresent(modname);
    }

    public long cachedCount() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        builtins = null;
    }

    private ModuleDecl tryModule(String modname) {
        if (modname == null || modname.isEmpty()) {
            return null;
        }
        if (Builtins.MODULE_NAME.equals(modname)) {
            return builtinsModule();
        }
        ModuleDecl cached = cache.getIfPresent(modname);
        if (cached != null) {
            return cached;
        }
        ParseTree tree = source.find(modname);
        if (tree == null) {
            LOG.log(Level.FINE, "没有模块 {0} 的解析树", modname);
            return null;
        }
        LOG.log(Level.FINE, "构建模块 {0}", modname);
        return build(tree, modname);
    }

    private static ModuleDecl require(ModuleDecl module, String modname) {
        if (module == null) {
            throw new BuildException("找不到模块 " + modname);
        }
        return module;
    }
}
