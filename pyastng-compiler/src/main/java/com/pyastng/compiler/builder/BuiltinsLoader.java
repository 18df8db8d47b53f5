package com.pyastng.compiler.builder;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.ModuleDecl;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 从类路径上的 JSON 描述组装内建模块
 *
 * <p>描述中列出类（基类名、方法、常量属性）、函数与常量；内建类都是新式类。</p>
 */
public final class BuiltinsLoader {
    private static final Logger LOG = Logger.getLogger(BuiltinsLoader.class.getName());

    private final Gson gson = new Gson();
    private final String resource;

    public BuiltinsLoader(String resource) {
        this.resource = resource;
    }

    /**
     * @param resolver 内建模块所用的解析器
     * @throws BuildException 资源不存在或格式错误
     */
    public ModuleDecl load(ModuleResolver resolver) {
        ModuleSpec spec = readSpec();
        ModuleDecl module = RawBuilding.buildModule(spec.name != null ? spec.name : Builtins.MODULE_NAME, spec.doc);
        module.setResolver(resolver);
        for (ClassSpec classSpec : orEmpty(spec.classes)) {
            ClassDecl cls = RawBuilding.attach(module, RawBuilding.buildClass(classSpec.name, classSpec.bases, classSpec.doc));
            cls.setNewStyle(true);
            for (FunctionSpec method : orEmpty(classSpec.methods)) {
                RawBuilding.attach(cls, function(method));
            }
            for (Map.Entry<String, Object> attribute : orEmpty(classSpec.attributes).entrySet()) {
                RawBuilding.attachConstNode(cls, attribute.getKey(), constant(attribute.getValue()));
            }
        }
        for (FunctionSpec functionSpec : orEmpty(spec.functions)) {
            RawBuilding.attach(module, function(functionSpec));
        }
        for (Map.Entry<String, Object> entry : orEmpty(spec.constants).entrySet()) {
            RawBuilding.attachConstNode(module, entry.getKey(), constant(entry.getValue()));
        }
        LOG.fine("内建模块 " + module.getName() + " 载入 " + module.getLocals().names().size() + " 个名称");
        return module;
    }

    private ModuleSpec readSpec() {
        InputStream in = BuiltinsLoader.class.getResourceAsStream(resource);
        if (in == null) {
            throw new BuildException("找不到内建模块描述: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            ModuleSpec spec = gson.fromJson(reader, ModuleSpec.class);
            if (spec == null) {
                throw new BuildException("内建模块描述为空: " + resource);
            }
            return spec;
        } catch (JsonParseException | IOException e) {
            throw new BuildException("无法读取内建模块描述: " + resource, e);
        }
    }

    private static FunctionDecl function(FunctionSpec spec) {
        List<Object> defaults = new ArrayList<Object>();
        for (Object value : orEmpty(spec.defaults)) {
            defaults.add(constant(value));
        }
        FunctionDecl function = RawBuilding.buildFunction(spec.name, spec.args, defaults, spec.doc);
        if (spec.vararg != null || spec.kwarg != null) {
            function.getArgs().setVararg(spec.vararg);
            function.getArgs().setKwarg(spec.kwarg);
            RawBuilding.registerArguments(function);
        }
        return function;
    }

    /** Gson 把数字读成 Double；整数值还原为 Long，与解析树中的常量一致 */
    private static Object constant(Object value) {
        if (value instanceof Double) {
            double number = (Double) value;
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return (long) number;
            }
        }
        return value;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : Collections.<T>emptyList();
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map != null ? map : Collections.<K, V>emptyMap();
    }

    // ============ JSON 结构 ============

    static final class ModuleSpec {
        String name;
        String doc;
        List<ClassSpec> classes;
        List<FunctionSpec> functions;
        Map<String, Object> constants;
    }

    static final class ClassSpec {
        String name;
        List<String> bases;
        String doc;
        List<FunctionSpec> methods;
        Map<String, Object> attributes;
    }

    static final class FunctionSpec {
        String name;
        List<String> args;
        List<Object> defaults;
        String vararg;
        String kwarg;
        String doc;
    }
}
