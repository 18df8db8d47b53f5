package com.pyastng.compiler;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.builder.ModuleManager;
import com.pyastng.compiler.parsetree.ParseTree;
import com.pyastng.compiler.parsetree.RawNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 测试用的 {@code compiler} 形状解析树工厂
 *
 * <p>行号参数放在最前面；语句体以可变参数给出，自动包进 {@code Stmt}。</p>
 */
public final class Trees {

    private Trees() {
    }

    public static RawNode module(RawNode... statements) {
        return RawNode.of("Module").with("doc", null).with("node", stmt(statements));
    }

    public static RawNode moduleWithDoc(String doc, RawNode... statements) {
        return RawNode.of("Module").with("doc", doc).with("node", stmt(statements));
    }

    public static RawNode stmt(RawNode... nodes) {
        return RawNode.of("Stmt").with("nodes", RawNode.list((Object[]) nodes));
    }

    // ============ 表达式 ============

    public static RawNode name(int line, String name) {
        return RawNode.of("Name").with("name", name).at(line);
    }

    public static RawNode constant(int line, Object value) {
        return RawNode.of("Const").with("value", value).at(line);
    }

    public static RawNode getattr(int line, RawNode expr, String attrname) {
        return RawNode.of("Getattr").with("expr", expr).with("attrname", attrname).at(line);
    }

    public static RawNode call(int line, RawNode func, RawNode... args) {
        return RawNode.of("CallFunc").with("node", func)
                .with("args", RawNode.list((Object[]) args))
                .with("star_args", null).with("dstar_args", null).at(line);
    }

    public static RawNode keyword(int line, String name, RawNode expr) {
        return RawNode.of("Keyword").with("name", name).with("expr", expr).at(line);
    }

    public static RawNode list(int line, RawNode... elements) {
        return RawNode.of("List").with("nodes", RawNode.list((Object[]) elements)).at(line);
    }

    public static RawNode tuple(int line, RawNode... elements) {
        return RawNode.of("Tuple").with("nodes", RawNode.list((Object[]) elements)).at(line);
    }

    // ============ 赋值目标 ============

    public static RawNode assName(int line, String name) {
        return RawNode.of("AssName").with("name", name).with("flags", "OP_ASSIGN").at(line);
    }

    public static RawNode assAttr(int line, RawNode expr, String attrname) {
        return RawNode.of("AssAttr").with("expr", expr).with("attrname", attrname)
                .with("flags", "OP_ASSIGN").at(line);
    }

    public static RawNode assTuple(int line, RawNode... targets) {
        return RawNode.of("AssTuple").with("nodes", RawNode.list((Object[]) targets)).at(line);
    }

    // ============ 语句 ============

    public static RawNode assign(int line, RawNode target, RawNode value) {
        return RawNode.of("Assign").with("nodes", RawNode.list(target)).with("expr", value).at(line);
    }

    /** {@code name = value} */
    public static RawNode assign(int line, String name, RawNode value) {
        return assign(line, assName(line, name), value);
    }

    public static RawNode discard(int line, RawNode expr) {
        return RawNode.of("Discard").with("expr", expr).at(line);
    }

    public static RawNode pass(int line) {
        return RawNode.of("Pass").at(line);
    }

    public static RawNode ret(int line, RawNode value) {
        return RawNode.of("Return").with("value", value).at(line);
    }

    public static RawNode del(int line, String name) {
        return RawNode.of("AssName").with("name", name).with("flags", "OP_DELETE").at(line);
    }

    public static RawNode global(int line, String... names) {
        return RawNode.of("Global").with("names", RawNode.list((Object[]) names)).at(line);
    }

    public static RawNode importNames(int line, String... names) {
        List<Object> pairs = new ArrayList<Object>();
        for (String name : names) {
            pairs.add(RawNode.list(name, null));
        }
        return RawNode.of("Import").with("names", pairs).at(line);
    }

    /** {@code from modname import names}；名称可写作 {@code "a as b"} */
    public static RawNode from(int line, String modname, int level, String... names) {
        List<Object> pairs = new ArrayList<Object>();
        for (String name : names) {
            int as = name.indexOf(" as ");
            pairs.add(as < 0 ? RawNode.list(name, null)
                    : RawNode.list(name.substring(0, as), name.substring(as + 4)));
        }
        return RawNode.of("From").with("modname", modname).with("level", level).with("names", pairs).at(line);
    }

    public static RawNode forLoop(int line, int to, RawNode target, RawNode iter, RawNode... body) {
        return RawNode.of("For").with("assign", target).with("list", iter)
                .with("body", stmt(body)).with("else_", null).at(line).span(line, to);
    }

    public static RawNode classDef(int line, int to, String name, List<RawNode> bases, RawNode... body) {
        return RawNode.of("Class").with("name", name)
                .with("bases", new ArrayList<Object>(bases))
                .with("doc", null).with("code", stmt(body)).at(line).span(line, to);
    }

    /** 参数名可以是字符串或嵌套的名称列表 */
    public static RawNode function(int line, int to, String name, List<?> argnames, RawNode... body) {
        return RawNode.of("Function").with("name", name)
                .with("argnames", new ArrayList<Object>(argnames))
                .with("defaults", RawNode.list()).with("flags", 0)
                .with("doc", null).with("decorators", null)
                .with("code", stmt(body)).at(line).span(line, to);
    }

    public static RawNode decorate(RawNode function, RawNode... decorators) {
        RawNode node = RawNode.of("Decorators").with("nodes", RawNode.list((Object[]) decorators));
        if (decorators.length > 0) {
            node.at(decorators[0].getLineno());
        }
        return function.with("decorators", node);
    }

    public static List<RawNode> bases(RawNode... bases) {
        return Arrays.asList(bases);
    }

    public static List<Object> args(Object... names) {
        return RawNode.list(names);
    }

    // ============ 构建 ============

    /**
     * 内存中的模块集合；{@code packages} 中的名称按包的 {@code __init__} 模块构建。
     */
    public static ModuleManager manager(final Map<String, RawNode> modules, String... packages) {
        final Set<String> packageNames = new HashSet<String>(Arrays.asList(packages));
        return new ModuleManager(modname -> {
            RawNode root = modules.get(modname);
            if (root == null) {
                return null;
            }
            String path = modname.replace('.', '/') + (packageNames.contains(modname) ? "/__init__.py" : ".py");
            return new ParseTree(root, path);
        });
    }

    public static <T> List<T> all(Iterator<T> values) {
        List<T> result = new ArrayList<T>();
        while (values.hasNext()) {
            result.add(values.next());
        }
        return result;
    }

    public static List<InferredValue> inferAll(AstNode node) {
        return all(node.infer());
    }
}
