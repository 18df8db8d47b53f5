package com.pyastng.compiler.analysis;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.ClassKind;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.TupleExpr;
import com.pyastng.compiler.ast.stmt.ExprStmt;
import com.pyastng.compiler.builder.ModuleManager;
import com.pyastng.compiler.parsetree.RawNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.pyastng.compiler.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 作用域查找与惰性推断测试
 */
class InferenceTest {

    private ModuleDecl build(RawNode... statements) {
        return manager(Collections.singletonMap("mod", module(statements))).module("mod");
    }

    /** 推断模块第 {@code index} 条表达式语句的值 */
    private static List<InferredValue> inferStatement(ModuleDecl module, int index) {
        return inferAll(((ExprStmt) module.getBody().get(index)).getValue());
    }

    private static List<Object> constValues(List<InferredValue> values) {
        List<Object> result = new ArrayList<Object>();
        for (InferredValue value : values) {
            if (value instanceof Const) {
                result.add(((Const) value).getValue());
            }
        }
        return result;
    }

    private static List<String> names(List<ClassDecl> classes) {
        List<String> result = new ArrayList<String>();
        for (ClassDecl cls : classes) {
            result.add(cls.getName());
        }
        return result;
    }

    // ============ 删除与属性查找 ============

    @Nested
    @DisplayName("删除与属性查找")
    class DeletionTests {

        @Test
        @DisplayName("删除从未赋值的名称后查找属性是不存在")
        void testDeleteNeverAssigned() {
            ModuleDecl module = build(del(1, "ghost"));

            assertEquals(1, module.getLocals().get("ghost").size());
            assertThrows(NotFoundException.class, () -> module.getAttribute("ghost", null));
        }

        @Test
        @DisplayName("类体中删除从未赋值的名称")
        void testDeleteInClassBody() {
            ModuleDecl module = build(classDef(1, 2, "C", bases(), del(2, "y")));
            ClassDecl c = (ClassDecl) module.getLocals().first("C");
            assertThrows(NotFoundException.class, () -> c.getAttribute("y", null));
        }

        @Test
        @DisplayName("删除之后的读取看不到此前的绑定")
        void testReadAfterDelete() {
            ModuleDecl module = build(assign(1, "x", constant(1, 1L)), del(2, "x"), discard(3, name(3, "x")));
            AstNode read = ((ExprStmt) module.getBody().get(2)).getValue();
            assertTrue(read.lookup("x").isEmpty());
            assertThrows(UnresolvedNameException.class, read::infer);
        }

        @Test
        @DisplayName("顶层的后一次赋值遮蔽前一次")
        void testShadowing() {
            ModuleDecl module = build(assign(1, "x", constant(1, 1L)), assign(2, "x", constant(2, 2L)),
                    discard(3, name(3, "x")));
            assertEquals(Collections.<Object>singletonList(2L), constValues(inferStatement(module, 2)));
        }

        @Test
        @DisplayName("for 循环中的绑定不遮蔽此前的绑定")
        void testLoopBinding() {
            ModuleDecl module = build(assign(1, "i", constant(1, 0L)),
                    forLoop(2, 3, assName(2, "i"), list(2, constant(2, 1L), constant(2, 2L)), pass(3)),
                    discard(4, name(4, "i")));
            assertEquals(Arrays.<Object>asList(0L, 1L, 2L), constValues(inferStatement(module, 2)));
        }

        @Test
        @DisplayName("未定义的名称")
        void testUnresolvedName() {
            ModuleDecl module = build(discard(1, name(1, "nowhere")));
            AstNode read = ((ExprStmt) module.getBody().get(0)).getValue();
            assertThrows(UnresolvedNameException.class, read::infer);
        }
    }

    // ============ 祖先 ============

    @Nested
    @DisplayName("祖先")
    class AncestorTests {

        @Test
        @DisplayName("祖先按先序产生且不重复")
        void testAncestors() {
            ModuleDecl module = build(
                    classDef(1, 2, "A", bases(name(1, "object")), pass(2)),
                    classDef(3, 4, "B", bases(name(3, "A")), pass(4)));
            ClassDecl b = (ClassDecl) module.getLocals().first("B");

            List<ClassDecl> ancestors = all(b.ancestors(true));
            assertEquals(Arrays.asList("A", "object"), names(ancestors));
            assertEquals(Builtins.qualify("object"), ancestors.get(1).qualifiedName());
            assertEquals(Arrays.asList("A"), names(all(b.ancestors(false))));
            assertTrue(b.isNewStyle());
        }

        @Test
        @DisplayName("__bases__ 是直接基类的元组，__mro__ 是全部祖先")
        void testBasesAndMro() {
            ModuleDecl module = build(
                    classDef(1, 2, "A", bases(name(1, "object")), pass(2)),
                    classDef(3, 4, "B", bases(name(3, "A")), pass(4)));
            ClassDecl a = (ClassDecl) module.getLocals().first("A");
            ClassDecl b = (ClassDecl) module.getLocals().first("B");

            List<AstNode> bases = b.getAttribute("__bases__", null);
            assertEquals(1, bases.size());
            TupleExpr direct = (TupleExpr) bases.get(0);
            assertEquals(1, direct.getElts().size());
            assertSame(a, direct.getElts().get(0));
            assertSame(b, direct.getParent());

            TupleExpr mro = (TupleExpr) b.getAttribute("__mro__", null).get(0);
            List<String> mroNames = new ArrayList<String>();
            for (AstNode element : mro.getElts()) {
                mroNames.add(((ClassDecl) element).getName());
            }
            assertEquals(Arrays.asList("A", "object"), mroNames);
            assertSame(module, mro.getElts().get(0).getParent());
        }

        @Test
        @DisplayName("旧式类没有 __mro__，但有空的 __bases__")
        void testOldStyleMro() {
            ModuleDecl module = build(classDef(1, 2, "Old", bases(), pass(2)));
            ClassDecl old = (ClassDecl) module.getLocals().first("Old");

            assertThrows(NotFoundException.class, () -> old.getAttribute("__mro__", null));
            TupleExpr bases = (TupleExpr) old.getAttribute("__bases__", null).get(0);
            assertTrue(bases.getElts().isEmpty());
        }

        @Test
        @DisplayName("__module__ 只取本类所在模块，不合并基类中的赋值")
        void testModuleAttributeNotInherited() {
            ModuleDecl module = build(
                    classDef(1, 2, "A", bases(name(1, "object")), assign(2, "__module__", constant(2, "elsewhere"))),
                    classDef(3, 4, "B", bases(name(3, "A")), pass(4)));
            ClassDecl b = (ClassDecl) module.getLocals().first("B");

            List<AstNode> values = b.getAttribute("__module__", null);
            assertEquals(1, values.size());
            assertEquals("mod", ((Const) values.get(0)).getValue());
        }

        @Test
        @DisplayName("菱形继承中的共同祖先")
        void testDiamond() {
            ModuleDecl module = build(
                    classDef(1, 2, "Root", bases(), pass(2)),
                    classDef(3, 4, "Left", bases(name(3, "Root")), pass(4)),
                    classDef(5, 6, "Right", bases(name(5, "Root")), pass(6)),
                    classDef(7, 8, "Leaf", bases(name(7, "Left"), name(7, "Right")), pass(8)));
            ClassDecl leaf = (ClassDecl) module.getLocals().first("Leaf");

            List<String> ancestors = names(all(leaf.ancestors(true)));
            assertEquals(Arrays.asList("Left", "Root", "Right", "Root"), ancestors);
            assertFalse(leaf.isNewStyle());
        }

        @Test
        @DisplayName("互为基类的两个类不会无限循环")
        void testCyclicAncestors() {
            ModuleDecl module = build(
                    classDef(1, 2, "X", bases(name(1, "Y")), pass(2)),
                    classDef(3, 4, "Y", bases(name(3, "X")), pass(4)));
            ClassDecl x = (ClassDecl) module.getLocals().first("X");

            List<ClassDecl> ancestors = all(x.ancestors(true));
            assertTrue(ancestors.size() <= 1);
            for (ClassDecl ancestor : ancestors) {
                assertEquals("Y", ancestor.getName());
            }
            assertEquals(ClassKind.CLASS, x.kind());
            assertFalse(x.isNewStyle());
            assertThrows(NotFoundException.class, () -> x.getAttribute("missing", null));
        }

        @Test
        @DisplayName("按名称约定判断类的种类")
        void testKind() {
            ModuleDecl module = build(
                    classDef(1, 2, "ParseException", bases(name(1, "Exception")), pass(2)),
                    classDef(3, 4, "Failure", bases(name(3, "ParseException")), pass(4)),
                    classDef(5, 6, "IVisitorInterface", bases(), pass(6)));

            assertEquals(ClassKind.EXCEPTION, ((ClassDecl) module.getLocals().first("Failure")).kind());
            assertEquals(ClassKind.INTERFACE, ((ClassDecl) module.getLocals().first("IVisitorInterface")).kind());
        }
    }

    // ============ 函数与方法 ============

    @Nested
    @DisplayName("函数与方法")
    class FunctionTests {

        @Test
        @DisplayName("只有 pass 的函数是抽象的")
        void testIsAbstract() {
            ModuleDecl module = build(
                    function(1, 2, "placeholder", args(), pass(2)),
                    function(3, 4, "concrete", args(), ret(4, constant(4, 1L))),
                    function(5, 6, "todo", args(), RawNode.of("Raise").with("expr1", name(6, "NotImplementedError"))
                            .with("expr2", null).with("expr3", null).at(6)));

            assertTrue(((FunctionDecl) module.getLocals().first("placeholder")).isAbstract());
            assertFalse(((FunctionDecl) module.getLocals().first("placeholder")).isAbstract(false));
            assertFalse(((FunctionDecl) module.getLocals().first("concrete")).isAbstract());
            assertTrue(((FunctionDecl) module.getLocals().first("todo")).isAbstract());
        }

        @Test
        @DisplayName("推断为 staticmethod 的别名装饰器")
        void testStaticmethodAlias() {
            ModuleDecl module = build(
                    assign(1, "sm", name(1, "staticmethod")),
                    classDef(2, 4, "C", bases(name(2, "object")),
                            decorate(function(3, 4, "create", args(), pass(4)), name(3, "sm"))));
            ClassDecl c = (ClassDecl) module.getLocals().first("C");
            FunctionDecl create = (FunctionDecl) c.getLocals().first("create");

            assertEquals(FunctionRole.STATICMETHOD, create.getRole());
            assertTrue(create.decoratorNames().contains(Builtins.STATICMETHOD));
            List<InferredValue> attribute = all(c.inferAttribute("create", null));
            assertEquals(1, attribute.size());
            assertSame(create, attribute.get(0));
        }

        @Test
        @DisplayName("调用类总是产生一个实例")
        void testClassCall() {
            ModuleDecl module = build(
                    classDef(1, 3, "C", bases(name(1, "object")),
                            function(2, 3, "__init__", args("self"), ret(3, constant(3, 5L)))),
                    discard(4, call(4, name(4, "C"))));
            ClassDecl c = (ClassDecl) module.getLocals().first("C");

            List<InferredValue> direct = all(c.inferCallResult(null, null));
            assertEquals(1, direct.size());
            assertEquals(new Instance(c), direct.get(0));

            List<InferredValue> viaCall = inferStatement(module, 1);
            assertEquals(1, viaCall.size());
            assertSame(c, ((Instance) viaCall.get(0)).getProxied());
        }

        @Test
        @DisplayName("函数调用的结果是 return 语句的值")
        void testReturnValues() {
            ModuleDecl module = build(
                    function(1, 5, "f", args("flag"),
                            RawNode.of("If").with("tests", RawNode.list(
                                    RawNode.list(name(2, "flag"), stmt(ret(3, constant(3, "yes"))))))
                                    .with("else_", null).at(2).span(2, 3),
                            ret(4, constant(4, null)),
                            ret(5, null)),
                    discard(6, call(6, name(6, "f"))));

            List<InferredValue> values = inferStatement(module, 1);
            assertEquals(3, values.size());
            assertEquals("yes", ((Const) values.get(0)).getValue());
            assertTrue(values.get(1) instanceof NoValue);
            assertTrue(values.get(2) instanceof NoValue);
        }

        @Test
        @DisplayName("生成器函数的调用结果是生成器")
        void testGenerator() {
            RawNode yield = RawNode.of("Yield").with("value", constant(2, 1L)).at(2);
            ModuleDecl module = build(function(1, 2, "gen", args(), discard(2, yield)), discard(3, call(3, name(3, "gen"))));

            List<InferredValue> values = inferStatement(module, 1);
            assertEquals(1, values.size());
            assertTrue(values.get(0) instanceof GeneratorValue);
        }

        @Test
        @DisplayName("参数取默认值，另加调用方可能传入的未知值")
        void testDefaults() {
            RawNode function = function(1, 2, "g", args("a"), ret(2, name(2, "a")))
                    .with("defaults", RawNode.list(constant(1, 2L)));
            ModuleDecl module = build(function, discard(3, call(3, name(3, "g"))));

            List<InferredValue> values = inferStatement(module, 1);
            assertEquals(Collections.<Object>singletonList(2L), constValues(values));
            assertTrue(values.get(values.size() - 1).isUnknown());
        }

        @Test
        @DisplayName("没有默认值的参数无法静态确定")
        void testVarargs() {
            RawNode function = function(1, 2, "h", args("first", "rest"), ret(2, name(2, "first"))).with("flags", 4);
            ModuleDecl module = build(function, discard(3, call(3, name(3, "h"))));

            List<InferredValue> values = inferStatement(module, 1);
            assertEquals(1, values.size());
            assertTrue(values.get(0).isUnknown());
        }
    }

    // ============ 属性赋值 ============

    @Nested
    @DisplayName("属性赋值")
    class AttributeTests {

        private ModuleDecl buildCounter() {
            return build(
                    classDef(1, 5, "Counter", bases(name(1, "object")),
                            function(2, 3, "reset", args("self"),
                                    assign(3, assAttr(3, name(3, "self"), "count"), constant(3, 0L))),
                            function(4, 5, "__init__", args("self"),
                                    assign(5, assAttr(5, name(5, "self"), "count"), constant(5, null)))),
                    assign(6, "counter", call(6, name(6, "Counter"))),
                    discard(7, getattr(7, name(7, "counter"), "count")),
                    discard(8, getattr(8, name(8, "counter"), "reset")),
                    discard(9, getattr(9, name(9, "Counter"), "reset")));
        }

        @Test
        @DisplayName("构造方法中的赋值排在最前")
        void testConstructorFirst() {
            ModuleDecl module = buildCounter();
            ClassDecl counter = (ClassDecl) module.getLocals().first("Counter");

            List<AstNode> bindings = counter.getInstanceAttrs().get("count");
            assertEquals(2, bindings.size());
            assertEquals("__init__", bindings.get(0).frame().getName());
            assertEquals("reset", bindings.get(1).frame().getName());
            assertFalse(counter.getLocals().contains("count"));
        }

        @Test
        @DisplayName("实例属性推断出全部赋值")
        void testInstanceAttribute() {
            ModuleDecl module = buildCounter();
            List<Object> values = constValues(inferStatement(module, 2));
            assertEquals(Arrays.<Object>asList(null, 0L), values);
        }

        @Test
        @DisplayName("经实例取到绑定方法，经类取到未绑定方法")
        void testMethods() {
            ModuleDecl module = buildCounter();

            List<InferredValue> bound = inferStatement(module, 3);
            assertEquals(1, bound.size());
            assertTrue(bound.get(0) instanceof BoundMethod);
            assertTrue(((BoundMethod) bound.get(0)).getBound() instanceof Instance);

            List<InferredValue> unbound = inferStatement(module, 4);
            assertEquals(1, unbound.size());
            assertTrue(unbound.get(0) instanceof UnboundMethod);
            assertFalse(((UnboundMethod) unbound.get(0)).isBound());
        }

        @Test
        @DisplayName("对类对象的属性赋值登记到类的局部表")
        void testClassAttributeAssignment() {
            ModuleDecl module = build(
                    classDef(1, 2, "Registry", bases(), pass(2)),
                    assign(3, assAttr(3, name(3, "Registry"), "default"), constant(3, "x")));
            ClassDecl registry = (ClassDecl) module.getLocals().first("Registry");

            assertTrue(registry.getLocals().contains("default"));
            assertEquals(Collections.<Object>singletonList("x"), constValues(all(registry.inferAttribute("default", null))));
        }

        @Test
        @DisplayName("接收者无法推断的属性赋值被跳过")
        void testUnresolvableReceiver() {
            ModuleDecl module = build(assign(1, assAttr(1, name(1, "unknown"), "x"), constant(1, 1L)));
            assertEquals(1, module.getBody().size());
        }

        @Test
        @DisplayName("父类上的类属性")
        void testInheritedAttribute() {
            ModuleDecl module = build(
                    classDef(1, 2, "Base", bases(), assign(2, "limit", constant(2, 10L))),
                    classDef(3, 4, "Derived", bases(name(3, "Base")), pass(4)));
            ClassDecl derived = (ClassDecl) module.getLocals().first("Derived");

            assertEquals(Collections.<Object>singletonList(10L),
                    constValues(all(derived.inferAttribute("limit", null))));
            assertEquals("Base", derived.localAttr("limit", null).get(0).frame().getName());
        }
    }

    // ============ 跨模块 ============

    @Nested
    @DisplayName("跨模块")
    class ImportTests {

        private ModuleManager modules(Map<String, RawNode> trees, String... packages) {
            return manager(trees, packages);
        }

        @Test
        @DisplayName("from 导入的函数的调用结果")
        void testFromImport() {
            Map<String, RawNode> trees = new HashMap<String, RawNode>();
            trees.put("lib", module(
                    function(1, 2, "make", args(), ret(2, call(2, name(2, "Widget")))),
                    classDef(3, 4, "Widget", bases(name(3, "object")), pass(4))));
            trees.put("app", module(
                    from(1, "lib", 0, "make"),
                    assign(2, "w", call(2, name(2, "make"))),
                    discard(3, name(3, "w"))));
            ModuleDecl app = modules(trees).module("app");

            List<InferredValue> values = inferStatement(app, 2);
            assertEquals(1, values.size());
            assertEquals("lib.Widget", ((Instance) values.get(0)).getProxied().qualifiedName());
        }

        @Test
        @DisplayName("import 绑定模块本身")
        void testImportModule() {
            Map<String, RawNode> trees = new HashMap<String, RawNode>();
            trees.put("lib", module(assign(1, "VALUE", constant(1, 42L))));
            trees.put("app", module(importNames(1, "lib"), discard(2, getattr(2, name(2, "lib"), "VALUE"))));
            ModuleManager manager = modules(trees);
            ModuleDecl app = manager.module("app");

            assertEquals(Collections.<Object>singletonList(42L), constValues(inferStatement(app, 1)));
            assertSame(manager.module("lib"), inferAll(((ExprStmt) app.getBody().get(1)).getValue()
                    .getChildren().get(0)).get(0));
        }

        @Test
        @DisplayName("通配导入按 __all__ 展开")
        void testWildcard() {
            Map<String, RawNode> trees = new HashMap<String, RawNode>();
            trees.put("lib", module(
                    assign(1, "__all__", list(1, constant(1, "public"))),
                    assign(2, "public", constant(2, 1L)),
                    assign(3, "hidden", constant(3, 2L))));
            trees.put("app", module(from(1, "lib", 0, "*"), discard(2, name(2, "public"))));
            ModuleDecl app = modules(trees).module("app");

            assertTrue(app.getLocals().contains("public"));
            assertFalse(app.getLocals().contains("hidden"));
            assertEquals(Collections.<Object>singletonList(1L), constValues(inferStatement(app, 1)));
        }

        @Test
        @DisplayName("包内的显式相对导入")
        void testExplicitRelative() {
            Map<String, RawNode> trees = new HashMap<String, RawNode>();
            trees.put("pkg", module(assign(1, "VERSION", constant(1, "1.0"))));
            trees.put("pkg.util", module(from(1, "", 1, "VERSION"), discard(2, name(2, "VERSION"))));
            ModuleDecl util = modules(trees, "pkg").module("pkg.util");

            assertEquals(Collections.<Object>singletonList("1.0"), constValues(inferStatement(util, 1)));
        }

        @Test
        @DisplayName("隐式相对导入优先，absolute_import 之后只找绝对名称")
        void testImplicitRelative() {
            Map<String, RawNode> trees = new HashMap<String, RawNode>();
            trees.put("pkg", module());
            trees.put("pkg.helpers", module(assign(1, "x", constant(1, 3L))));
            trees.put("helpers", module(assign(1, "x", constant(1, 4L))));
            trees.put("pkg.implicit", module(from(1, "helpers", 0, "x"), discard(2, name(2, "x"))));
            trees.put("pkg.absolute", module(from(1, "__future__", 0, "absolute_import"),
                    from(2, "helpers", 0, "x"), discard(3, name(3, "x"))));
            ModuleManager manager = modules(trees, "pkg");

            assertEquals(Collections.<Object>singletonList(3L),
                    constValues(inferStatement(manager.module("pkg.implicit"), 1)));
            assertEquals(Collections.<Object>singletonList(4L),
                    constValues(inferStatement(manager.module("pkg.absolute"), 2)));
        }

        @Test
        @DisplayName("包的子模块作为属性")
        void testSubmoduleAttribute() {
            Map<String, RawNode> trees = new HashMap<String, RawNode>();
            trees.put("pkg", module());
            trees.put("pkg.sub", module(assign(1, "y", constant(1, 1L))));
            ModuleManager manager = modules(trees, "pkg");
            ModuleDecl pkg = manager.module("pkg");

            assertTrue(pkg.isPackage());
            assertSame(manager.module("pkg.sub"), pkg.getAttribute("sub", null).get(0));
        }

        @Test
        @DisplayName("循环导入")
        void testCyclicImport() {
            Map<String, RawNode> trees = new HashMap<String, RawNode>();
            trees.put("a", module(from(1, "b", 0, "*"), assign(2, "fromA", constant(2, 1L))));
            trees.put("b", module(from(1, "a", 0, "*"), assign(2, "fromB", constant(2, 2L))));
            ModuleManager manager = modules(trees);
            ModuleDecl a = manager.module("a");

            assertTrue(a.getLocals().contains("fromA"));
            assertSame(a, manager.module("a"));
            assertTrue(manager.module("b").getLocals().contains("fromB"));
        }

        @Test
        @DisplayName("内建名称")
        void testBuiltins() {
            ModuleDecl module = build(discard(1, name(1, "len")), discard(2, call(2, name(2, "isinstance"))));

            List<InferredValue> values = inferStatement(module, 0);
            assertEquals(1, values.size());
            FunctionDecl len = (FunctionDecl) values.get(0);
            assertEquals(Builtins.MODULE_NAME, len.root().getName());
            assertFalse(len.root().isPureSource());
        }
    }
}
