package com.pyastng.compiler.rebuild;

import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.*;
import com.pyastng.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pyastng.compiler.ast.expr.CompareExpr.CompareOp;
import com.pyastng.compiler.ast.stmt.*;
import com.pyastng.compiler.builder.ModuleBuilder;
import com.pyastng.compiler.parsetree.MalformedTreeException;
import com.pyastng.compiler.parsetree.RawNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.pyastng.compiler.Trees.manager;
import static org.junit.jupiter.api.Assertions.*;

/**
 * _ast 形状解析树的重建测试
 */
class AstTreeRebuilderTest {

    private ModuleDecl build(RawNode... statements) {
        RawNode root = RawNode.of("Module").with("body", RawNode.list((Object[]) statements));
        return manager(Collections.singletonMap("mod", root)).module("mod");
    }

    private static RawNode name(int line, String id) {
        return RawNode.of("Name").with("id", id).with("ctx", RawNode.of("Load")).at(line);
    }

    private static RawNode num(int line, long n) {
        return RawNode.of("Num").with("n", n).at(line);
    }

    private static RawNode str(int line, String s) {
        return RawNode.of("Str").with("s", s).at(line);
    }

    private static RawNode expr(int line, RawNode value) {
        return RawNode.of("Expr").with("value", value).at(line);
    }

    private static RawNode assign(int line, RawNode target, RawNode value) {
        return RawNode.of("Assign").with("targets", RawNode.list(target)).with("value", value).at(line);
    }

    private static RawNode pass(int line) {
        return RawNode.of("Pass").at(line);
    }

    private static RawNode arguments(String... names) {
        Object[] args = new Object[names.length];
        for (int i = 0; i < names.length; i++) {
            args[i] = RawNode.of("Name").with("id", names[i]).with("ctx", RawNode.of("Param"));
        }
        return RawNode.of("arguments").with("args", RawNode.list(args))
                .with("vararg", null).with("kwarg", null).with("defaults", RawNode.list());
    }

    private static RawNode functionDef(int line, String name, RawNode args, RawNode[] decorators, RawNode... body) {
        return RawNode.of("FunctionDef").with("name", name).with("args", args)
                .with("decorator_list", RawNode.list((Object[]) decorators))
                .with("body", RawNode.list((Object[]) body)).at(line);
    }

    private static RawNode classDef(int line, String name, RawNode[] bases, RawNode... body) {
        return RawNode.of("ClassDef").with("name", name).with("bases", RawNode.list((Object[]) bases))
                .with("body", RawNode.list((Object[]) body)).at(line);
    }

    private static <T> T firstValue(ModuleDecl module, Class<T> type) {
        Object value = ((ExprStmt) module.getBody().get(0)).getValue();
        assertTrue(type.isInstance(value), "期望 " + type.getSimpleName() + "，实际是 " + value);
        return type.cast(value);
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("模块、类与函数的文档字符串从语句体中取出")
        void testDocstrings() {
            ModuleDecl module = build(
                    expr(1, str(1, "模块")),
                    classDef(2, "C", new RawNode[0], expr(3, str(3, "类")),
                            functionDef(4, "m", arguments("self"), new RawNode[0],
                                    expr(5, RawNode.of("Constant").with("value", "方法").at(5)), pass(6))));

            assertEquals("模块", module.getDoc());
            assertEquals(1, module.getBody().size());
            ClassDecl c = (ClassDecl) module.getBody().get(0);
            assertEquals("类", c.getDoc());
            FunctionDecl m = (FunctionDecl) c.getBody().get(0);
            assertEquals("方法", m.getDoc());
            assertEquals(1, m.getBody().size());
            assertEquals(FunctionRole.METHOD, m.getRole());
        }

        @Test
        @DisplayName("Delete 的目标在删除上下文中访问")
        void testDelete() {
            RawNode target = RawNode.of("Name").with("id", "x").with("ctx", RawNode.of("Del")).at(2);
            ModuleDecl module = build(assign(1, RawNode.of("Name").with("id", "x").at(1), num(1, 1)),
                    RawNode.of("Delete").with("targets", RawNode.list(target)).at(2));

            DeleteStmt del = (DeleteStmt) module.getBody().get(1);
            assertTrue(del.getTargets().get(0) instanceof DeleteName);
            assertEquals(2, module.getLocals().get("x").size());
        }

        @Test
        @DisplayName("赋值目标由结构决定，不看 ctx 字段")
        void testStructuralContext() {
            ModuleDecl module = build(assign(1, name(1, "x"), num(1, 1)));
            AssignStmt assign = (AssignStmt) module.getBody().get(0);
            assertTrue(assign.getTargets().get(0) instanceof AssignName);
            assertTrue(module.getLocals().contains("x"));
        }

        @Test
        @DisplayName("有装饰器时 def 行在装饰器之后")
        void testDecoratorLines() {
            RawNode decorated = functionDef(1, "f", arguments(), new RawNode[]{name(1, "a"), name(2, "b")}, pass(4));
            ModuleDecl module = build(decorated);

            FunctionDecl f = (FunctionDecl) module.getBody().get(0);
            assertEquals(1, f.getLineno());
            assertEquals(3, f.getFromLineno());
        }

        @Test
        @DisplayName("合并写法的 try 拆成 try-finally 包裹 try-except")
        void testCombinedTry() {
            RawNode handler = RawNode.of("ExceptHandler").with("type", name(3, "Exception"))
                    .with("name", "e").with("body", RawNode.list(pass(4))).at(3);
            RawNode tryNode = RawNode.of("Try").with("body", RawNode.list(pass(2)))
                    .with("handlers", RawNode.list(handler))
                    .with("orelse", RawNode.list())
                    .with("finalbody", RawNode.list(pass(6))).at(1);
            ModuleDecl module = build(tryNode);

            TryFinallyStmt outer = (TryFinallyStmt) module.getBody().get(0);
            TryExceptStmt inner = (TryExceptStmt) outer.getBody().get(0);
            assertEquals(1, inner.getHandlers().size());
            assertEquals("e", ((AssignName) inner.getHandlers().get(0).getName()).getName());
            assertEquals(1, outer.getFinalbody().size());
            assertTrue(module.getLocals().contains("e"));
        }

        @Test
        @DisplayName("with 的 items 写法")
        void testWithItems() {
            RawNode item = RawNode.of("withitem").with("context_expr", name(1, "lock"))
                    .with("optional_vars", name(1, "held"));
            ModuleDecl module = build(RawNode.of("With").with("items", RawNode.list(item))
                    .with("body", RawNode.list(pass(2))).at(1));

            WithStmt with = (WithStmt) module.getBody().get(0);
            assertEquals("lock", ((Name) with.getExpr()).getName());
            assertTrue(with.getVars() instanceof AssignName);
            assertTrue(module.getLocals().contains("held"));
        }

        @Test
        @DisplayName("多个上下文管理器是格式错误")
        void testWithManyItems() {
            RawNode item = RawNode.of("withitem").with("context_expr", name(1, "a"));
            RawNode with = RawNode.of("With").with("items", RawNode.list(item, item))
                    .with("body", RawNode.list(pass(2))).at(1);
            assertThrows(MalformedTreeException.class, () -> build(with));
        }

        @Test
        @DisplayName("相对导入")
        void testImportFrom() {
            RawNode alias = RawNode.of("alias").with("name", "helper").with("asname", "h");
            ModuleDecl module = build(RawNode.of("ImportFrom").with("module", "util")
                    .with("names", RawNode.list(alias)).with("level", 1).at(1));

            FromImportStmt from = (FromImportStmt) module.getBody().get(0);
            assertEquals("util", from.getModname());
            assertEquals(1, from.getLevel());
            assertSame(from, module.getLocals().first("h"));
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("二元运算与比较")
        void testOperators() {
            RawNode binop = RawNode.of("BinOp").with("left", num(1, 1)).with("op", RawNode.of("Mult"))
                    .with("right", num(1, 2)).at(1);
            RawNode compare = RawNode.of("Compare").with("left", binop)
                    .with("ops", RawNode.list(RawNode.of("Lt"), RawNode.of("NotIn")))
                    .with("comparators", RawNode.list(name(1, "b"), name(1, "c"))).at(1);
            ModuleDecl module = build(expr(1, compare));

            CompareExpr node = firstValue(module, CompareExpr.class);
            assertEquals(BinaryOp.MUL, ((BinaryExpr) node.getLeft()).getOperator());
            assertEquals(Arrays.asList(CompareOp.LT, CompareOp.NOT_IN), node.getOperators());
        }

        @Test
        @DisplayName("比较运算符与操作数数量不一致是格式错误")
        void testCompareMismatch() {
            RawNode compare = RawNode.of("Compare").with("left", num(1, 1))
                    .with("ops", RawNode.list(RawNode.of("Lt")))
                    .with("comparators", RawNode.list()).at(1);
            assertThrows(MalformedTreeException.class, () -> build(expr(1, compare)));
        }

        @Test
        @DisplayName("未知运算符是格式错误")
        void testUnknownOperator() {
            RawNode binop = RawNode.of("BinOp").with("left", num(1, 1)).with("op", RawNode.of("MatMult"))
                    .with("right", num(1, 2)).at(1);
            assertThrows(MalformedTreeException.class, () -> build(expr(1, binop)));
        }

        @Test
        @DisplayName("下标的几种形状")
        void testSubscripts() {
            RawNode index = RawNode.of("Subscript").with("value", name(1, "a"))
                    .with("slice", RawNode.of("Index").with("value", num(1, 0))).at(1);
            RawNode ext = RawNode.of("Subscript").with("value", name(2, "a"))
                    .with("slice", RawNode.of("Tuple").with("elts", RawNode.list(
                            RawNode.of("Slice").with("lower", num(2, 1)), num(2, 2)))).at(2);
            RawNode bare = RawNode.of("Subscript").with("value", name(3, "a"))
                    .with("slice", name(3, "k")).at(3);
            ModuleDecl module = build(expr(1, index), expr(2, ext), expr(3, bare));

            SubscriptExpr first = (SubscriptExpr) ((ExprStmt) module.getBody().get(0)).getValue();
            assertTrue(first.getSlice() instanceof IndexSlice);
            SubscriptExpr second = (SubscriptExpr) ((ExprStmt) module.getBody().get(1)).getValue();
            ExtSliceExpr dims = (ExtSliceExpr) second.getSlice();
            assertTrue(dims.getDims().get(0) instanceof SliceExpr);
            assertTrue(dims.getDims().get(1) instanceof IndexSlice);
            SubscriptExpr third = (SubscriptExpr) ((ExprStmt) module.getBody().get(2)).getValue();
            assertEquals("k", ((Name) ((IndexSlice) third.getSlice()).getValue()).getName());
        }

        @Test
        @DisplayName("调用的关键字与星号参数")
        void testCall() {
            RawNode call = RawNode.of("Call").with("func", name(1, "f"))
                    .with("args", RawNode.list(num(1, 1)))
                    .with("keywords", RawNode.list(RawNode.of("keyword").with("arg", "k").with("value", num(1, 2))))
                    .with("starargs", name(1, "rest")).with("kwargs", null).at(1);
            CallExpr node = firstValue(build(expr(1, call)), CallExpr.class);
            assertEquals(1, node.getArgs().size());
            assertEquals("k", node.getKeywords().get(0).getArg());
            assertEquals("rest", ((Name) node.getStarargs()).getName());
            assertNull(node.getKwargs());
        }

        @Test
        @DisplayName("字典的键值数量不一致是格式错误")
        void testDictMismatch() {
            RawNode dict = RawNode.of("Dict").with("keys", RawNode.list(num(1, 1)))
                    .with("values", RawNode.list()).at(1);
            assertThrows(MalformedTreeException.class, () -> build(expr(1, dict)));
        }

        @Test
        @DisplayName("列表推导的目标绑定在推导中")
        void testListComp() {
            RawNode generator = RawNode.of("comprehension").with("target", name(1, "x"))
                    .with("iter", name(1, "xs")).with("ifs", RawNode.list());
            RawNode comp = RawNode.of("ListComp").with("elt", name(1, "x"))
                    .with("generators", RawNode.list(generator)).at(1);
            ListCompExpr node = firstValue(build(expr(1, comp)), ListCompExpr.class);
            assertTrue(node.getGenerators().get(0).getTarget() instanceof AssignName);
        }

        @Test
        @DisplayName("NameConstant 与 Constant")
        void testConstants() {
            ModuleDecl module = build(expr(1, RawNode.of("NameConstant").with("value", true).at(1)),
                    expr(2, name(2, "None")));
            assertEquals(Boolean.TRUE, ((Const) ((ExprStmt) module.getBody().get(0)).getValue()).getValue());
            assertTrue(((Const) ((ExprStmt) module.getBody().get(1)).getValue()).isNone());
        }
    }

    @Nested
    @DisplayName("前端选择")
    class FrontEndTests {

        @Test
        @DisplayName("不经缓存直接构建")
        void testModuleBuilder() {
            RawNode root = RawNode.of("Module").with("body", RawNode.list(pass(1)));
            ModuleDecl module = new ModuleBuilder(null).build(root, "standalone");
            assertEquals("standalone", module.getName());
            assertTrue(module.getBody().get(0) instanceof PassStmt);
        }
    }
}
