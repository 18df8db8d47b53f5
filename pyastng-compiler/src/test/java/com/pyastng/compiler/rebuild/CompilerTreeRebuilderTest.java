package com.pyastng.compiler.rebuild;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.LineRange;
import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.*;
import com.pyastng.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pyastng.compiler.ast.expr.CompareExpr.CompareOp;
import com.pyastng.compiler.ast.stmt.*;
import com.pyastng.compiler.parsetree.MalformedTreeException;
import com.pyastng.compiler.parsetree.RawNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.pyastng.compiler.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * compiler 形状解析树的重建测试
 */
class CompilerTreeRebuilderTest {

    private ModuleDecl build(RawNode... statements) {
        return buildModule(module(statements));
    }

    private ModuleDecl buildModule(RawNode root) {
        return manager(Collections.singletonMap("mod", root)).module("mod");
    }

    private AstNode firstValue(ModuleDecl module) {
        return ((ExprStmt) module.getBody().get(0)).getValue();
    }

    private static RawNode subscript(int line, RawNode expr, RawNode... subs) {
        return RawNode.of("Subscript").with("expr", expr).with("flags", "OP_APPLY")
                .with("subs", RawNode.list((Object[]) subs)).at(line);
    }

    private static RawNode sliceobj(int line, RawNode... bounds) {
        return RawNode.of("Sliceobj").with("nodes", RawNode.list((Object[]) bounds)).at(line);
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("比较链保留全部运算符与操作数")
        void testCompareChain() {
            RawNode compare = RawNode.of("Compare").with("expr", name(1, "a"))
                    .with("ops", RawNode.list(
                            RawNode.list("<", name(1, "b")),
                            RawNode.list("<", name(1, "c")),
                            RawNode.list("<=", name(1, "d")))).at(1);
            ModuleDecl module = build(discard(1, compare));

            CompareExpr node = (CompareExpr) firstValue(module);
            assertEquals("a", ((Name) node.getLeft()).getName());
            assertEquals(Arrays.asList(CompareOp.LT, CompareOp.LT, CompareOp.LE), node.getOperators());
            assertEquals(3, node.getComparators().size());
            assertEquals("d", ((Name) node.getComparators().get(2)).getName());
        }

        @Test
        @DisplayName("多元位运算折叠为左倾二叉树")
        void testBitwiseFold() {
            RawNode bitor = RawNode.of("Bitor")
                    .with("nodes", RawNode.list(name(1, "a"), name(1, "b"), name(1, "c"))).at(1);
            ModuleDecl module = build(discard(1, bitor));

            BinaryExpr outer = (BinaryExpr) firstValue(module);
            assertEquals(BinaryOp.BIT_OR, outer.getOperator());
            assertEquals("c", ((Name) outer.getRight()).getName());
            BinaryExpr inner = (BinaryExpr) outer.getLeft();
            assertEquals("a", ((Name) inner.getLeft()).getName());
            assertEquals("b", ((Name) inner.getRight()).getName());
            assertSame(outer, inner.getParent());
        }

        @Test
        @DisplayName("位运算少于两个操作数是格式错误")
        void testBitwiseTooFewOperands() {
            RawNode bitand = RawNode.of("Bitand").with("nodes", RawNode.list(name(1, "a"))).at(1);
            assertThrows(MalformedTreeException.class, () -> build(discard(1, bitand)));
        }

        @Test
        @DisplayName("关键字参数从位置参数中拆出")
        void testKeywordSplit() {
            ModuleDecl module = build(discard(1,
                    call(1, name(1, "f"), name(1, "x"), keyword(1, "k", constant(1, 1L)))));

            CallExpr call = (CallExpr) firstValue(module);
            assertEquals(1, call.getArgs().size());
            assertEquals(1, call.getKeywords().size());
            assertEquals("k", call.getKeywords().get(0).getArg());
            assertEquals(1L, ((Const) call.getKeywords().get(0).getValue()).getValue());
            assertNull(call.getStarargs());
        }

        @Test
        @DisplayName("None/True/False 的读取改写为常量")
        void testConstantNames() {
            ModuleDecl module = build(discard(1, name(1, "True")));
            Const value = (Const) firstValue(module);
            assertEquals(Boolean.TRUE, value.getValue());
        }

        @Test
        @DisplayName("生成器表达式去掉内层节点")
        void testGenExpr() {
            RawNode quals = RawNode.of("GenExprFor").with("assign", assName(1, "x"))
                    .with("iter", name(1, "xs"))
                    .with("ifs", RawNode.list(RawNode.of("GenExprIf").with("test", name(1, "x")).at(1))).at(1);
            RawNode inner = RawNode.of("GenExprInner").with("expr", name(1, "x"))
                    .with("quals", RawNode.list(quals)).at(1);
            ModuleDecl module = build(discard(1, RawNode.of("GenExpr").with("code", inner).at(1)));

            GeneratorExpr gen = (GeneratorExpr) firstValue(module);
            assertEquals(1, gen.getGenerators().size());
            Comprehension comprehension = gen.getGenerators().get(0);
            assertTrue(comprehension.getTarget() instanceof AssignName);
            assertEquals(1, comprehension.getIfs().size());
            assertTrue(gen.getLocals().contains("x"));
        }
    }

    // ============ 下标 ============

    @Nested
    @DisplayName("下标")
    class SubscriptTests {

        @Test
        @DisplayName("单个索引")
        void testIndex() {
            SubscriptExpr node = (SubscriptExpr) firstValue(build(discard(1,
                    subscript(1, name(1, "a"), constant(1, 1L)))));
            IndexSlice index = (IndexSlice) node.getSlice();
            assertEquals(1L, ((Const) index.getValue()).getValue());
        }

        @Test
        @DisplayName("多个索引组成元组")
        void testMultiIndex() {
            SubscriptExpr node = (SubscriptExpr) firstValue(build(discard(1,
                    subscript(1, name(1, "a"), constant(1, 1L), constant(1, 2L)))));
            TupleExpr tuple = (TupleExpr) ((IndexSlice) node.getSlice()).getValue();
            assertEquals(2, tuple.getElts().size());
        }

        @Test
        @DisplayName("Slice 节点没有步长")
        void testSimpleSlice() {
            RawNode slice = RawNode.of("Slice").with("expr", name(1, "a")).with("flags", "OP_APPLY")
                    .with("lower", constant(1, 1L)).with("upper", constant(1, null)).at(1);
            SubscriptExpr node = (SubscriptExpr) firstValue(build(discard(1, slice)));
            SliceExpr bounds = (SliceExpr) node.getSlice();
            assertEquals(1L, ((Const) bounds.getLower()).getValue());
            assertNull(bounds.getUpper());
            assertNull(bounds.getStep());
        }

        @Test
        @DisplayName("Sliceobj 的 None 边界视为缺省")
        void testSliceobjWithStep() {
            SubscriptExpr node = (SubscriptExpr) firstValue(build(discard(1,
                    subscript(1, name(1, "a"),
                            sliceobj(1, constant(1, null), constant(1, null), constant(1, 2L))))));
            SliceExpr bounds = (SliceExpr) node.getSlice();
            assertNull(bounds.getLower());
            assertNull(bounds.getUpper());
            assertEquals(2L, ((Const) bounds.getStep()).getValue());
        }

        @Test
        @DisplayName("切片与索引混合是扩展切片")
        void testExtendedSlice() {
            SubscriptExpr node = (SubscriptExpr) firstValue(build(discard(1,
                    subscript(1, name(1, "a"),
                            sliceobj(1, constant(1, 1L), constant(1, 2L)), constant(1, 3L)))));
            ExtSliceExpr ext = (ExtSliceExpr) node.getSlice();
            assertEquals(2, ext.getDims().size());
            assertTrue(ext.getDims().get(0) instanceof SliceExpr);
            assertTrue(ext.getDims().get(1) instanceof IndexSlice);
        }

        @Test
        @DisplayName("语句位置的下标是 del")
        void testSubscriptDelete() {
            ModuleDecl module = build(subscript(1, name(1, "a"), constant(1, 0L)));
            DeleteStmt del = (DeleteStmt) module.getBody().get(0);
            assertTrue(del.getTargets().get(0) instanceof SubscriptExpr);
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("elif 链规范化为嵌套的 if")
        void testElifChain() {
            RawNode ifNode = RawNode.of("If").with("tests", RawNode.list(
                    RawNode.list(name(1, "a"), stmt(pass(2))),
                    RawNode.list(name(3, "b"), stmt(discard(4, name(4, "s2"))))))
                    .with("else_", stmt(discard(6, name(6, "s3")))).at(1).span(1, 6);
            ModuleDecl module = build(ifNode);

            IfStmt root = (IfStmt) module.getBody().get(0);
            assertEquals("a", ((Name) root.getTest()).getName());
            assertTrue(root.getBody().get(0) instanceof PassStmt);
            assertTrue(root.hasElif());
            assertEquals(1, root.getOrelse().size());

            IfStmt elif = (IfStmt) root.getOrelse().get(0);
            assertEquals("b", ((Name) elif.getTest()).getName());
            assertEquals(3, elif.getLineno());
            assertEquals(4, elif.getToLineno());
            assertEquals("s2", ((Name) ((ExprStmt) elif.getBody().get(0)).getValue()).getName());
            assertEquals(1, elif.getOrelse().size());
            assertEquals("s3", ((Name) ((ExprStmt) elif.getOrelse().get(0)).getValue()).getName());
            assertFalse(elif.hasElif());
        }

        @Test
        @DisplayName("if 语句按行所在的分支给出块范围")
        void testIfBlockRange() {
            RawNode ifNode = RawNode.of("If").with("tests", RawNode.list(
                    RawNode.list(name(1, "a"), stmt(pass(2), pass(3)))))
                    .with("else_", stmt(pass(5), pass(6))).at(1).span(1, 6);
            IfStmt statement = (IfStmt) build(ifNode).getBody().get(0);

            assertEquals(1, statement.getBlockStartToLineno());
            assertEquals(new LineRange(1, 1), statement.blockRange(1));
            assertEquals(new LineRange(2, 3), statement.blockRange(2));
            assertEquals(new LineRange(4, 4), statement.blockRange(4));
            assertEquals(new LineRange(5, 6), statement.blockRange(5));
        }

        @Test
        @DisplayName("没有 else 的 if 体之后到语句末尾")
        void testIfWithoutElseBlockRange() {
            RawNode ifNode = RawNode.of("If").with("tests", RawNode.list(
                    RawNode.list(name(1, "a"), stmt(pass(2)))))
                    .with("else_", null).at(1).span(1, 3);
            IfStmt statement = (IfStmt) build(ifNode).getBody().get(0);

            assertEquals(new LineRange(2, 2), statement.blockRange(2));
            assertEquals(new LineRange(3, 3), statement.blockRange(3));
        }

        @Test
        @DisplayName("没有行号的 Discard 被剪除")
        void testDiscardPruned() {
            RawNode empty = RawNode.of("Discard").with("expr", constant(1, null));
            ModuleDecl module = build(pass(1), empty);
            assertEquals(1, module.getBody().size());
        }

        @Test
        @DisplayName("语句位置的名称绑定是 del")
        void testAssNameDelete() {
            ModuleDecl module = build(assign(1, "x", constant(1, 1L)), del(2, "x"));

            DeleteStmt del = (DeleteStmt) module.getBody().get(1);
            DeleteName target = (DeleteName) del.getTargets().get(0);
            assertEquals("x", target.getName());
            List<AstNode> bindings = module.getLocals().get("x");
            assertEquals(2, bindings.size());
            assertSame(target, bindings.get(1));
        }

        @Test
        @DisplayName("语句位置的 AssTuple 删除每个元素")
        void testAssTupleDelete() {
            ModuleDecl module = build(assTuple(1, assName(1, "a"), assName(1, "b")));
            DeleteStmt del = (DeleteStmt) module.getBody().get(0);
            assertEquals(2, del.getTargets().size());
            assertTrue(del.getTargets().get(0) instanceof DeleteName);
        }

        @Test
        @DisplayName("return None 没有值")
        void testReturnNone() {
            ModuleDecl module = build(function(1, 2, "f", args(), ret(2, constant(2, null))));
            FunctionDecl f = (FunctionDecl) module.getBody().get(0);
            assertNull(((ReturnStmt) f.getBody().get(0)).getValue());
        }

        @Test
        @DisplayName("语句位置的 yield 包装为表达式语句")
        void testYieldStatement() {
            RawNode yield = RawNode.of("Yield").with("value", constant(2, 1L)).at(2);
            ModuleDecl module = build(function(1, 2, "g", args(), yield));

            FunctionDecl g = (FunctionDecl) module.getBody().get(0);
            ExprStmt statement = (ExprStmt) g.getBody().get(0);
            assertTrue(statement.getValue() instanceof YieldExpr);
            assertTrue(g.isGenerator());
        }

        @Test
        @DisplayName("元组解包赋值绑定每个名称")
        void testTupleAssign() {
            ModuleDecl module = build(assign(1, assTuple(1, assName(1, "a"), assName(1, "b")),
                    tuple(1, constant(1, 1L), constant(1, 2L))));

            AssignStmt assign = (AssignStmt) module.getBody().get(0);
            TupleExpr target = (TupleExpr) assign.getTargets().get(0);
            assertTrue(target.getElts().get(0) instanceof AssignName);
            assertTrue(module.getLocals().contains("a"));
            assertTrue(module.getLocals().contains("b"));
        }

        @Test
        @DisplayName("增量赋值的目标是绑定")
        void testAugAssign() {
            RawNode aug = RawNode.of("AugAssign").with("node", name(2, "x"))
                    .with("op", "+=").with("expr", constant(2, 1L)).at(2);
            ModuleDecl module = build(assign(1, "x", constant(1, 0L)), aug);

            AugAssignStmt statement = (AugAssignStmt) module.getBody().get(1);
            assertEquals(BinaryOp.ADD, statement.getOperator());
            assertTrue(statement.getTarget() instanceof AssignName);
            assertEquals(2, module.getLocals().get("x").size());
        }

        @Test
        @DisplayName("try/except 的名称在处理块中绑定")
        void testTryExcept() {
            RawNode tryExcept = RawNode.of("TryExcept").with("body", stmt(pass(2)))
                    .with("handlers", RawNode.list(RawNode.list(name(3, "ValueError"), assName(3, "e"), stmt(pass(4)))))
                    .with("else_", null).at(1).span(1, 4);
            ModuleDecl module = build(tryExcept);

            TryExceptStmt statement = (TryExceptStmt) module.getBody().get(0);
            ExceptHandler handler = statement.getHandlers().get(0);
            assertEquals("ValueError", ((Name) handler.getType()).getName());
            assertEquals("e", ((AssignName) handler.getName()).getName());
            assertTrue(module.getLocals().contains("e"));
        }

        @Test
        @DisplayName("无法识别的节点以占位节点代替")
        void testUnknownNode() {
            ModuleDecl module = build(RawNode.of("Frobnicate").at(1));
            EmptyNode node = (EmptyNode) module.getBody().get(0);
            assertEquals("Frobnicate", node.getOrigin());
            assertTrue(node.isStatement());
        }

        @Test
        @DisplayName("模块文档")
        void testModuleDoc() {
            ModuleDecl module = buildModule(moduleWithDoc("模块说明", pass(1)));
            assertEquals("模块说明", module.getDoc());
            assertEquals("mod.py", module.getFile());
            assertFalse(module.isPackage());
        }
    }

    // ============ 函数与类 ============

    @Nested
    @DisplayName("函数与类")
    class DeclarationTests {

        @Test
        @DisplayName("有装饰器的函数从最后一个装饰器的下一行开始")
        void testDecoratedFromLineno() {
            RawNode function = decorate(function(1, 4, "f", args(), pass(4)),
                    name(1, "first"), call(2, name(2, "second")));
            ModuleDecl module = build(function);

            FunctionDecl f = (FunctionDecl) module.getBody().get(0);
            assertEquals(1, f.getLineno());
            assertEquals(3, f.getFromLineno());
            assertEquals(2, f.getDecorators().getNodes().size());
        }

        @Test
        @DisplayName("嵌套参数与可变参数")
        void testArguments() {
            RawNode function = function(1, 2, "f", args("a", RawNode.list("b", "c"), "rest", "options"), pass(2))
                    .with("flags", 12);
            ModuleDecl module = build(function);

            FunctionDecl f = (FunctionDecl) module.getBody().get(0);
            Arguments arguments = f.getArgs();
            assertEquals("rest", arguments.getVararg());
            assertEquals("options", arguments.getKwarg());
            assertEquals(2, arguments.getArgs().size());
            TupleExpr nested = (TupleExpr) arguments.getArgs().get(1);
            assertEquals(2, nested.getElts().size());
            for (String name : Arrays.asList("a", "b", "c", "rest", "options")) {
                assertTrue(f.getLocals().contains(name), name);
            }
            assertSame(arguments, f.getLocals().first("rest"));
        }

        @Test
        @DisplayName("global 名称绑定到模块")
        void testGlobal() {
            ModuleDecl module = build(function(1, 3, "f", args(),
                    global(2, "counter"), assign(3, "counter", constant(3, 1L))));

            FunctionDecl f = (FunctionDecl) module.getBody().get(0);
            assertFalse(f.getLocals().contains("counter"));
            assertTrue(module.getLocals().contains("counter"));
        }

        @Test
        @DisplayName("类中的函数是方法，__new__ 是类方法")
        void testMethodRoles() {
            ModuleDecl module = build(classDef(1, 3, "C", bases(name(1, "object")),
                    function(2, 2, "m", args("self"), pass(2)),
                    function(3, 3, "__new__", args("cls"), pass(3))));

            ClassDecl c = (ClassDecl) module.getBody().get(0);
            assertEquals(FunctionRole.METHOD, ((FunctionDecl) c.getLocals().first("m")).getRole());
            assertEquals(FunctionRole.CLASSMETHOD, ((FunctionDecl) c.getLocals().first("__new__")).getRole());
        }

        @Test
        @DisplayName("装饰器决定方法角色")
        void testDecoratorRole() {
            ModuleDecl module = build(classDef(1, 5, "C", bases(name(1, "object")),
                    decorate(function(2, 3, "s", args(), pass(3)), name(2, "staticmethod")),
                    decorate(function(4, 5, "k", args("cls"), pass(5)), name(4, "classmethod"))));

            ClassDecl c = (ClassDecl) module.getBody().get(0);
            assertEquals(FunctionRole.STATICMETHOD, ((FunctionDecl) c.getLocals().first("s")).getRole());
            assertEquals(FunctionRole.CLASSMETHOD, ((FunctionDecl) c.getLocals().first("k")).getRole());
        }

        @Test
        @DisplayName("类体中的 name = classmethod(name) 追溯设置角色")
        void testClassmethodAssignment() {
            ModuleDecl module = build(classDef(1, 3, "C", bases(),
                    function(2, 2, "k", args("cls"), pass(2)),
                    assign(3, "k", call(3, name(3, "classmethod"), name(3, "k")))));

            ClassDecl c = (ClassDecl) module.getBody().get(0);
            FunctionDecl k = (FunctionDecl) c.getLocals().first("k");
            assertEquals(FunctionRole.CLASSMETHOD, k.getRole());
            assertEquals(1, k.getExtraDecorators().size());
        }

        @Test
        @DisplayName("staticmethod 装饰的 __new__ 仍是类方法")
        void testDecoratedNewStaysClassmethod() {
            ModuleDecl module = build(classDef(1, 3, "C", bases(name(1, "object")),
                    decorate(function(2, 3, "__new__", args("cls"), pass(3)), name(2, "staticmethod"))));

            ClassDecl c = (ClassDecl) module.getBody().get(0);
            FunctionDecl created = (FunctionDecl) c.getLocals().first("__new__");
            assertEquals(FunctionRole.CLASSMETHOD, created.getRole());
            assertEquals(1, created.getDecorators().getNodes().size());
        }

        @Test
        @DisplayName("__new__ = staticmethod(__new__) 只登记额外装饰，不改变角色")
        void testNewStaticmethodAssignment() {
            ModuleDecl module = build(classDef(1, 3, "C", bases(name(1, "object")),
                    function(2, 2, "__new__", args("cls"), pass(2)),
                    assign(3, "__new__", call(3, name(3, "staticmethod"), name(3, "__new__")))));

            ClassDecl c = (ClassDecl) module.getBody().get(0);
            FunctionDecl created = (FunctionDecl) c.getLocals().first("__new__");
            assertEquals(FunctionRole.CLASSMETHOD, created.getRole());
            assertEquals(1, created.getExtraDecorators().size());
        }

        @Test
        @DisplayName("类外的 __new__ 函数按装饰器取角色")
        void testNewOutsideClass() {
            ModuleDecl module = build(decorate(function(1, 2, "__new__", args(), pass(2)), name(1, "staticmethod")));
            assertEquals(FunctionRole.STATICMETHOD, ((FunctionDecl) module.getLocals().first("__new__")).getRole());
        }

        @Test
        @DisplayName("类与函数的块范围是整个定义")
        void testDeclarationBlockRange() {
            ModuleDecl module = build(
                    classDef(1, 4, "C", bases(name(1, "A"), name(2, "B")),
                            function(3, 4, "m", args("self"), pass(4))),
                    decorate(function(5, 8, "f", args(), pass(7), pass(8)), name(5, "wrap")));

            ClassDecl c = (ClassDecl) module.getLocals().first("C");
            assertEquals(2, c.getBlockStartToLineno());
            assertEquals(new LineRange(1, 4), c.blockRange(3));
            assertEquals(new LineRange(1, 4), c.blockRange(1));

            FunctionDecl f = (FunctionDecl) module.getLocals().first("f");
            assertEquals(6, f.getBlockStartToLineno());
            assertEquals(new LineRange(6, 8), f.blockRange(7));
            assertTrue(f.blockRange(7).contains(8));
            assertFalse(f.blockRange(7).contains(5));
        }

        @Test
        @DisplayName("类体中的 __metaclass__ 赋值使无基类的类成为新式类")
        void testMetaclass() {
            ModuleDecl module = build(
                    classDef(1, 2, "Old", bases(), pass(2)),
                    classDef(3, 4, "New", bases(), assign(4, "__metaclass__", name(4, "type"))));

            assertFalse(((ClassDecl) module.getLocals().first("Old")).isNewStyle());
            assertTrue(((ClassDecl) module.getLocals().first("New")).isNewStyle());
        }

        @Test
        @DisplayName("导入绑定第一段名称或别名")
        void testImports() {
            ModuleDecl module = build(importNames(1, "os.path"), from(2, "pkg.mod", 0, "a as b", "c"));

            assertTrue(module.getLocals().first("os") instanceof ImportStmt);
            assertTrue(module.getLocals().first("b") instanceof FromImportStmt);
            assertTrue(module.getLocals().contains("c"));
            assertFalse(module.getLocals().contains("a"));
        }
    }
}
