package com.pyastng.compiler.builder;

import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.EmptyNode;
import com.pyastng.compiler.ast.stmt.FromImportStmt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 无源码节点的构造测试
 */
class RawBuildingTest {

    @Test
    @DisplayName("构造的模块不是纯源码模块")
    void testBuildModule() {
        ModuleDecl module = RawBuilding.buildModule("native", "文档");

        assertEquals("native", module.getName());
        assertEquals("文档", module.getDoc());
        assertFalse(module.isPureSource());
        assertFalse(module.isPackage());
        assertTrue(module.getBody().isEmpty());
    }

    @Test
    @DisplayName("基类名称挂为名称读取节点")
    void testBuildClass() {
        ClassDecl cls = RawBuilding.buildClass("Sub", Arrays.asList("Base", "Mixin"), null);

        assertEquals(2, cls.getBases().size());
        assertEquals(Arrays.asList("Base", "Mixin"), cls.basenames());
        assertSame(cls, cls.getBases().get(0).getParent());
    }

    @Test
    @DisplayName("函数参数与默认值")
    void testBuildFunction() {
        FunctionDecl function = RawBuilding.buildFunction("f", Arrays.asList("a", "b"),
                Collections.<Object>singletonList(3L), null);

        assertTrue(function.getArgs().hasArgumentInfo());
        assertEquals(Arrays.asList("a", "b"), function.getArgs().argNames());
        assertTrue(function.getLocals().contains("a"));
        assertEquals(3L, ((Const) function.getArgs().defaultValue("b")).getValue());
        assertNull(function.getArgs().defaultValue("a"));
    }

    @Test
    @DisplayName("没有参数信息的函数")
    void testBuildFunctionWithoutArgs() {
        FunctionDecl function = RawBuilding.buildFunction("g", null, null, null);

        assertFalse(function.getArgs().hasArgumentInfo());
        assertTrue(function.getLocals().names().isEmpty());
    }

    @Test
    @DisplayName("特殊属性不作为常量登记")
    void testAttachConstNode() {
        ModuleDecl module = RawBuilding.buildModule("native", null);

        assertNull(RawBuilding.attachConstNode(module, "__name__", "x"));
        assertFalse(module.getLocals().contains("__name__"));

        Const limit = RawBuilding.attachConstNode(module, "LIMIT", 10L);
        assertSame(limit, module.getLocals().first("LIMIT"));
        assertSame(module, limit.getParent());
        assertEquals(1, module.getBody().size());
    }

    @Test
    @DisplayName("类中的函数是方法，__new__ 是类方法")
    void testAttachMethods() {
        ModuleDecl module = RawBuilding.buildModule("native", null);
        ClassDecl cls = RawBuilding.attach(module, RawBuilding.buildClass("C", null, null));
        FunctionDecl init = RawBuilding.attach(cls, RawBuilding.buildFunction("__init__", null, null, null));
        FunctionDecl create = RawBuilding.attach(cls, RawBuilding.buildFunction("__new__", null, null, null));
        FunctionDecl helper = RawBuilding.attach(module, RawBuilding.buildFunction("helper", null, null, null));

        assertEquals(FunctionRole.METHOD, init.getRole());
        assertEquals(FunctionRole.CLASSMETHOD, create.getRole());
        assertEquals(FunctionRole.FUNCTION, helper.getRole());
        assertSame(cls, module.getLocals().first("C"));
        assertEquals("native.C", cls.qualifiedName());
    }

    @Test
    @DisplayName("以导入语句和占位节点登记名称")
    void testAttachImportAndDummy() {
        ModuleDecl module = RawBuilding.buildModule("native", null);
        FromImportStmt node = RawBuilding.attachImportNode(module, "os.path", "join");
        EmptyNode dummy = RawBuilding.attachDummyNode(module, "opaque");

        assertEquals("os.path", node.getModname());
        assertEquals(0, node.getLevel());
        assertEquals("join", node.realName("join"));
        assertSame(node, module.getLocals().first("join"));
        assertSame(dummy, module.getLocals().first("opaque"));
    }
}
