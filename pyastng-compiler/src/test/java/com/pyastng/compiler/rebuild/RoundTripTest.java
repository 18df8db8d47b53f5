package com.pyastng.compiler.rebuild;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.TreeDump;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.DeleteName;
import com.pyastng.compiler.builder.DirectoryParseTreeSource;
import com.pyastng.compiler.builder.ModuleManager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 同一解析树重复构建得到相同的语法图与绑定
 */
class RoundTripTest {

    private static ModuleDecl load(String modname) throws URISyntaxException {
        Path fixtures = Paths.get(RoundTripTest.class.getResource("/fixtures").toURI());
        return new ModuleManager(new DirectoryParseTreeSource(fixtures)).module(modname);
    }

    /** 所有作用域的局部名称与类的实例属性名称，按遍历顺序 */
    private static List<String> bindings(AstNode node) {
        List<String> result = new ArrayList<String>();
        collect(node, result);
        return result;
    }

    private static void collect(AstNode node, List<String> out) {
        if (node instanceof ModuleDecl) {
            out.add("module " + ((ModuleDecl) node).getLocals().names());
        } else if (node instanceof ClassDecl) {
            ClassDecl cls = (ClassDecl) node;
            out.add("class " + cls.getName() + " " + cls.getLocals().names() + " " + cls.getInstanceAttrs().names());
        } else if (node instanceof FunctionDecl) {
            FunctionDecl function = (FunctionDecl) node;
            out.add("def " + function.getName() + " " + function.getLocals().names());
        }
        for (AstNode child : node.getChildren()) {
            collect(child, out);
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"shapes", "ast_shapes"})
    @DisplayName("两次构建的输出与绑定一致")
    void testRebuildIsStable(String modname) throws URISyntaxException {
        ModuleDecl first = load(modname);
        ModuleDecl second = load(modname);

        assertThat(first).isNotSameAs(second);
        assertThat(TreeDump.dump(second, true)).isEqualTo(TreeDump.dump(first, true));
        assertThat(bindings(second)).isEqualTo(bindings(first));
    }

    @Test
    @DisplayName("compiler 形状的示例模块")
    void testCompilerShapes() throws URISyntaxException {
        ModuleDecl module = load("shapes");

        assertThat(module.getDoc()).isEqualTo("示例模块");
        assertThat(module.getLocals().names()).contains("os", "Base", "Child", "helper", "total");

        ClassDecl base = (ClassDecl) module.getLocals().first("Base");
        assertThat(base.getInstanceAttrs().names()).containsExactly("value");
        assertThat(base.isNewStyle()).isTrue();

        ClassDecl child = (ClassDecl) module.getLocals().first("Child");
        FunctionDecl make = (FunctionDecl) child.getLocals().first("make");
        assertThat(make.getRole()).isEqualTo(FunctionRole.STATICMETHOD);
        assertThat(make.getFromLineno()).isEqualTo(10);
        assertThat(make.getArgs().getVararg()).isEqualTo("rest");

        FunctionDecl helper = (FunctionDecl) module.getLocals().first("helper");
        assertThat(helper.getLocals().names()).contains("a", "b", "c", "i").doesNotContain("total");
        List<AstNode> loopBindings = helper.getLocals().get("i");
        assertThat(loopBindings.get(loopBindings.size() - 1)).isInstanceOf(DeleteName.class);
    }

    @Test
    @DisplayName("_ast 形状的示例模块")
    void testAstShapes() throws URISyntaxException {
        ModuleDecl module = load("ast_shapes");

        assertThat(module.getDoc()).isEqualTo("示例模块");
        ClassDecl point = (ClassDecl) module.getLocals().first("Point");
        assertThat(point.getInstanceAttrs().names()).containsExactly("x");
        assertThat(module.getLocals().names()).contains("VERSION", "Point", "origin");
    }
}
