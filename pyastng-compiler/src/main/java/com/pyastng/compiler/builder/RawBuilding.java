package com.pyastng.compiler.builder;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.ScopeNode;
import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionBase;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.AssignName;
import com.pyastng.compiler.ast.expr.CollectionExpr;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.EmptyNode;
import com.pyastng.compiler.ast.expr.Name;
import com.pyastng.compiler.ast.stmt.FromImportStmt;
import com.pyastng.compiler.ast.stmt.ImportAlias;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 不经解析树直接构造节点的工厂方法
 *
 * <p>用于组装内建模块等没有源码的模块。构造出的节点没有行号。</p>
 */
public final class RawBuilding {

    /** 由节点自身合成、不允许覆盖的属性 */
    private static final Set<String> SPECIAL_ATTRIBUTES =
            new HashSet<String>(Arrays.asList("__name__", "__doc__", "__dict__", "__file__", "__path__"));

    private RawBuilding() {
    }

    public static ModuleDecl buildModule(String name, String doc) {
        ModuleDecl module = new ModuleDecl(name);
        module.setDoc(doc);
        module.setPackage(false);
        module.setPureSource(false);
        return module;
    }

    /**
     * @param basenames 基类名称，作为名称读取节点挂在类上，推断时在外层作用域查找
     */
    public static ClassDecl buildClass(String name, List<String> basenames, String doc) {
        ClassDecl cls = new ClassDecl(name);
        cls.setDoc(doc);
        if (basenames != null) {
            for (String basename : basenames) {
                Name base = new Name(basename);
                base.setParent(cls);
                cls.getBases().add(base);
            }
        }
        return cls;
    }

    /**
     * @param args     参数名；null 表示没有参数信息
     * @param defaults 末尾参数的常量默认值
     */
    public static FunctionDecl buildFunction(String name, List<String> args, List<Object> defaults, String doc) {
        FunctionDecl function = new FunctionDecl(name);
        function.setDoc(doc);
        Arguments arguments = new Arguments();
        arguments.setParent(function);
        if (args == null) {
            arguments.setArgs(null);
        } else {
            for (String arg : args) {
                AssignName node = new AssignName(arg);
                node.setParent(arguments);
                arguments.getArgs().add(node);
            }
        }
        if (defaults != null) {
            for (Object value : defaults) {
                Const node = new Const(value);
                node.setParent(arguments);
                arguments.getDefaults().add(node);
            }
        }
        function.setArgs(arguments);
        if (args != null && !args.isEmpty()) {
            registerArguments(function);
        }
        return function;
    }

    /** 把参数（含嵌套解包和可变参数）登记到函数的局部表 */
    public static void registerArguments(FunctionBase function) {
        Arguments arguments = function.getArgs();
        if (arguments.getVararg() != null) {
            function.setLocal(arguments.getVararg(), arguments);
        }
        if (arguments.getKwarg() != null) {
            function.setLocal(arguments.getKwarg(), arguments);
        }
        if (arguments.hasArgumentInfo()) {
            registerArguments(function, arguments.getArgs());
        }
    }

    private static void registerArguments(FunctionBase function, List<AstNode> args) {
        for (AstNode arg : args) {
            if (arg instanceof AssignName) {
                function.setLocal(((AssignName) arg).getName(), arg);
            } else if (arg instanceof CollectionExpr) {
                registerArguments(function, ((CollectionExpr) arg).getElts());
            }
        }
    }

    /** 以占位节点登记名称 */
    public static EmptyNode attachDummyNode(ScopeNode scope, String name) {
        EmptyNode node = new EmptyNode();
        attachLocalNode(scope, node, name);
        return node;
    }

    /** 以常量节点登记名称；特殊属性不登记，返回 null */
    public static Const attachConstNode(ScopeNode scope, String name, Object value) {
        if (SPECIAL_ATTRIBUTES.contains(name)) {
            return null;
        }
        Const node = new Const(value);
        attachLocalNode(scope, node, name);
        return node;
    }

    /** 以 {@code from modname import membername} 登记名称 */
    public static FromImportStmt attachImportNode(ScopeNode scope, String modname, String membername) {
        FromImportStmt node = new FromImportStmt();
        node.setModname(modname);
        node.setLevel(0);
        node.getNames().add(new ImportAlias(membername, null));
        attachLocalNode(scope, node, membername);
        return node;
    }

    /** 把类或函数挂到作用域中；类中的函数是方法，{@code __new__} 是类方法 */
    public static <T extends AstNode & ScopeNode> T attach(ScopeNode scope, T member) {
        if (member instanceof FunctionDecl && scope instanceof ClassDecl) {
            ((FunctionDecl) member).setRole("__new__".equals(member.getName())
                    ? FunctionRole.CLASSMETHOD : FunctionRole.METHOD);
        }
        attachLocalNode(scope, member, member.getName());
        return member;
    }

    private static void attachLocalNode(ScopeNode scope, AstNode node, String name) {
        node.setParent(scope.asNode());
        bodyOf(scope).add(node);
        scope.setLocal(name, node);
    }

    private static List<AstNode> bodyOf(ScopeNode scope) {
        if (scope instanceof ModuleDecl) {
            return ((ModuleDecl) scope).getBody();
        }
        if (scope instanceof ClassDecl) {
            return ((ClassDecl) scope).getBody();
        }
        if (scope instanceof FunctionDecl) {
            return ((FunctionDecl) scope).getBody();
        }
        // 其它作用域没有语句体，只登记绑定
        return new ArrayList<AstNode>();
    }
}
