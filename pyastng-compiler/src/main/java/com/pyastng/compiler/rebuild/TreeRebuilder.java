package com.pyastng.compiler.rebuild;

import com.pyastng.compiler.analysis.BuiltinLiteral;
import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.analysis.InferenceException;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.analysis.Instance;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.LocalsTable;
import com.pyastng.compiler.ast.ScopeNode;
import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.AssignAttr;
import com.pyastng.compiler.ast.expr.AssignName;
import com.pyastng.compiler.ast.expr.Attribute;
import com.pyastng.compiler.ast.expr.CallExpr;
import com.pyastng.compiler.ast.expr.Comprehension;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.DeleteAttr;
import com.pyastng.compiler.ast.expr.DeleteName;
import com.pyastng.compiler.ast.expr.EmptyNode;
import com.pyastng.compiler.ast.expr.Name;
import com.pyastng.compiler.ast.stmt.AssignStmt;
import com.pyastng.compiler.ast.stmt.DeleteStmt;
import com.pyastng.compiler.ast.stmt.FromImportStmt;
import com.pyastng.compiler.ast.stmt.GlobalStmt;
import com.pyastng.compiler.ast.stmt.ImportAlias;
import com.pyastng.compiler.ast.stmt.ImportStmt;
import com.pyastng.compiler.builder.BuildException;
import com.pyastng.compiler.builder.BuilderConfig;
import com.pyastng.compiler.builder.ModuleResolver;
import com.pyastng.compiler.parsetree.RawNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 解析树重建器基类
 *
 * <p>子类按前端的节点形状分派，公共部分在这里：赋值上下文的切换与恢复、
 * 名称绑定登记、类与函数的收尾（元类标记、角色、global 名称）、导入绑定，
 * 以及整棵树建好之后的属性赋值延迟解析。</p>
 */
public abstract class TreeRebuilder {
    private static final Logger LOG = Logger.getLogger(TreeRebuilder.class.getName());

    /** 作为名称读取时直接改写为常量的标识符 */
    private static final Map<String, Object> CONSTANT_NAMES = new HashMap<String, Object>();

    static {
        CONSTANT_NAMES.put("None", null);
        CONSTANT_NAMES.put("True", Boolean.TRUE);
        CONSTANT_NAMES.put("False", Boolean.FALSE);
    }

    protected final ModuleResolver resolver;
    protected final BuilderConfig config;
    private RebuildSession session;

    protected TreeRebuilder(ModuleResolver resolver, BuilderConfig config) {
        this.resolver = resolver;
        this.config = config != null ? config : new BuilderConfig();
    }

    /**
     * 重建一个模块。
     *
     * @param root        前端的 Module 节点
     * @param modname     模块名
     * @param path        来源路径，可为 null
     * @param packageInit 是否包的初始化模块
     */
    public ModuleDecl build(RawNode root, String modname, String path, boolean packageInit) {
        session = new RebuildSession();
        ModuleDecl module = new ModuleDecl(modname);
        module.setFile(path);
        module.setPackage(packageInit);
        module.setResolver(resolver);
        setInfos(root, module, null);
        if (resolver != null) {
            resolver.beginBuilding(module);
        }
        rebuildModule(root, module);
        for (AssignAttr delayed : session.getDelayed()) {
            resolveAssignAttr(delayed);
        }
        LOG.fine("模块 " + modname + " 重建完成，延迟属性赋值 " + session.getDelayed().size() + " 个");
        return module;
    }

    /** 填充模块的文档与语句体 */
    protected abstract void rebuildModule(RawNode raw, ModuleDecl module);

    /** 按前端节点类型分派；{@code raw} 为 null 时返回 null */
    protected abstract AstNode visit(RawNode raw, AstNode parent);

    // ============ 公共访问辅助 ============

    protected AssignContext context() {
        return session.getContext();
    }

    /** 在指定上下文中访问子节点，返回后恢复原上下文 */
    protected AstNode visitIn(AssignContext context, RawNode raw, AstNode parent) {
        AssignContext previous = session.enter(context);
        try {
            return visit(raw, parent);
        } finally {
            session.restore(previous);
        }
    }

    /** 作为读取访问表达式 */
    protected AstNode expr(RawNode raw, AstNode parent) {
        return visitIn(AssignContext.DISCARD, raw, parent);
    }

    protected List<AstNode> exprs(List<RawNode> raws, AstNode parent) {
        List<AstNode> result = new ArrayList<AstNode>(raws.size());
        for (RawNode raw : raws) {
            AstNode node = expr(raw, parent);
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    /** 访问语句列表；被剪除的语句不出现在结果中 */
    protected List<AstNode> statements(List<RawNode> raws, AstNode parent) {
        List<AstNode> result = new ArrayList<AstNode>(raws.size());
        for (RawNode raw : raws) {
            AstNode node = visitIn(AssignContext.NONE, raw, parent);
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    protected <T extends AstNode> T setInfos(RawNode raw, T node, AstNode parent) {
        if (parent != null) {
            node.setParent(parent);
        }
        if (raw != null) {
            if (raw.getLineno() != null) {
                node.setLineno(raw.getLineno());
            }
            if (raw.getFromLineno() != null) {
                node.setFromLineno(raw.getFromLineno());
            }
            if (raw.getToLineno() != null) {
                node.setToLineno(raw.getToLineno());
            }
        }
        return node;
    }

    /** 无法识别的节点类型：以占位节点代替 */
    protected AstNode unknownNode(RawNode raw, AstNode parent) {
        LOG.log(Level.FINE, "无法识别的节点类型 {0}，以占位节点代替", raw.getType());
        EmptyNode node = setInfos(raw, new EmptyNode(raw.getType()), parent);
        node.setStatementPosition(context() == AssignContext.NONE);
        return node;
    }

    // ============ 名称与属性 ============

    /** 按当前上下文把名称解释为读取、绑定或删除 */
    protected AstNode nameNode(RawNode raw, String name, AstNode parent) {
        switch (context()) {
            case NONE:
                return deleteStatement(raw, Collections.singletonList(raw), parent);
            case DELETE: {
                DeleteName node = setInfos(raw, new DeleteName(name), parent);
                saveAssignment(node, name);
                return node;
            }
            case ASSIGN:
            case AUG_ASSIGN: {
                AssignName node = setInfos(raw, new AssignName(name), parent);
                saveAssignment(node, name);
                return node;
            }
            default:
                return readName(raw, name, parent);
        }
    }

    /** 名称读取；None/True/False 改写为常量 */
    protected AstNode readName(RawNode raw, String name, AstNode parent) {
        if (CONSTANT_NAMES.containsKey(name)) {
            return setInfos(raw, new Const(CONSTANT_NAMES.get(name)), parent);
        }
        return setInfos(raw, new Name(name), parent);
    }

    /** 按当前上下文把属性访问解释为读取、赋值或删除；接收者总是作为读取访问 */
    protected AstNode attributeNode(RawNode raw, RawNode receiver, String attrname, AstNode parent) {
        switch (context()) {
            case NONE:
                return deleteStatement(raw, Collections.singletonList(raw), parent);
            case DELETE: {
                DeleteAttr node = setInfos(raw, new DeleteAttr(attrname), parent);
                node.setExpr(expr(receiver, node));
                return node;
            }
            case ASSIGN:
            case AUG_ASSIGN: {
                AssignAttr node = setInfos(raw, new AssignAttr(attrname), parent);
                node.setExpr(expr(receiver, node));
                session.delay(node);
                return node;
            }
            default:
                return readAttribute(raw, receiver, attrname, parent);
        }
    }

    protected AstNode readAttribute(RawNode raw, RawNode receiver, String attrname, AstNode parent) {
        Attribute node = setInfos(raw, new Attribute(attrname), parent);
        node.setExpr(expr(receiver, node));
        return node;
    }

    /** 语句位置上的绑定形式：合成删除语句，原节点在删除上下文中作为其目标 */
    protected DeleteStmt deleteStatement(RawNode raw, List<RawNode> targets, AstNode parent) {
        DeleteStmt node = setInfos(raw, new DeleteStmt(), parent);
        for (RawNode target : targets) {
            AstNode visited = visitIn(AssignContext.DELETE, target, node);
            if (visited != null) {
                node.getTargets().add(visited);
            }
        }
        return node;
    }

    /** 登记绑定：函数内声明为 global 的名称绑定到模块 */
    protected void saveAssignment(AstNode node, String name) {
        if (session.isGlobal(name)) {
            node.root().setLocal(name, node);
        } else {
            node.getParent().scope().setLocal(name, node);
        }
    }

    /** 可变参数与关键字参数以参数表节点作为绑定 */
    protected void saveArgumentNames(Arguments arguments) {
        ScopeNode function = arguments.getParent().scope();
        if (arguments.getVararg() != null) {
            function.setLocal(arguments.getVararg(), arguments);
        }
        if (arguments.getKwarg() != null) {
            function.setLocal(arguments.getKwarg(), arguments);
        }
    }

    /** 推导式子句：目标在赋值上下文中访问，绑定登记到所在作用域 */
    protected Comprehension comprehension(RawNode raw, RawNode target, RawNode iter, List<RawNode> ifs,
                                          AstNode parent) {
        Comprehension node = setInfos(raw, new Comprehension(), parent);
        node.setTarget(visitIn(AssignContext.ASSIGN, target, node));
        node.setIter(expr(iter, node));
        node.getIfs().addAll(exprs(ifs, node));
        return node;
    }

    // ============ 语句收尾 ============

    protected GlobalStmt globalStatement(RawNode raw, List<String> names, AstNode parent) {
        GlobalStmt node = setInfos(raw, new GlobalStmt(), parent);
        node.getNames().addAll(names);
        session.declareGlobals(names);
        return node;
    }

    /**
     * 类体中的 {@code name = classmethod(name)} 追溯设置方法角色并记为附加装饰器；
     * 对 {@code __metaclass__} 的赋值标记当前类体。
     */
    protected void setAssignInfos(AssignStmt assign) {
        ScopeNode frame = assign.frame();
        if (frame instanceof ClassDecl && assign.getValue() instanceof CallExpr
                && ((CallExpr) assign.getValue()).getFunc() instanceof Name) {
            CallExpr call = (CallExpr) assign.getValue();
            String funcName = ((Name) call.getFunc()).getName();
            for (AstNode target : assign.getTargets()) {
                if (!(target instanceof AssignName)) {
                    continue;
                }
                AstNode method = frame.getLocals().first(((AssignName) target).getName());
                if (method instanceof FunctionDecl) {
                    FunctionDecl function = (FunctionDecl) method;
                    // __new__ 的角色不随包装调用改变
                    if (!isNewMethod(function)) {
                        if ("classmethod".equals(funcName)) {
                            function.setRole(FunctionRole.CLASSMETHOD);
                        } else if ("staticmethod".equals(funcName)) {
                            function.setRole(FunctionRole.STATICMETHOD);
                        }
                    }
                    function.addExtraDecorator(call);
                }
            }
        }
        for (AstNode target : assign.getTargets()) {
            if (target instanceof AssignName && "__metaclass__".equals(((AssignName) target).getName())) {
                session.markMetaclass();
            }
        }
    }

    protected void enterClass() {
        session.enterClass();
    }

    /** 类体访问完毕：没有基类时由所在层的元类标记决定新式类 */
    protected void finishClass(ClassDecl cls) {
        boolean metaclass = session.leaveClass();
        if (cls.getBases().isEmpty()) {
            cls.setNewStyle(metaclass);
        }
        cls.getParent().frame().setLocal(cls.getName(), cls);
    }

    protected void enterFunction() {
        session.enterFunction();
    }

    /**
     * 函数访问完毕：类中的函数是方法，第一个装饰器为 classmethod/staticmethod 时取相应角色；
     * 类中的 {@code __new__} 总是类方法，不受装饰器影响。
     */
    protected void finishFunction(FunctionDecl function) {
        session.leaveFunction();
        ScopeNode frame = function.getParent().frame();
        if (frame instanceof ClassDecl) {
            function.setRole(isNewMethod(function) ? FunctionRole.CLASSMETHOD : FunctionRole.METHOD);
        }
        if (!isNewMethod(function) && function.getDecorators() != null
                && !function.getDecorators().getNodes().isEmpty()) {
            FunctionRole role = decoratorRole(function.getDecorators().getNodes().get(0));
            if (role != null) {
                function.setRole(role);
            }
        }
        frame.setLocal(function.getName(), function);
    }

    private static boolean isNewMethod(FunctionDecl function) {
        return "__new__".equals(function.getName()) && function.getParent() != null
                && function.getParent().frame() instanceof ClassDecl;
    }

    /** 推断装饰器；推断不出结论时退回到按名称判断 */
    private FunctionRole decoratorRole(AstNode decorator) {
        boolean decided = false;
        try {
            Iterator<InferredValue> values = decorator.infer();
            while (values.hasNext()) {
                InferredValue value = values.next();
                if (value.isUnknown()) {
                    continue;
                }
                decided = true;
                if (value instanceof ClassDecl) {
                    String qname = value.qualifiedName();
                    if (Builtins.CLASSMETHOD.equals(qname)) {
                        return FunctionRole.CLASSMETHOD;
                    }
                    if (Builtins.STATICMETHOD.equals(qname)) {
                        return FunctionRole.STATICMETHOD;
                    }
                }
            }
        } catch (InferenceException e) {
            LOG.log(Level.FINE, "无法推断装饰器 " + decorator, e);
        }
        if (!decided && decorator instanceof Name) {
            String name = ((Name) decorator).getName();
            if ("classmethod".equals(name)) {
                return FunctionRole.CLASSMETHOD;
            }
            if ("staticmethod".equals(name)) {
                return FunctionRole.STATICMETHOD;
            }
        }
        return null;
    }

    // ============ 导入 ============

    protected ImportStmt importStatement(RawNode raw, List<ImportAlias> names, AstNode parent) {
        ImportStmt node = setInfos(raw, new ImportStmt(), parent);
        node.getNames().addAll(names);
        for (ImportAlias alias : names) {
            String bound = alias.getAsname() != null ? alias.getAsname() : alias.getName();
            int dot = bound.indexOf('.');
            parent.scope().setLocal(dot < 0 ? bound : bound.substring(0, dot), node);
        }
        return node;
    }

    protected FromImportStmt fromImportStatement(RawNode raw, String modname, int level,
                                                 List<ImportAlias> names, AstNode parent) {
        FromImportStmt node = setInfos(raw, new FromImportStmt(), parent);
        node.setModname(modname);
        node.setLevel(level);
        node.getNames().addAll(names);
        ScopeNode scope = parent.scope();
        for (ImportAlias alias : names) {
            if (!alias.isWildcard()) {
                scope.setLocal(alias.getAsname() != null ? alias.getAsname() : alias.getName(), node);
            } else if (config.isExpandWildcardImports()) {
                ModuleDecl imported;
                try {
                    imported = node.root().importModule(modname, false, level);
                } catch (BuildException e) {
                    LOG.log(Level.FINE, "无法展开 from " + modname + " import *", e);
                    continue;
                }
                for (String name : imported.wildcardImportNames()) {
                    scope.setLocal(name, node);
                }
            }
        }
        return node;
    }

    // ============ 延迟属性赋值 ============

    /**
     * 推断接收者，把赋值登记到每个类或实例的属性表中。
     * 构造方法中的赋值排在最前（已有构造方法中的赋值时除外）；推断失败时跳过。
     */
    private void resolveAssignAttr(AssignAttr node) {
        if (!node.markResolved()) {
            return;
        }
        ScopeNode frame = node.frame();
        String constructor = config.getConstructorName();
        try {
            Iterator<InferredValue> receivers = node.getExpr().infer();
            while (receivers.hasNext()) {
                InferredValue receiver = receivers.next();
                LocalsTable attributes;
                if (receiver.getClass() == Instance.class) {
                    attributes = ((Instance) receiver).getProxied().getInstanceAttrs();
                } else if (receiver instanceof ScopeNode && !(receiver instanceof BuiltinLiteral)) {
                    attributes = ((ScopeNode) receiver).getLocals();
                } else {
                    continue;
                }
                String name = node.getAttrname();
                if (attributes.containsBinding(name, node)) {
                    continue;
                }
                List<AstNode> existing = attributes.get(name);
                if (constructor.equals(frame.getName()) && !existing.isEmpty()
                        && !constructor.equals(existing.get(0).frame().getName())) {
                    attributes.insertFirst(name, node);
                } else {
                    attributes.add(name, node);
                }
            }
        } catch (InferenceException e) {
            LOG.log(Level.FINE, "无法推断属性赋值 " + node.getAttrname() + " 的接收者", e);
        }
    }
}
