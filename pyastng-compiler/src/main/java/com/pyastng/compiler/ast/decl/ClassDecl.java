package com.pyastng.compiler.ast.decl;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.Sets;
import com.pyastng.compiler.analysis.BoundMethod;
import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.analysis.CallableValue;
import com.pyastng.compiler.analysis.Inference;
import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.InferenceException;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.analysis.Instance;
import com.pyastng.compiler.analysis.NotFoundException;
import com.pyastng.compiler.analysis.ScopeLookup;
import com.pyastng.compiler.analysis.UnboundMethod;
import com.pyastng.compiler.analysis.Unknown;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.LineRange;
import com.pyastng.compiler.ast.LocalsTable;
import com.pyastng.compiler.ast.LookupResult;
import com.pyastng.compiler.ast.ScopeNode;
import com.pyastng.compiler.ast.expr.Attribute;
import com.pyastng.compiler.ast.expr.CollectionExpr;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.Name;
import com.pyastng.compiler.ast.expr.TupleExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 类定义
 *
 * <p>除局部符号表外还维护 {@code instanceAttrs}：通过接收者表达式（如 {@code self.x = ...}）
 * 赋值的属性，在模块重建完成后的延迟解析中填充。种类与新式类标志惰性计算并缓存。</p>
 */
public class ClassDecl extends AstNode implements ScopeNode, CallableValue {

    /** 祖先遍历在推断上下文中的标记 */
    private static final String ANCESTORS_LOOKUP = "<ancestors>";

    private final String name;
    private String doc;
    private final List<AstNode> bases = new ArrayList<AstNode>();
    private final List<AstNode> body = new ArrayList<AstNode>();
    private final LocalsTable locals = new LocalsTable();
    private final LocalsTable instanceAttrs = new LocalsTable();
    private volatile ClassKind kind;
    private volatile Boolean newStyle;

    public ClassDecl(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getDoc() {
        return doc;
    }

    public void setDoc(String doc) {
        this.doc = doc;
    }

    /** 基类表达式 */
    public List<AstNode> getBases() {
        return bases;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public LocalsTable getLocals() {
        return locals;
    }

    public LocalsTable getInstanceAttrs() {
        return instanceAttrs;
    }

    @Override
    public AstNode asNode() {
        return this;
    }

    @Override
    public ScopeNode frame() {
        return this;
    }

    @Override
    public boolean isStatement() {
        return true;
    }

    /** 类头结束的行号 */
    public int getBlockStartToLineno() {
        return bases.isEmpty() ? getFromLineno() : bases.get(bases.size() - 1).getToLineno();
    }

    /** 总是整个定义的范围，与给定行号无关 */
    @Override
    public LineRange blockRange(int lineno) {
        return new LineRange(getFromLineno(), getToLineno());
    }

    @Override
    public String qualifiedName() {
        if (getParent() == null) {
            return name;
        }
        return getParent().frame().asNode().qualifiedName() + "." + name;
    }

    @Override
    public String pytype() {
        return isNewStyle() ? Builtins.qualify("type") : Builtins.qualify("classobj");
    }

    // ============ 种类与新式类 ============

    /** 由重建器（没有基类时）或内建构造器显式设置 */
    public void setNewStyle(boolean newStyle) {
        this.newStyle = newStyle;
    }

    /** 是否新式类：显式设置，否则由任一直接祖先是新式类决定 */
    public boolean isNewStyle() {
        return isNewStyle(Sets.<ClassDecl>newIdentityHashSet());
    }

    private boolean isNewStyle(Set<ClassDecl> visiting) {
        Boolean cached = newStyle;
        if (cached != null) {
            return cached;
        }
        if (!visiting.add(this)) {
            return false;
        }
        boolean result = false;
        Iterator<ClassDecl> it = ancestors(false, null);
        while (it.hasNext()) {
            if (it.next().isNewStyle(visiting)) {
                result = true;
                break;
            }
        }
        newStyle = result;
        return result;
    }

    /** 类的种类：按名称约定判断，否则继承第一个非普通类祖先的种类 */
    public ClassKind kind() {
        return kind(Sets.<ClassDecl>newIdentityHashSet());
    }

    private ClassKind kind(Set<ClassDecl> visiting) {
        ClassKind cached = kind;
        if (cached != null) {
            return cached;
        }
        ClassKind result = ClassKind.CLASS;
        if ("type".equals(name)) {
            result = ClassKind.METACLASS;
        } else if (name.endsWith("Interface")) {
            result = ClassKind.INTERFACE;
        } else if (name.endsWith("Exception")) {
            result = ClassKind.EXCEPTION;
        } else {
            if (!visiting.add(this)) {
                // 在祖先环中没有找到种类
                return ClassKind.CLASS;
            }
            Iterator<ClassDecl> it = ancestors(false, null);
            while (it.hasNext()) {
                ClassKind baseKind = it.next().kind(visiting);
                if (baseKind != ClassKind.CLASS) {
                    result = baseKind;
                    break;
                }
            }
        }
        kind = result;
        return result;
    }

    // ============ 祖先 ============

    /**
     * 惰性产生祖先类：深度优先、先序；基类表达式经推断求值，非类结果被跳过，
     * 自身被跳过，已在当前路径上的类被跳过。
     *
     * @param transitive false 时只产生直接基类
     */
    public Iterator<ClassDecl> ancestors(boolean transitive, InferenceContext context) {
        InferenceContext ctx = InferenceContext.orNew(context).pushLookup(this, ANCESTORS_LOOKUP);
        if (ctx == null) {
            return Collections.emptyIterator();
        }
        return new AncestorIterator(transitive, ctx);
    }

    public Iterator<ClassDecl> ancestors(boolean transitive) {
        return ancestors(transitive, null);
    }

    private final class AncestorIterator extends AbstractIterator<ClassDecl> {
        private final boolean transitive;
        private final InferenceContext context;
        private final Iterator<AstNode> baseIterator = new ArrayList<AstNode>(bases).iterator();
        private Iterator<InferredValue> current = Collections.emptyIterator();
        private Iterator<ClassDecl> inherited = Collections.emptyIterator();

        AncestorIterator(boolean transitive, InferenceContext context) {
            this.transitive = transitive;
            this.context = context;
        }

        @Override
        protected ClassDecl computeNext() {
            while (inherited.hasNext()) {
                ClassDecl ancestor = inherited.next();
                if (ancestor != ClassDecl.this) {
                    return ancestor;
                }
            }
            ClassDecl base = nextBase();
            if (base == null) {
                return endOfData();
            }
            if (transitive) {
                inherited = base.ancestors(true, context);
            }
            return base;
        }

        private ClassDecl nextBase() {
            while (true) {
                try {
                    while (current.hasNext()) {
                        InferredValue value = current.next();
                        if (!(value instanceof ClassDecl)) {
                            continue;
                        }
                        ClassDecl cls = (ClassDecl) value;
                        if (cls == ClassDecl.this || context.isLookupInProgress(cls, ANCESTORS_LOOKUP)) {
                            continue;
                        }
                        return cls;
                    }
                } catch (InferenceException e) {
                    current = Collections.emptyIterator();
                }
                if (!baseIterator.hasNext()) {
                    return null;
                }
                try {
                    current = baseIterator.next().infer(context);
                } catch (InferenceException e) {
                    current = Collections.emptyIterator();
                }
            }
        }
    }

    /** 局部表中定义了 {@code name} 的祖先 */
    public Iterator<ClassDecl> localAttrAncestors(final String attribute, InferenceContext context) {
        return Iterators.filter(ancestors(true, context), cls -> cls.locals.contains(attribute));
    }

    /** 实例属性表中定义了 {@code name} 的祖先 */
    public Iterator<ClassDecl> instanceAttrAncestors(final String attribute, InferenceContext context) {
        return Iterators.filter(ancestors(true, context), cls -> cls.instanceAttrs.contains(attribute));
    }

    /** 基类的点分名称 */
    public List<String> basenames() {
        List<String> names = new ArrayList<String>();
        for (AstNode base : bases) {
            names.add(dottedName(base));
        }
        return names;
    }

    private static String dottedName(AstNode node) {
        if (node instanceof Name) {
            return ((Name) node).getName();
        }
        if (node instanceof Attribute) {
            Attribute attribute = (Attribute) node;
            return dottedName(attribute.getExpr()) + "." + attribute.getAttrname();
        }
        return node.getClass().getSimpleName();
    }

    // ============ 属性 ============

    /**
     * 类自身或最近祖先局部表中的定义。
     *
     * @throws NotFoundException 都没有定义
     */
    public List<AstNode> localAttr(String attribute, InferenceContext context) {
        List<AstNode> values = locals.get(attribute);
        if (values.isEmpty()) {
            Iterator<ClassDecl> it = localAttrAncestors(attribute, context);
            if (it.hasNext()) {
                values = it.next().locals.get(attribute);
            }
        }
        values = SpecialAttributes.withoutDeletions(values);
        if (values.isEmpty()) {
            throw new NotFoundException(attribute);
        }
        return values;
    }

    /**
     * 类自身及所有祖先的实例属性定义。
     *
     * @throws NotFoundException 都没有定义
     */
    public List<AstNode> instanceAttr(String attribute, InferenceContext context) {
        List<AstNode> values = new ArrayList<AstNode>(instanceAttrs.get(attribute));
        Iterator<ClassDecl> it = instanceAttrAncestors(attribute, context);
        while (it.hasNext()) {
            values.addAll(it.next().instanceAttrs.get(attribute));
        }
        values = SpecialAttributes.withoutDeletions(values);
        if (values.isEmpty()) {
            throw new NotFoundException(attribute);
        }
        return values;
    }

    @Override
    public List<AstNode> getLocalDefinitions(String attribute, InferenceContext context) {
        return findLocalAttr(attribute, context);
    }

    private List<AstNode> findLocalAttr(String attribute, InferenceContext context) {
        try {
            return localAttr(attribute, context);
        } catch (NotFoundException e) {
            return Collections.emptyList();
        }
    }

    /**
     * 先查自身局部表，再按祖先顺序查每个祖先的 {@code getAttribute}。
     * 同一 {@code (类, 属性)} 的查找已在进行时视为不存在。
     *
     * <p>{@code __module__}、{@code __bases__}、{@code __mro__}（仅新式类）由合成节点回答，
     * 不再查祖先。</p>
     */
    @Override
    public List<AstNode> getAttribute(String attribute, InferenceContext context) {
        InferenceContext ctx = InferenceContext.orNew(context).pushLookup(this, attribute);
        if (ctx == null) {
            throw new NotFoundException(attribute, "属性查找出现循环: " + name + "." + attribute);
        }
        List<AstNode> values = new ArrayList<AstNode>(locals.get(attribute));
        switch (attribute) {
            case "__module__":
                values.add(0, new Const(root() != null ? root().qualifiedName() : null));
                return SpecialAttributes.withoutDeletions(values);
            case "__bases__":
                values.add(0, ancestorTuple(false, ctx));
                return SpecialAttributes.withoutDeletions(values);
            case "__mro__":
                if (!isNewStyle()) {
                    throw new NotFoundException(attribute, "旧式类没有 __mro__: " + name);
                }
                values.add(0, ancestorTuple(true, ctx));
                return SpecialAttributes.withoutDeletions(values);
            case "__name__":
            case "__doc__":
            case "__dict__":
                return SpecialAttributes.standard(attribute, name, doc, values);
            default:
                break;
        }
        Iterator<ClassDecl> it = ancestors(false, ctx);
        while (it.hasNext()) {
            values.addAll(it.next().findAttribute(attribute, ctx));
        }
        values = SpecialAttributes.withoutDeletions(values);
        if (values.isEmpty()) {
            throw new NotFoundException(attribute);
        }
        return values;
    }

    /** 祖先类组成的元组常量；元素仍挂在各自的定义处 */
    private TupleExpr ancestorTuple(boolean transitive, InferenceContext context) {
        TupleExpr tuple = new TupleExpr();
        tuple.setParent(this);
        tuple.setLineno(getLineno());
        Iterators.addAll(tuple.getElts(), ancestors(transitive, context));
        return tuple;
    }

    /** 同 {@link #getAttribute}，不存在时返回空列表 */
    public List<AstNode> findAttribute(String attribute, InferenceContext context) {
        try {
            return getAttribute(attribute, context);
        } catch (NotFoundException e) {
            return Collections.emptyList();
        }
    }

    /**
     * 推断属性：函数转换为方法视图，描述符实例（类定义了 {@code __get__}）变为 Unknown；
     * 查找失败但类有动态属性钩子时产生 Unknown。
     */
    @Override
    public Iterator<InferredValue> inferAttribute(String attribute, InferenceContext context) {
        final InferenceContext ctx = InferenceContext.orNew(context).withLookupName(attribute);
        List<AstNode> statements;
        try {
            statements = getAttribute(attribute, ctx);
        } catch (NotFoundException e) {
            if (!attribute.startsWith("__") && hasDynamicGetattr(ctx)) {
                return Inference.unknown();
            }
            throw new InferenceException("类 " + name + " 没有属性 " + attribute, e);
        }
        return Iterators.transform(Inference.inferStatements(statements, ctx, this),
                value -> toAttributeValue(value, ctx));
    }

    private InferredValue toAttributeValue(InferredValue value, InferenceContext context) {
        if (value instanceof Instance && value.getClass() == Instance.class) {
            ClassDecl valueClass = ((Instance) value).getProxied();
            if (!valueClass.findAttribute("__get__", context).isEmpty()) {
                return Unknown.INSTANCE;
            }
            return value;
        }
        if (value instanceof FunctionDecl) {
            return functionToMethod((FunctionDecl) value);
        }
        return value;
    }

    private InferredValue functionToMethod(FunctionDecl function) {
        switch (function.getRole()) {
            case CLASSMETHOD:
                return new BoundMethod(function, this);
            case STATICMETHOD:
                return function;
            default:
                return new UnboundMethod(function);
        }
    }

    /** 定义了 {@code __getattr__}，或在内建模块之外定义了 {@code __getattribute__} */
    public boolean hasDynamicGetattr(InferenceContext context) {
        if (!findAttribute("__getattr__", context).isEmpty()) {
            return true;
        }
        List<AstNode> getattribute = findAttribute("__getattribute__", context);
        if (getattribute.isEmpty()) {
            return false;
        }
        ModuleDecl definitionRoot = getattribute.get(0).root();
        return definitionRoot == null || !Builtins.MODULE_NAME.equals(definitionRoot.getName());
    }

    public boolean hasDynamicGetattr() {
        return hasDynamicGetattr(null);
    }

    // ============ 方法 ============

    /** 本类直接定义的方法 */
    public List<FunctionDecl> myMethods() {
        List<FunctionDecl> methods = new ArrayList<FunctionDecl>();
        for (AstNode member : locals.firstBindings()) {
            if (member instanceof FunctionDecl) {
                methods.add((FunctionDecl) member);
            }
        }
        return methods;
    }

    /** 本类及祖先的方法，同名只保留最近的定义 */
    public List<FunctionDecl> methods() {
        Set<String> done = new HashSet<String>();
        List<FunctionDecl> result = new ArrayList<FunctionDecl>();
        collectMethods(myMethods(), done, result);
        Iterator<ClassDecl> it = ancestors(true, null);
        while (it.hasNext()) {
            collectMethods(it.next().myMethods(), done, result);
        }
        return result;
    }

    private static void collectMethods(List<FunctionDecl> methods, Set<String> done, List<FunctionDecl> result) {
        for (FunctionDecl method : methods) {
            if (done.add(method.getName())) {
                result.add(method);
            }
        }
    }

    /**
     * 通过 {@code __implements__} 声明的接口。
     *
     * @param inherited false 时只认本类自己的声明
     * @throws InferenceException 有接口表达式无法推断
     */
    public List<ClassDecl> interfaces(boolean inherited) {
        List<AstNode> declarations;
        try {
            declarations = new Instance(this).getAttribute("__implements__", null, true);
        } catch (NotFoundException e) {
            return Collections.emptyList();
        }
        AstNode implementsNode = declarations.get(0);
        if (!inherited && implementsNode.frame() != this) {
            return Collections.emptyList();
        }
        Set<ClassDecl> found = new LinkedHashSet<ClassDecl>();
        boolean missing = false;
        for (InferredValue value : unpackInfer(implementsNode)) {
            if (value instanceof ClassDecl) {
                found.add((ClassDecl) value);
            } else if (value.isUnknown()) {
                missing = true;
            }
        }
        if (missing) {
            throw new InferenceException("无法推断 " + name + " 的全部接口");
        }
        return new ArrayList<ClassDecl>(found);
    }

    /** 推断并展开元组/列表 */
    private static List<InferredValue> unpackInfer(InferredValue value) {
        List<InferredValue> result = new ArrayList<InferredValue>();
        if (value instanceof CollectionExpr) {
            for (AstNode element : ((CollectionExpr) value).getElts()) {
                result.addAll(unpackInfer(element));
            }
            return result;
        }
        if (!(value instanceof AstNode) || value instanceof ClassDecl) {
            result.add(value);
            return result;
        }
        Iterator<InferredValue> it = Inference.orUnknown(() -> ((AstNode) value).infer());
        while (it.hasNext()) {
            InferredValue inferred = it.next();
            if (inferred == value) {
                result.add(inferred);
            } else {
                result.addAll(unpackInfer(inferred));
            }
        }
        return result;
    }

    // ============ 作用域与调用 ============

    @Override
    public LookupResult scopeLookup(AstNode node, String lookupName, int offset) {
        if (getParent() != null && isInBases(node)) {
            // 基类表达式在外层 frame 中求值
            return ScopeLookup.lookupLocals(getParent().frame(), node, lookupName, -1);
        }
        return ScopeLookup.lookupLocals(this, node, lookupName, offset);
    }

    private boolean isInBases(AstNode node) {
        for (AstNode base : bases) {
            if (node.isWithin(base)) {
                return true;
            }
        }
        return false;
    }

    /** 调用类总是得到恰好一个该类的实例 */
    @Override
    public Iterator<InferredValue> inferCallResult(AstNode caller, InferenceContext context) {
        return Inference.single(new Instance(this));
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>(bases);
        children.addAll(body);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }

    @Override
    public String toString() {
        return "ClassDecl(" + name + ")@" + getLineno();
    }
}
