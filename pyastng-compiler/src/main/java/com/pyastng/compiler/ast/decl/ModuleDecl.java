package com.pyastng.compiler.ast.decl;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.analysis.Inference;
import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.InferenceException;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.analysis.NotFoundException;
import com.pyastng.compiler.analysis.ScopeLookup;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.LineRange;
import com.pyastng.compiler.ast.LocalsTable;
import com.pyastng.compiler.ast.LookupResult;
import com.pyastng.compiler.ast.ScopeNode;
import com.pyastng.compiler.ast.expr.AssignName;
import com.pyastng.compiler.ast.expr.CollectionExpr;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.ListExpr;
import com.pyastng.compiler.ast.stmt.AssignStmt;
import com.pyastng.compiler.ast.stmt.FromImportStmt;
import com.pyastng.compiler.builder.BuildException;
import com.pyastng.compiler.builder.ModuleResolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 模块：语法图的根节点
 *
 * <p>持有构建时使用的 {@link ModuleResolver}，用于导入其它模块和查找内建名称。</p>
 */
public class ModuleDecl extends AstNode implements ScopeNode {
    private static final Logger LOG = Logger.getLogger(ModuleDecl.class.getName());

    /** 在模块作用域中隐式可见的名称 */
    private static final Set<String> SCOPE_ATTRIBUTES = new HashSet<String>(
            Arrays.asList("__name__", "__doc__", "__file__", "__path__"));

    private static final Set<String> SPECIAL_ATTRIBUTES = new HashSet<String>(
            Arrays.asList("__name__", "__doc__", "__file__", "__path__", "__dict__"));

    private final String name;
    private String doc;
    private String file;
    private boolean packageFlag;
    private boolean pureSource = true;
    private ModuleResolver resolver;
    private final List<AstNode> body = new ArrayList<AstNode>();
    private final LocalsTable locals = new LocalsTable();

    public ModuleDecl(String name) {
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

    /** 来源路径，仅作信息用途，可为 null */
    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    /** 是否包的初始化模块 */
    public boolean isPackage() {
        return packageFlag;
    }

    public void setPackage(boolean packageFlag) {
        this.packageFlag = packageFlag;
    }

    /** 是否由源码解析树构建（而非由内建描述构造） */
    public boolean isPureSource() {
        return pureSource;
    }

    public void setPureSource(boolean pureSource) {
        this.pureSource = pureSource;
    }

    public ModuleResolver getResolver() {
        return resolver;
    }

    public void setResolver(ModuleResolver resolver) {
        this.resolver = resolver;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public LocalsTable getLocals() {
        return locals;
    }

    @Override
    public AstNode asNode() {
        return this;
    }

    @Override
    public ScopeNode frame() {
        return this;
    }

    /** 总是整个模块的范围 */
    @Override
    public LineRange blockRange(int lineno) {
        return new LineRange(getFromLineno(), getToLineno());
    }

    @Override
    public ModuleDecl root() {
        return this;
    }

    @Override
    public String qualifiedName() {
        return name;
    }

    @Override
    public String pytype() {
        return Builtins.qualify("module");
    }

    /** 由源码构建且有来源文件 */
    public boolean fullyDefined() {
        return pureSource && file != null;
    }

    // ============ 查找 ============

    @Override
    public LookupResult scopeLookup(AstNode node, String lookupName, int offset) {
        if (SCOPE_ATTRIBUTES.contains(lookupName) && !locals.contains(lookupName)) {
            return new LookupResult(this, findAttribute(lookupName, null));
        }
        return ScopeLookup.lookupLocals(this, node, lookupName, offset);
    }

    @Override
    public List<AstNode> getLocalDefinitions(String lookupName, InferenceContext context) {
        if (SPECIAL_ATTRIBUTES.contains(lookupName)) {
            return findAttribute(lookupName, context);
        }
        return locals.get(lookupName);
    }

    /**
     * 模块属性：局部绑定、隐式属性，包模块还可以是其子模块。
     *
     * @throws NotFoundException 属性不存在
     */
    @Override
    public List<AstNode> getAttribute(String attribute, InferenceContext context) {
        List<AstNode> explicit = locals.get(attribute);
        if (SPECIAL_ATTRIBUTES.contains(attribute)) {
            if ("__file__".equals(attribute)) {
                return prepend(new Const(file), explicit);
            }
            if ("__path__".equals(attribute) && packageFlag) {
                return prepend(new ListExpr(), explicit);
            }
            return SpecialAttributes.standard(attribute, name, doc, explicit);
        }
        if (!explicit.isEmpty()) {
            List<AstNode> values = SpecialAttributes.withoutDeletions(explicit);
            if (values.isEmpty()) {
                throw new NotFoundException(attribute);
            }
            return values;
        }
        if (packageFlag) {
            try {
                return Collections.<AstNode>singletonList(importModule(attribute, true, 0));
            } catch (BuildException e) {
                LOG.log(Level.FINE, "包 " + name + " 没有子模块 " + attribute, e);
            }
        }
        throw new NotFoundException(attribute);
    }

    private List<AstNode> findAttribute(String attribute, InferenceContext context) {
        try {
            return getAttribute(attribute, context);
        } catch (NotFoundException e) {
            return Collections.emptyList();
        }
    }

    private static List<AstNode> prepend(AstNode first, List<AstNode> rest) {
        List<AstNode> result = new ArrayList<AstNode>(rest.size() + 1);
        result.add(first);
        result.addAll(rest);
        return result;
    }

    @Override
    public Iterator<InferredValue> inferAttribute(String attribute, InferenceContext context) {
        InferenceContext ctx = InferenceContext.orNew(context).withLookupName(attribute);
        try {
            return Inference.inferStatements(getAttribute(attribute, ctx), ctx, this);
        } catch (NotFoundException e) {
            throw new InferenceException("模块 " + name + " 没有属性 " + attribute, e);
        }
    }

    // ============ 导入 ============

    /**
     * 导入另一个模块。
     *
     * @param relativeOnly 只尝试相对于本模块的名称（用于包的子模块）
     * @param level        相对导入层级，0 表示隐式
     * @throws BuildException 模块无法构建或本模块没有解析器
     */
    public ModuleDecl importModule(String modname, boolean relativeOnly, int level) {
        if (resolver == null) {
            throw new BuildException("模块 " + name + " 没有解析器，无法导入 " + modname);
        }
        if (relativeOnly) {
            return resolver.resolveModule(absoluteModname(modname, level), null, 0);
        }
        return resolver.resolveModule(modname, this, level);
    }

    public ModuleDecl importModule(String modname) {
        return importModule(modname, false, 0);
    }

    /** 把相对于本模块的名称转换为绝对模块名 */
    public String absoluteModname(String modname, int level) {
        if (level == 0 && absoluteImportActivated()) {
            return modname;
        }
        String packageName;
        if (level > 0) {
            int up = packageFlag ? level - 1 : level;
            packageName = stripComponents(name, up);
        } else if (packageFlag) {
            packageName = name;
        } else {
            packageName = stripComponents(name, 1);
        }
        if (packageName.isEmpty()) {
            return modname;
        }
        if (modname == null || modname.isEmpty()) {
            return packageName;
        }
        return packageName + "." + modname;
    }

    private static String stripComponents(String dotted, int count) {
        String result = dotted;
        for (int i = 0; i < count; i++) {
            int dot = result.lastIndexOf('.');
            if (dot < 0) {
                return "";
            }
            result = result.substring(0, dot);
        }
        return result;
    }

    /** 是否有 {@code from __future__ import absolute_import} */
    public boolean absoluteImportActivated() {
        for (AstNode binding : locals.get("absolute_import")) {
            if (binding instanceof FromImportStmt && "__future__".equals(((FromImportStmt) binding).getModname())) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code from <本模块> import *} 导入的名称：{@code __all__} 字面量中的字符串，
     * 否则为所有不以下划线开头的名称。
     */
    public List<String> wildcardImportNames() {
        AstNode all = locals.first("__all__");
        if (all instanceof AssignName && all.getParent() instanceof AssignStmt) {
            AstNode value = ((AssignStmt) all.getParent()).getValue();
            if (value instanceof CollectionExpr) {
                List<String> names = new ArrayList<String>();
                for (AstNode element : ((CollectionExpr) value).getElts()) {
                    if (element instanceof Const && ((Const) element).getValue() instanceof String) {
                        names.add((String) ((Const) element).getValue());
                    }
                }
                return names;
            }
        }
        List<String> names = new ArrayList<String>();
        for (String local : locals.names()) {
            if (!local.startsWith("_")) {
                names.add(local);
            }
        }
        return names;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<AstNode>(body);
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }

    @Override
    public String toString() {
        return "ModuleDecl(" + name + ")";
    }
}
