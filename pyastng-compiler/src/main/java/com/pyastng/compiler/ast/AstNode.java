package com.pyastng.compiler.ast;

import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.InferenceEngine;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.ast.decl.ModuleDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 规范语法图节点基类
 *
 * <p>子节点由父节点独占；{@code parent} 是非拥有的反向引用，只设置一次，
 * 仅 {@link #replace(AstNode, AstNode)} 允许改写。</p>
 */
public abstract class AstNode implements InferredValue {

    /** 行号尚未确定 */
    public static final int UNSET_LINE = -1;

    private AstNode parent;
    private int lineno;
    private int fromLineno = UNSET_LINE;
    private int toLineno = UNSET_LINE;

    protected AstNode() {
    }

    // ============ 结构 ============

    public AstNode getParent() {
        return parent;
    }

    /**
     * 设置父节点。父引用只能设置一次。
     */
    public void setParent(AstNode parent) {
        if (this.parent != null && this.parent != parent) {
            throw new IllegalStateException("父节点已设置: " + this);
        }
        this.parent = parent;
    }

    /** 按字段顺序返回所有非空子节点 */
    public abstract List<AstNode> getChildren();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /**
     * 结构替换：用 {@code newChild} 取代直接子节点 {@code child}。
     */
    public final void replace(AstNode child, AstNode newChild) {
        if (child.parent != this) {
            throw new IllegalArgumentException(child + " 不是 " + this + " 的子节点");
        }
        if (!replaceChild(child, newChild)) {
            throw new UnsupportedOperationException(getClass().getSimpleName() + " 不支持替换子节点");
        }
        child.parent = null;
        newChild.parent = this;
    }

    /** 子类在自己的子节点序列中完成替换，找不到返回 false */
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return false;
    }

    protected static boolean replaceIn(List<AstNode> sequence, AstNode child, AstNode newChild) {
        for (int i = 0; i < sequence.size(); i++) {
            if (sequence.get(i) == child) {
                sequence.set(i, newChild);
                return true;
            }
        }
        return false;
    }

    protected static void addChild(List<AstNode> out, AstNode child) {
        if (child != null) {
            out.add(child);
        }
    }

    protected static void addChildren(List<AstNode> out, List<? extends AstNode> children) {
        if (children == null) return;
        for (AstNode child : children) {
            addChild(out, child);
        }
    }

    // ============ 行号 ============

    public int getLineno() {
        return lineno;
    }

    public void setLineno(int lineno) {
        this.lineno = lineno;
    }

    public int getFromLineno() {
        return fromLineno != UNSET_LINE ? fromLineno : lineno;
    }

    public void setFromLineno(int fromLineno) {
        this.fromLineno = fromLineno;
    }

    public int getToLineno() {
        return toLineno != UNSET_LINE ? toLineno : getFromLineno();
    }

    public void setToLineno(int toLineno) {
        this.toLineno = toLineno;
    }

    public boolean hasToLineno() {
        return toLineno != UNSET_LINE;
    }

    /** {@code lineno} 所在块的行号范围：默认从该行到本节点末尾 */
    public LineRange blockRange(int lineno) {
        return new LineRange(lineno, getToLineno());
    }

    // ============ 导航 ============

    /** 最近的作用域节点（包含自身） */
    public ScopeNode scope() {
        AstNode node = this;
        while (node != null) {
            if (node instanceof ScopeNode) {
                return (ScopeNode) node;
            }
            node = node.parent;
        }
        return null;
    }

    /** 最近的 frame：模块、类或函数（推导式作用域不是 frame） */
    public ScopeNode frame() {
        return parent != null ? parent.frame() : null;
    }

    /** 所属模块 */
    public ModuleDecl root() {
        AstNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node instanceof ModuleDecl ? (ModuleDecl) node : null;
    }

    public boolean isStatement() {
        return false;
    }

    /** 最近的语句节点（包含自身） */
    public AstNode statement() {
        if (isStatement() || parent == null) {
            return this;
        }
        return parent.statement();
    }

    /** 判断本节点是否位于 {@code ancestor} 子树中（包含自身） */
    public boolean isWithin(AstNode ancestor) {
        AstNode node = this;
        while (node != null) {
            if (node == ancestor) return true;
            node = node.parent;
        }
        return false;
    }

    /** 同一父节点下的前一条语句 */
    public AstNode previousSibling() {
        List<AstNode> siblings = statementSiblings();
        int index = indexOf(siblings, this);
        return index > 0 ? siblings.get(index - 1) : null;
    }

    /** 同一父节点下的后一条语句 */
    public AstNode nextSibling() {
        List<AstNode> siblings = statementSiblings();
        int index = indexOf(siblings, this);
        return index >= 0 && index + 1 < siblings.size() ? siblings.get(index + 1) : null;
    }

    private List<AstNode> statementSiblings() {
        if (parent == null || !isStatement()) {
            return Collections.emptyList();
        }
        List<AstNode> result = new ArrayList<AstNode>();
        for (AstNode child : parent.getChildren()) {
            if (child.isStatement()) {
                result.add(child);
            }
        }
        return result;
    }

    protected static int indexOf(List<? extends AstNode> nodes, AstNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) return i;
        }
        return -1;
    }

    /**
     * 先序遍历收集指定类型的节点；{@code skip} 类型的子树（根节点除外）不进入。
     */
    public <T extends AstNode> List<T> nodesOfClass(Class<T> type, Class<? extends AstNode> skip) {
        List<T> result = new ArrayList<T>();
        collectNodes(this, type, skip, result, true);
        return result;
    }

    private static <T extends AstNode> void collectNodes(AstNode node, Class<T> type,
                                                        Class<? extends AstNode> skip,
                                                        List<T> result, boolean isRoot) {
        if (!isRoot && skip != null && skip.isInstance(node)) {
            return;
        }
        if (type.isInstance(node)) {
            result.add(type.cast(node));
        }
        for (AstNode child : node.getChildren()) {
            collectNodes(child, type, skip, result, false);
        }
    }

    // ============ 查找与推断 ============

    /** 在词法作用域链中查找名称 */
    public LookupResult lookup(String name) {
        return scope().scopeLookup(this, name, 0);
    }

    public Iterator<InferredValue> infer(InferenceContext context) {
        return InferenceEngine.INSTANCE.infer(this, context);
    }

    public Iterator<InferredValue> infer() {
        return infer(null);
    }

    @Override
    public String pytype() {
        return getClass().getSimpleName();
    }

    @Override
    public String qualifiedName() {
        return pytype();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + lineno;
    }
}
