package com.pyastng.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 作用域符号表：名称 → 按出现顺序排列的绑定节点。
 *
 * <p>只追加，不删除；同名的后续绑定不会移除先前的绑定。</p>
 */
public final class LocalsTable {

    private final Map<String, List<AstNode>> entries = new LinkedHashMap<String, List<AstNode>>();

    /** 追加绑定；同一节点不重复登记 */
    public void add(String name, AstNode binding) {
        List<AstNode> bindings = bindingsFor(name);
        if (!containsIdentity(bindings, binding)) {
            bindings.add(binding);
        }
    }

    /** 把绑定插到最前面；同一节点不重复登记 */
    public void insertFirst(String name, AstNode binding) {
        List<AstNode> bindings = bindingsFor(name);
        if (!containsIdentity(bindings, binding)) {
            bindings.add(0, binding);
        }
    }

    private List<AstNode> bindingsFor(String name) {
        List<AstNode> bindings = entries.get(name);
        if (bindings == null) {
            bindings = new ArrayList<AstNode>();
            entries.put(name, bindings);
        }
        return bindings;
    }

    /** 返回名称的全部绑定（只读视图），未定义返回空列表 */
    public List<AstNode> get(String name) {
        List<AstNode> bindings = entries.get(name);
        return bindings == null ? Collections.<AstNode>emptyList() : Collections.unmodifiableList(bindings);
    }

    /** 名称的第一个绑定，未定义返回 null */
    public AstNode first(String name) {
        List<AstNode> bindings = entries.get(name);
        return bindings == null || bindings.isEmpty() ? null : bindings.get(0);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public boolean containsBinding(String name, AstNode binding) {
        List<AstNode> bindings = entries.get(name);
        return bindings != null && containsIdentity(bindings, binding);
    }

    /** 按首次登记顺序返回所有名称 */
    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /** 每个名称的第一个绑定 */
    public List<AstNode> firstBindings() {
        List<AstNode> result = new ArrayList<AstNode>();
        for (List<AstNode> bindings : entries.values()) {
            if (!bindings.isEmpty()) {
                result.add(bindings.get(0));
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private static boolean containsIdentity(List<AstNode> bindings, AstNode binding) {
        for (AstNode existing : bindings) {
            if (existing == binding) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return entries.keySet().toString();
    }
}
