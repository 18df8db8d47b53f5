package com.pyastng.compiler.analysis;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 推断上下文
 *
 * <p>不可变：每次压入都返回新的上下文，因此惰性序列在稍后被拉取时
 * 看到的仍是创建它时的路径。记录两类正在进行的工作：
 * {@code (节点, 查找名)} 推断路径和 {@code (作用域, 属性名)} 属性查找。
 * 遇到已在路径上的条目即视为递归。</p>
 */
public final class InferenceContext {

    private final String lookupName;
    private final Set<Entry> path;
    private final Set<Entry> lookups;

    public InferenceContext() {
        this(null, Collections.<Entry>emptySet(), Collections.<Entry>emptySet());
    }

    private InferenceContext(String lookupName, Set<Entry> path, Set<Entry> lookups) {
        this.lookupName = lookupName;
        this.path = path;
        this.lookups = lookups;
    }

    /** context 为 null 时返回一个新的空上下文 */
    public static InferenceContext orNew(InferenceContext context) {
        return context != null ? context : new InferenceContext();
    }

    /** 当前请求的名称（导入语句等上下文相关节点据此解析） */
    public String getLookupName() {
        return lookupName;
    }

    public InferenceContext withLookupName(String name) {
        if (Objects.equals(name, lookupName)) {
            return this;
        }
        return new InferenceContext(name, path, lookups);
    }

    /**
     * 把 {@code (node, lookupName)} 压入推断路径。
     *
     * @return 新上下文；条目已在路径上时返回 null
     */
    public InferenceContext push(Object node) {
        Entry entry = new Entry(node, lookupName);
        if (path.contains(entry)) {
            return null;
        }
        return new InferenceContext(lookupName, with(path, entry), lookups);
    }

    /**
     * 记录对 {@code owner} 的属性 {@code name} 的查找。
     *
     * @return 新上下文；同一查找正在进行时返回 null
     */
    public InferenceContext pushLookup(Object owner, String name) {
        Entry entry = new Entry(owner, name);
        if (lookups.contains(entry)) {
            return null;
        }
        return new InferenceContext(lookupName, path, with(lookups, entry));
    }

    public boolean isLookupInProgress(Object owner, String name) {
        return lookups.contains(new Entry(owner, name));
    }

    private static Set<Entry> with(Set<Entry> entries, Entry entry) {
        Set<Entry> copy = new HashSet<Entry>(entries);
        copy.add(entry);
        return Collections.unmodifiableSet(copy);
    }

    /** 按对象同一性比较的条目 */
    private static final class Entry {
        private final Object owner;
        private final String name;

        Entry(Object owner, String name) {
            this.owner = owner;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry other = (Entry) o;
            return owner == other.owner && Objects.equals(name, other.name);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(owner) + Objects.hashCode(name);
        }
    }
}
