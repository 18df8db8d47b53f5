package com.pyastng.compiler.parsetree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 外部前端产生的具体解析树节点
 *
 * <p>字段值只能是 {@link RawNode}、{@link List}、字符串、{@link Long}、{@link Double}、
 * 布尔值或 null。行号缺失时为 null。</p>
 */
public final class RawNode {

    private final String type;
    private final Map<String, Object> fields = new LinkedHashMap<String, Object>();
    private Integer lineno;
    private Integer fromLineno;
    private Integer toLineno;

    public RawNode(String type) {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("节点类型不能为空");
        }
        this.type = type;
    }

    public static RawNode of(String type) {
        return new RawNode(type);
    }

    public String getType() {
        return type;
    }

    /** 设置字段；整数统一为 Long，数组统一为 List */
    public RawNode with(String name, Object value) {
        fields.put(name, normalize(value));
        return this;
    }

    /** 便捷写法：{@code list(a, b)} 作为列表字段的值 */
    public static List<Object> list(Object... values) {
        List<Object> result = new ArrayList<Object>();
        for (Object value : values) {
            result.add(normalize(value));
        }
        return result;
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Object[]) {
            return list((Object[]) value);
        }
        if (value instanceof List) {
            List<Object> result = new ArrayList<Object>();
            for (Object element : (List<?>) value) {
                result.add(normalize(element));
            }
            return result;
        }
        return value;
    }

    public RawNode at(int line) {
        this.lineno = line;
        return this;
    }

    public RawNode span(int from, int to) {
        this.fromLineno = from;
        this.toLineno = to;
        return this;
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public RawNode getNode(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof RawNode)) {
            throw new MalformedTreeException(type + "." + name + " 不是节点: " + value);
        }
        return (RawNode) value;
    }

    /** 列表字段，缺失或为 null 时返回空列表 */
    public List<Object> getList(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new MalformedTreeException(type + "." + name + " 不是列表: " + value);
        }
        @SuppressWarnings("unchecked")
        List<Object> list = (List<Object>) value;
        return list;
    }

    /** 节点列表字段；null 元素保留 */
    public List<RawNode> getNodes(String name) {
        List<RawNode> nodes = new ArrayList<RawNode>();
        for (Object element : getList(name)) {
            if (element != null && !(element instanceof RawNode)) {
                throw new MalformedTreeException(type + "." + name + " 含有非节点元素: " + element);
            }
            nodes.add((RawNode) element);
        }
        return nodes;
    }

    public String getString(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new MalformedTreeException(type + "." + name + " 不是字符串: " + value);
        }
        return (String) value;
    }

    public long getLong(String name, long defaultValue) {
        Object value = fields.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number)) {
            throw new MalformedTreeException(type + "." + name + " 不是数字: " + value);
        }
        return ((Number) value).longValue();
    }

    public boolean getBoolean(String name) {
        Object value = fields.get(name);
        return Boolean.TRUE.equals(value);
    }

    public Integer getLineno() {
        return lineno;
    }

    public Integer getFromLineno() {
        return fromLineno;
    }

    public Integer getToLineno() {
        return toLineno;
    }

    public void setLineno(Integer lineno) {
        this.lineno = lineno;
    }

    public void setFromLineno(Integer fromLineno) {
        this.fromLineno = fromLineno;
    }

    public void setToLineno(Integer toLineno) {
        this.toLineno = toLineno;
    }

    /** 复制行号信息到另一个节点（用于合成节点） */
    public RawNode copyLinesTo(RawNode other) {
        other.lineno = lineno;
        other.fromLineno = fromLineno;
        other.toLineno = toLineno;
        return other;
    }

    /** 字段中类型为 {@code type} 的一个节点 */
    public static boolean isType(Object value, String... types) {
        return value instanceof RawNode && Arrays.asList(types).contains(((RawNode) value).type);
    }

    @Override
    public String toString() {
        return type + (lineno != null ? "@" + lineno : "") + fields.keySet();
    }
}
