package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.analysis.BuiltinLiteral;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 字面常量：None、布尔、整数、浮点数、字符串
 *
 * <p>整数统一为 {@link Long}，浮点数为 {@link Double}，None 为 {@code null}。</p>
 */
public class Const extends Expression implements BuiltinLiteral {
    private final Object value;

    public Const(Object value) {
        this.value = normalize(value);
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNone() {
        return value == null;
    }

    @Override
    public String builtinClassName() {
        if (value == null) return "NoneType";
        if (value instanceof Boolean) return "bool";
        if (value instanceof Long) return "int";
        if (value instanceof Double) return "float";
        return "str";
    }

    @Override
    public String pytype() {
        return Builtins.qualify(builtinClassName());
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConst(this, context);
    }

    @Override
    public String toString() {
        return "Const(" + value + ")@" + getLineno();
    }
}
