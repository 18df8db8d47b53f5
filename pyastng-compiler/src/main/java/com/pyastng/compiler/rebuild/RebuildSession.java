package com.pyastng.compiler.rebuild;

import com.pyastng.compiler.ast.expr.AssignAttr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 一次模块重建的状态
 *
 * <p>赋值上下文、每层类体的元类标记、每层函数的 global 名称，
 * 以及待解析的属性赋值队列。每次构建都使用新的会话。</p>
 */
final class RebuildSession {

    private AssignContext context = AssignContext.NONE;
    private final Deque<Boolean> metaclass = new ArrayDeque<Boolean>();
    private final Deque<Set<String>> globalNames = new ArrayDeque<Set<String>>();
    private final List<AssignAttr> delayed = new ArrayList<AssignAttr>();

    RebuildSession() {
        metaclass.push(Boolean.FALSE);
    }

    AssignContext getContext() {
        return context;
    }

    /** 设置新的上下文，返回旧值供调用方恢复 */
    AssignContext enter(AssignContext newContext) {
        AssignContext previous = context;
        context = newContext;
        return previous;
    }

    void restore(AssignContext previous) {
        context = previous;
    }

    // ============ 元类 ============

    /** 进入类体：沿用外层的标记 */
    void enterClass() {
        metaclass.push(metaclass.peek());
    }

    /** 当前类体出现了 {@code __metaclass__} 赋值 */
    void markMetaclass() {
        metaclass.pop();
        metaclass.push(Boolean.TRUE);
    }

    /** 离开类体，返回该层的标记 */
    boolean leaveClass() {
        return metaclass.pop();
    }

    // ============ global ============

    void enterFunction() {
        globalNames.push(new HashSet<String>());
    }

    void leaveFunction() {
        globalNames.pop();
    }

    /** 模块层的 global 语句没有效果 */
    void declareGlobals(List<String> names) {
        if (!globalNames.isEmpty()) {
            globalNames.peek().addAll(names);
        }
    }

    boolean isGlobal(String name) {
        return !globalNames.isEmpty() && globalNames.peek().contains(name);
    }

    // ============ 延迟属性赋值 ============

    void delay(AssignAttr node) {
        delayed.add(node);
    }

    List<AssignAttr> getDelayed() {
        return Collections.unmodifiableList(delayed);
    }
}
