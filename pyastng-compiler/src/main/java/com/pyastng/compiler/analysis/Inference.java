package com.pyastng.compiler.analysis;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.expr.DeleteAttr;
import com.pyastng.compiler.ast.expr.DeleteName;
import com.pyastng.compiler.ast.stmt.ImportBase;

import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 惰性推断序列的组合工具
 */
public final class Inference {

    private Inference() {
    }

    public static Iterator<InferredValue> unknown() {
        return Iterators.<InferredValue>singletonIterator(Unknown.INSTANCE);
    }

    public static Iterator<InferredValue> single(InferredValue value) {
        return Iterators.singletonIterator(value);
    }

    /** 去掉重复的候选值，保持首次出现的顺序 */
    public static Iterator<InferredValue> distinct(final Iterator<InferredValue> values) {
        return new AbstractIterator<InferredValue>() {
            private final Set<InferredValue> seen = new HashSet<InferredValue>();

            @Override
            protected InferredValue computeNext() {
                while (values.hasNext()) {
                    InferredValue value = values.next();
                    if (seen.add(value)) {
                        return value;
                    }
                }
                return endOfData();
            }
        };
    }

    /**
     * 延迟到第一次拉取时才调用 {@code supplier}；推断失败以 {@link Unknown} 代替。
     */
    public static Iterator<InferredValue> orUnknown(final Supplier<Iterator<InferredValue>> supplier) {
        return new AbstractIterator<InferredValue>() {
            private Iterator<InferredValue> delegate;

            @Override
            protected InferredValue computeNext() {
                try {
                    if (delegate == null) {
                        delegate = supplier.get();
                    }
                    return delegate.hasNext() ? delegate.next() : endOfData();
                } catch (InferenceException e) {
                    delegate = Collections.emptyIterator();
                    return Unknown.INSTANCE;
                }
            }
        };
    }

    /**
     * 逐个推断绑定节点。
     *
     * <p>删除节点被跳过；无法解析的名称被跳过；其它推断失败产生 {@link Unknown}。
     * 一个候选值都没有产生时抛出 {@link InferenceException}。</p>
     *
     * @param frame 绑定所在的作用域或实例，仅用于错误信息
     */
    public static Iterator<InferredValue> inferStatements(final List<AstNode> statements,
                                                          InferenceContext context,
                                                          final Object frame) {
        final InferenceContext base = InferenceContext.orNew(context);
        final String name = base.getLookupName();
        return new AbstractIterator<InferredValue>() {
            private int index;
            private Iterator<InferredValue> current = Collections.emptyIterator();
            private boolean inferred;

            @Override
            protected InferredValue computeNext() {
                while (true) {
                    try {
                        if (current.hasNext()) {
                            inferred = true;
                            return current.next();
                        }
                    } catch (UnresolvedNameException e) {
                        current = Collections.emptyIterator();
                        continue;
                    } catch (InferenceException e) {
                        current = Collections.emptyIterator();
                        inferred = true;
                        return Unknown.INSTANCE;
                    }
                    if (index >= statements.size()) {
                        if (!inferred) {
                            throw new InferenceException("没有可推断的绑定: " + name + " (" + frame + ")");
                        }
                        return endOfData();
                    }
                    AstNode statement = statements.get(index++);
                    if (statement instanceof DeleteName || statement instanceof DeleteAttr) {
                        continue;
                    }
                    InferenceContext stmtContext = base.withLookupName(inferName(statement, name));
                    try {
                        current = statement.infer(stmtContext);
                    } catch (UnresolvedNameException e) {
                        current = Collections.emptyIterator();
                    } catch (InferenceException e) {
                        current = Collections.emptyIterator();
                        inferred = true;
                        return Unknown.INSTANCE;
                    }
                }
            }
        };
    }

    /**
     * 对每个来源值展开出候选值：Unknown 原样产生，单个来源展开失败时跳过它。
     * 所有来源都没有产生结果时抛出 {@link InferenceException}。
     */
    public static Iterator<InferredValue> expand(final Iterator<InferredValue> sources,
                                                 final Function<InferredValue, Iterator<InferredValue>> expander,
                                                 final String failure) {
        return new AbstractIterator<InferredValue>() {
            private Iterator<InferredValue> current = Collections.emptyIterator();
            private boolean inferred;

            @Override
            protected InferredValue computeNext() {
                while (true) {
                    try {
                        if (current.hasNext()) {
                            inferred = true;
                            return current.next();
                        }
                    } catch (InferenceException | NotFoundException e) {
                        current = Collections.emptyIterator();
                    }
                    if (!sources.hasNext()) {
                        if (!inferred) {
                            throw new InferenceException(failure);
                        }
                        return endOfData();
                    }
                    InferredValue source = sources.next();
                    if (source.isUnknown()) {
                        inferred = true;
                        return source;
                    }
                    try {
                        current = expander.apply(source);
                    } catch (InferenceException | NotFoundException e) {
                        current = Collections.emptyIterator();
                    }
                }
            }
        };
    }

    /** 只有导入语句和参数表需要知道被请求的名称 */
    private static String inferName(AstNode statement, String name) {
        if (statement instanceof ImportBase || statement instanceof Arguments) {
            return name;
        }
        return null;
    }

    /**
     * 在任意候选值上推断属性。
     *
     * @throws InferenceException 值不支持属性访问或属性不存在
     */
    public static Iterator<InferredValue> inferAttribute(InferredValue owner, String name, InferenceContext context) {
        if (owner instanceof AttributeOwner) {
            return ((AttributeOwner) owner).inferAttribute(name, context);
        }
        if (owner instanceof BuiltinLiteral) {
            AstNode node = (AstNode) owner;
            ClassDecl cls = Builtins.findClass(node, ((BuiltinLiteral) owner).builtinClassName());
            if (cls != null) {
                return new Instance(cls).inferAttribute(name, context);
            }
        }
        throw new InferenceException("无法在 " + owner + " 上推断属性 " + name);
    }
}
