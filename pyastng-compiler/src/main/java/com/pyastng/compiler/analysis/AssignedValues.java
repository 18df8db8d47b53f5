package com.pyastng.compiler.analysis;

import com.google.common.collect.Iterators;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.ScopeNode;
import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.FunctionRole;
import com.pyastng.compiler.ast.expr.CollectionExpr;
import com.pyastng.compiler.ast.expr.Comprehension;
import com.pyastng.compiler.ast.expr.DictExpr;
import com.pyastng.compiler.ast.expr.ListExpr;
import com.pyastng.compiler.ast.expr.TupleExpr;
import com.pyastng.compiler.ast.stmt.AssignStmt;
import com.pyastng.compiler.ast.stmt.DeleteStmt;
import com.pyastng.compiler.ast.stmt.ExceptHandler;
import com.pyastng.compiler.ast.stmt.ForStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 赋值目标（AssignName / AssignAttr）被赋予的值
 *
 * <p>先沿外层元组/列表记下解包下标路径，再按绑定结构分派：
 * 赋值语句取右值，for 与推导式取可迭代字面量的元素，参数取默认值或方法接收者，
 * except 子句取异常类的实例。无法静态确定时为 {@link Unknown}。</p>
 */
final class AssignedValues {

    private AssignedValues() {
    }

    static Iterator<InferredValue> infer(AstNode target, final InferenceContext context) {
        final InferenceContext ctx = context.withLookupName(null);
        List<Integer> path = new ArrayList<Integer>();
        AstNode current = target;
        AstNode parent = target.getParent();
        while (parent instanceof TupleExpr || parent instanceof ListExpr) {
            path.add(0, indexOf(((CollectionExpr) parent).getElts(), current));
            current = parent;
            parent = parent.getParent();
        }

        if (parent instanceof AssignStmt) {
            final AstNode value = ((AssignStmt) parent).getValue();
            return unpack(Inference.orUnknown(() -> value.infer(ctx)), path, ctx);
        }
        if (parent instanceof ForStmt && ((ForStmt) parent).getTarget() == current) {
            return iterated(((ForStmt) parent).getIter(), path, ctx);
        }
        if (parent instanceof Comprehension && ((Comprehension) parent).getTarget() == current) {
            return iterated(((Comprehension) parent).getIter(), path, ctx);
        }
        if (parent instanceof Arguments) {
            return argument((Arguments) parent, current, path, ctx);
        }
        if (parent instanceof ExceptHandler && ((ExceptHandler) parent).getName() == current) {
            return caught((ExceptHandler) parent, ctx);
        }
        if (parent instanceof DeleteStmt) {
            return Collections.emptyIterator();
        }
        return Inference.unknown();
    }

    private static int indexOf(List<AstNode> elements, AstNode node) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /** 按下标路径逐层取出元组/列表字面量中的元素 */
    private static Iterator<InferredValue> unpack(Iterator<InferredValue> values, final List<Integer> path,
                                                  final InferenceContext ctx) {
        if (path.isEmpty()) {
            return values;
        }
        final int index = path.get(0);
        final List<Integer> rest = path.subList(1, path.size());
        return Iterators.concat(Iterators.transform(values, value -> {
            if (value instanceof ListExpr || value instanceof TupleExpr) {
                List<AstNode> elts = ((CollectionExpr) value).getElts();
                if (index >= 0 && index < elts.size()) {
                    final AstNode element = elts.get(index);
                    return unpack(Inference.orUnknown(() -> element.infer(ctx)), rest, ctx);
                }
            }
            return Inference.unknown();
        }));
    }

    /** 可迭代对象是字面量时逐个产生其元素（字典产生键） */
    private static Iterator<InferredValue> iterated(final AstNode iterable, final List<Integer> path,
                                                    final InferenceContext ctx) {
        Iterator<InferredValue> iterables = Inference.orUnknown(() -> iterable.infer(ctx));
        return Iterators.concat(Iterators.transform(iterables, value -> {
            List<AstNode> elements;
            if (value instanceof CollectionExpr) {
                elements = ((CollectionExpr) value).getElts();
            } else if (value instanceof DictExpr) {
                elements = ((DictExpr) value).getKeys();
            } else {
                return Inference.unknown();
            }
            if (elements.isEmpty()) {
                return Collections.<InferredValue>emptyIterator();
            }
            return Iterators.concat(Iterators.transform(elements.iterator(),
                    element -> unpack(Inference.orUnknown(() -> element.infer(ctx)), path, ctx)));
        }));
    }

    /**
     * 参数的值：方法的首个参数是实例，类方法的首个参数是类本身；
     * 有默认值时产生默认值，再补一个 Unknown 代表调用方可能传入的值。
     */
    private static Iterator<InferredValue> argument(Arguments arguments, AstNode current, List<Integer> path,
                                                    final InferenceContext ctx) {
        if (!path.isEmpty() || !arguments.hasArgumentInfo()) {
            return Inference.unknown();
        }
        List<AstNode> args = arguments.getArgs();
        AstNode function = arguments.getParent();
        if (!args.isEmpty() && args.get(0) == current && function instanceof FunctionDecl
                && function.getParent() != null) {
            FunctionRole role = ((FunctionDecl) function).getRole();
            ScopeNode frame = function.getParent().frame();
            if (frame instanceof ClassDecl) {
                if (role == FunctionRole.METHOD) {
                    return Inference.single(new Instance((ClassDecl) frame));
                }
                if (role == FunctionRole.CLASSMETHOD) {
                    return Inference.single((ClassDecl) frame);
                }
            }
        }
        int index = indexOf(args, current);
        int defaultIndex = index - (args.size() - arguments.getDefaults().size());
        if (index < 0 || defaultIndex < 0) {
            return Inference.unknown();
        }
        final AstNode defaultValue = arguments.getDefaults().get(defaultIndex);
        return Iterators.concat(Inference.orUnknown(() -> defaultValue.infer(ctx)), Inference.unknown());
    }

    /** except 子句绑定的是被捕获异常类的实例 */
    private static Iterator<InferredValue> caught(ExceptHandler handler, final InferenceContext ctx) {
        final AstNode type = handler.getType();
        if (type == null) {
            return Inference.unknown();
        }
        return Iterators.concat(Iterators.transform(Inference.orUnknown(() -> type.infer(ctx)), value -> {
            if (value instanceof CollectionExpr) {
                return Iterators.concat(Iterators.transform(((CollectionExpr) value).getElts().iterator(),
                        element -> Iterators.transform(Inference.orUnknown(() -> element.infer(ctx)),
                                AssignedValues::instantiate)));
            }
            return Inference.single(instantiate(value));
        }));
    }

    private static InferredValue instantiate(InferredValue value) {
        return value instanceof ClassDecl ? new Instance((ClassDecl) value) : value;
    }
}
