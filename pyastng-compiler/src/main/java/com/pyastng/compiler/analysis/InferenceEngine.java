package com.pyastng.compiler.analysis;

import com.google.common.collect.Iterators;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.LookupResult;
import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.*;
import com.pyastng.compiler.ast.stmt.FromImportStmt;
import com.pyastng.compiler.ast.stmt.ImportBase;
import com.pyastng.compiler.ast.stmt.ImportStmt;
import com.pyastng.compiler.builder.BuildException;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 推断引擎
 *
 * <p>按节点类型分派，产生惰性的候选值序列。每次推断先把 {@code (节点, 查找名)}
 * 压入上下文路径，已在路径上说明出现递归，此时结果为空序列。
 * 未覆盖的节点类型推断为 {@link Unknown}。</p>
 */
public final class InferenceEngine implements AstVisitor<Iterator<InferredValue>, InferenceContext> {

    public static final InferenceEngine INSTANCE = new InferenceEngine();

    private InferenceEngine() {
    }

    /**
     * 推断节点的候选值，结果已去重。
     *
     * @throws InferenceException 可能在创建或拉取序列时抛出
     */
    public Iterator<InferredValue> infer(AstNode node, InferenceContext context) {
        InferenceContext ctx = InferenceContext.orNew(context).push(node);
        if (ctx == null) {
            return Collections.emptyIterator();
        }
        Iterator<InferredValue> result = node.accept(this, ctx);
        if (result == null) {
            return Inference.unknown();
        }
        return Inference.distinct(result);
    }

    // ============ 推断为自身的节点 ============

    @Override
    public Iterator<InferredValue> visitModuleDecl(ModuleDecl node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitClassDecl(ClassDecl node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitFunctionDecl(FunctionDecl node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitLambdaExpr(LambdaExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitConst(Const node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitListExpr(ListExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitTupleExpr(TupleExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitSetExpr(SetExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitDictExpr(DictExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitSliceExpr(SliceExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitGeneratorExpr(GeneratorExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitSetCompExpr(SetCompExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    @Override
    public Iterator<InferredValue> visitDictCompExpr(DictCompExpr node, InferenceContext ctx) {
        return Inference.single(node);
    }

    // ============ 名称 ============

    @Override
    public Iterator<InferredValue> visitName(Name node, InferenceContext ctx) {
        LookupResult result = node.lookup(node.getName());
        if (result.isEmpty()) {
            throw new UnresolvedNameException(node.getName());
        }
        return Inference.inferStatements(result.getBindings(), ctx.withLookupName(node.getName()), result.getScope());
    }

    @Override
    public Iterator<InferredValue> visitAssignName(AssignName node, InferenceContext ctx) {
        return AssignedValues.infer(node, ctx);
    }

    @Override
    public Iterator<InferredValue> visitAssignAttr(AssignAttr node, InferenceContext ctx) {
        return AssignedValues.infer(node, ctx);
    }

    @Override
    public Iterator<InferredValue> visitDeleteName(DeleteName node, InferenceContext ctx) {
        return Collections.emptyIterator();
    }

    @Override
    public Iterator<InferredValue> visitDeleteAttr(DeleteAttr node, InferenceContext ctx) {
        return Collections.emptyIterator();
    }

    // ============ 属性与调用 ============

    @Override
    public Iterator<InferredValue> visitAttribute(Attribute node, final InferenceContext ctx) {
        final String attribute = node.getAttrname();
        return Inference.expand(node.getExpr().infer(ctx.withLookupName(null)),
                owner -> Inference.inferAttribute(owner, attribute, ctx),
                "无法推断属性 " + attribute);
    }

    @Override
    public Iterator<InferredValue> visitCallExpr(final CallExpr node, final InferenceContext ctx) {
        return Inference.expand(node.getFunc().infer(ctx.withLookupName(null)), callee -> {
            if (callee instanceof CallableValue) {
                return ((CallableValue) callee).inferCallResult(node, ctx);
            }
            return Collections.<InferredValue>emptyIterator();
        }, "无法推断调用结果");
    }

    // ============ 导入 ============

    @Override
    public Iterator<InferredValue> visitImportStmt(ImportStmt node, InferenceContext ctx) {
        String name = requireLookupName(node, ctx);
        return Inference.single(doImportModule(node, realName(node, name), 0));
    }

    @Override
    public Iterator<InferredValue> visitFromImportStmt(FromImportStmt node, InferenceContext ctx) {
        String name = requireLookupName(node, ctx);
        String real = realName(node, name);
        ModuleDecl module = doImportModule(node, node.getModname(), node.getLevel());
        return module.inferAttribute(real, ctx.withLookupName(real));
    }

    private static String requireLookupName(ImportBase node, InferenceContext ctx) {
        if (ctx.getLookupName() == null) {
            throw new InferenceException("推断导入语句需要查找名称: " + node);
        }
        return ctx.getLookupName();
    }

    private static String realName(ImportBase node, String name) {
        try {
            return node.realName(name);
        } catch (NotFoundException e) {
            throw new InferenceException("导入语句没有绑定名称 " + name, e);
        }
    }

    /** 导入自身时直接返回本模块 */
    private static ModuleDecl doImportModule(ImportBase node, String modname, int level) {
        ModuleDecl module = node.root();
        if (Objects.equals(module.absoluteModname(modname, level), module.getName())) {
            return module;
        }
        try {
            return module.importModule(modname, false, level);
        } catch (BuildException e) {
            throw new InferenceException("无法导入模块 " + modname, e);
        }
    }

    // ============ 其它表达式 ============

    @Override
    public Iterator<InferredValue> visitIfExpr(final IfExpr node, final InferenceContext ctx) {
        return Iterators.concat(
                Inference.orUnknown(() -> node.getBody().infer(ctx)),
                Inference.orUnknown(() -> node.getOrelse().infer(ctx)));
    }

    @Override
    public Iterator<InferredValue> visitBoolExpr(BoolExpr node, final InferenceContext ctx) {
        return Iterators.concat(Iterators.transform(node.getValues().iterator(),
                value -> Inference.orUnknown(() -> value.infer(ctx))));
    }

    /** 只处理以常量为下标的列表、元组和字典字面量 */
    @Override
    public Iterator<InferredValue> visitSubscriptExpr(SubscriptExpr node, final InferenceContext ctx) {
        if (!(node.getSlice() instanceof IndexSlice)) {
            return Inference.unknown();
        }
        AstNode indexNode = ((IndexSlice) node.getSlice()).getValue();
        Iterator<InferredValue> indexes = indexNode.infer(ctx);
        if (!indexes.hasNext()) {
            throw new InferenceException("无法推断下标");
        }
        InferredValue index = indexes.next();
        if (!(index instanceof Const)) {
            return Inference.unknown();
        }
        final Object key = ((Const) index).getValue();
        return Inference.expand(node.getValue().infer(ctx), value -> {
            AstNode item = itemOf(value, key);
            if (item == null) {
                return Inference.unknown();
            }
            return item.infer(ctx);
        }, "无法推断下标访问");
    }

    private static AstNode itemOf(InferredValue container, Object key) {
        if (container instanceof ListExpr || container instanceof TupleExpr) {
            if (!(key instanceof Long)) {
                return null;
            }
            List<AstNode> elts = ((CollectionExpr) container).getElts();
            long position = (Long) key;
            if (position < 0) {
                position += elts.size();
            }
            return position >= 0 && position < elts.size() ? elts.get((int) position) : null;
        }
        if (container instanceof DictExpr) {
            DictExpr dict = (DictExpr) container;
            for (int i = 0; i < dict.getKeys().size(); i++) {
                AstNode candidate = dict.getKeys().get(i);
                if (candidate instanceof Const && Objects.equals(((Const) candidate).getValue(), key)) {
                    return dict.getValues().get(i);
                }
            }
        }
        return null;
    }

    /** 可变参数与关键字参数分别是 tuple 和 dict 的实例 */
    @Override
    public Iterator<InferredValue> visitArguments(Arguments node, InferenceContext ctx) {
        String name = ctx.getLookupName();
        String className = null;
        if (name != null && name.equals(node.getVararg())) {
            className = "tuple";
        } else if (name != null && name.equals(node.getKwarg())) {
            className = "dict";
        }
        if (className != null) {
            ClassDecl cls = Builtins.findClass(node, className);
            if (cls != null) {
                return Inference.single(new Instance(cls));
            }
        }
        return Inference.unknown();
    }
}
