package com.pyastng.compiler.ast.decl;

import com.google.common.collect.Iterators;
import com.pyastng.compiler.analysis.GeneratorValue;
import com.pyastng.compiler.analysis.Inference;
import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.InferenceException;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.analysis.NoValue;
import com.pyastng.compiler.analysis.NotFoundException;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.LineRange;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.Name;
import com.pyastng.compiler.ast.expr.YieldExpr;
import com.pyastng.compiler.ast.stmt.PassStmt;
import com.pyastng.compiler.ast.stmt.RaiseStmt;
import com.pyastng.compiler.ast.stmt.ReturnStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 函数定义 {@code def name(args): body}
 */
public class FunctionDecl extends FunctionBase {
    private static final Logger LOG = Logger.getLogger(FunctionDecl.class.getName());

    private final String name;
    private String doc;
    private Decorators decorators;
    private final List<AstNode> body = new ArrayList<AstNode>();
    private FunctionRole role = FunctionRole.FUNCTION;
    private final List<AstNode> extraDecorators = new ArrayList<AstNode>();
    private volatile Set<String> decoratorNames;

    public FunctionDecl(String name) {
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

    /** 装饰器，没有装饰器时为 null */
    public Decorators getDecorators() {
        return decorators;
    }

    public void setDecorators(Decorators decorators) {
        this.decorators = decorators;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public FunctionRole getRole() {
        return role;
    }

    public void setRole(FunctionRole role) {
        this.role = role;
    }

    /**
     * 类体中 {@code name = classmethod(name)} 形式记录的调用表达式。
     * 它们属于类体中的赋值语句，不是本节点的子节点。
     */
    public List<AstNode> getExtraDecorators() {
        return Collections.unmodifiableList(extraDecorators);
    }

    public void addExtraDecorator(AstNode call) {
        extraDecorators.add(call);
        decoratorNames = null;
    }

    public boolean isBound() {
        return role == FunctionRole.CLASSMETHOD;
    }

    @Override
    public boolean isStatement() {
        return true;
    }

    /** 函数头结束的行号 */
    public int getBlockStartToLineno() {
        return getArgs() != null ? Math.max(getFromLineno(), getArgs().getToLineno()) : getFromLineno();
    }

    /** 总是整个定义的范围，与给定行号无关 */
    @Override
    public LineRange blockRange(int lineno) {
        return new LineRange(getFromLineno(), getToLineno());
    }

    @Override
    protected boolean isEvaluatedInParentFrame(AstNode node) {
        return super.isEvaluatedInParentFrame(node) || (decorators != null && node.isWithin(decorators));
    }

    /**
     * 方法体只有一条语句且是 pass（或抛出 NotImplementedError）时视为抽象方法，
     * 空方法体等同于只有 pass。
     */
    public boolean isAbstract() {
        return isAbstract(true);
    }

    public boolean isAbstract(boolean passIsAbstract) {
        if (body.isEmpty()) {
            return passIsAbstract;
        }
        if (body.size() != 1) {
            return false;
        }
        AstNode statement = body.get(0);
        if (statement instanceof RaiseStmt && ((RaiseStmt) statement).getExceptionType() != null) {
            List<Name> names = ((RaiseStmt) statement).getExceptionType().nodesOfClass(Name.class, null);
            return !names.isEmpty() && "NotImplementedError".equals(names.get(0).getName());
        }
        return passIsAbstract && statement instanceof PassStmt;
    }

    /** 函数体（不含嵌套函数）中出现 yield */
    public boolean isGenerator() {
        return !nodesOfClass(YieldExpr.class, FunctionBase.class).isEmpty();
    }

    /** 装饰器（含类体中补记的调用）推断出的限定名集合 */
    public Set<String> decoratorNames() {
        Set<String> cached = decoratorNames;
        if (cached != null) {
            return cached;
        }
        List<AstNode> nodes = new ArrayList<AstNode>();
        if (decorators != null) {
            nodes.addAll(decorators.getNodes());
        }
        nodes.addAll(extraDecorators);
        Set<String> result = new LinkedHashSet<String>();
        for (AstNode node : nodes) {
            try {
                Iterator<InferredValue> values = node.infer();
                while (values.hasNext()) {
                    InferredValue value = values.next();
                    if (!value.isUnknown()) {
                        result.add(value.qualifiedName());
                    }
                }
            } catch (InferenceException e) {
                LOG.log(Level.FINE, "装饰器无法推断: " + name, e);
            }
        }
        cached = Collections.unmodifiableSet(result);
        decoratorNames = cached;
        return cached;
    }

    /**
     * 生成器函数产生一个生成器值；否则依次产生每条 return 的推断结果，
     * 裸 return 产生 {@code NoValue}，推断失败产生 {@code Unknown}。
     */
    @Override
    public Iterator<InferredValue> inferCallResult(AstNode caller, final InferenceContext context) {
        if (isGenerator()) {
            return Inference.single(new GeneratorValue(this));
        }
        List<ReturnStmt> returns = nodesOfClass(ReturnStmt.class, FunctionBase.class);
        return Iterators.concat(Iterators.transform(returns.iterator(), ret -> {
            if (ret.getValue() == null) {
                return Inference.single(NoValue.INSTANCE);
            }
            return Inference.orUnknown(() -> ret.getValue().infer(context));
        }));
    }

    @Override
    public List<AstNode> getAttribute(String attribute, InferenceContext context) {
        if ("__module__".equals(attribute)) {
            return Collections.<AstNode>singletonList(new Const(root() != null ? root().qualifiedName() : null));
        }
        return SpecialAttributes.standard(attribute, name, doc, Collections.<AstNode>emptyList());
    }

    @Override
    public Iterator<InferredValue> inferAttribute(String attribute, InferenceContext context) {
        try {
            return Inference.inferStatements(getAttribute(attribute, context), context, this);
        } catch (NotFoundException e) {
            throw new InferenceException("函数 " + name + " 没有属性 " + attribute, e);
        }
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, decorators);
        addChild(children, getArgs());
        children.addAll(body);
        return children;
    }

    @Override
    protected boolean replaceChild(AstNode child, AstNode newChild) {
        return replaceIn(body, child, newChild);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }

    @Override
    public String toString() {
        return "FunctionDecl(" + name + ")@" + getLineno();
    }
}
