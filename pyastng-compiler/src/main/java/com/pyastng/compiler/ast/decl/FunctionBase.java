package com.pyastng.compiler.ast.decl;

import com.pyastng.compiler.analysis.Builtins;
import com.pyastng.compiler.analysis.CallableValue;
import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.ScopeLookup;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.LocalsTable;
import com.pyastng.compiler.ast.LookupResult;
import com.pyastng.compiler.ast.ScopeNode;

import java.util.Collections;
import java.util.List;

/**
 * 函数与 lambda 的公共部分：参数表、局部符号表、调用结果推断
 */
public abstract class FunctionBase extends AstNode implements ScopeNode, CallableValue {
    private final LocalsTable locals = new LocalsTable();
    private Arguments args;

    public Arguments getArgs() {
        return args;
    }

    public void setArgs(Arguments args) {
        this.args = args;
    }

    @Override
    public LocalsTable getLocals() {
        return locals;
    }

    @Override
    public AstNode asNode() {
        return this;
    }

    @Override
    public ScopeNode frame() {
        return this;
    }

    public FunctionRole getRole() {
        return FunctionRole.FUNCTION;
    }

    /** 参数名（展开嵌套解包，含可变参数） */
    public List<String> argNames() {
        return args != null ? args.argNames() : Collections.<String>emptyList();
    }

    /** 定义在类中且不是 staticmethod/普通函数 */
    public boolean isMethod() {
        return getRole() != FunctionRole.FUNCTION && getParent() != null
                && getParent().frame() instanceof ClassDecl;
    }

    @Override
    public String pytype() {
        if (getRole() == FunctionRole.METHOD || getRole() == FunctionRole.CLASSMETHOD) {
            return Builtins.qualify("instancemethod");
        }
        return Builtins.qualify("function");
    }

    @Override
    public String qualifiedName() {
        if (getParent() == null) {
            return getName();
        }
        return getParent().frame().asNode().qualifiedName() + "." + getName();
    }

    /** 位于外层 frame 求值的子表达式（默认值等）中的节点 */
    protected boolean isEvaluatedInParentFrame(AstNode node) {
        if (args == null) {
            return false;
        }
        for (AstNode value : args.getDefaults()) {
            if (node.isWithin(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public LookupResult scopeLookup(AstNode node, String name, int offset) {
        if (getParent() != null && isEvaluatedInParentFrame(node)) {
            return ScopeLookup.lookupLocals(getParent().frame(), node, name, -1);
        }
        return ScopeLookup.lookupLocals(this, node, name, offset);
    }

    @Override
    public List<AstNode> getLocalDefinitions(String name, InferenceContext context) {
        return locals.get(name);
    }
}
