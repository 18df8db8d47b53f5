package com.pyastng.compiler.ast.decl;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.expr.AssignName;
import com.pyastng.compiler.ast.expr.CollectionExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * 函数参数表
 *
 * <p>{@code args} 中的元素是 {@link AssignName} 或嵌套解包的元组；
 * {@code args} 为 null 表示没有参数信息（如由内建描述构造的函数）。
 * 可变参数 {@code *vararg} 与 {@code **kwarg} 以本节点作为绑定登记在函数的局部表中。</p>
 */
public class Arguments extends AstNode {
    private List<AstNode> args;
    private final List<AstNode> defaults = new ArrayList<AstNode>();
    private String vararg;
    private String kwarg;

    public Arguments() {
        this.args = new ArrayList<AstNode>();
    }

    /** 位置参数；null 表示没有参数信息 */
    public List<AstNode> getArgs() {
        return args;
    }

    public void setArgs(List<AstNode> args) {
        this.args = args;
    }

    public boolean hasArgumentInfo() {
        return args != null;
    }

    /** 默认值，与 {@code args} 的末尾对齐 */
    public List<AstNode> getDefaults() {
        return defaults;
    }

    public String getVararg() {
        return vararg;
    }

    public void setVararg(String vararg) {
        this.vararg = vararg;
    }

    public String getKwarg() {
        return kwarg;
    }

    public void setKwarg(String kwarg) {
        this.kwarg = kwarg;
    }

    /** 所有参数名（展开嵌套解包），含可变参数 */
    public List<String> argNames() {
        List<String> names = new ArrayList<String>();
        if (args != null) {
            collectNames(args, names);
        }
        if (vararg != null) names.add(vararg);
        if (kwarg != null) names.add(kwarg);
        return names;
    }

    private static void collectNames(List<AstNode> nodes, List<String> names) {
        for (AstNode node : nodes) {
            if (node instanceof AssignName) {
                names.add(((AssignName) node).getName());
            } else if (node instanceof CollectionExpr) {
                collectNames(((CollectionExpr) node).getElts(), names);
            }
        }
    }

    /** 参数 {@code name} 的默认值表达式；没有默认值返回 null */
    public AstNode defaultValue(String name) {
        if (args == null) {
            return null;
        }
        for (int i = 0; i < args.size(); i++) {
            AstNode arg = args.get(i);
            if (arg instanceof AssignName && ((AssignName) arg).getName().equals(name)) {
                int index = i - (args.size() - defaults.size());
                return index >= 0 ? defaults.get(index) : null;
            }
        }
        return null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChildren(children, args);
        children.addAll(defaults);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArguments(this, context);
    }
}
