package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 调用表达式：{@code func(args, k=v, *starargs, **kwargs)}
 */
public class CallExpr extends Expression {
    private AstNode func;
    private final List<AstNode> args = new ArrayList<AstNode>();
    private final List<Keyword> keywords = new ArrayList<Keyword>();
    private AstNode starargs;
    private AstNode kwargs;

    public AstNode getFunc() {
        return func;
    }

    public void setFunc(AstNode func) {
        this.func = func;
    }

    /** 位置参数 */
    public List<AstNode> getArgs() {
        return args;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    /** 关键字参数：名称 → 值表达式 */
    public Map<String, AstNode> getKeywordMap() {
        Map<String, AstNode> map = new LinkedHashMap<String, AstNode>();
        for (Keyword keyword : keywords) {
            map.put(keyword.getArg(), keyword.getValue());
        }
        return map;
    }

    public AstNode getStarargs() {
        return starargs;
    }

    public void setStarargs(AstNode starargs) {
        this.starargs = starargs;
    }

    public AstNode getKwargs() {
        return kwargs;
    }

    public void setKwargs(AstNode kwargs) {
        this.kwargs = kwargs;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, func);
        children.addAll(args);
        children.addAll(keywords);
        addChild(children, starargs);
        addChild(children, kwargs);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
