package com.pyastng.compiler.ast.expr;

import com.pyastng.compiler.analysis.InferenceContext;
import com.pyastng.compiler.analysis.InferenceException;
import com.pyastng.compiler.analysis.InferredValue;
import com.pyastng.compiler.analysis.NotFoundException;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.AstVisitor;
import com.pyastng.compiler.ast.decl.FunctionBase;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * lambda 表达式
 */
public class LambdaExpr extends FunctionBase {
    private AstNode body;

    @Override
    public String getName() {
        return "<lambda>";
    }

    public AstNode getBody() {
        return body;
    }

    public void setBody(AstNode body) {
        this.body = body;
    }

    /** 调用结果即函数体表达式的推断结果 */
    @Override
    public Iterator<InferredValue> inferCallResult(AstNode caller, InferenceContext context) {
        return body.infer(context);
    }

    @Override
    public List<AstNode> getAttribute(String name, InferenceContext context) {
        throw new NotFoundException(name);
    }

    @Override
    public Iterator<InferredValue> inferAttribute(String name, InferenceContext context) {
        throw new InferenceException("lambda 没有属性 " + name);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<AstNode>();
        addChild(children, getArgs());
        addChild(children, body);
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
