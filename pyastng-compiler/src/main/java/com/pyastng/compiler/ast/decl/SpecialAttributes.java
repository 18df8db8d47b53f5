package com.pyastng.compiler.ast.decl;

import com.pyastng.compiler.analysis.NotFoundException;
import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.DeleteAttr;
import com.pyastng.compiler.ast.expr.DeleteName;
import com.pyastng.compiler.ast.expr.DictExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模块、类、函数共有的隐式属性：{@code __name__}、{@code __doc__}、{@code __dict__}
 */
final class SpecialAttributes {

    private SpecialAttributes() {
    }

    /**
     * @param explicit 同名的显式绑定，排在合成节点之后
     */
    static List<AstNode> standard(String attribute, String name, String doc, List<AstNode> explicit) {
        AstNode synthetic;
        if ("__name__".equals(attribute)) {
            synthetic = new Const(name);
        } else if ("__doc__".equals(attribute)) {
            synthetic = new Const(doc);
        } else if ("__dict__".equals(attribute)) {
            synthetic = new DictExpr();
        } else {
            throw new NotFoundException(attribute);
        }
        if (explicit.isEmpty()) {
            return Collections.singletonList(synthetic);
        }
        List<AstNode> result = new ArrayList<AstNode>();
        result.add(synthetic);
        result.addAll(explicit);
        return result;
    }

    /** 去掉删除节点 */
    static List<AstNode> withoutDeletions(List<AstNode> values) {
        List<AstNode> result = new ArrayList<AstNode>(values.size());
        for (AstNode value : values) {
            if (!(value instanceof DeleteName) && !(value instanceof DeleteAttr)) {
                result.add(value);
            }
        }
        return result;
    }
}
