package com.pyastng.compiler.analysis;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.LookupResult;
import com.pyastng.compiler.ast.ScopeNode;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionBase;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.DeleteName;
import com.pyastng.compiler.ast.stmt.ForStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 词法作用域查找
 *
 * <p>先在本作用域按位置过滤绑定；找不到时，外层是函数则继续在外层查找，
 * 否则直接跳到模块（类作用域对嵌套函数不可见）；模块找不到时查内建模块。</p>
 */
public final class ScopeLookup {

    private ScopeLookup() {
    }

    /**
     * 在 {@code scope} 的局部绑定中查找，找不到时沿作用域链向外。
     */
    public static LookupResult lookupLocals(ScopeNode scope, AstNode node, String name, int offset) {
        List<AstNode> bindings = filterStatements(node, scope.getLocals().get(name), scope, offset);
        if (!bindings.isEmpty()) {
            return new LookupResult(scope, bindings);
        }
        AstNode parent = scope.asNode().getParent();
        if (parent != null) {
            ScopeNode parentScope = parent.scope();
            if (!(parentScope instanceof FunctionBase)) {
                parentScope = parentScope.asNode().root();
            }
            return parentScope.scopeLookup(node, name, 0);
        }
        if (scope instanceof ModuleDecl) {
            return builtinLookup((ModuleDecl) scope, name);
        }
        return new LookupResult(scope, Collections.<AstNode>emptyList());
    }

    /** 在内建模块中查找；模块本身就是内建模块或没有解析器时结果为空 */
    public static LookupResult builtinLookup(ModuleDecl module, String name) {
        ModuleDecl builtins = module.getResolver() != null ? module.getResolver().builtinsModule() : null;
        if (builtins == null || builtins == module) {
            return new LookupResult(module, Collections.<AstNode>emptyList());
        }
        return new LookupResult(builtins, builtins.getLocals().get(name));
    }

    /**
     * 按使用位置过滤绑定。
     *
     * <p>只有使用点与被查找作用域处于同一 frame 时才过滤：保留位置不晚于使用点的绑定，
     * frame 顶层的无条件绑定遮蔽此前的绑定，删除清空此前的绑定。
     * {@code offset} 为 -1 时使用点的 frame 视为外层 frame（基类、参数默认值、装饰器）。</p>
     */
    static List<AstNode> filterStatements(AstNode node, List<AstNode> bindings, ScopeNode frame, int offset) {
        if (bindings.isEmpty()) {
            return bindings;
        }
        ScopeNode myFrame = node.frame();
        if (offset == -1 && myFrame != null && myFrame.asNode().getParent() != null) {
            myFrame = myFrame.asNode().getParent().frame();
        }
        if (myFrame != frame || node == frame.asNode()) {
            return bindings;
        }
        AstNode myStatement = node.statement();
        int myLine = myStatement.getFromLineno() > 0 ? myStatement.getFromLineno() + offset : 0;

        List<AstNode> result = new ArrayList<AstNode>();
        for (AstNode binding : bindings) {
            AstNode statement = binding.statement();
            if (myLine > 0 && statement.getFromLineno() > myLine) {
                break;
            }
            if (binding instanceof ClassDecl && isInBases(node, (ClassDecl) binding)) {
                break;
            }
            if (binding instanceof DeleteName) {
                result.clear();
                continue;
            }
            boolean optional = statement instanceof ForStmt;
            if (!optional && statement.getParent() == frame.asNode()) {
                result.clear();
            }
            result.add(binding);
        }
        return result;
    }

    private static boolean isInBases(AstNode node, ClassDecl cls) {
        for (AstNode base : cls.getBases()) {
            if (node.isWithin(base)) {
                return true;
            }
        }
        return false;
    }
}
