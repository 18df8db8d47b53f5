package com.pyastng.compiler.ast;

import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.AssignAttr;
import com.pyastng.compiler.ast.expr.AssignName;
import com.pyastng.compiler.ast.expr.Attribute;
import com.pyastng.compiler.ast.expr.BinaryExpr;
import com.pyastng.compiler.ast.expr.BoolExpr;
import com.pyastng.compiler.ast.expr.CompareExpr;
import com.pyastng.compiler.ast.expr.Const;
import com.pyastng.compiler.ast.expr.DeleteAttr;
import com.pyastng.compiler.ast.expr.DeleteName;
import com.pyastng.compiler.ast.expr.EmptyNode;
import com.pyastng.compiler.ast.expr.Keyword;
import com.pyastng.compiler.ast.expr.Name;
import com.pyastng.compiler.ast.expr.UnaryExpr;
import com.pyastng.compiler.ast.stmt.AugAssignStmt;
import com.pyastng.compiler.ast.stmt.FromImportStmt;
import com.pyastng.compiler.ast.stmt.GlobalStmt;
import com.pyastng.compiler.ast.stmt.ImportBase;
import com.pyastng.compiler.ast.stmt.PrintStmt;

/**
 * 把语法图输出为缩进的文本，每行一个节点
 *
 * <p>只包含结构与节点自身的标量属性，两棵结构相同的树输出相同的文本。</p>
 */
public final class TreeDump {
    private static final String INDENT = "  ";

    private final StringBuilder output = new StringBuilder();
    private final boolean withLines;

    private TreeDump(boolean withLines) {
        this.withLines = withLines;
    }

    public static String dump(AstNode node) {
        return dump(node, false);
    }

    /**
     * @param withLines 是否附带 {@code lineno}/{@code fromLineno}/{@code toLineno}
     */
    public static String dump(AstNode node, boolean withLines) {
        TreeDump dump = new TreeDump(withLines);
        dump.write(node, 0);
        return dump.output.toString();
    }

    private void write(AstNode node, int depth) {
        for (int i = 0; i < depth; i++) {
            output.append(INDENT);
        }
        output.append(node.getClass().getSimpleName());
        String label = label(node);
        if (label != null) {
            output.append('(').append(label).append(')');
        }
        if (withLines) {
            output.append(" @").append(node.getLineno())
                    .append(' ').append(node.getFromLineno())
                    .append('-').append(node.getToLineno());
        }
        output.append('\n');
        for (AstNode child : node.getChildren()) {
            write(child, depth + 1);
        }
    }

    private static String label(AstNode node) {
        if (node instanceof ModuleDecl) return ((ModuleDecl) node).getName();
        if (node instanceof ClassDecl) return ((ClassDecl) node).getName();
        if (node instanceof FunctionDecl) {
            FunctionDecl function = (FunctionDecl) node;
            return function.getName() + ", " + function.getRole();
        }
        if (node instanceof Name) return ((Name) node).getName();
        if (node instanceof AssignName) return ((AssignName) node).getName();
        if (node instanceof DeleteName) return ((DeleteName) node).getName();
        if (node instanceof Attribute) return ((Attribute) node).getAttrname();
        if (node instanceof AssignAttr) return ((AssignAttr) node).getAttrname();
        if (node instanceof DeleteAttr) return ((DeleteAttr) node).getAttrname();
        if (node instanceof Const) return constLabel(((Const) node).getValue());
        if (node instanceof BinaryExpr) return ((BinaryExpr) node).getOperator().name();
        if (node instanceof BoolExpr) return ((BoolExpr) node).getOperator().name();
        if (node instanceof UnaryExpr) return ((UnaryExpr) node).getOperator().name();
        if (node instanceof CompareExpr) return ((CompareExpr) node).getOperators().toString();
        if (node instanceof AugAssignStmt) return ((AugAssignStmt) node).getOperator().name();
        if (node instanceof Keyword) return ((Keyword) node).getArg();
        if (node instanceof GlobalStmt) return String.join(", ", ((GlobalStmt) node).getNames());
        if (node instanceof FromImportStmt) {
            FromImportStmt from = (FromImportStmt) node;
            return from.getModname() + ", " + from.getLevel() + ", " + from.getNames();
        }
        if (node instanceof ImportBase) return ((ImportBase) node).getNames().toString();
        if (node instanceof PrintStmt) return ((PrintStmt) node).isNewline() ? "nl" : null;
        if (node instanceof EmptyNode) return ((EmptyNode) node).getOrigin();
        if (node instanceof Arguments) {
            Arguments arguments = (Arguments) node;
            if (arguments.getVararg() == null && arguments.getKwarg() == null) {
                return null;
            }
            return "*" + arguments.getVararg() + ", **" + arguments.getKwarg();
        }
        return null;
    }

    private static String constLabel(Object value) {
        if (value instanceof String) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
