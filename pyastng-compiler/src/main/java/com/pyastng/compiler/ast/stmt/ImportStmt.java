package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstVisitor;

/**
 * {@code import a.b [as c], ...}
 */
public class ImportStmt extends ImportBase {

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportStmt(this, context);
    }
}
