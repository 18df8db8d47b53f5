package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.ast.AstVisitor;

/**
 * {@code from modname import name [as asname], ...}
 *
 * <p>{@code level} 为相对导入的层级，0 表示绝对导入（或隐式相对导入）。</p>
 */
public class FromImportStmt extends ImportBase {
    private String modname;
    private int level;

    public String getModname() {
        return modname;
    }

    public void setModname(String modname) {
        this.modname = modname;
    }

    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = level;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFromImportStmt(this, context);
    }
}
