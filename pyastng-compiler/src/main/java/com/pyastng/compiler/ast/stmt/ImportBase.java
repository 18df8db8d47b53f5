package com.pyastng.compiler.ast.stmt;

import com.pyastng.compiler.analysis.NotFoundException;
import com.pyastng.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * import / from-import 的公共部分
 */
public abstract class ImportBase extends Statement {
    private final List<ImportAlias> names = new ArrayList<ImportAlias>();

    public List<ImportAlias> getNames() {
        return names;
    }

    /**
     * 由绑定名求被导入的真实名称。
     * {@code import a.b} 绑定 {@code a}；{@code import a.b as c} 绑定 {@code c} 并对应 {@code a.b}。
     */
    public String realName(String boundName) {
        for (ImportAlias alias : names) {
            if (alias.isWildcard()) {
                return boundName;
            }
            String name = alias.getName();
            String asname = alias.getAsname();
            if (asname == null) {
                int dot = name.indexOf('.');
                name = dot < 0 ? name : name.substring(0, dot);
                asname = name;
            }
            if (boundName.equals(asname)) {
                return name;
            }
        }
        throw new NotFoundException(boundName);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
