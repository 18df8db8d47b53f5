package com.pyastng.compiler.ast.stmt;

/**
 * import 语句中的一项：{@code name [as asname]}
 */
public final class ImportAlias {
    private final String name;
    private final String asname;

    public ImportAlias(String name, String asname) {
        this.name = name;
        this.asname = asname;
    }

    public String getName() {
        return name;
    }

    /** 别名，未指定时为 null */
    public String getAsname() {
        return asname;
    }

    public boolean isWildcard() {
        return "*".equals(name);
    }

    @Override
    public String toString() {
        return asname == null ? name : name + " as " + asname;
    }
}
