package com.pyastng.compiler.builder;

/**
 * 模块构建配置
 */
public class BuilderConfig {
    private String builtinsResource = "/builtins.json";
    private String constructorName = "__init__";
    private boolean expandWildcardImports = true;

    public BuilderConfig() {
    }

    /** 内建模块描述所在的类路径资源 */
    public String getBuiltinsResource() {
        return builtinsResource;
    }

    public void setBuiltinsResource(String builtinsResource) {
        this.builtinsResource = builtinsResource;
    }

    /** 构造方法名；其中的属性赋值在实例属性表中排在最前 */
    public String getConstructorName() {
        return constructorName;
    }

    public void setConstructorName(String constructorName) {
        this.constructorName = constructorName;
    }

    /** 是否在重建时展开 {@code from m import *} */
    public boolean isExpandWildcardImports() {
        return expandWildcardImports;
    }

    public void setExpandWildcardImports(boolean expandWildcardImports) {
        this.expandWildcardImports = expandWildcardImports;
    }
}
