package com.initialone.jmigrate.engine;

import com.github.javaparser.ast.CompilationUnit;

/** 已注册到引擎的模板单元：名字、源码文本与解析结果。 */
public final class UnitHandle {
    public final String name;
    public final String source;
    public final CompilationUnit cu;

    public UnitHandle(String name, String source, CompilationUnit cu) {
        this.name = name;
        this.source = source;
        this.cu = cu;
    }

    @Override
    public String toString() {
        return name;
    }
}
