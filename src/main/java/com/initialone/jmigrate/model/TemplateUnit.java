package com.initialone.jmigrate.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一个合成的模板单元：同签名的 before()/after() 方法 + 两者需要的 import。
 * 只在一次运行内存在，不会写进目标源码树。
 */
public final class TemplateUnit {
    /** 模板单元专用包名。'$' 开头保证不会与真实的目标包重名。 */
    public static final String RESERVED_PACKAGE = "$jmigrate$templates";

    public final String name;
    public final int ordinal;
    public final SubstitutionRule rule;
    public final RewriteFamily family;
    public final ArityVariant variant;
    public final List<Param> signature;
    public final String before;
    public final String after;
    public final List<String> imports;

    public TemplateUnit(String name, int ordinal, SubstitutionRule rule, RewriteFamily family,
                        ArityVariant variant, List<Param> signature,
                        String before, String after, List<String> imports) {
        this.name = name;
        this.ordinal = ordinal;
        this.rule = rule;
        this.family = family;
        this.variant = variant;
        this.signature = List.copyOf(signature);
        this.before = before;
        this.after = after;
        this.imports = List.copyOf(imports);
    }

    public static boolean isReservedPackage(String pkg) {
        return RESERVED_PACKAGE.equals(pkg);
    }

    public String renderedSignature() {
        return signature.stream().map(Param::render).collect(Collectors.joining(", "));
    }

    /** 渲染成可解析的 Java 编译单元文本。 */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("package ").append(RESERVED_PACKAGE).append(";\n\n");
        for (String imp : imports) {
            sb.append("import ").append(imp).append(";\n");
        }
        sb.append("\n");
        sb.append("// ").append(family.name).append(" ").append(rule.name)
                .append(" (").append(variant.count).append(" message args)\n");
        sb.append("class ").append(name).append(" {\n");
        sb.append("    void before(").append(renderedSignature()).append(") { ").append(before).append("; }\n");
        sb.append("    void after(").append(renderedSignature()).append(") { ").append(after).append("; }\n");
        sb.append("}\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return name + "[" + family.name + " " + rule.name + " x" + variant.count + "]";
    }
}
