package com.initialone.jmigrate.template;

/**
 * 单次运行的模板命名状态。每次运行新建一个，编号不会在运行之间泄漏。
 */
public final class ExpansionContext {
    private final String prefix;
    private int seq;

    public ExpansionContext() {
        this("Template");
    }

    public ExpansionContext(String prefix) {
        this.prefix = prefix;
    }

    public String nextName() {
        return String.format("%s%04d", prefix, seq++);
    }

    public int issued() {
        return seq;
    }
}
