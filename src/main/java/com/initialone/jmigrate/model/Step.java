package com.initialone.jmigrate.model;

import java.util.List;
import java.util.Objects;

/**
 * 调用链上的一步：{@code .method(arg0, arg1)}。
 * 参数是表达式片段，可以引用规则参数名、占位符 {@code $subject} / {@code $message}，
 * 或者辅助类调用（如 {@code Offset.offset(b)}）。
 */
public final class Step {
    public static final String SUBJECT = "$subject";
    public static final String MESSAGE = "$message";

    public final String method;
    public final List<String> args;

    public Step(String method, List<String> args) {
        this.method = Objects.requireNonNull(method, "method");
        this.args = List.copyOf(args);
    }

    public static Step of(String method, String... args) {
        return new Step(method, List.of(args));
    }

    public boolean usesMessage() {
        return args.contains(MESSAGE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Step)) return false;
        Step s = (Step) o;
        return method.equals(s.method) && args.equals(s.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, args);
    }

    @Override
    public String toString() {
        return "." + method + "(" + String.join(", ", args) + ")";
    }
}
