package com.initialone.jmigrate.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 一侧调用的结构化形状：入口调用的主语参数 + 入口之后的调用链。
 * 例如 before 侧 {@code isAssignableTo}：subject = a, steps = [isAssignableTo(b)]；
 * 入口（{@code Truth.assertThat(a)} 或 {@code Truth.assertWithMessage(..).that(a)}）由家族提供。
 */
public final class CallShape {
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    public final String subject;
    public final List<Step> steps;

    public CallShape(String subject, List<Step> steps) {
        this.subject = Objects.requireNonNull(subject, "subject");
        this.steps = List.copyOf(steps);
    }

    public static CallShape of(String subject, Step... steps) {
        return new CallShape(subject, List.of(steps));
    }

    /** 形状里出现的、属于给定参数集合的标识符。 */
    public Set<String> references(Set<String> paramNames) {
        Set<String> out = new LinkedHashSet<>();
        if (paramNames.contains(subject)) out.add(subject);
        for (Step s : steps) {
            for (String arg : s.args) {
                Matcher m = IDENT.matcher(arg);
                while (m.find()) {
                    if (paramNames.contains(m.group())) out.add(m.group());
                }
            }
        }
        return out;
    }

    /** 方法名/参数个数组成的链键，用于检测目录中重叠的 before 形状。 */
    public String chainKey() {
        return steps.stream()
                .map(s -> s.method + "/" + s.args.size())
                .collect(Collectors.joining("."));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallShape)) return false;
        CallShape c = (CallShape) o;
        return subject.equals(c.subject) && steps.equals(c.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, steps);
    }

    @Override
    public String toString() {
        return "(" + subject + ")" + steps.stream().map(Step::toString).collect(Collectors.joining());
    }
}
