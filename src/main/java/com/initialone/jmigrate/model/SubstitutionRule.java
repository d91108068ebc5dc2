package com.initialone.jmigrate.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 一条语义迁移规则：签名（不含尾部 message 参数）+ before 形状 + after 形状。
 * 构造时校验：before/after 引用的绑定变量集合与签名一致（允许顺序交换）。
 */
public final class SubstitutionRule {
    public final String name;
    public final List<Param> params;
    public final CallShape before;
    public final CallShape after;

    public SubstitutionRule(String name, List<Param> params, CallShape before, CallShape after) {
        this.name = Objects.requireNonNull(name, "name");
        this.params = List.copyOf(params);
        this.before = Objects.requireNonNull(before, "before");
        this.after = Objects.requireNonNull(after, "after");

        Set<String> names = paramNames();
        if (names.size() != this.params.size()) {
            throw new IllegalArgumentException("rule " + name + ": duplicate parameter names " + this.params);
        }
        for (String reserved : List.of(Step.SUBJECT, Step.MESSAGE)) {
            if (names.contains(reserved)) {
                throw new IllegalArgumentException("rule " + name + ": parameter name " + reserved + " is reserved");
            }
        }
        for (Param p : this.params) {
            if (p.name.matches("m[0-9]+")) {
                throw new IllegalArgumentException("rule " + name + ": parameter " + p.name + " clashes with message arguments");
            }
        }
        Set<String> beforeRefs = before.references(names);
        Set<String> afterRefs = after.references(names);
        if (!beforeRefs.equals(names)) {
            throw new IllegalArgumentException("rule " + name + ": before shape must bind every parameter, binds " + beforeRefs);
        }
        if (!afterRefs.equals(names)) {
            throw new IllegalArgumentException("rule " + name + ": after shape must use the same variables, uses " + afterRefs);
        }
    }

    public Set<String> paramNames() {
        return params.stream().map(p -> p.name).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** before 侧主语参数的声明类型。 */
    public String subjectType() {
        for (Param p : params) {
            if (p.name.equals(before.subject)) return p.type;
        }
        return null;
    }

    public String beforeKey() {
        return before.chainKey();
    }

    /** after 侧主语不是 before 侧主语，即操作数被交换。 */
    public boolean reordersOperands() {
        return !before.subject.equals(after.subject);
    }

    @Override
    public String toString() {
        return name + params + ": " + before + " -> " + after;
    }
}
