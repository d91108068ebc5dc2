package com.initialone.jmigrate.model;

import com.initialone.jmigrate.util.Tools;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 一个断言 API 的入口：所属类 + 无 message 时的入口调用链 + 带 message 时的入口调用链。
 * <p>
 * 例：Truth 严格入口 plain = [assertThat($subject)]，message = [assertWithMessage($message), that($subject)]。
 * {@code members} 是 owner 类的静态成员名，reconciler 用来判断静态导入是否仍被使用。
 */
public final class ApiEntry {
    public final String owner;
    public final List<Step> plain;
    public final List<Step> message;
    public final Set<String> members;

    public ApiEntry(String owner, List<Step> plain, List<Step> message, Set<String> members) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.plain = List.copyOf(plain);
        this.message = List.copyOf(message);
        this.members = Set.copyOf(members);
        if (plain.stream().noneMatch(s -> s.args.contains(Step.SUBJECT))) {
            throw new IllegalArgumentException("plain entry of " + owner + " never takes $subject");
        }
        if (message.stream().noneMatch(Step::usesMessage)) {
            throw new IllegalArgumentException("message entry of " + owner + " never takes $message");
        }
    }

    public String simpleName() {
        return Tools.simpleName(owner);
    }

    public List<Step> steps(ArityVariant variant) {
        return variant.hasMessage() ? message : plain;
    }
}
