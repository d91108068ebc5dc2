package com.initialone.jmigrate.exceptions;

import java.util.List;

/**
 * 模板单元 + 目标源码的整体加载/检查失败（解析错误、模板类型不合法）。
 * 没有合法的程序镜像就无法安全地构造 matcher，所以是致命错误。
 * 消息只是摘要，逐条问题在 {@link #getProblems()} 里。
 */
public class ProgramLoadException extends MigrationException {
    private final List<String> problems;

    public ProgramLoadException(String message, List<String> problems) {
        super(message);
        this.problems = List.copyOf(problems);
    }

    public ProgramLoadException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of();
    }

    public List<String> getProblems() {
        return problems;
    }
}
