package com.initialone.jmigrate.model;

/** 改写后目标 API 的引用方式（Java 里对应 import 的“别名”约定）。 */
public enum ImportStyle {
    /** {@code import static org.assertj.core.api.Assertions.assertThat;} + {@code assertThat(x)} */
    STATIC_MEMBER,
    /** {@code import org.assertj.core.api.Assertions;} + {@code Assertions.assertThat(x)} */
    TYPE
}
