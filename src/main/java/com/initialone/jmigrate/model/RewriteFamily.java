package com.initialone.jmigrate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一个改写家族（Strict / Soft）：源 API 入口、目标 API 入口、辅助类导入，以及目标 API 的导入风格。
 * 同一条规则对每个家族都展开一次，新增家族只需要新增一个值对象。
 */
public final class RewriteFamily {
    public final String name;
    public final ApiEntry source;
    public final ApiEntry destination;
    /** 辅助类简单名 -> 全限定名，例如 Offset -> org.assertj.core.data.Offset */
    public final Map<String, String> helpers;
    public final ImportStyle destinationStyle;

    public RewriteFamily(String name, ApiEntry source, ApiEntry destination,
                         Map<String, String> helpers, ImportStyle destinationStyle) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.helpers = Collections.unmodifiableMap(new LinkedHashMap<>(helpers));
        this.destinationStyle = Objects.requireNonNull(destinationStyle, "destinationStyle");
    }

    @Override
    public String toString() {
        return name + "(" + source.owner + " -> " + destination.owner + ")";
    }
}
