package com.initialone.jmigrate.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 尾部可选 message 参数的个数（0..5）。
 * 第一个是格式串 {@code String m0}，其余是 {@code Object m1..}。
 */
public enum ArityVariant {
    NONE(0), ONE(1), TWO(2), THREE(3), FOUR(4), FIVE(5);

    public final int count;

    ArityVariant(int count) {
        this.count = count;
    }

    public boolean hasMessage() {
        return count > 0;
    }

    public List<Param> declarations() {
        List<Param> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(new Param(i == 0 ? "String" : "Object", "m" + i));
        }
        return out;
    }

    public List<String> references() {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < count; i++) out.add("m" + i);
        return out;
    }
}
