package com.initialone.jmigrate.model;

import java.util.Objects;

/** 模板签名里的一个带类型的参数槽，例如 {@code Class<?> a}。 */
public final class Param {
    public final String type;
    public final String name;

    public Param(String type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String render() {
        return type + " " + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Param)) return false;
        Param p = (Param) o;
        return type.equals(p.type) && name.equals(p.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name);
    }

    @Override
    public String toString() {
        return render();
    }
}
