package com.initialone.jmigrate.model;

import java.util.Objects;

/**
 * 一条 import：路径、是否 static、是否 on-demand（.*），以及改写后是否仍被使用。
 * 相等性只看 (path, static, onDemand)，used 是派生属性。
 */
public final class ImportRecord {
    public final String path;
    public final boolean isStatic;
    public final boolean onDemand;
    public final boolean used;

    public ImportRecord(String path, boolean isStatic, boolean onDemand, boolean used) {
        this.path = Objects.requireNonNull(path, "path");
        this.isStatic = isStatic;
        this.onDemand = onDemand;
        this.used = used;
    }

    public static ImportRecord type(String fqn) {
        return new ImportRecord(fqn, false, false, true);
    }

    public static ImportRecord staticMember(String owner, String member) {
        return new ImportRecord(owner + "." + member, true, false, true);
    }

    public ImportRecord withUsed(boolean u) {
        return u == used ? this : new ImportRecord(path, isStatic, onDemand, u);
    }

    /** 静态成员导入的 owner 类（{@code a.b.C.m} -> {@code a.b.C}），静态 on-demand 时就是 path。 */
    public String staticOwner() {
        if (!isStatic) return null;
        if (onDemand) return path;
        int i = path.lastIndexOf('.');
        return i < 0 ? path : path.substring(0, i);
    }

    /** 单类型导入 / 静态成员导入所引入的简单名；on-demand 返回 null。 */
    public String importedName() {
        if (onDemand) return null;
        int i = path.lastIndexOf('.');
        return i < 0 ? path : path.substring(i + 1);
    }

    public String render() {
        return "import " + (isStatic ? "static " : "") + path + (onDemand ? ".*" : "") + ";";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportRecord)) return false;
        ImportRecord r = (ImportRecord) o;
        return isStatic == r.isStatic && onDemand == r.onDemand && path.equals(r.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, isStatic, onDemand);
    }

    @Override
    public String toString() {
        return render() + (used ? "" : " // unused");
    }
}
