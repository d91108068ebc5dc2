package com.initialone.jmigrate.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 一个文件的规范 import 集合（有序、不可变）。
 * reconciler 只修改这一份值，再由它重建 CompilationUnit 的 import 列表。
 */
public final class ImportSet {
    private final List<ImportRecord> records;

    public ImportSet(List<ImportRecord> records) {
        List<ImportRecord> dedup = new ArrayList<>();
        for (ImportRecord r : records) {
            if (!dedup.contains(r)) dedup.add(r);
        }
        this.records = Collections.unmodifiableList(dedup);
    }

    public static ImportSet empty() {
        return new ImportSet(List.of());
    }

    public List<ImportRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean contains(ImportRecord r) {
        return records.contains(r);
    }

    public ImportSet without(Predicate<ImportRecord> drop) {
        List<ImportRecord> out = new ArrayList<>();
        for (ImportRecord r : records) {
            if (!drop.test(r)) out.add(r);
        }
        return out.size() == records.size() ? this : new ImportSet(out);
    }

    /** 追加到末尾，已存在则不动（保持原有顺序）。 */
    public ImportSet with(ImportRecord r) {
        if (records.contains(r)) return this;
        List<ImportRecord> out = new ArrayList<>(records);
        out.add(r);
        return new ImportSet(out);
    }

    /** 只比较内容与顺序，不比较 used 标记。 */
    public boolean sameImports(ImportSet other) {
        return records.equals(other.records);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ImportSet && sameImports((ImportSet) o);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return records.toString();
    }
}
