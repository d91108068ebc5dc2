package com.initialone.jmigrate.engine;

import com.initialone.jmigrate.model.ImportRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 整个程序的加载结果：按包分组的目标文件 + 重新解析过的模板单元 + 包之间的 import 依赖。
 */
public final class ProgramImage {
    private final Map<String, List<TargetFile>> packages;
    private final List<UnitHandle> units;
    /** 包 -> 直接依赖它的包（通过 import） */
    private final Map<String, Set<String>> dependents;

    public ProgramImage(Map<String, List<TargetFile>> packages, List<UnitHandle> units) {
        Map<String, List<TargetFile>> sorted = new TreeMap<>();
        packages.forEach((k, v) -> sorted.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
        this.packages = Collections.unmodifiableMap(sorted);
        this.units = List.copyOf(units);
        this.dependents = buildDependents(this.packages);
    }

    public Set<String> packageNames() {
        return packages.keySet();
    }

    public List<TargetFile> files(String pkg) {
        return packages.getOrDefault(pkg, List.of());
    }

    public List<UnitHandle> units() {
        return units;
    }

    public Set<String> directDependents(String pkg) {
        return dependents.getOrDefault(pkg, Set.of());
    }

    /** seeds 加上所有直接或间接依赖 seeds 的包。 */
    public Set<String> withDependents(Set<String> seeds) {
        Set<String> out = new TreeSet<>(seeds);
        Deque<String> todo = new ArrayDeque<>(seeds);
        while (!todo.isEmpty()) {
            for (String d : directDependents(todo.pop())) {
                if (out.add(d)) todo.push(d);
            }
        }
        return out;
    }

    private static Map<String, Set<String>> buildDependents(Map<String, List<TargetFile>> packages) {
        Map<String, Set<String>> out = new TreeMap<>();
        for (Map.Entry<String, List<TargetFile>> e : packages.entrySet()) {
            String from = e.getKey();
            for (TargetFile f : e.getValue()) {
                for (ImportRecord r : f.imports().records()) {
                    String to = importedPackage(r, packages.keySet());
                    if (to != null && !to.equals(from)) {
                        out.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
                    }
                }
            }
        }
        return out;
    }

    /** import 指向的已加载包；取最长的匹配前缀，以便处理嵌套类型和静态成员。 */
    static String importedPackage(ImportRecord r, Set<String> known) {
        String best = null;
        if (!r.isStatic && r.onDemand && known.contains(r.path)) {
            return r.path;
        }
        for (String pkg : known) {
            if (pkg.isEmpty()) continue;
            if (r.path.startsWith(pkg + ".") && (best == null || pkg.length() > best.length())) {
                best = pkg;
            }
        }
        return best;
    }
}
