package com.initialone.jmigrate.ast;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.initialone.jmigrate.engine.TargetFile;
import com.initialone.jmigrate.model.ImportRecord;
import com.initialone.jmigrate.model.ImportSet;
import com.initialone.jmigrate.model.ImportStyle;
import com.initialone.jmigrate.model.RewriteFamily;
import com.initialone.jmigrate.util.Tools;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 所有匹配器跑完之后整理一个文件的 import，一次处理所有家族：
 * <ol>
 *   <li>删除已不再使用的源 API import（仍被使用的保留，文件照样能编译）</li>
 *   <li>把引擎插入的全限定 owner 缩短：静态导入风格去掉 scope，类型风格改成简单名；有冲突时保留全限定名</li>
 *   <li>从规范 import 集合重建声明列表</li>
 * </ol>
 */
public class ImportReconciler {
    private final boolean verbose;
    private final PrintStream err;
    /** 源 owner -> 静态成员名 */
    private final Map<String, Set<String>> sourceMembers = new HashMap<>();
    /** 目标/辅助 owner -> 导入风格 */
    private final Map<String, ImportStyle> styles = new HashMap<>();

    public ImportReconciler(List<RewriteFamily> families, boolean verbose, PrintStream err) {
        this.verbose = verbose;
        this.err = err;
        for (RewriteFamily f : families) {
            sourceMembers.computeIfAbsent(f.source.owner, k -> new HashSet<>()).addAll(f.source.members);
            styles.putIfAbsent(f.destination.owner, f.destinationStyle);
            for (String helper : f.helpers.values()) {
                styles.putIfAbsent(helper, ImportStyle.TYPE);
            }
        }
    }

    /** @return 1 表示文件有改动，0 表示没有 */
    public int reconcile(TargetFile file) {
        ImportSet original = file.imports();
        UsageScanner usage = UsageScanner.scan(file.cu());
        ImportSet next = usage.mark(original, sourceMembers)
                .without(r -> !r.used && isSourceImport(r));
        boolean changed = !next.sameImports(original);

        Map<String, List<MethodCallExpr>> inserted = insertedCalls(file);
        for (Map.Entry<String, List<MethodCallExpr>> e : inserted.entrySet()) {
            String owner = e.getKey();
            List<MethodCallExpr> calls = e.getValue();
            ImportSet shortened = styles.get(owner) == ImportStyle.STATIC_MEMBER
                    ? shortenStatic(owner, calls, next, usage)
                    : null;
            if (shortened == null) {
                shortened = shortenType(owner, calls, next, usage, file.packageName());
            }
            if (shortened == null) {
                if (verbose) err.println("[reconcile] " + file.path() + ": keep " + owner + " qualified");
                continue;
            }
            next = shortened;
            changed = true;
        }

        if (!next.sameImports(original)) {
            file.setImports(next);
        }
        return changed ? 1 : 0;
    }

    private boolean isSourceImport(ImportRecord r) {
        if (r.isStatic) {
            return sourceMembers.containsKey(r.staticOwner());
        }
        return !r.onDemand && sourceMembers.containsKey(r.path);
    }

    /** 引擎插入的 owner 引用，按 owner 分组（保持出现顺序）。 */
    private static Map<String, List<MethodCallExpr>> insertedCalls(TargetFile file) {
        Map<String, List<MethodCallExpr>> out = new LinkedHashMap<>();
        for (Expression e : file.cu().findAll(Expression.class, x -> x.containsData(Markers.INSERTED_OWNER))) {
            Node parent = e.getParentNode().orElse(null);
            if (parent instanceof MethodCallExpr
                    && ((MethodCallExpr) parent).getScope().map(s -> s == e).orElse(false)) {
                out.computeIfAbsent(e.getData(Markers.INSERTED_OWNER), k -> new ArrayList<>())
                        .add((MethodCallExpr) parent);
            }
        }
        return out;
    }

    /** 去掉 scope 并加 {@code import static Owner.m}；任一成员名有冲突就返回 null。 */
    private ImportSet shortenStatic(String owner, List<MethodCallExpr> calls, ImportSet imports, UsageScanner usage) {
        Set<String> members = new LinkedHashSet<>();
        for (MethodCallExpr c : calls) {
            members.add(c.getNameAsString());
        }
        ImportRecord ownerOnDemand = new ImportRecord(owner, true, true, true);
        for (String m : members) {
            if (usage.declaresMethod(m)) return null;
            boolean claimedByOwner = imports.contains(ImportRecord.staticMember(owner, m)) || imports.contains(ownerOnDemand);
            for (ImportRecord r : imports.records()) {
                if (!r.isStatic || owner.equals(r.staticOwner())) continue;
                if (r.onDemand || m.equals(r.importedName())) return null;
            }
            // 文件里已有的同名无 scope 调用，如果不是这个 owner 的静态导入带来的，就是别的东西（比如继承来的方法）
            if (usage.unscopedCalls(m) > 0 && !claimedByOwner) return null;
        }
        ImportSet next = imports;
        for (String m : members) {
            if (!next.contains(ownerOnDemand)) {
                next = next.with(ImportRecord.staticMember(owner, m));
            }
        }
        for (MethodCallExpr c : calls) {
            c.removeScope();
        }
        return next;
    }

    /** 改成简单名并加 {@code import Owner}；简单名已被别的东西占用就返回 null。 */
    private ImportSet shortenType(String owner, List<MethodCallExpr> calls, ImportSet imports, UsageScanner usage,
                                  String filePackage) {
        String simple = Tools.simpleName(owner);
        String pkg = Tools.pkgName(owner);
        if (usage.declaresType(simple)) return null;
        boolean covered = pkg.equals(filePackage);
        for (ImportRecord r : imports.records()) {
            if (r.isStatic) continue;
            if (!r.onDemand && simple.equals(r.importedName())) {
                if (!r.path.equals(owner)) return null;
                covered = true;
            } else if (r.onDemand && r.path.equals(pkg)) {
                covered = true;
            }
        }
        // 简单名已经在用、又不是由这个 owner 的 import 带来的，那它指的是别的类型（比如 on-demand 导入的 JUnit Assertions）
        if (usage.usesName(simple) && !covered) return null;
        ImportSet next = covered ? imports : imports.with(ImportRecord.type(owner));
        for (MethodCallExpr c : calls) {
            c.setScope(new NameExpr(simple));
        }
        return next;
    }
}
