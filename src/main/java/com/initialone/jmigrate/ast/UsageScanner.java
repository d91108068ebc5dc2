package com.initialone.jmigrate.ast;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.initialone.jmigrate.model.ImportRecord;
import com.initialone.jmigrate.model.ImportSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 扫描一个编译单元里实际用到的简单名，用来判断 import 是否仍被使用。
 * 结果偏保守：局部变量名也算"用到"，宁可多留一条 import 也不能让文件编译不过。
 */
public final class UsageScanner {
    /** 类型名、作为表达式出现的名字（含 Owner.m() 的 Owner）、注解名 */
    private final Set<String> names = new HashSet<>();
    /** 无 scope 的方法调用：方法名 -> 次数 */
    private final Map<String, Integer> unscopedCalls = new HashMap<>();
    private final Set<String> declaredTypes = new HashSet<>();
    private final Set<String> declaredMethods = new HashSet<>();

    private UsageScanner() {
    }

    public static UsageScanner scan(CompilationUnit cu) {
        UsageScanner s = new UsageScanner();
        for (ClassOrInterfaceType t : cu.findAll(ClassOrInterfaceType.class)) {
            if (t.getScope().isEmpty()) s.names.add(t.getNameAsString());
        }
        for (NameExpr n : cu.findAll(NameExpr.class)) {
            s.names.add(n.getNameAsString());
        }
        for (AnnotationExpr a : cu.findAll(AnnotationExpr.class)) {
            String q = a.getNameAsString();
            int dot = q.indexOf('.');
            s.names.add(dot < 0 ? q : q.substring(0, dot));
        }
        for (MethodCallExpr c : cu.findAll(MethodCallExpr.class)) {
            if (c.getScope().isEmpty()) s.unscopedCalls.merge(c.getNameAsString(), 1, Integer::sum);
        }
        for (TypeDeclaration<?> t : cu.findAll(TypeDeclaration.class)) {
            s.declaredTypes.add(t.getNameAsString());
        }
        for (MethodDeclaration m : cu.findAll(MethodDeclaration.class)) {
            s.declaredMethods.add(m.getNameAsString());
        }
        return s;
    }

    public boolean usesName(String simple) {
        return names.contains(simple);
    }

    public int unscopedCalls(String method) {
        return unscopedCalls.getOrDefault(method, 0);
    }

    public boolean declaresType(String simple) {
        return declaredTypes.contains(simple);
    }

    public boolean declaresMethod(String name) {
        return declaredMethods.contains(name);
    }

    /**
     * 给每条 import 标上 used。
     *
     * @param knownMembers 已知 owner 的静态成员名（用于判断 static on-demand 导入），未知 owner 一律视为仍在使用
     */
    public ImportSet mark(ImportSet imports, Map<String, Set<String>> knownMembers) {
        List<ImportRecord> out = new ArrayList<>();
        for (ImportRecord r : imports.records()) {
            out.add(r.withUsed(isUsed(r, knownMembers)));
        }
        return new ImportSet(out);
    }

    private boolean isUsed(ImportRecord r, Map<String, Set<String>> knownMembers) {
        if (!r.isStatic) {
            return r.onDemand || names.contains(r.importedName());
        }
        if (!r.onDemand) {
            String m = r.importedName();
            return unscopedCalls.containsKey(m) || names.contains(m);
        }
        Set<String> members = knownMembers.get(r.staticOwner());
        if (members == null) return true;
        for (String m : members) {
            if (unscopedCalls.containsKey(m) || names.contains(m)) return true;
        }
        return false;
    }
}
