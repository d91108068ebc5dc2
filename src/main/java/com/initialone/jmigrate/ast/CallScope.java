package com.initialone.jmigrate.ast;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.initialone.jmigrate.util.Tools;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 目标文件里"一个调用的 owner 是谁"的判断，只依赖 import 与包名，不依赖目标 API 是否在 classpath 上。
 */
final class CallScope {
    private final CompilationUnit cu;
    private final String packageName;
    /** 单类型导入：简单名 -> FQN */
    private final Map<String, String> typeImports = new HashMap<>();
    private final Set<String> onDemandPackages = new HashSet<>();
    /** 静态成员导入：成员名 -> owner FQN 集合 */
    private final Map<String, Set<String>> staticMembers = new HashMap<>();
    private final Set<String> staticOnDemand = new HashSet<>();
    private final Set<String> declaredMethods = new HashSet<>();
    /** 从父类/接口继承来的方法名，第一次需要时才求解 */
    private Set<String> inheritedMethods;

    CallScope(CompilationUnit cu) {
        this.cu = cu;
        this.packageName = cu.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        for (ImportDeclaration d : cu.getImports()) {
            String path = d.getNameAsString();
            if (d.isStatic()) {
                if (d.isAsterisk()) {
                    staticOnDemand.add(path);
                } else {
                    staticMembers.computeIfAbsent(Tools.simpleName(path), k -> new HashSet<>())
                            .add(Tools.pkgName(path));
                }
            } else if (d.isAsterisk()) {
                onDemandPackages.add(path);
            } else {
                typeImports.put(Tools.simpleName(path), path);
            }
        }
        for (MethodDeclaration md : cu.findAll(MethodDeclaration.class)) {
            declaredMethods.add(md.getNameAsString());
        }
    }

    /** call 是否是对 owner 的静态调用：Owner.m()、a.b.Owner.m()，或由静态导入覆盖的 m()。 */
    boolean isStaticCallOn(MethodCallExpr call, String owner) {
        if (call.getScope().isEmpty()) {
            String m = call.getNameAsString();
            // 文件自己声明的或继承来的同名方法优先于静态导入
            if (declaredMethods.contains(m) || inheritedMethods().contains(m)) return false;
            return staticMembers.getOrDefault(m, Set.of()).contains(owner) || staticOnDemand.contains(owner);
        }
        return refersToType(call.getScope().get(), owner);
    }

    private Set<String> inheritedMethods() {
        if (inheritedMethods == null) {
            inheritedMethods = new HashSet<>();
            Set<String> seen = new HashSet<>();
            for (TypeDeclaration<?> td : cu.findAll(TypeDeclaration.class)) {
                try {
                    collectInherited(td.resolve(), inheritedMethods, seen);
                } catch (RuntimeException ignore) {
                    // 类型本身解析不到，只能靠文件内声明判断
                }
            }
        }
        return inheritedMethods;
    }

    private static void collectInherited(ResolvedReferenceTypeDeclaration type, Set<String> out, Set<String> seen) {
        List<ResolvedReferenceType> ancestors;
        try {
            ancestors = type.getAncestors(true);
        } catch (RuntimeException e) {
            return;
        }
        for (ResolvedReferenceType anc : ancestors) {
            ResolvedReferenceTypeDeclaration d = anc.getTypeDeclaration().orElse(null);
            if (d == null || !seen.add(d.getQualifiedName())) continue;
            try {
                for (ResolvedMethodDeclaration m : d.getDeclaredMethods()) {
                    out.add(m.getName());
                }
            } catch (RuntimeException ignore) {
                // 解析不到的祖先跳过，继续看其它祖先
            }
            collectInherited(d, out, seen);
        }
    }

    boolean refersToType(Expression scope, String owner) {
        if (scope instanceof FieldAccessExpr) {
            return scope.toString().equals(owner);
        }
        if (!(scope instanceof NameExpr)) return false;
        String simple = ((NameExpr) scope).getNameAsString();
        if (!simple.equals(Tools.simpleName(owner))) return false;
        String imported = typeImports.get(simple);
        if (imported != null) return imported.equals(owner);
        String pkg = Tools.pkgName(owner);
        return onDemandPackages.contains(pkg) || packageName.equals(pkg);
    }
}
