package com.initialone.jmigrate.ast;

import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;

import java.util.Map;
import java.util.Set;

/**
 * 模板参数类型与实参类型的兼容性判断（赋值兼容：装箱/拆箱、基本类型拓宽、按擦除比较祖先类型）。
 */
final class TypeChecks {
    private static final Map<String, String> BOX = Map.of(
            "boolean", "java.lang.Boolean",
            "byte", "java.lang.Byte",
            "short", "java.lang.Short",
            "char", "java.lang.Character",
            "int", "java.lang.Integer",
            "long", "java.lang.Long",
            "float", "java.lang.Float",
            "double", "java.lang.Double");

    private static final Map<String, Set<String>> WIDENING = Map.of(
            "byte", Set.of("short", "int", "long", "float", "double"),
            "short", Set.of("int", "long", "float", "double"),
            "char", Set.of("int", "long", "float", "double"),
            "int", Set.of("long", "float", "double"),
            "long", Set.of("float", "double"),
            "float", Set.of("double"),
            "double", Set.of(),
            "boolean", Set.of());

    private TypeChecks() {
    }

    static boolean isObject(ResolvedType t) {
        return t.isReferenceType() && "java.lang.Object".equals(t.asReferenceType().getQualifiedName());
    }

    static boolean assignable(ResolvedType param, ResolvedType arg) {
        if (arg.isNull()) {
            return !param.isPrimitive();
        }
        if (param.isPrimitive()) {
            String p = param.describe();
            String a = arg.isPrimitive() ? arg.describe() : unbox(arg);
            return a != null && (p.equals(a) || WIDENING.getOrDefault(a, Set.of()).contains(p));
        }
        if (!param.isReferenceType()) {
            return safeIsAssignableBy(param, arg);
        }
        String pq = param.asReferenceType().getQualifiedName();
        if ("java.lang.Object".equals(pq)) {
            return true;
        }
        if (arg.isPrimitive()) {
            String boxed = BOX.get(arg.describe());
            if (boxed == null) return false;
            if (pq.equals(boxed)) return true;
            return ("java.lang.Number".equals(pq) && !"java.lang.Boolean".equals(boxed) && !"java.lang.Character".equals(boxed))
                    || "java.io.Serializable".equals(pq) || "java.lang.Comparable".equals(pq);
        }
        if (arg.isArray()) {
            return "java.lang.Cloneable".equals(pq) || "java.io.Serializable".equals(pq);
        }
        if (arg.isReferenceType()) {
            ResolvedReferenceType ar = arg.asReferenceType();
            if (pq.equals(ar.getQualifiedName())) return true;
            try {
                for (ResolvedReferenceType anc : ar.getAllAncestors()) {
                    if (pq.equals(anc.getQualifiedName())) return true;
                }
                return false;
            } catch (RuntimeException e) {
                // 祖先链里有解析不到的类型，退回 JavaParser 自己的判断
                return safeIsAssignableBy(param, arg);
            }
        }
        return safeIsAssignableBy(param, arg);
    }

    private static String unbox(ResolvedType arg) {
        if (!arg.isReferenceType()) return null;
        String q = arg.asReferenceType().getQualifiedName();
        for (Map.Entry<String, String> e : BOX.entrySet()) {
            if (e.getValue().equals(q)) return e.getKey();
        }
        return null;
    }

    private static boolean safeIsAssignableBy(ResolvedType param, ResolvedType arg) {
        try {
            return param.isAssignableBy(arg);
        } catch (RuntimeException e) {
            return false;
        }
    }
}
