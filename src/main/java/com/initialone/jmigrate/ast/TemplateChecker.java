package com.initialone.jmigrate.ast;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.initialone.jmigrate.engine.UnitHandle;
import com.initialone.jmigrate.model.TemplateUnit;
import com.initialone.jmigrate.util.Tools;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 模板单元的静态检查。返回问题列表，空列表表示通过。
 */
public final class TemplateChecker {
    private TemplateChecker() {
    }

    public static List<String> check(UnitHandle unit) {
        List<String> problems = new ArrayList<>();
        CompilationUnit cu = unit.cu;
        String pkg = cu.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        if (!TemplateUnit.isReservedPackage(pkg)) {
            problems.add(unit.name + ": package is '" + pkg + "', expected " + TemplateUnit.RESERVED_PACKAGE);
        }
        MethodDeclaration before = method(cu, "before");
        MethodDeclaration after = method(cu, "after");
        if (before == null || after == null) {
            problems.add(unit.name + ": needs both before(..) and after(..)");
            return problems;
        }
        if (!sameSignature(before.getParameters(), after.getParameters())) {
            problems.add(unit.name + ": before and after signatures differ");
        }
        Set<String> known = new HashSet<>();
        for (Parameter p : before.getParameters()) {
            known.add(p.getNameAsString());
            try {
                p.getType().resolve();
            } catch (RuntimeException e) {
                problems.add(unit.name + ": parameter " + p + " does not resolve: " + e.getMessage());
            }
        }
        for (ImportDeclaration d : cu.getImports()) {
            if (!d.isStatic() && !d.isAsterisk()) {
                known.add(Tools.simpleName(d.getNameAsString()));
            }
        }
        checkBody(unit.name, before, known, problems);
        checkBody(unit.name, after, known, problems);
        return problems;
    }

    private static void checkBody(String unit, MethodDeclaration md, Set<String> known, List<String> problems) {
        BlockStmt body = md.getBody().orElse(null);
        if (body == null || body.getStatements().size() != 1) {
            problems.add(unit + ": " + md.getNameAsString() + " must hold exactly one statement");
            return;
        }
        Statement st = body.getStatement(0);
        if (!st.isExpressionStmt() || !st.asExpressionStmt().getExpression().isMethodCallExpr()) {
            problems.add(unit + ": " + md.getNameAsString() + " must be a single call expression");
            return;
        }
        for (NameExpr n : st.findAll(NameExpr.class)) {
            if (!known.contains(n.getNameAsString())) {
                problems.add(unit + ": " + md.getNameAsString() + " uses unknown name " + n.getNameAsString());
            }
        }
    }

    private static boolean sameSignature(NodeList<Parameter> a, NodeList<Parameter> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            Parameter x = a.get(i);
            Parameter y = b.get(i);
            if (!x.getNameAsString().equals(y.getNameAsString())
                    || !x.getType().asString().equals(y.getType().asString())) {
                return false;
            }
        }
        return true;
    }

    static MethodDeclaration method(CompilationUnit cu, String name) {
        for (TypeDeclaration<?> t : cu.getTypes()) {
            List<MethodDeclaration> ms = t.getMethodsByName(name);
            if (ms.size() == 1) return ms.get(0);
        }
        return null;
    }
}
