package com.initialone.jmigrate.ast;

import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.resolution.types.ResolvedType;
import com.initialone.jmigrate.engine.Matcher;
import com.initialone.jmigrate.engine.TargetFile;
import com.initialone.jmigrate.engine.UnitHandle;
import com.initialone.jmigrate.exceptions.MatchApplicationException;
import com.initialone.jmigrate.util.Tools;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个模板单元编译出的匹配器：before 表达式是模式，参数是元变量，after 表达式是替换。
 * <p>
 * 匹配分两步：先做结构合一（调用名、实参个数、owner），再对每个绑定做类型检查。
 * 只替换最外层的匹配；插入的 owner 引用写成全限定名并打上 {@link Markers#INSERTED_OWNER}，
 * 交给 {@link ImportReconciler} 缩短。
 */
public class TemplateMatcher implements Matcher {
    private final String name;
    private final MethodCallExpr before;
    private final MethodCallExpr after;
    /** 参数名 -> 解析后的参数类型（声明顺序） */
    private final Map<String, ResolvedType> params;
    /** 模板 import 的类：简单名 -> FQN */
    private final Map<String, String> owners;
    private final boolean verbose;
    private final PrintStream err;

    TemplateMatcher(String name, MethodCallExpr before, MethodCallExpr after,
                    Map<String, ResolvedType> params, Map<String, String> owners,
                    boolean verbose, PrintStream err) {
        this.name = name;
        this.before = before;
        this.after = after;
        this.params = params;
        this.owners = owners;
        this.verbose = verbose;
        this.err = err;
    }

    /** 从已通过 {@link TemplateChecker} 检查的单元构建匹配器。 */
    public static TemplateMatcher compile(UnitHandle unit, boolean verbose, PrintStream err) {
        MethodDeclaration b = TemplateChecker.method(unit.cu, "before");
        MethodDeclaration a = TemplateChecker.method(unit.cu, "after");
        Map<String, ResolvedType> params = new LinkedHashMap<>();
        for (Parameter p : b.getParameters()) {
            params.put(p.getNameAsString(), p.getType().resolve());
        }
        Map<String, String> owners = new HashMap<>();
        for (ImportDeclaration d : unit.cu.getImports()) {
            if (!d.isStatic() && !d.isAsterisk()) {
                owners.put(Tools.simpleName(d.getNameAsString()), d.getNameAsString());
            }
        }
        return new TemplateMatcher(unit.name, body(b), body(a), params, owners, verbose, err);
    }

    private static MethodCallExpr body(MethodDeclaration md) {
        ExpressionStmt st = md.getBody().orElseThrow().getStatement(0).asExpressionStmt();
        return st.getExpression().asMethodCallExpr();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int apply(TargetFile file) throws MatchApplicationException {
        try {
            CallScope scope = new CallScope(file.cu());
            List<MethodCallExpr> matched = new ArrayList<>();
            List<Map<String, Expression>> bindings = new ArrayList<>();
            // findAll 是先序遍历，外层调用先于内层出现
            for (MethodCallExpr call : file.cu().findAll(MethodCallExpr.class)) {
                if (!call.getNameAsString().equals(before.getNameAsString())) continue;
                if (insideAny(call, matched)) continue;
                Map<String, Expression> b = new HashMap<>();
                if (unify(before, call, b, scope) && typesAccept(call, b)) {
                    matched.add(call);
                    bindings.add(b);
                }
            }
            for (int i = 0; i < matched.size(); i++) {
                MethodCallExpr call = matched.get(i);
                if (!call.replace(instantiate(bindings.get(i)))) {
                    throw new IllegalStateException("cannot replace " + call);
                }
            }
            return matched.size();
        } catch (RuntimeException e) {
            throw new MatchApplicationException(name + " failed on " + file.path() + ": " + e, e);
        }
    }

    private static boolean insideAny(Node n, List<MethodCallExpr> outer) {
        for (Node p = n.getParentNode().orElse(null); p != null; p = p.getParentNode().orElse(null)) {
            for (MethodCallExpr m : outer) {
                if (m == p) return true;
            }
        }
        return false;
    }

    private boolean unify(Expression t, Expression e, Map<String, Expression> b, CallScope scope) {
        if (t instanceof NameExpr && params.containsKey(((NameExpr) t).getNameAsString())) {
            String p = ((NameExpr) t).getNameAsString();
            Expression bound = b.get(p);
            if (bound != null) return bound.equals(e);
            b.put(p, e);
            return true;
        }
        if (t instanceof MethodCallExpr) {
            if (!(e instanceof MethodCallExpr)) return false;
            MethodCallExpr tm = (MethodCallExpr) t;
            MethodCallExpr em = (MethodCallExpr) e;
            if (!tm.getNameAsString().equals(em.getNameAsString())) return false;
            if (tm.getArguments().size() != em.getArguments().size()) return false;
            if (tm.getTypeArguments().isPresent()) return false;
            Expression ts = tm.getScope().orElse(null);
            if (ts instanceof NameExpr && owners.containsKey(((NameExpr) ts).getNameAsString())) {
                if (!scope.isStaticCallOn(em, owners.get(((NameExpr) ts).getNameAsString()))) return false;
            } else if (ts != null) {
                if (em.getScope().isEmpty() || !unify(ts, em.getScope().get(), b, scope)) return false;
            } else if (em.getScope().isPresent()) {
                return false;
            }
            for (int i = 0; i < tm.getArguments().size(); i++) {
                if (!unify(tm.getArgument(i), em.getArgument(i), b, scope)) return false;
            }
            return true;
        }
        if (t instanceof FieldAccessExpr && owners.containsKey(((FieldAccessExpr) t).getScope().toString())) {
            if (!(e instanceof FieldAccessExpr)) return false;
            FieldAccessExpr tf = (FieldAccessExpr) t;
            FieldAccessExpr ef = (FieldAccessExpr) e;
            return tf.getNameAsString().equals(ef.getNameAsString())
                    && scope.refersToType(ef.getScope(), owners.get(tf.getScope().toString()));
        }
        return t.equals(e);
    }

    private boolean typesAccept(MethodCallExpr call, Map<String, Expression> b) {
        for (Map.Entry<String, Expression> e : b.entrySet()) {
            ResolvedType want = params.get(e.getKey());
            if (TypeChecks.isObject(want)) continue;
            ResolvedType got;
            try {
                got = e.getValue().calculateResolvedType();
            } catch (RuntimeException ex) {
                diag(call, e.getKey() + " = " + e.getValue() + " has no resolvable type (" + ex.getClass().getSimpleName() + ")");
                return false;
            }
            if (!TypeChecks.assignable(want, got)) {
                diag(call, e.getKey() + " = " + e.getValue() + " is " + got.describe() + ", wants " + want.describe());
                return false;
            }
        }
        return true;
    }

    private void diag(MethodCallExpr call, String why) {
        if (!verbose) return;
        String at = call.getBegin().map(p -> "line " + p.line).orElse("?");
        err.println("[engine] " + name + " skip " + at + ": " + why);
    }

    /** 复制 after 表达式：owner 换成带标记的 FQN，参数换成绑定的表达式副本。 */
    Expression instantiate(Map<String, Expression> b) {
        MethodCallExpr copy = after.clone();
        List<NameExpr> names = copy.findAll(NameExpr.class);
        for (NameExpr n : names) {
            String id = n.getNameAsString();
            if (params.containsKey(id)) {
                Expression bound = b.get(id).clone();
                if (isOperand(n) && needsParens(bound)) {
                    bound = new EnclosedExpr(bound);
                }
                n.replace(bound);
            } else if (owners.containsKey(id)) {
                Expression fq = qualified(owners.get(id));
                fq.setData(Markers.INSERTED_OWNER, owners.get(id));
                n.replace(fq);
            }
        }
        return copy;
    }

    static Expression qualified(String fqn) {
        String[] parts = fqn.split("\\.");
        Expression e = new NameExpr(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            e = new FieldAccessExpr(e, parts[i]);
        }
        return e;
    }

    /** 作为调用/字段的 scope 或强转的操作数出现时，复合表达式要加括号。 */
    private static boolean isOperand(NameExpr n) {
        Node p = n.getParentNode().orElse(null);
        if (p instanceof CastExpr) {
            return true;
        }
        if (p instanceof MethodCallExpr) {
            return ((MethodCallExpr) p).getScope().map(s -> s == n).orElse(false);
        }
        if (p instanceof FieldAccessExpr) {
            return ((FieldAccessExpr) p).getScope() == n;
        }
        return false;
    }

    private static boolean needsParens(Expression e) {
        return e instanceof BinaryExpr || e instanceof ConditionalExpr || e instanceof CastExpr
                || e instanceof LambdaExpr || e instanceof AssignExpr || e instanceof UnaryExpr
                || e instanceof InstanceOfExpr;
    }
}
