package com.initialone.jmigrate.catalog;

import com.initialone.jmigrate.model.CallShape;
import com.initialone.jmigrate.model.Param;
import com.initialone.jmigrate.model.Step;
import com.initialone.jmigrate.model.SubstitutionRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 替换规则目录：纯数据，无副作用。
 * <p>
 * 每条规则只写一次（Truth 主语链 -> AssertJ 主语链），入口调用和尾部 message 参数由
 * {@link com.initialone.jmigrate.template.TemplateExpander} 按家族、按参数个数展开。
 * 构造时保证不存在两条 before 形状重叠的规则（同一调用链只允许按不同的装箱主语类型拆分）。
 */
public final class RuleCatalog {
    private static final Set<String> BOXED = Set.of(
            "Boolean", "Byte", "Short", "Character", "Integer", "Long", "Float", "Double");

    private final List<SubstitutionRule> rules;

    public RuleCatalog(List<SubstitutionRule> rules) {
        this.rules = List.copyOf(rules);
        Map<String, List<SubstitutionRule>> byKey = new HashMap<>();
        Map<String, String> byName = new HashMap<>();
        for (SubstitutionRule r : this.rules) {
            List<SubstitutionRule> same = byKey.computeIfAbsent(r.beforeKey(), k -> new ArrayList<>());
            for (SubstitutionRule prev : same) {
                if (!disjointSubjects(prev, r)) {
                    throw new IllegalArgumentException("rules " + prev.name + " and " + r.name
                            + " have overlapping before shapes (" + r.beforeKey() + ")");
                }
            }
            same.add(r);
            if (byName.putIfAbsent(r.name, r.name) != null) {
                throw new IllegalArgumentException("duplicate rule name " + r.name);
            }
        }
    }

    /** 同一条调用链只能按不同的装箱主语类型拆开（装箱类型只接受自己和对应的基本类型）。 */
    private static boolean disjointSubjects(SubstitutionRule x, SubstitutionRule y) {
        String tx = x.subjectType();
        String ty = y.subjectType();
        return tx != null && ty != null && BOXED.contains(tx) && BOXED.contains(ty) && !tx.equals(ty);
    }

    public List<SubstitutionRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    /** Truth -> AssertJ built-in rules. */
    public static RuleCatalog builtin() {
        return new RuleCatalog(List.of(
                same("IsEqualTo", "isEqualTo", "Object"),
                same("IsNotEqualTo", "isNotEqualTo", "Object"),
                unary("IsNull", "isNull", "isNull", "Object"),
                unary("IsNotNull", "isNotNull", "isNotNull", "Object"),
                binary("IsSameInstanceAs", "isSameInstanceAs", "isSameAs", "Object", "Object"),
                binary("IsNotSameInstanceAs", "isNotSameInstanceAs", "isNotSameAs", "Object", "Object"),
                binary("IsInstanceOf", "isInstanceOf", "isInstanceOf", "Object", "Class<?>"),
                unary("IsTrue", "isTrue", "isTrue", "boolean"),
                unary("IsFalse", "isFalse", "isFalse", "boolean"),
                // Truth: a 可赋值给 b；AssertJ: b 可由 a 赋值，主语交换
                new SubstitutionRule("IsAssignableTo",
                        List.of(new Param("Class<?>", "a"), new Param("Class<?>", "b")),
                        CallShape.of("a", Step.of("isAssignableTo", "b")),
                        CallShape.of("b", Step.of("isAssignableFrom", "a"))),
                binary("Contains", "contains", "contains", "String", "CharSequence"),
                binary("StartsWith", "startsWith", "startsWith", "String", "String"),
                binary("EndsWith", "endsWith", "endsWith", "String", "String"),
                binary("Matches", "matches", "matches", "String", "String"),
                binary("ContainsMatch", "containsMatch", "containsPattern", "String", "String"),
                binary("HasSize", "hasSize", "hasSize", "Iterable<?>", "int"),
                unary("IsEmpty", "isEmpty", "isEmpty", "Iterable<?>"),
                unary("IsNotEmpty", "isNotEmpty", "isNotEmpty", "Iterable<?>"),
                // 主语按装箱类型精确匹配，容差强转成主语的基本类型，Offset 的类型参数才能对上 isCloseTo 的重载
                within("IsWithinOfInt", "Integer", "int"),
                within("IsWithinOfLong", "Long", "long"),
                within("IsWithinOfFloat", "Float", "float"),
                within("IsWithinOf", "Double", "double")
        ));
    }

    private static SubstitutionRule within(String name, String boxed, String primitive) {
        return new SubstitutionRule(name,
                List.of(new Param(boxed, "a"), new Param(primitive, "b"), new Param(primitive, "c")),
                CallShape.of("a", Step.of("isWithin", "b"), Step.of("of", "c")),
                CallShape.of("a", Step.of("isCloseTo", "c", "Offset.offset((" + primitive + ") b)")));
    }

    private static SubstitutionRule same(String name, String method, String type) {
        return binary(name, method, method, type, type);
    }

    private static SubstitutionRule unary(String name, String from, String to, String type) {
        return new SubstitutionRule(name,
                List.of(new Param(type, "a")),
                CallShape.of("a", Step.of(from)),
                CallShape.of("a", Step.of(to)));
    }

    private static SubstitutionRule binary(String name, String from, String to, String subjectType, String argType) {
        return new SubstitutionRule(name,
                List.of(new Param(subjectType, "a"), new Param(argType, "b")),
                CallShape.of("a", Step.of(from, "b")),
                CallShape.of("a", Step.of(to, "b")));
    }
}
