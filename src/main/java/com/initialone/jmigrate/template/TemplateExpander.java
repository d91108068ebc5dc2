package com.initialone.jmigrate.template;

import com.initialone.jmigrate.catalog.RuleCatalog;
import com.initialone.jmigrate.engine.RewriteEngine;
import com.initialone.jmigrate.engine.UnitHandle;
import com.initialone.jmigrate.exceptions.TemplateGenerationException;
import com.initialone.jmigrate.model.ApiEntry;
import com.initialone.jmigrate.model.ArityVariant;
import com.initialone.jmigrate.model.CallShape;
import com.initialone.jmigrate.model.Param;
import com.initialone.jmigrate.model.RewriteFamily;
import com.initialone.jmigrate.model.Step;
import com.initialone.jmigrate.model.SubstitutionRule;
import com.initialone.jmigrate.model.TemplateUnit;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 把 N 条规则展开成 N × |家族| × |参数个数变体| 个模板单元。
 * <p>
 * 展开本身是纯函数（{@link #expand}），只产生结构化的单元；
 * 渲染成文本、落盘和注册到引擎在 {@link #register} 里完成，任何一步失败都终止整个运行。
 */
public class TemplateExpander {
    private final RuleCatalog catalog;
    private final List<RewriteFamily> families;
    private final List<ArityVariant> variants;

    public TemplateExpander(RuleCatalog catalog, List<RewriteFamily> families) {
        this(catalog, families, List.of(ArityVariant.values()));
    }

    public TemplateExpander(RuleCatalog catalog, List<RewriteFamily> families, List<ArityVariant> variants) {
        this.catalog = catalog;
        this.families = List.copyOf(families);
        this.variants = List.copyOf(variants);
    }

    public int expectedCount() {
        return catalog.size() * families.size() * variants.size();
    }

    /** 顺序：家族 -> 规则 -> 变体；ordinal 即单元在列表里的位置。 */
    public List<TemplateUnit> expand(ExpansionContext ctx) {
        List<TemplateUnit> out = new ArrayList<>(expectedCount());
        for (RewriteFamily family : families) {
            for (SubstitutionRule rule : catalog.rules()) {
                for (ArityVariant variant : variants) {
                    out.add(expandOne(ctx.nextName(), out.size(), rule, family, variant));
                }
            }
        }
        return out;
    }

    TemplateUnit expandOne(String name, int ordinal, SubstitutionRule rule, RewriteFamily family, ArityVariant variant) {
        List<Param> sig = new ArrayList<>(rule.params);
        sig.addAll(variant.declarations());

        String before = renderCall(family.source, variant, rule.before);
        String after = renderCall(family.destination, variant, rule.after);

        List<String> imports = new ArrayList<>();
        imports.add(family.source.owner);
        if (!imports.contains(family.destination.owner)) {
            imports.add(family.destination.owner);
        }
        // 只有 after 形状真正引用了辅助类时才加它的 import
        for (Map.Entry<String, String> h : family.helpers.entrySet()) {
            if (references(rule.after, h.getKey()) && !imports.contains(h.getValue())) {
                imports.add(h.getValue());
            }
        }
        return new TemplateUnit(name, ordinal, rule, family, variant, sig, before, after, imports);
    }

    /**
     * 逐个写入工作区并注册到引擎；返回的句柄顺序与单元 ordinal 一致。
     */
    public List<UnitHandle> register(List<TemplateUnit> units, RewriteEngine engine, TemplateWorkspace workspace)
            throws TemplateGenerationException {
        List<UnitHandle> handles = new ArrayList<>(units.size());
        for (TemplateUnit unit : units) {
            String text;
            try {
                text = workspace.write(unit);
            } catch (IOException e) {
                throw new TemplateGenerationException("cannot write template " + unit.name + ": " + e.getMessage(), e);
            }
            handles.add(engine.registerUnit(unit.name, text));
        }
        return handles;
    }

    /** 入口类简单名 + 入口调用链 + 规则调用链。 */
    static String renderCall(ApiEntry entry, ArityVariant variant, CallShape shape) {
        StringBuilder sb = new StringBuilder(entry.simpleName());
        for (Step s : entry.steps(variant)) {
            appendStep(sb, s, shape.subject, variant);
        }
        for (Step s : shape.steps) {
            appendStep(sb, s, shape.subject, variant);
        }
        return sb.toString();
    }

    private static void appendStep(StringBuilder sb, Step step, String subject, ArityVariant variant) {
        List<String> args = new ArrayList<>();
        for (String a : step.args) {
            if (Step.SUBJECT.equals(a)) {
                args.add(subject);
            } else if (Step.MESSAGE.equals(a)) {
                args.addAll(variant.references());
            } else {
                args.add(a);
            }
        }
        sb.append('.').append(step.method).append('(').append(String.join(", ", args)).append(')');
    }

    private static boolean references(CallShape shape, String simpleName) {
        Pattern p = Pattern.compile("(?<![\\w$.])" + Pattern.quote(simpleName) + "\\s*\\.");
        for (Step s : shape.steps) {
            for (String a : s.args) {
                if (p.matcher(a).find()) return true;
            }
        }
        return false;
    }
}
