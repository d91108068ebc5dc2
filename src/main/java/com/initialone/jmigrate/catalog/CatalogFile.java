package com.initialone.jmigrate.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jmigrate.model.ApiEntry;
import com.initialone.jmigrate.model.CallShape;
import com.initialone.jmigrate.model.ImportStyle;
import com.initialone.jmigrate.model.Param;
import com.initialone.jmigrate.model.RewriteFamily;
import com.initialone.jmigrate.model.Step;
import com.initialone.jmigrate.model.SubstitutionRule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 规则目录 + 家族定义的 JSON 形式（rules.json）。
 * 字段保持 public，直接交给 Jackson 绑定；转换成不可变的模型对象时再做校验。
 */
public class CatalogFile {
    private static final ObjectMapper OM = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public List<FamilyDef> families = new ArrayList<>();
    public List<RuleDef> rules = new ArrayList<>();

    public static class FamilyDef {
        public String name;
        public EntryDef source;
        public EntryDef destination;
        /** 辅助类简单名 -> FQN */
        public Map<String, String> helpers = new LinkedHashMap<>();
        /** STATIC_MEMBER | TYPE */
        public String style = ImportStyle.STATIC_MEMBER.name();
    }

    public static class EntryDef {
        public String owner;
        public List<StepDef> plain = new ArrayList<>();
        public List<StepDef> message = new ArrayList<>();
        public List<String> members = new ArrayList<>();
    }

    public static class StepDef {
        public String method;
        public List<String> args = new ArrayList<>();
    }

    public static class RuleDef {
        public String name;
        public List<ParamDef> params = new ArrayList<>();
        public ShapeDef before;
        public ShapeDef after;
    }

    public static class ParamDef {
        public String type;
        public String name;
    }

    public static class ShapeDef {
        public String subject;
        public List<StepDef> steps = new ArrayList<>();
    }

    /* ======================= IO ======================= */

    public static CatalogFile read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("catalog not found: " + path.toAbsolutePath());
        }
        return OM.readValue(path.toFile(), CatalogFile.class);
    }

    public void write(Path path) throws IOException {
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        OM.writeValue(path.toFile(), this);
    }

    public String toJson() throws IOException {
        return OM.writeValueAsString(this);
    }

    /* ======================= 模型 <-> JSON ======================= */

    public static CatalogFile of(RuleCatalog catalog, List<RewriteFamily> fams) {
        CatalogFile f = new CatalogFile();
        for (RewriteFamily fam : fams) {
            FamilyDef d = new FamilyDef();
            d.name = fam.name;
            d.source = entryDef(fam.source);
            d.destination = entryDef(fam.destination);
            d.helpers.putAll(fam.helpers);
            d.style = fam.destinationStyle.name();
            f.families.add(d);
        }
        for (SubstitutionRule r : catalog.rules()) {
            RuleDef d = new RuleDef();
            d.name = r.name;
            for (Param p : r.params) {
                ParamDef pd = new ParamDef();
                pd.type = p.type;
                pd.name = p.name;
                d.params.add(pd);
            }
            d.before = shapeDef(r.before);
            d.after = shapeDef(r.after);
            f.rules.add(d);
        }
        return f;
    }

    public RuleCatalog toCatalog() {
        require(rules != null, "catalog has null rules");
        List<SubstitutionRule> out = new ArrayList<>();
        for (RuleDef d : rules) {
            require(d != null, "null rule");
            require(d.name != null, "rule without name");
            require(d.params != null, "rule " + d.name + " has null params");
            require(d.before != null && d.after != null, "rule " + d.name + " needs before and after");
            List<Param> params = new ArrayList<>();
            for (ParamDef p : d.params) {
                require(p != null && p.type != null && p.name != null, "rule " + d.name + " has a param without type or name");
                params.add(new Param(p.type, p.name));
            }
            out.add(new SubstitutionRule(d.name, params, shape(d.before), shape(d.after)));
        }
        return new RuleCatalog(out);
    }

    public List<RewriteFamily> toFamilies() {
        require(families != null, "catalog has null families");
        List<RewriteFamily> out = new ArrayList<>();
        for (FamilyDef d : families) {
            require(d != null, "null family");
            require(d.name != null, "family without name");
            require(d.source != null && d.destination != null, "family " + d.name + " needs source and destination");
            require(d.helpers != null, "family " + d.name + " has null helpers");
            ImportStyle style = ImportStyle.valueOf(d.style == null ? "STATIC_MEMBER" : d.style.trim().toUpperCase());
            out.add(new RewriteFamily(d.name, entry(d.source), entry(d.destination), d.helpers, style));
        }
        require(!out.isEmpty(), "catalog declares no families");
        return out;
    }

    private static EntryDef entryDef(ApiEntry e) {
        EntryDef d = new EntryDef();
        d.owner = e.owner;
        d.plain = stepDefs(e.plain);
        d.message = stepDefs(e.message);
        d.members = e.members.stream().sorted().collect(Collectors.toList());
        return d;
    }

    private static ShapeDef shapeDef(CallShape s) {
        ShapeDef d = new ShapeDef();
        d.subject = s.subject;
        d.steps = stepDefs(s.steps);
        return d;
    }

    private static List<StepDef> stepDefs(List<Step> steps) {
        List<StepDef> out = new ArrayList<>();
        for (Step s : steps) {
            StepDef d = new StepDef();
            d.method = s.method;
            d.args = new ArrayList<>(s.args);
            out.add(d);
        }
        return out;
    }

    private static ApiEntry entry(EntryDef d) {
        require(d.owner != null, "api entry without owner");
        require(d.plain != null && d.message != null, "api entry " + d.owner + " has null plain or message steps");
        require(d.members != null && !d.members.contains(null), "api entry " + d.owner + " has null members");
        return new ApiEntry(d.owner, steps(d.plain), steps(d.message), new LinkedHashSet<>(d.members));
    }

    private static CallShape shape(ShapeDef d) {
        require(d.subject != null, "shape without subject");
        require(d.steps != null, "shape (" + d.subject + ") has null steps");
        return new CallShape(d.subject, steps(d.steps));
    }

    private static List<Step> steps(List<StepDef> defs) {
        List<Step> out = new ArrayList<>();
        for (StepDef s : defs) {
            require(s != null && s.method != null, "step without method");
            require(s.args != null && !s.args.contains(null), "step " + s.method + " has null args");
            out.add(new Step(s.method, s.args));
        }
        return out;
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
