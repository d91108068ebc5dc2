package com.initialone.jmigrate.pipeline;

import com.initialone.jmigrate.ast.ImportReconciler;
import com.initialone.jmigrate.catalog.RuleCatalog;
import com.initialone.jmigrate.engine.Matcher;
import com.initialone.jmigrate.engine.ProgramImage;
import com.initialone.jmigrate.engine.RewriteEngine;
import com.initialone.jmigrate.engine.TargetFile;
import com.initialone.jmigrate.engine.UnitHandle;
import com.initialone.jmigrate.exceptions.MatchApplicationException;
import com.initialone.jmigrate.exceptions.MigrationException;
import com.initialone.jmigrate.model.RewriteFamily;
import com.initialone.jmigrate.model.TemplateUnit;
import com.initialone.jmigrate.template.ExpansionContext;
import com.initialone.jmigrate.template.TemplateExpander;
import com.initialone.jmigrate.template.TemplateWorkspace;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 一次迁移：展开模板 -> 注册 -> 加载程序 -> 建匹配器 -> 逐包逐文件改写并整理 import -> 写回。
 * <p>
 * 包按名字排序，文件按路径排序，输出顺序确定。模板工作区在成功和失败时都会关闭。
 */
public class MigrationRunner {
    private final RewriteEngine engine;
    private final PrintStream out;
    private final PrintStream err;

    public MigrationRunner(RewriteEngine engine, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.out = out;
        this.err = err;
    }

    public MigrationReport run(MigrationOptions o, RuleCatalog catalog, List<RewriteFamily> families)
            throws MigrationException, IOException {
        try (TemplateWorkspace ws = TemplateWorkspace.open(o.templateDir, o.keepTemplates, err)) {
            TemplateExpander expander = new TemplateExpander(catalog, families);
            List<TemplateUnit> units = expander.expand(new ExpansionContext());
            List<UnitHandle> handles = expander.register(units, engine, ws);
            if (o.verbose) {
                err.println("[migrate] " + handles.size() + " templates in " + ws.root());
            }

            ProgramImage image = engine.loadProgram(o.roots, o.classpath, handles);
            List<Matcher> matchers = new ArrayList<>(handles.size());
            for (UnitHandle h : handles) {
                matchers.add(engine.makeMatcher(image, h));
            }
            ImportReconciler reconciler = new ImportReconciler(families, o.verbose, err);

            Set<String> packages = new PackageResolver(err).resolve(o.patterns, image, o.transitive);
            MigrationReport report = new MigrationReport(o.dryRun, handles.size());
            for (String pkg : packages) {
                if (TemplateUnit.isReservedPackage(pkg)) continue;
                out.println("[migrate] package " + pkg);
                report.visit(pkg);
                List<TargetFile> files = new ArrayList<>(image.files(pkg));
                files.sort(Comparator.comparing(TargetFile::path));
                for (TargetFile f : files) {
                    int n = migrateFile(f, matchers, reconciler, report);
                    if (n == 0) continue;
                    err.println("=== " + f.path() + " (" + n + " matches)");
                    report.record(pkg, f.path(), n);
                    if (!o.dryRun) {
                        engine.writeFile(f.path(), f);
                    }
                }
            }
            out.println("[migrate] DONE. files=" + report.changedFiles() + ", changes=" + report.total()
                    + (o.dryRun ? " (dry-run)" : ""));
            return report;
        }
    }

    private int migrateFile(TargetFile f, List<Matcher> matchers, ImportReconciler reconciler, MigrationReport report) {
        int n = 0;
        for (Matcher m : matchers) {
            try {
                n += m.apply(f);
            } catch (MatchApplicationException e) {
                // 单个匹配器失败只影响它自己，这个文件的其它改写照常进行
                err.println("[migrate] ERROR: " + e.getMessage());
                report.failures++;
            }
        }
        return n + reconciler.reconcile(f);
    }
}
