package com.initialone.jmigrate.commands;

import com.initialone.jmigrate.engine.JavaParserRewriteEngine;
import com.initialone.jmigrate.engine.RewriteEngine;
import com.initialone.jmigrate.exceptions.MigrationException;
import com.initialone.jmigrate.exceptions.ProgramLoadException;
import com.initialone.jmigrate.pipeline.MigrationOptions;
import com.initialone.jmigrate.pipeline.MigrationReport;
import com.initialone.jmigrate.pipeline.MigrationRunner;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * 把选中包里的 Truth 断言改写成 AssertJ（原地写回）。
 *
 * 用法：
 *   java -jar jmigrate.jar migrate --root src/test/java com.acme.foo
 *   java -jar jmigrate.jar migrate --root src/test/java --transitive --dry-run --report out/report.json 'com.acme.**'
 */
@CommandLine.Command(
        name = "migrate",
        description = "Rewrite Truth assertions in the given packages to AssertJ, in place"
)
public class MigrateCmd implements Callable<Integer> {
    @CommandLine.Mixin
    EngineOptions engine;

    @CommandLine.Mixin
    CatalogOptions catalog;

    @CommandLine.Option(names = "--help", description = "Show how templates are matched, then this usage")
    boolean help;

    @CommandLine.Option(names = "--transitive",
            description = "Also migrate loaded packages that depend on the selected ones")
    boolean transitive;

    @CommandLine.Option(names = "--dry-run", description = "Report changes without writing files")
    boolean dryRun;

    @CommandLine.Option(names = "--report", paramLabel = "FILE", description = "Write a JSON report")
    Path report;

    @CommandLine.Option(names = "--template-dir", paramLabel = "DIR",
            description = "Parent dir for the generated templates (default: -Djmigrate.template.dir or java.io.tmpdir)")
    Path templateDir;

    @CommandLine.Option(names = "--keep-templates", description = "Do not delete the generated templates")
    boolean keepTemplates;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "<package>",
            description = "Package names or globs: com.acme.foo, com.acme.*, com/acme/**")
    List<String> packages = new ArrayList<>();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final PrintStream out;
    private final PrintStream err;
    /** verbose -> 引擎 */
    private final Function<Boolean, RewriteEngine> engines;

    public MigrateCmd(PrintStream out, PrintStream err) {
        this(out, err, verbose -> new JavaParserRewriteEngine(verbose, err));
    }

    MigrateCmd(PrintStream out, PrintStream err, Function<Boolean, RewriteEngine> engines) {
        this.out = out;
        this.err = err;
        this.engines = engines;
    }

    @Override
    public Integer call() {
        RewriteEngine eng = engines.apply(engine.verbose);
        if (help) {
            err.println(eng.help());
            spec.commandLine().usage(err);
            return 2;
        }
        if (packages.isEmpty()) {
            spec.commandLine().usage(err);
            return 1;
        }

        MigrationOptions o = new MigrationOptions();
        o.roots = engine.rootsOrDefault();
        o.classpath = engine.classpath;
        o.patterns = packages;
        o.transitive = transitive;
        o.dryRun = dryRun;
        o.verbose = engine.verbose;
        o.templateDir = templateDir;
        o.keepTemplates = keepTemplates;

        try {
            MigrationReport r = new MigrationRunner(eng, out, err).run(o, catalog.rules(), catalog.families());
            if (report != null) {
                r.write(report);
                out.println("[migrate] report: " + report.toAbsolutePath());
            }
            return 0;
        } catch (ProgramLoadException e) {
            err.println("[migrate] failed: " + e.getMessage());
            for (String p : e.getProblems()) {
                err.println("  " + p);
            }
            return 2;
        } catch (MigrationException | IOException | IllegalArgumentException e) {
            err.println("[migrate] failed: " + e.getMessage());
            return 2;
        }
    }
}
