package com.initialone.jmigrate.commands;

import com.initialone.jmigrate.engine.JavaParserRewriteEngine;
import com.initialone.jmigrate.exceptions.TemplateGenerationException;
import com.initialone.jmigrate.model.TemplateUnit;
import com.initialone.jmigrate.template.ExpansionContext;
import com.initialone.jmigrate.template.TemplateExpander;
import com.initialone.jmigrate.template.TemplateWorkspace;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 只展开模板并写到 --out 下，便于查看引擎实际拿到的模板。
 */
@CommandLine.Command(
        name = "templates",
        mixinStandardHelpOptions = true,
        description = "Expand the catalog into template units and write them for inspection"
)
public class TemplatesCmd implements Callable<Integer> {
    @CommandLine.Mixin
    CatalogOptions catalog;

    @CommandLine.Option(names = "--out", required = true, paramLabel = "DIR", description = "Output dir")
    Path outDir;

    private final PrintStream out;
    private final PrintStream err;

    public TemplatesCmd(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        try (TemplateWorkspace ws = TemplateWorkspace.open(outDir, true, err)) {
            TemplateExpander expander = new TemplateExpander(catalog.rules(), catalog.families());
            List<TemplateUnit> units = expander.expand(new ExpansionContext());
            // 注册一遍，保证写出来的每个单元都能被引擎解析
            expander.register(units, new JavaParserRewriteEngine(false, err), ws);
            out.println("[templates] wrote " + units.size() + " units to "
                    + ws.root().resolve(TemplateUnit.RESERVED_PACKAGE));
            return 0;
        } catch (TemplateGenerationException | IOException | IllegalArgumentException e) {
            err.println("[templates] failed: " + e.getMessage());
            return 2;
        }
    }
}
