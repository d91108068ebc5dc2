package com.initialone.jmigrate.commands;

import com.initialone.jmigrate.catalog.CatalogFile;
import com.initialone.jmigrate.catalog.Families;
import com.initialone.jmigrate.catalog.RuleCatalog;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "catalog",
        mixinStandardHelpOptions = true,
        description = "Print (or write) the built-in rule catalog as JSON; edit it and pass it back with --catalog"
)
public class CatalogCmd implements Callable<Integer> {
    @CommandLine.Option(names = "--out", paramLabel = "FILE", description = "Write to FILE instead of stdout")
    Path outFile;

    private final PrintStream out;
    private final PrintStream err;

    public CatalogCmd(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        CatalogFile f = CatalogFile.of(RuleCatalog.builtin(), Families.builtin());
        try {
            if (outFile == null) {
                out.println(f.toJson());
            } else {
                f.write(outFile);
                out.println("[catalog] wrote " + f.rules.size() + " rules to " + outFile.toAbsolutePath());
            }
            return 0;
        } catch (IOException e) {
            err.println("[catalog] failed: " + e.getMessage());
            return 2;
        }
    }
}
