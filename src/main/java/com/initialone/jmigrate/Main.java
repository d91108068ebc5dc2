package com.initialone.jmigrate;

import com.initialone.jmigrate.commands.CatalogCmd;
import com.initialone.jmigrate.commands.MigrateCmd;
import com.initialone.jmigrate.commands.TemplatesCmd;
import picocli.CommandLine;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "jmigrate",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Migrate Truth assertions to AssertJ with type-checked rewrite templates. Typical flow:",
                "  catalog (optional, to customise rules) -> migrate",
                "",
                "System properties: jmigrate.template.dir / jmigrate.templates.keep"
        }
)
public class Main implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final PrintStream err;

    public Main(PrintStream err) {
        this.err = err;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(err);
        return 1;
    }

    public static CommandLine newCommandLine(PrintStream out, PrintStream err) {
        CommandLine cl = new CommandLine(new Main(err));
        cl.addSubcommand(new MigrateCmd(out, err));
        cl.addSubcommand(new TemplatesCmd(out, err));
        cl.addSubcommand(new CatalogCmd(out, err));
        cl.setOut(new PrintWriter(out, true));
        cl.setErr(new PrintWriter(err, true));
        return cl;
    }

    public static int execute(String[] args, PrintStream out, PrintStream err) {
        return newCommandLine(out, err).execute(args);
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.out, System.err));
    }
}
