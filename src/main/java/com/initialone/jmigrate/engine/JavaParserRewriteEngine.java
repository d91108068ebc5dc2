package com.initialone.jmigrate.engine;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.initialone.jmigrate.ast.TemplateChecker;
import com.initialone.jmigrate.ast.TemplateMatcher;
import com.initialone.jmigrate.exceptions.PersistException;
import com.initialone.jmigrate.exceptions.ProgramLoadException;
import com.initialone.jmigrate.exceptions.TemplateGenerationException;
import com.initialone.jmigrate.model.TemplateUnit;
import com.initialone.jmigrate.util.Tools;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 JavaParser + SymbolSolver 的改写引擎：
 * - 目标源码用带符号求解的解析器读入，并开启 lexical preservation（没改动的文本原样写回）
 * - 模板单元先单独解析（registerUnit），加载程序时再用同一个解析器重新解析并检查
 * - 匹配器见 {@link TemplateMatcher}
 */
public class JavaParserRewriteEngine implements RewriteEngine {
    private final boolean verbose;
    private final PrintStream err;

    public JavaParserRewriteEngine(boolean verbose, PrintStream err) {
        this.verbose = verbose;
        this.err = err;
    }

    @Override
    public String help() {
        return String.join("\n",
                "Rewrite templates are Java classes in package " + TemplateUnit.RESERVED_PACKAGE + ":",
                "  class T { void before(<params>) { <pattern>; } void after(<params>) { <replacement>; } }",
                "  - each parameter is a metavariable; it matches any expression assignable to its type",
                "    (boxing and widening allowed, Object matches anything, unresolvable types never match)",
                "  - a parameter used twice must match equal expressions",
                "  - imported classes in the template match Owner.m(..), a.b.Owner.m(..) and statically",
                "    imported m(..) in the target file",
                "  - only outermost matches are replaced; imports are reconciled afterwards",
                "");
    }

    @Override
    public UnitHandle registerUnit(String name, String sourceText) throws TemplateGenerationException {
        ParseResult<CompilationUnit> res = new JavaParser().parse(sourceText);
        if (!res.isSuccessful() || res.getResult().isEmpty()) {
            throw new TemplateGenerationException("template " + name + " does not parse: " + describe(res.getProblems()));
        }
        return new UnitHandle(name, sourceText, res.getResult().get());
    }

    @Override
    public ProgramImage loadProgram(List<Path> roots, List<Path> classpath, List<UnitHandle> units)
            throws ProgramLoadException {
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                throw new ProgramLoadException("source root is not a directory: " + root, List.of());
            }
        }
        JavaParser parser = newParser(roots, classpath);
        List<String> problems = new ArrayList<>();
        Map<String, List<TargetFile>> packages = new LinkedHashMap<>();

        for (Path root : roots) {
            List<Path> files;
            try {
                files = Tools.listJavaFiles(root);
            } catch (IOException e) {
                throw new ProgramLoadException("cannot list sources under " + root, e);
            }
            for (Path p : files) {
                String text;
                try {
                    text = Files.readString(p, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    problems.add(p + ": " + e.getMessage());
                    continue;
                }
                ParseResult<CompilationUnit> res = parser.parse(text);
                if (!res.isSuccessful() || res.getResult().isEmpty()) {
                    problems.add(p + ": " + describe(res.getProblems()));
                    continue;
                }
                CompilationUnit cu = res.getResult().get();
                LexicalPreservingPrinter.setup(cu);
                String pkg = cu.getPackageDeclaration().map(d -> d.getNameAsString()).orElse("");
                packages.computeIfAbsent(pkg, k -> new ArrayList<>()).add(new TargetFile(p, pkg, cu, text));
            }
        }

        List<UnitHandle> loaded = new ArrayList<>(units.size());
        for (UnitHandle u : units) {
            ParseResult<CompilationUnit> res = parser.parse(u.source);
            if (!res.isSuccessful() || res.getResult().isEmpty()) {
                problems.add(u.name + ": " + describe(res.getProblems()));
                continue;
            }
            UnitHandle h = new UnitHandle(u.name, u.source, res.getResult().get());
            problems.addAll(TemplateChecker.check(h));
            loaded.add(h);
        }

        if (!problems.isEmpty()) {
            throw new ProgramLoadException("program does not load (" + problems.size() + " problems)", problems);
        }
        if (verbose) {
            err.println("[engine] loaded " + packages.size() + " packages, " + loaded.size() + " templates");
        }
        return new ProgramImage(packages, loaded);
    }

    @Override
    public Matcher makeMatcher(ProgramImage image, UnitHandle unit) throws ProgramLoadException {
        for (UnitHandle h : image.units()) {
            if (h.name.equals(unit.name)) {
                try {
                    return TemplateMatcher.compile(h, verbose, err);
                } catch (RuntimeException e) {
                    throw new ProgramLoadException("cannot build matcher for " + unit.name, e);
                }
            }
        }
        throw new ProgramLoadException("template " + unit.name + " is not part of the loaded program", List.of());
    }

    @Override
    public void writeFile(Path originalPath, TargetFile file) throws PersistException {
        try {
            Files.writeString(originalPath, print(file), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new PersistException(originalPath, e);
        }
    }

    /** 优先 lexical preservation；失败时退回普通打印（格式会变，但语义不变）。 */
    public String print(TargetFile file) {
        try {
            return LexicalPreservingPrinter.print(file.cu());
        } catch (RuntimeException e) {
            err.println("[engine] WARN: lexical print failed for " + file.path() + ", pretty printing: " + e.getMessage());
            return file.cu().toString();
        }
    }

    private JavaParser newParser(List<Path> roots, List<Path> classpath) {
        CombinedTypeSolver ts = new CombinedTypeSolver();
        // 反射求解（JRE 以及本进程 classpath 上的类型）
        ts.add(new ReflectionTypeSolver(false));
        for (Path root : roots) {
            ts.add(new JavaParserTypeSolver(root.toFile()));
        }
        // 额外 classpath：目录 / jar
        if (classpath != null) {
            for (Path cp : classpath) {
                try {
                    if (cp != null && Files.exists(cp)) {
                        if (Files.isDirectory(cp)) {
                            ts.add(new JavaParserTypeSolver(cp.toFile()));
                        } else if (cp.toString().endsWith(".jar")) {
                            ts.add(new JarTypeSolver(cp.toString()));
                        }
                    }
                } catch (IOException | RuntimeException e) {
                    err.println("[engine] skip classpath entry: " + cp + " -> " + e.getMessage());
                }
            }
        }
        ParserConfiguration cfg = new ParserConfiguration()
                .setSymbolResolver(new JavaSymbolSolver(ts))
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return new JavaParser(cfg);
    }

    private static String describe(List<Problem> problems) {
        List<String> out = new ArrayList<>();
        for (Problem p : problems) {
            out.add(p.getVerboseMessage());
        }
        return out.isEmpty() ? "unknown parse failure" : String.join("; ", out);
    }
}
