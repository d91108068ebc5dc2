package com.initialone.jmigrate.ast;

import com.initialone.jmigrate.catalog.Families;
import com.initialone.jmigrate.catalog.RuleCatalog;
import com.initialone.jmigrate.engine.JavaParserRewriteEngine;
import com.initialone.jmigrate.engine.Matcher;
import com.initialone.jmigrate.engine.ProgramImage;
import com.initialone.jmigrate.engine.TargetFile;
import com.initialone.jmigrate.engine.UnitHandle;
import com.initialone.jmigrate.template.ExpansionContext;
import com.initialone.jmigrate.template.TemplateExpander;
import com.initialone.jmigrate.template.TemplateWorkspace;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** 测试用：在临时源码树上跑内置目录的全部模板，不经过 MigrationRunner。 */
final class Harness {
    final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    final PrintStream err = new PrintStream(errBuf, true);
    final JavaParserRewriteEngine engine = new JavaParserRewriteEngine(true, err);
    final ProgramImage image;
    final List<Matcher> matchers = new ArrayList<>();
    final ImportReconciler reconciler = new ImportReconciler(Families.builtin(), true, err);

    Harness(Path srcRoot, Path scratch) throws Exception {
        TemplateExpander expander = new TemplateExpander(RuleCatalog.builtin(), Families.builtin());
        try (TemplateWorkspace ws = TemplateWorkspace.open(scratch, false, err)) {
            List<UnitHandle> handles = expander.register(expander.expand(new ExpansionContext()), engine, ws);
            image = engine.loadProgram(List.of(srcRoot), List.of(), handles);
            for (UnitHandle h : handles) {
                matchers.add(engine.makeMatcher(image, h));
            }
        }
    }

    TargetFile file(String pkg, String fileName) {
        return image.files(pkg).stream()
                .filter(f -> f.path().getFileName().toString().equals(fileName))
                .findFirst().orElseThrow();
    }

    int applyAll(TargetFile f) throws Exception {
        int n = 0;
        for (Matcher m : matchers) {
            n += m.apply(f);
        }
        return n;
    }

    String print(TargetFile f) {
        return engine.print(f);
    }

    String errText() {
        return errBuf.toString();
    }
}
