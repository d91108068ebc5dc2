package com.initialone.jmigrate.pipeline;

import com.initialone.jmigrate.FaultyEngine;
import com.initialone.jmigrate.Fixtures;
import com.initialone.jmigrate.catalog.Families;
import com.initialone.jmigrate.catalog.RuleCatalog;
import com.initialone.jmigrate.engine.JavaParserRewriteEngine;
import com.initialone.jmigrate.engine.RewriteEngine;
import com.initialone.jmigrate.exceptions.PersistException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class MigrationRunnerTest {
    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuf, true);
    private final PrintStream err = new PrintStream(errBuf, true);

    private MigrationReport run(Path root, boolean transitive, boolean dryRun, String... patterns) throws Exception {
        return run(new JavaParserRewriteEngine(false, err), root, transitive, dryRun, patterns);
    }

    private MigrationReport run(RewriteEngine engine, Path root, boolean transitive, boolean dryRun,
                                String... patterns) throws Exception {
        MigrationOptions o = new MigrationOptions();
        o.roots = List.of(root);
        o.patterns = List.of(patterns);
        o.transitive = transitive;
        o.dryRun = dryRun;
        o.templateDir = dir.resolve("scratch");
        return new MigrationRunner(engine, out, err).run(o, RuleCatalog.builtin(), Families.builtin());
    }

    private Path fixture(String name) {
        return Fixtures.copy(name, dir.resolve("src"));
    }

    @Test
    @DisplayName("Equality and the operand-swapping rule, with the import swapped")
    void scenario_basic() throws Exception {
        Path root = fixture("basic");
        Path test = root.resolve("com/acme/a/EqualityTest.java");
        Path plain = root.resolve("com/acme/a/Plain.java");
        String plainBefore = Fixtures.read(plain);

        MigrationReport r = run(root, false, false, "com.acme.a");

        String out = Fixtures.read(test);
        assertTrue(out.contains("assertThat(got).isEqualTo(want);"), out);
        assertTrue(out.contains("assertThat(b).isAssignableFrom(a);"), out);
        assertTrue(out.contains("import static org.assertj.core.api.Assertions.assertThat;"), out);
        assertFalse(out.contains("com.google.common.truth"), out);
        assertEquals(3, r.count("com.acme.a", test));

        assertEquals(plainBefore, Fixtures.read(plain), "zero-match file is byte-identical");
        assertEquals(0, r.count("com.acme.a", plain));
        assertTrue(outBuf.toString().contains("[migrate] package com.acme.a"));
        assertTrue(errBuf.toString().contains("=== " + test + " (3 matches)"));
    }

    @Test
    @DisplayName("Message variants move into as(..)")
    void scenario_message() throws Exception {
        Path root = fixture("message");
        run(root, false, false, "com.acme.b");
        String out = Fixtures.read(root.resolve("com/acme/b/MessageTest.java"));
        assertTrue(out.contains("assertThat(cond).as(\"msg\").isTrue();"), out);
        assertTrue(out.contains("assertThat(cond).as(\"value of %s\", cond).isTrue();"), out);
        assertTrue(out.contains("import static org.assertj.core.api.Assertions.assertThat;"), out);
        assertFalse(out.contains("assertWithMessage"), out);
    }

    @Test
    @DisplayName("Dependent package is only migrated in transitive mode")
    void scenario_transitive() throws Exception {
        Path root = fixture("transitive");
        Path q = root.resolve("com/acme/q/UsesHelperTest.java");
        String qBefore = Fixtures.read(q);

        MigrationReport plain = run(root, false, false, "com.acme.p");
        assertEquals(Fixtures.read(q), qBefore);
        assertFalse(plain.packages.containsKey("com.acme.q"));
        assertTrue(Fixtures.read(root.resolve("com/acme/p/Helper.java")).contains("assertThat(name()).isNotNull();"));

        MigrationReport transitive = run(root, true, false, "com.acme.p");
        String out = Fixtures.read(q);
        assertTrue(out.contains("assertThat(Helper.name()).isEqualTo(\"p\");"), out);
        assertFalse(out.contains("import com.google.common.truth.Truth;"), out);
        assertEquals(2, transitive.count("com.acme.q", q));
        assertEquals(0, transitive.count("com.acme.p", root.resolve("com/acme/p/Helper.java")));
    }

    @Test
    @DisplayName("Two rules in one block: count is rewrites plus one for imports")
    void scenario_two_rules() throws Exception {
        Path root = fixture("tworules");
        Path f = root.resolve("com/acme/d/TwoRulesTest.java");
        MigrationReport r = run(root, false, false, "com.acme.d");
        String out = Fixtures.read(f);
        assertTrue(out.contains("assertThat(items).hasSize(2);"), out);
        assertTrue(out.contains("assertThat(s).startsWith(\"he\");"), out);
        assertTrue(out.contains("import java.util.List;"), out);
        assertEquals(3, r.count("com.acme.d", f));
        assertEquals(3, r.total());
    }

    @Test
    @DisplayName("Partial migration keeps the Truth import")
    void partial() throws Exception {
        Path root = fixture("partial");
        Path f = root.resolve("com/acme/e/PartialTest.java");
        MigrationReport r = run(root, false, false, "com.acme.e");
        String out = Fixtures.read(f);
        assertTrue(out.contains("import static com.google.common.truth.Truth.assertThat;"), out);
        assertTrue(out.contains("Assertions.assertThat(s).isNotNull();"), out);
        assertEquals(2, r.count("com.acme.e", f));
    }

    @Test
    @DisplayName("Soft family and helper import together")
    void soft_and_helper() throws Exception {
        Path root = fixture("soft");
        Path f = root.resolve("com/acme/s/AssumeTest.java");
        MigrationReport r = run(root, false, false, "com.acme.s");
        String out = Fixtures.read(f);
        assertTrue(out.contains("assumeThat(host).isNotNull();"), out);
        assertTrue(out.contains("import static org.assertj.core.api.Assumptions.assumeThat;"), out);
        assertTrue(out.contains("assertThat(1.0d).isCloseTo(1.001, Offset.offset((double) 0.01));"), out);
        assertTrue(out.contains("import org.assertj.core.data.Offset;"), out);
        assertEquals(3, r.count("com.acme.s", f));
    }

    @Test
    @DisplayName("Second run finds nothing to do")
    void idempotent() throws Exception {
        Path root = fixture("tworules");
        run(root, false, false, "com.acme.**");
        String once = Fixtures.read(root.resolve("com/acme/d/TwoRulesTest.java"));
        MigrationReport again = run(root, false, false, "com.acme.**");
        assertEquals(0, again.total());
        assertEquals(once, Fixtures.read(root.resolve("com/acme/d/TwoRulesTest.java")));
    }

    @Test
    @DisplayName("Dry run reports but writes nothing, and templates are cleaned up")
    void dry_run() throws Exception {
        Path root = fixture("basic");
        Path test = root.resolve("com/acme/a/EqualityTest.java");
        String before = Fixtures.read(test);
        MigrationReport r = run(root, false, true, "com.acme.a");
        assertEquals(3, r.total());
        assertTrue(r.dryRun);
        assertEquals(before, Fixtures.read(test));
        try (Stream<Path> left = Files.list(dir.resolve("scratch"))) {
            assertEquals(0, left.count());
        }
    }

    @Test
    @DisplayName("Report is written as JSON")
    void report_json() throws Exception {
        Path root = fixture("tworules");
        MigrationReport r = run(root, false, true, "com.acme.d");
        Path json = dir.resolve("out/report.json");
        r.write(json);
        MigrationReport back = MigrationReport.read(json);
        assertEquals(r.total(), back.total());
        assertEquals(22 * 2 * 6, back.templates);
        assertTrue(Fixtures.read(json).contains("\"com.acme.d\""));
    }

    @Test
    @DisplayName("A failing matcher is reported and counted as zero; other rewrites on the file still happen")
    void matcher_failure_is_not_fatal() throws Exception {
        Path root = fixture("basic");
        Path test = root.resolve("com/acme/a/EqualityTest.java");
        // Template0000 = strict / IsEqualTo / no message
        FaultyEngine engine = FaultyEngine.failingMatcher(new JavaParserRewriteEngine(false, err), "Template0000");

        MigrationReport r = run(engine, root, false, false, "com.acme.a");

        String out = Fixtures.read(test);
        assertTrue(out.contains("assertThat(b).isAssignableFrom(a);"), out);
        assertTrue(out.contains("assertThat(got).isEqualTo(want);"), out);
        assertTrue(out.contains("com.google.common.truth.Truth.assertThat"), out);
        assertEquals(2, r.failures, "one failure per file in the package");
        assertEquals(2, r.count("com.acme.a", test));
        assertTrue(errBuf.toString().contains("[migrate] ERROR: Template0000 failed on " + test), errBuf.toString());
        assertTrue(outBuf.toString().contains("[migrate] DONE."));
    }

    @Test
    @DisplayName("A failed write aborts the run and still removes the templates")
    void persist_failure_aborts() throws Exception {
        Path root = fixture("basic");
        Path test = root.resolve("com/acme/a/EqualityTest.java");
        String before = Fixtures.read(test);
        FaultyEngine engine = FaultyEngine.failingWrites(new JavaParserRewriteEngine(false, err));

        PersistException e = assertThrows(PersistException.class,
                () -> run(engine, root, false, false, "com.acme.a"));

        assertEquals(test, e.getPath());
        assertEquals(1, engine.writes);
        assertEquals(before, Fixtures.read(test));
        assertFalse(outBuf.toString().contains("DONE"));
        try (Stream<Path> left = Files.list(dir.resolve("scratch"))) {
            assertEquals(0, left.count());
        }
    }
}
