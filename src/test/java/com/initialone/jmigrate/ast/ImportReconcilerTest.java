package com.initialone.jmigrate.ast;

import com.initialone.jmigrate.Fixtures;
import com.initialone.jmigrate.engine.TargetFile;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ImportReconcilerTest {
    @TempDir
    Path dir;

    private Harness harness(String source) throws Exception {
        Fixtures.write(dir.resolve("src"), "t/A.java", source);
        return new Harness(dir.resolve("src"), dir.resolve("scratch"));
    }

    @Test
    @DisplayName("Fully migrated file swaps the Truth import for a static AssertJ import")
    void full_migration() throws Exception {
        Harness h = harness(String.join("\n",
                "package t;",
                "",
                "import static com.google.common.truth.Truth.assertThat;",
                "",
                "class A {",
                "    void f() {",
                "        String s = \"x\";",
                "        assertThat(s).isNotNull();",
                "    }",
                "}",
                ""));
        TargetFile f = h.file("t", "A.java");
        assertEquals(1, h.applyAll(f));
        assertEquals(1, h.reconciler.reconcile(f));
        String out = h.print(f);
        assertFalse(out.contains("com.google.common.truth"), out);
        assertTrue(out.contains("import static org.assertj.core.api.Assertions.assertThat;"), out);
        assertTrue(out.contains("        assertThat(s).isNotNull();"), out);
        assertTrue(f.importsConsistent());
    }

    @Test
    @DisplayName("Truth import that is still used is kept and AssertJ falls back to the class import")
    void partial_migration() throws Exception {
        Harness h = harness(String.join("\n",
                "package t;",
                "import static com.google.common.truth.Truth.assertThat;",
                "class A { void f() { String s = \"\"; assertThat(s).isEmpty(); assertThat(s).isNotNull(); } }"));
        TargetFile f = h.file("t", "A.java");
        assertEquals(1, h.applyAll(f));
        assertEquals(1, h.reconciler.reconcile(f));
        String out = h.print(f);
        assertTrue(out.contains("import static com.google.common.truth.Truth.assertThat;"), out);
        assertTrue(out.contains("import org.assertj.core.api.Assertions;"), out);
        assertTrue(out.contains("Assertions.assertThat(s).isNotNull()"), out);
        assertTrue(out.contains("assertThat(s).isEmpty()"), out);
        assertTrue(f.importsConsistent());
    }

    @Test
    @DisplayName("JUnit's Assertions already owns the simple name: the AssertJ call stays qualified")
    void name_clash() throws Exception {
        Harness h = harness(String.join("\n",
                "package t;",
                "import static com.google.common.truth.Truth.assertThat;",
                "import static org.junit.jupiter.api.Assertions.*;",
                "import org.junit.jupiter.api.Assertions;",
                "class A { void f() {",
                "  String s = \"x\";",
                "  assertThat(s).isNotNull();",
                "  assertEquals(1, 1);",
                "  Assertions.assertTrue(true);",
                "} }"));
        TargetFile f = h.file("t", "A.java");
        assertEquals(1, h.applyAll(f));
        assertEquals(1, h.reconciler.reconcile(f));
        String out = h.print(f);
        assertTrue(out.contains("org.assertj.core.api.Assertions.assertThat(s).isNotNull()"), out);
        assertFalse(out.contains("import org.assertj"), out);
        assertFalse(out.contains("import static org.assertj"), out);
        assertFalse(out.contains("com.google.common.truth"), out);
    }

    @Test
    @DisplayName("Helper classes are imported by type")
    void helper_type_import() throws Exception {
        Harness h = harness(String.join("\n",
                "package t;",
                "import static com.google.common.truth.Truth.*;",
                "class A { void f() { assertThat(1.0d).isWithin(0.01).of(1.001); } }"));
        TargetFile f = h.file("t", "A.java");
        assertEquals(1, h.applyAll(f));
        assertEquals(1, h.reconciler.reconcile(f));
        String out = h.print(f);
        assertTrue(out.contains("import org.assertj.core.data.Offset;"), out);
        assertTrue(out.contains("assertThat(1.0d).isCloseTo(1.001, Offset.offset((double) 0.01))"), out);
        assertFalse(out.contains("Truth.*"), out);
    }

    @Test
    @DisplayName("Unused Truth import alone counts as one change; a clean file counts as none")
    void unused_import_only() throws Exception {
        Fixtures.write(dir.resolve("src"), "t/B.java", "package t;\nclass B { }\n");
        Harness h = harness(String.join("\n",
                "package t;",
                "import com.google.common.truth.Truth;",
                "class A { }"));
        TargetFile a = h.file("t", "A.java");
        assertEquals(0, h.applyAll(a));
        assertEquals(1, h.reconciler.reconcile(a));
        assertFalse(h.print(a).contains("import"));

        TargetFile b = h.file("t", "B.java");
        assertEquals(0, h.reconciler.reconcile(b));
        assertEquals(b.originalText(), h.print(b));
    }

    @Test
    @DisplayName("A type named like the destination class blocks the class import")
    void local_type_clash() throws Exception {
        Harness h = harness(String.join("\n",
                "package t;",
                "import static com.google.common.truth.Truth.assertThat;",
                "class A {",
                "  static class Assertions { }",
                "  void f() { String s = \"\"; assertThat(s).isEmpty(); assertThat(s).isNotNull(); }",
                "}"));
        TargetFile f = h.file("t", "A.java");
        assertEquals(1, h.applyAll(f));
        h.reconciler.reconcile(f);
        assertTrue(h.print(f).contains("org.assertj.core.api.Assertions.assertThat(s).isNotNull()"));
    }
}
