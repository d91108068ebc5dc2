package com.initialone.jmigrate.pipeline;

import com.initialone.jmigrate.Fixtures;
import com.initialone.jmigrate.engine.JavaParserRewriteEngine;
import com.initialone.jmigrate.engine.ProgramImage;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PackageResolverTest {
    private static ProgramImage image;
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private PackageResolver resolver;

    @BeforeAll
    static void load(@TempDir Path dir) throws Exception {
        Fixtures.write(dir, "com/acme/a/X.java", "package com.acme.a;\npublic class X { }\n");
        Fixtures.write(dir, "com/acme/a/sub/S.java", "package com.acme.a.sub;\nclass S { }\n");
        Fixtures.write(dir, "com/acme/b/Y.java", "package com.acme.b;\nimport com.acme.a.X;\nclass Y { }\n");
        Fixtures.write(dir, "org/other/Z.java", "package org.other;\nimport com.acme.b.*;\nclass Z { }\n");
        JavaParserRewriteEngine engine = new JavaParserRewriteEngine(false, new PrintStream(new ByteArrayOutputStream()));
        image = engine.loadProgram(List.of(dir), List.of(), List.of());
    }

    @BeforeEach
    void setup() {
        resolver = new PackageResolver(new PrintStream(errBuf, true));
    }

    @Test
    @DisplayName("Exact dotted and slashed names")
    void exact() {
        assertEquals(Set.of("com.acme.a"), resolver.resolve(List.of("com.acme.a"), image, false));
        assertEquals(Set.of("com.acme.a"), resolver.resolve(List.of("com/acme/a"), image, false));
    }

    @Test
    @DisplayName("* stays within one segment, ** crosses segments")
    void globs() {
        assertEquals(Set.of("com.acme.a", "com.acme.b"), resolver.resolve(List.of("com.acme.*"), image, false));
        assertEquals(Set.of("com.acme.a", "com.acme.a.sub", "com.acme.b"),
                resolver.resolve(List.of("com/acme/**"), image, false));
    }

    @Test
    @DisplayName("Transitive adds direct and indirect dependents")
    void transitive() {
        assertEquals(Set.of("com.acme.a", "com.acme.b", "org.other"),
                resolver.resolve(List.of("com.acme.a"), image, true));
        assertEquals(Set.of("com.acme.a.sub"), resolver.resolve(List.of("com.acme.a.sub"), image, true));
    }

    @Test
    @DisplayName("Pattern without a match warns and selects nothing")
    void no_match() {
        assertTrue(resolver.resolve(List.of("net.nothing"), image, false).isEmpty());
        assertTrue(errBuf.toString().contains("no loaded package matches net.nothing"));
    }

    @Test
    @DisplayName("Dotted patterns become path globs")
    void to_glob() {
        assertEquals("com/acme/**", PackageResolver.toGlob("com.acme.**"));
        assertEquals("com/acme/*", PackageResolver.toGlob("com/acme/*/"));
    }
}
