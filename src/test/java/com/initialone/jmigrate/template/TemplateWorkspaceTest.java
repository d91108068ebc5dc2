package com.initialone.jmigrate.template;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateWorkspaceTest {

    @Test
    @DisplayName("Workspace is removed even when the run fails")
    void removed_on_failure(@TempDir Path dir) {
        PrintStream err = new PrintStream(new ByteArrayOutputStream(), true);
        Path[] root = new Path[1];
        assertThrows(IllegalStateException.class, () -> {
            try (TemplateWorkspace ws = TemplateWorkspace.open(dir, false, err)) {
                root[0] = ws.root();
                throw new IllegalStateException("boom");
            }
        });
        assertFalse(Files.exists(root[0]));
    }

    @Test
    @DisplayName("keep=true leaves the templates in place and says where")
    void keep(@TempDir Path dir) throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        Path root;
        try (TemplateWorkspace ws = TemplateWorkspace.open(dir, true, new PrintStream(buf, true))) {
            root = ws.root();
        }
        assertTrue(Files.isDirectory(root));
        assertTrue(root.getFileName().toString().startsWith("jmigrate-templates-"));
        assertTrue(buf.toString().contains("keep template dir"));
    }
}
