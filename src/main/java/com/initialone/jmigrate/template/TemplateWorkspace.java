package com.initialone.jmigrate.template;

import com.initialone.jmigrate.model.TemplateUnit;
import com.initialone.jmigrate.util.Tools;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * 模板单元的临时目录，作用域是一次运行。
 * 用 try-with-resources 打开，成功或失败都会删除（除非 keep=true，方便排查模板）。
 *
 * 目录名示例: jmigrate-templates-1a2b3c4d
 */
public final class TemplateWorkspace implements AutoCloseable {
    private final Path root;
    private final boolean keep;
    private final PrintStream err;

    private TemplateWorkspace(Path root, boolean keep, PrintStream err) {
        this.root = root;
        this.keep = keep;
        this.err = err;
    }

    /**
     * @param baseRoot 父目录；null 时用 {@code jmigrate.template.dir} 系统属性，再退回 java.io.tmpdir
     */
    public static TemplateWorkspace open(Path baseRoot, boolean keep, PrintStream err) throws IOException {
        Path base = baseRoot;
        if (base == null) {
            base = Paths.get(System.getProperty("jmigrate.template.dir", System.getProperty("java.io.tmpdir")));
        }
        String dirName = "jmigrate-templates-" + UUID.randomUUID().toString().substring(0, 8);
        Path root = base.resolve(dirName);
        Files.createDirectories(root.resolve(TemplateUnit.RESERVED_PACKAGE));
        return new TemplateWorkspace(root, keep || Boolean.getBoolean("jmigrate.templates.keep"), err);
    }

    public Path root() {
        return root;
    }

    /** 把单元写成 {@code <root>/$jmigrate$templates/TemplateNNNN.java}，返回写入的文本。 */
    public String write(TemplateUnit unit) throws IOException {
        String text = unit.render();
        Path file = root.resolve(TemplateUnit.RESERVED_PACKAGE).resolve(unit.name + ".java");
        Files.writeString(file, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return text;
    }

    @Override
    public void close() {
        if (keep) {
            err.println("[migrate] keep template dir: " + root);
            return;
        }
        Tools.safeRecursiveDelete(root, err);
    }
}
