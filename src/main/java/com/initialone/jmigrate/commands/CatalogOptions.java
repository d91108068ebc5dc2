package com.initialone.jmigrate.commands;

import com.initialone.jmigrate.catalog.CatalogFile;
import com.initialone.jmigrate.catalog.Families;
import com.initialone.jmigrate.catalog.RuleCatalog;
import com.initialone.jmigrate.model.RewriteFamily;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public class CatalogOptions {

    @CommandLine.Option(names = "--catalog", paramLabel = "FILE",
            description = "Rule catalog JSON (default: built-in Truth -> AssertJ catalog)")
    public Path catalog;

    private CatalogFile loaded;

    public RuleCatalog rules() throws IOException {
        CatalogFile f = file();
        return f == null ? RuleCatalog.builtin() : f.toCatalog();
    }

    /** 自定义目录没写 families 时沿用内置的 Strict / Soft 两个家族。 */
    public List<RewriteFamily> families() throws IOException {
        CatalogFile f = file();
        return f == null || f.families == null || f.families.isEmpty() ? Families.builtin() : f.toFamilies();
    }

    private CatalogFile file() throws IOException {
        if (catalog == null) return null;
        if (loaded == null) loaded = CatalogFile.read(catalog);
        return loaded;
    }
}
