package com.initialone.jmigrate.engine;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.NodeList;
import com.initialone.jmigrate.model.ImportRecord;
import com.initialone.jmigrate.model.ImportSet;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次运行中被迁移的一个源文件。
 * <p>
 * 两种 import 表示：{@link #imports()} 是规范集合，{@link #cu()} 里的 import 列表是声明视图。
 * 只能通过 {@link #setImports(ImportSet)} 修改，修改后由规范集合重建声明视图，两者始终一致。
 */
public final class TargetFile {
    private final Path path;
    private final String packageName;
    private final CompilationUnit cu;
    private final String originalText;
    private ImportSet imports;

    public TargetFile(Path path, String packageName, CompilationUnit cu, String originalText) {
        this.path = path;
        this.packageName = packageName;
        this.cu = cu;
        this.originalText = originalText;
        this.imports = readImports(cu);
    }

    public Path path() {
        return path;
    }

    public String packageName() {
        return packageName;
    }

    public CompilationUnit cu() {
        return cu;
    }

    public String originalText() {
        return originalText;
    }

    public ImportSet imports() {
        return imports;
    }

    /** 用新的规范集合替换 import：删除不在集合里的声明，按集合顺序追加缺少的声明。 */
    public void setImports(ImportSet next) {
        NodeList<ImportDeclaration> decls = cu.getImports();
        List<ImportDeclaration> drop = new ArrayList<>();
        for (ImportDeclaration d : decls) {
            if (!next.contains(toRecord(d))) drop.add(d);
        }
        for (ImportDeclaration d : drop) {
            d.remove();
        }
        List<ImportRecord> present = new ArrayList<>();
        for (ImportDeclaration d : cu.getImports()) {
            present.add(toRecord(d));
        }
        for (ImportRecord r : next.records()) {
            if (!present.contains(r)) {
                cu.getImports().add(new ImportDeclaration(r.path, r.isStatic, r.onDemand));
                present.add(r);
            }
        }
        this.imports = next;
    }

    /** import 列表（声明视图）与规范集合内容一致。 */
    public boolean importsConsistent() {
        return readImports(cu).sameImports(imports);
    }

    public static ImportSet readImports(CompilationUnit cu) {
        List<ImportRecord> out = new ArrayList<>();
        for (ImportDeclaration d : cu.getImports()) {
            out.add(toRecord(d));
        }
        return new ImportSet(out);
    }

    public static ImportRecord toRecord(ImportDeclaration d) {
        return new ImportRecord(d.getNameAsString(), d.isStatic(), d.isAsterisk(), true);
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
