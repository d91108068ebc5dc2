package com.initialone.jmigrate.pipeline;

import com.initialone.jmigrate.engine.ProgramImage;
import com.initialone.jmigrate.model.TemplateUnit;
import com.initialone.jmigrate.util.Tools;

import java.io.PrintStream;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 把命令行上的包模式解析成已加载的包名集合。
 * 模式可以写成 com.acme.foo 或 com/acme/foo，支持 glob：* 匹配一段，** 跨段。
 */
public class PackageResolver {
    private final PrintStream err;

    public PackageResolver(PrintStream err) {
        this.err = err;
    }

    /** 结果已排序，且不含保留的模板包。 */
    public Set<String> resolve(List<String> patterns, ProgramImage image, boolean transitive) {
        Set<String> selected = new TreeSet<>();
        for (String pattern : patterns) {
            PathMatcher pm = FileSystems.getDefault().getPathMatcher("glob:" + toGlob(pattern));
            boolean any = false;
            for (String pkg : image.packageNames()) {
                if (pkg.isEmpty() || TemplateUnit.isReservedPackage(pkg)) continue;
                if (pm.matches(asPath(pkg))) {
                    selected.add(pkg);
                    any = true;
                }
            }
            if (!any) {
                err.println("[migrate] WARN: no loaded package matches " + pattern);
            }
        }
        if (transitive) {
            selected = image.withDependents(selected);
            selected.removeIf(TemplateUnit::isReservedPackage);
        }
        return selected;
    }

    static String toGlob(String pattern) {
        String p = pattern.trim();
        if (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        // 点号写法转成路径写法；glob 里的 ** 不含点，可以直接替换
        return p.contains("/") ? p : Tools.pkgAsPath(p);
    }

    private static Path asPath(String pkg) {
        return Paths.get(Tools.pkgAsPath(pkg));
    }
}
