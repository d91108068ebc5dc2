package com.initialone.jmigrate.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** 一次迁移运行的全部输入，命令行和测试都通过它驱动 {@link MigrationRunner}。 */
public class MigrationOptions {
    public List<Path> roots = new ArrayList<>();
    public List<Path> classpath = new ArrayList<>();
    public List<String> patterns = new ArrayList<>();
    public boolean transitive;
    public boolean dryRun;
    public boolean verbose;
    /** 模板临时目录的父目录；null 表示用系统属性或 java.io.tmpdir */
    public Path templateDir;
    public boolean keepTemplates;
}
