package com.initialone.jmigrate.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 迁移结果：包 -> 文件 -> 改动数。字段 public，直接交给 Jackson 写成 JSON。
 */
public class MigrationReport {
    private static final ObjectMapper OM = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public boolean dryRun;
    public int templates;
    public int failures;
    /** 访问过的包（包括没有改动的） */
    public Map<String, Map<String, Integer>> packages = new TreeMap<>();

    public MigrationReport() {
    }

    public MigrationReport(boolean dryRun, int templates) {
        this.dryRun = dryRun;
        this.templates = templates;
    }

    public void visit(String pkg) {
        packages.computeIfAbsent(pkg, k -> new LinkedHashMap<>());
    }

    public void record(String pkg, Path file, int count) {
        packages.computeIfAbsent(pkg, k -> new LinkedHashMap<>()).put(file.toString(), count);
    }

    public int total() {
        int sum = 0;
        for (Map<String, Integer> files : packages.values()) {
            for (int n : files.values()) sum += n;
        }
        return sum;
    }

    public int changedFiles() {
        int sum = 0;
        for (Map<String, Integer> files : packages.values()) {
            sum += files.size();
        }
        return sum;
    }

    public int count(String pkg, Path file) {
        return packages.getOrDefault(pkg, Map.of()).getOrDefault(file.toString(), 0);
    }

    public void write(Path path) throws IOException {
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        OM.writeValue(path.toFile(), this);
    }

    public static MigrationReport read(Path path) throws IOException {
        return OM.readValue(path.toFile(), MigrationReport.class);
    }
}
