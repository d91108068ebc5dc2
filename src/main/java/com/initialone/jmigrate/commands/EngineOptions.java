package com.initialone.jmigrate.commands;

import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

// 加载目标程序相关的选项，migrate / templates 共用
public class EngineOptions {

    @CommandLine.Option(names = "--root", paramLabel = "DIR",
            description = "Source root to load (repeatable, default: src/test/java)")
    public List<Path> roots = new ArrayList<>();

    @CommandLine.Option(names = "--classpath", split = ":", paramLabel = "CP",
            description = "Extra classpath jars/dirs for type resolution, separated by ':'")
    public List<Path> classpath = new ArrayList<>();

    @CommandLine.Option(names = {"-v", "--verbose"},
            description = "Print matcher and reconciler diagnostics")
    public boolean verbose;

    public List<Path> rootsOrDefault() {
        return roots.isEmpty() ? List.of(Paths.get("src", "test", "java")) : roots;
    }
}
