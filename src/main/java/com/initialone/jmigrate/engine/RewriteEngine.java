package com.initialone.jmigrate.engine;

import com.initialone.jmigrate.exceptions.PersistException;
import com.initialone.jmigrate.exceptions.ProgramLoadException;
import com.initialone.jmigrate.exceptions.TemplateGenerationException;

import java.nio.file.Path;
import java.util.List;

/**
 * 结构化匹配/替换引擎的契约。流水线只通过这几个入口使用引擎。
 */
public interface RewriteEngine {

    /** 引擎自身的帮助文本（模板是如何被解释的）。 */
    String help();

    UnitHandle registerUnit(String name, String sourceText) throws TemplateGenerationException;

    /**
     * 解析 roots 下全部源码并与模板单元一起检查，得到程序镜像。
     *
     * @param classpath 额外的 jar/目录，用于目标代码的类型求解
     */
    ProgramImage loadProgram(List<Path> roots, List<Path> classpath, List<UnitHandle> units)
            throws ProgramLoadException;

    Matcher makeMatcher(ProgramImage image, UnitHandle unit) throws ProgramLoadException;

    void writeFile(Path originalPath, TargetFile file) throws PersistException;
}
