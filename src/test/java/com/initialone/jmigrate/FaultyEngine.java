package com.initialone.jmigrate;

import com.initialone.jmigrate.engine.Matcher;
import com.initialone.jmigrate.engine.ProgramImage;
import com.initialone.jmigrate.engine.RewriteEngine;
import com.initialone.jmigrate.engine.TargetFile;
import com.initialone.jmigrate.engine.UnitHandle;
import com.initialone.jmigrate.exceptions.MatchApplicationException;
import com.initialone.jmigrate.exceptions.PersistException;
import com.initialone.jmigrate.exceptions.ProgramLoadException;
import com.initialone.jmigrate.exceptions.TemplateGenerationException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** 委托给真实引擎，让指定模板的匹配器或写回步骤失败。 */
public final class FaultyEngine implements RewriteEngine {
    private final RewriteEngine real;
    private final String failingUnit;
    private final boolean failWrites;
    public int writes;

    private FaultyEngine(RewriteEngine real, String failingUnit, boolean failWrites) {
        this.real = real;
        this.failingUnit = failingUnit;
        this.failWrites = failWrites;
    }

    public static FaultyEngine failingMatcher(RewriteEngine real, String unitName) {
        return new FaultyEngine(real, unitName, false);
    }

    public static FaultyEngine failingWrites(RewriteEngine real) {
        return new FaultyEngine(real, null, true);
    }

    @Override
    public String help() {
        return real.help();
    }

    @Override
    public UnitHandle registerUnit(String name, String sourceText) throws TemplateGenerationException {
        return real.registerUnit(name, sourceText);
    }

    @Override
    public ProgramImage loadProgram(List<Path> roots, List<Path> classpath, List<UnitHandle> units)
            throws ProgramLoadException {
        return real.loadProgram(roots, classpath, units);
    }

    @Override
    public Matcher makeMatcher(ProgramImage image, UnitHandle unit) throws ProgramLoadException {
        Matcher m = real.makeMatcher(image, unit);
        if (!unit.name.equals(failingUnit)) return m;
        return new Matcher() {
            @Override
            public String name() {
                return m.name();
            }

            @Override
            public int apply(TargetFile file) throws MatchApplicationException {
                throw new MatchApplicationException(unit.name + " failed on " + file.path(),
                        new IllegalStateException("broken matcher"));
            }
        };
    }

    @Override
    public void writeFile(Path originalPath, TargetFile file) throws PersistException {
        writes++;
        if (failWrites) {
            throw new PersistException(originalPath, new IOException("disk full"));
        }
        real.writeFile(originalPath, file);
    }
}
