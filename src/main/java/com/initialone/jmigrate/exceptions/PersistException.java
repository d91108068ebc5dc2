package com.initialone.jmigrate.exceptions;

import java.nio.file.Path;

/** Writing a rewritten file back to disk failed. */
public class PersistException extends MigrationException {
    private final Path path;

    public PersistException(Path path, Throwable cause) {
        super("failed to write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
