package com.initialone.jmigrate.exceptions;

/**
 * A single matcher failed on a single file. Not fatal: the runner reports it
 * and counts zero matches for that matcher on that file.
 */
public class MatchApplicationException extends MigrationException {
    public MatchApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
