package com.initialone.jmigrate.exceptions;

/** Writing or registering a template unit failed. Always fatal. */
public class TemplateGenerationException extends MigrationException {
    public TemplateGenerationException(String message) {
        super(message);
    }

    public TemplateGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
