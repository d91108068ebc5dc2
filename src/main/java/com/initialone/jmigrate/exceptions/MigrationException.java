package com.initialone.jmigrate.exceptions;

/**
 * 迁移流水线中所有致命/可报告错误的根类型。
 */
public class MigrationException extends Exception {
    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
