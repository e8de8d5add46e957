package com.aec.AdminDrive.exception;

public class ConfigException extends RuntimeException {

    public enum Kind {
        INVALID_INTERVAL,
        MISSING_CREDENTIALS
    }

    private final Kind kind;

    public ConfigException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
