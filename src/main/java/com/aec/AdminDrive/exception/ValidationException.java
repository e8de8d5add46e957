package com.aec.AdminDrive.exception;

public class ValidationException extends RuntimeException {

    public enum Kind {
        MISSING_CONFIRMATION
    }

    private final Kind kind;

    public ValidationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
