package com.aec.AdminDrive.exception;

public class CredentialException extends RuntimeException {

    public enum Kind {
        /** No credential has ever been stored for the admin account. */
        UNAUTHENTICATED,
        EXPIRED,
        DEACTIVATED,
        REFRESH_FAILED,
        INVALID_STATE
    }

    private final Kind kind;

    public CredentialException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CredentialException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
