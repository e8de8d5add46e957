package com.aec.AdminDrive.exception;

public class ProviderException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED,
        TRANSIENT,
        INVALID_GRANT
    }

    private final Kind kind;
    private final Integer statusCode;

    public ProviderException(Kind kind, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public ProviderException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public Kind kind() { return kind; }

    /** HTTP status of the provider response, {@code null} for network failures. */
    public Integer statusCode() { return statusCode; }

    public boolean isRetryable() {
        return kind != Kind.INVALID_GRANT;
    }
}
