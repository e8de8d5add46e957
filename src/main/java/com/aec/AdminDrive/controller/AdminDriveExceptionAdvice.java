package com.aec.AdminDrive.controller;

import com.aec.AdminDrive.dto.ErrorResponse;
import com.aec.AdminDrive.exception.ConfigException;
import com.aec.AdminDrive.exception.CredentialException;
import com.aec.AdminDrive.exception.ProviderException;
import com.aec.AdminDrive.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class AdminDriveExceptionAdvice {

    static final String REAUTHENTICATE = "REAUTHENTICATE";

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<ErrorResponse> handleCredential(CredentialException e) {
        HttpStatus status = switch (e.kind()) {
            case UNAUTHENTICATED, EXPIRED, DEACTIVATED -> HttpStatus.UNAUTHORIZED;
            case INVALID_STATE -> HttpStatus.BAD_REQUEST;
            case REFRESH_FAILED -> HttpStatus.BAD_GATEWAY;
        };
        String action = status == HttpStatus.UNAUTHORIZED ? REAUTHENTICATE : null;
        return body(status, e.kind().name(), e.getMessage(), action);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ErrorResponse> handleProvider(ProviderException e) {
        if (e.kind() == ProviderException.Kind.RATE_LIMITED) {
            return body(HttpStatus.TOO_MANY_REQUESTS, e.kind().name(), e.getMessage(), null);
        }
        log.warn("Provider error reached HTTP layer: {} {}", e.kind(), e.getMessage());
        String action = e.kind() == ProviderException.Kind.INVALID_GRANT ? REAUTHENTICATE : null;
        return body(HttpStatus.BAD_GATEWAY, e.kind().name(), e.getMessage(), action);
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ErrorResponse> handleConfig(ConfigException e) {
        return body(HttpStatus.BAD_REQUEST, e.kind().name(), e.getMessage(), null);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e.kind().name(), e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), null);
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message, String action) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code)
                .message(message)
                .action(action)
                .timestamp(Instant.now())
                .build());
    }
}
