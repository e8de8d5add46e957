package com.aec.AdminDrive.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ErrorResponse {
    private String code;
    private String message;
    /** Hint for the client, e.g. REAUTHENTICATE. */
    private String action;
    private Instant timestamp;
}
