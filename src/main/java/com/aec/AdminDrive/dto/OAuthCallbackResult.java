package com.aec.AdminDrive.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OAuthCallbackResult {
    private Long credentialId;
    private String accountEmail;
    private String sessionId;
    private Instant tokenExpiresAt;
    private boolean initialQuotaChecked;
    private String message;
}
