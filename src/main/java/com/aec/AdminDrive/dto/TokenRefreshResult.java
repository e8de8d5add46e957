package com.aec.AdminDrive.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TokenRefreshResult {
    private Long credentialId;
    private boolean success;
    private Instant tokenExpiresAt;
    private Instant refreshedAt;
    /** First characters of the new access token, for operator confirmation only. */
    private String tokenPreview;
}
