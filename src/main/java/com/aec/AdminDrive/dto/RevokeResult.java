package com.aec.AdminDrive.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RevokeResult {
    private Long credentialId;
    private boolean revoked;
    private boolean providerRevoked;
    private String reason;
    private Instant revokedAt;
}
