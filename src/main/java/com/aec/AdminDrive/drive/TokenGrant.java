package com.aec.AdminDrive.drive;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TokenGrant {
    String accessToken;
    /** Absent on most refresh responses. */
    String refreshToken;
    Instant expiresAt;
    String scope;
}
