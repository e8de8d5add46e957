package com.aec.AdminDrive.dto;

import com.aec.AdminDrive.model.QuotaWarningLevel;
import com.aec.AdminDrive.model.TokenState;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CredentialStatusDto {
    private boolean authenticated;
    private Long credentialId;
    private TokenState state;
    private String accountEmail;
    private boolean persistent;
    private String sessionId;
    private Instant tokenExpiresAt;
    private Long timeUntilExpirySeconds;
    private boolean autoRefreshEnabled;
    private boolean active;
    private String deactivatedReason;
    private int refreshAttempts;
    private int maxRefreshFailures;
    private Instant lastRefreshAt;
    private Instant lastActivityAt;

    private Long quotaTotal;
    private Long quotaUsed;
    private double usagePercentage;
    private QuotaWarningLevel warningLevel;
    private Instant lastQuotaCheck;
}
