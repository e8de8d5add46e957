package com.aec.AdminDrive.dto;

import com.aec.AdminDrive.model.QuotaUsage;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StorageStatusSummary {
    private int totalSessions;
    private int sessionsWithWarnings;
    private int criticalSessions;
    private double totalUsedGb;
    private double totalQuotaGb;
    private double overallUsagePercentage;
    private List<SessionQuota> sessions;
    private Instant timestamp;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    public static class SessionQuota {
        private Long credentialId;
        private String accountEmail;
        private QuotaUsage usage;
        private Instant lastCheck;
    }
}
