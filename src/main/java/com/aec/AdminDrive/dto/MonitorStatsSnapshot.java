package com.aec.AdminDrive.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MonitorStatsSnapshot {
    private Instant serviceStarted;
    private Instant lastCheck;
    private long totalChecks;
    private long totalAlertsSent;
    private String lastError;
    private int consecutiveErrors;
    private Long uptimeSeconds;
}
