package com.aec.AdminDrive.dto;

import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProviderPerformanceSummary {
    private Map<String, OperationStats> operations;
    private long rateLimitHits;
    private Instant lastRateLimitHit;
    private List<String> recommendations;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    public static class OperationStats {
        private long total;
        private long successful;
        private long failed;
        private double averageDurationMs;
        private double failureRate;
    }
}
