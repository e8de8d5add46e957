package com.aec.AdminDrive.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MonitorLifecycleResult {
    private boolean success;
    /** For stop: whether the worker exited within the timeout. */
    private boolean clean;
    private String message;
    private MonitorStatsSnapshot stats;
}
