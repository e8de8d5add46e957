package com.aec.AdminDrive.dto;

import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class QuotaCheckSummary {
    private boolean success;
    private int sessionsChecked;
    private int alertsGenerated;
    @Builder.Default
    private List<QuotaCheckResult> results = new ArrayList<>();
    private boolean forced;
    private String error;
    private Instant timestamp;
}
