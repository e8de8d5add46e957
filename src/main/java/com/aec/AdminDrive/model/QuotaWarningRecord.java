package com.aec.AdminDrive.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuotaWarningRecord {
    private Instant timestamp;
    private QuotaWarningLevel oldLevel;
    private QuotaWarningLevel newLevel;
    private double usagePercentage;
    private boolean alertSent;
}
