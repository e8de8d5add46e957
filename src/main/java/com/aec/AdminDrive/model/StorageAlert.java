package com.aec.AdminDrive.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class StorageAlert {
    QuotaWarningLevel level;
    double usagePercentage;
    double totalGb;
    double usedGb;
    double availableGb;
    String message;
    List<String> recommendations;
    Instant timestamp;
}
