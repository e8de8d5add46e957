package com.aec.AdminDrive.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QuotaUsage {
    Long totalBytes;
    Long usedBytes;
    Long availableBytes;
    double totalGb;
    double usedGb;
    double availableGb;
    double usagePercentage;
    QuotaWarningLevel warningLevel;
}
