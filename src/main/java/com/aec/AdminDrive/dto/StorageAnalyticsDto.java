package com.aec.AdminDrive.dto;

import com.aec.AdminDrive.model.QuotaUsage;
import com.aec.AdminDrive.model.QuotaWarningRecord;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StorageAnalyticsDto {
    private Long credentialId;
    private String accountEmail;
    private QuotaUsage usage;
    private List<String> recommendations;
    private List<String> cleanupRecommendations;
    private List<QuotaWarningRecord> warningHistory;
    private Instant lastCheck;
}
