package com.aec.AdminDrive.dto;

import com.aec.AdminDrive.model.QuotaUsage;
import com.aec.AdminDrive.model.QuotaWarningLevel;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class QuotaCheckResult {
    private Long credentialId;
    private boolean success;
    private QuotaUsage usage;
    private QuotaWarningLevel previousLevel;
    private QuotaWarningLevel warningLevel;
    private boolean levelChanged;
    private boolean alertGenerated;
    private String error;
    private Instant checkedAt;
}
