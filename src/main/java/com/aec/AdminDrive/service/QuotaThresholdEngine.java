package com.aec.AdminDrive.service;

import com.aec.AdminDrive.model.QuotaUsage;
import com.aec.AdminDrive.model.QuotaWarningLevel;
import com.aec.AdminDrive.model.StorageAlert;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Maps storage usage to a {@link QuotaWarningLevel} and the operator-facing texts for it.
 * <ul>
 *   <li>&lt; 80 % : none</li>
 *   <li>80 - 84.999 % : low</li>
 *   <li>85 - 89.999 % : medium</li>
 *   <li>90 - 94.999 % : high</li>
 *   <li>&ge; 95 % : critical</li>
 * </ul>
 * Unset or zero quotas count as 0 % usage.
 */
public final class QuotaThresholdEngine {

    private QuotaThresholdEngine() {}

    public static final double LOW_THRESHOLD = 80.0;
    public static final double MEDIUM_THRESHOLD = 85.0;
    public static final double HIGH_THRESHOLD = 90.0;
    public static final double CRITICAL_THRESHOLD = 95.0;

    public static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    public static double usagePercentage(Long usedBytes, Long totalBytes) {
        if (usedBytes == null || totalBytes == null || totalBytes <= 0) return 0.0;
        return usedBytes * 100.0 / totalBytes;
    }

    public static QuotaWarningLevel levelFor(double usagePercentage) {
        if (usagePercentage >= CRITICAL_THRESHOLD) return QuotaWarningLevel.CRITICAL;
        if (usagePercentage >= HIGH_THRESHOLD) return QuotaWarningLevel.HIGH;
        if (usagePercentage >= MEDIUM_THRESHOLD) return QuotaWarningLevel.MEDIUM;
        if (usagePercentage >= LOW_THRESHOLD) return QuotaWarningLevel.LOW;
        return QuotaWarningLevel.NONE;
    }

    public static QuotaWarningLevel levelFor(Long usedBytes, Long totalBytes) {
        return levelFor(usagePercentage(usedBytes, totalBytes));
    }

    public static double toGigabytes(Long bytes) {
        return bytes == null ? 0.0 : bytes / BYTES_PER_GB;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public static QuotaUsage usage(Long usedBytes, Long totalBytes) {
        double pct = usagePercentage(usedBytes, totalBytes);
        Long available = (usedBytes == null || totalBytes == null) ? null : Math.max(0L, totalBytes - usedBytes);
        return QuotaUsage.builder()
                .totalBytes(totalBytes)
                .usedBytes(usedBytes)
                .availableBytes(available)
                .totalGb(round2(toGigabytes(totalBytes)))
                .usedGb(round2(toGigabytes(usedBytes)))
                .availableGb(round2(toGigabytes(available)))
                .usagePercentage(round2(pct))
                .warningLevel(levelFor(pct))
                .build();
    }

    public static StorageAlert buildAlert(Long usedBytes, Long totalBytes, Instant at) {
        double pct = usagePercentage(usedBytes, totalBytes);
        QuotaWarningLevel level = levelFor(pct);
        long available = (usedBytes == null || totalBytes == null) ? 0L : Math.max(0L, totalBytes - usedBytes);
        double availableGb = toGigabytes(available);
        return StorageAlert.builder()
                .level(level)
                .usagePercentage(pct)
                .totalGb(toGigabytes(totalBytes))
                .usedGb(toGigabytes(usedBytes))
                .availableGb(availableGb)
                .message(message(level, pct, availableGb))
                .recommendations(recommendations(level))
                .timestamp(at)
                .build();
    }

    public static String message(QuotaWarningLevel level, double usagePercentage, double availableGb) {
        String pct = String.format(Locale.ROOT, "%.1f", usagePercentage);
        String gb = String.format(Locale.ROOT, "%.1f", availableGb);
        return switch (level) {
            case CRITICAL -> "CRITICAL: Google Drive storage is " + pct + "% full. Only " + gb + " GB remaining.";
            case HIGH -> "HIGH WARNING: Google Drive storage is " + pct + "% full. Only " + gb + " GB remaining.";
            case MEDIUM -> "MEDIUM WARNING: Google Drive storage is " + pct + "% full. " + gb + " GB remaining.";
            case LOW -> "Low warning: Google Drive storage is " + pct + "% full. " + gb + " GB remaining.";
            case NONE -> "Google Drive storage is " + pct + "% full. " + gb + " GB remaining.";
        };
    }

    public static List<String> recommendations(QuotaWarningLevel level) {
        return switch (level) {
            case CRITICAL -> List.of(
                    "IMMEDIATE ACTION REQUIRED",
                    "Delete unnecessary files immediately",
                    "Archive old files to free up space",
                    "Consider upgrading Google Drive storage plan",
                    "New file uploads may be disabled automatically");
            case HIGH -> List.of(
                    "URGENT: Take action within 24 hours",
                    "Review and delete large files",
                    "Archive files older than 6 months",
                    "Empty trash to free up space",
                    "Consider upgrading storage plan");
            case MEDIUM -> List.of(
                    "Action recommended within one week",
                    "Review and organize files",
                    "Delete duplicate files",
                    "Archive old project files",
                    "Monitor storage usage more frequently");
            case LOW -> List.of(
                    "No immediate action required",
                    "Start planning storage cleanup",
                    "Review file organization",
                    "Consider archiving old files",
                    "Monitor storage growth trends");
            case NONE -> List.of();
        };
    }

    public static List<String> cleanupRecommendations(double usagePercentage) {
        if (usagePercentage > HIGH_THRESHOLD) {
            return List.of(
                    "URGENT: Delete large files immediately",
                    "Empty Google Drive trash",
                    "Archive files older than 6 months",
                    "Review and delete duplicate files");
        }
        if (usagePercentage > LOW_THRESHOLD) {
            return List.of(
                    "Review files larger than 50MB",
                    "Archive files older than 1 year",
                    "Organize files into folders",
                    "Clean up duplicate files");
        }
        return List.of(
                "Monitor storage usage monthly",
                "Consider archiving old projects",
                "Use selective sync if available");
    }
}
