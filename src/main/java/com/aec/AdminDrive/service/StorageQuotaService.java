package com.aec.AdminDrive.service;

import com.aec.AdminDrive.config.StorageMonitorProperties;
import com.aec.AdminDrive.drive.DriveProviderClient;
import com.aec.AdminDrive.drive.DriveQuota;
import com.aec.AdminDrive.dto.QuotaCheckResult;
import com.aec.AdminDrive.dto.QuotaCheckSummary;
import com.aec.AdminDrive.dto.StorageAnalyticsDto;
import com.aec.AdminDrive.dto.StorageStatusSummary;
import com.aec.AdminDrive.exception.CredentialException;
import com.aec.AdminDrive.exception.ProviderException;
import com.aec.AdminDrive.model.AdminCredential;
import com.aec.AdminDrive.model.QuotaUsage;
import com.aec.AdminDrive.model.QuotaWarningLevel;
import com.aec.AdminDrive.model.StorageAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class StorageQuotaService {

    private final CredentialStore store;
    private final TokenLifecycleService lifecycle;
    private final DriveProviderClient provider;
    private final RetryExecutor retry;
    private final StorageAlertNotifier notifier;
    private final StorageMonitorProperties props;
    private final Clock clock;

    public StorageQuotaService(CredentialStore store, TokenLifecycleService lifecycle, DriveProviderClient provider,
                               RetryExecutor retry, StorageAlertNotifier notifier,
                               StorageMonitorProperties props, Clock clock) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.provider = provider;
        this.retry = retry;
        this.notifier = notifier;
        this.props = props;
        this.clock = clock;
    }

    public QuotaCheckResult checkStorageQuota(Long credentialId) {
        String token = lifecycle.getValidToken(credentialId);
        DriveQuota quota = retry.execute("quota_read", () -> provider.fetchStorageQuota(token));

        Instant at = clock.instant();
        CredentialStore.QuotaUpdate update = store.applyQuotaSnapshot(
                credentialId, quota.getLimitBytes(), quota.getUsageBytes(), at, props.getWarningHistoryLimit());
        AdminCredential c = update.credential();

        boolean alertGenerated = false;
        if (update.escalated()) {
            StorageAlert alert = QuotaThresholdEngine.buildAlert(quota.getUsageBytes(), quota.getLimitBytes(), at);
            alertGenerated = notifier.dispatch(c, alert);
        } else if (update.levelChanged()) {
            log.info("Storage level for credential {} went from {} to {}", credentialId,
                    update.previousLevel(), update.newLevel());
        }

        return QuotaCheckResult.builder()
                .credentialId(credentialId)
                .success(true)
                .usage(QuotaThresholdEngine.usage(quota.getUsageBytes(), quota.getLimitBytes()))
                .previousLevel(update.previousLevel())
                .warningLevel(update.newLevel())
                .levelChanged(update.levelChanged())
                .alertGenerated(alertGenerated)
                .checkedAt(at)
                .build();
    }

    /** One pass over every active credential. Failures are reported per credential. */
    public QuotaCheckSummary checkAllStorageQuotas(boolean forced) {
        List<AdminCredential> active = store.findActive();
        List<QuotaCheckResult> results = new ArrayList<>();
        int alerts = 0;
        String firstError = null;

        for (AdminCredential c : active) {
            try {
                QuotaCheckResult r = checkStorageQuota(c.getId());
                if (r.isAlertGenerated()) alerts++;
                results.add(r);
            } catch (CredentialException | ProviderException e) {
                log.warn("Quota check for credential {} failed: {}", c.getId(), e.getMessage());
                if (firstError == null) firstError = "credential " + c.getId() + ": " + e.getMessage();
                results.add(QuotaCheckResult.builder()
                        .credentialId(c.getId())
                        .success(false)
                        .warningLevel(c.getQuotaWarningLevel())
                        .error(e.getMessage())
                        .checkedAt(clock.instant())
                        .build());
            }
        }

        return QuotaCheckSummary.builder()
                .success(firstError == null)
                .sessionsChecked(active.size())
                .alertsGenerated(alerts)
                .results(results)
                .forced(forced)
                .error(firstError)
                .timestamp(clock.instant())
                .build();
    }

    public StorageAnalyticsDto getStorageAnalytics() {
        AdminCredential c = store.requirePrimary();
        if (c.isActive() && c.getLastQuotaCheck() == null) {
            try {
                checkStorageQuota(c.getId());
            } catch (CredentialException | ProviderException e) {
                log.warn("Initial quota read for analytics failed: {}", e.getMessage());
            }
            c = store.require(c.getId());
        }
        QuotaUsage usage = QuotaThresholdEngine.usage(c.getDriveQuotaUsed(), c.getDriveQuotaTotal());
        return StorageAnalyticsDto.builder()
                .credentialId(c.getId())
                .accountEmail(c.getAccountEmail())
                .usage(usage)
                .recommendations(QuotaThresholdEngine.recommendations(usage.getWarningLevel()))
                .cleanupRecommendations(QuotaThresholdEngine.cleanupRecommendations(usage.getUsagePercentage()))
                .warningHistory(List.copyOf(c.getQuotaWarningsSent()))
                .lastCheck(c.getLastQuotaCheck())
                .build();
    }

    public StorageStatusSummary getAllStorageStatus() {
        List<AdminCredential> active = store.findActive();
        List<StorageStatusSummary.SessionQuota> sessions = new ArrayList<>();
        int withWarnings = 0;
        int critical = 0;
        long totalUsed = 0;
        long totalQuota = 0;

        for (AdminCredential c : active) {
            QuotaUsage usage = QuotaThresholdEngine.usage(c.getDriveQuotaUsed(), c.getDriveQuotaTotal());
            if (usage.getWarningLevel() != QuotaWarningLevel.NONE) withWarnings++;
            if (usage.getWarningLevel() == QuotaWarningLevel.CRITICAL) critical++;
            if (c.getDriveQuotaUsed() != null) totalUsed += c.getDriveQuotaUsed();
            if (c.getDriveQuotaTotal() != null) totalQuota += c.getDriveQuotaTotal();
            sessions.add(StorageStatusSummary.SessionQuota.builder()
                    .credentialId(c.getId())
                    .accountEmail(c.getAccountEmail())
                    .usage(usage)
                    .lastCheck(c.getLastQuotaCheck())
                    .build());
        }

        return StorageStatusSummary.builder()
                .totalSessions(active.size())
                .sessionsWithWarnings(withWarnings)
                .criticalSessions(critical)
                .totalUsedGb(QuotaThresholdEngine.round2(QuotaThresholdEngine.toGigabytes(totalUsed)))
                .totalQuotaGb(QuotaThresholdEngine.round2(QuotaThresholdEngine.toGigabytes(totalQuota)))
                .overallUsagePercentage(QuotaThresholdEngine.round2(
                        QuotaThresholdEngine.usagePercentage(totalUsed, totalQuota)))
                .sessions(sessions)
                .timestamp(clock.instant())
                .build();
    }
}
