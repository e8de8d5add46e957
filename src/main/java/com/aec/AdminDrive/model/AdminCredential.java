package com.aec.AdminDrive.model;

import com.aec.AdminDrive.service.QuotaThresholdEngine;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * OAuth grant of the admin Google Drive account. Rows are never deleted, only deactivated.
 * Mutated exclusively through {@link com.aec.AdminDrive.service.CredentialStore}.
 */
@Entity
@Table(name = "admin_drive_credentials", indexes = {
        @Index(name = "idx_admin_cred_active", columnList = "active, userId"),
        @Index(name = "idx_admin_cred_expires", columnList = "tokenExpiresAt")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AdminCredential {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Owning admin user of the surrounding application. */
    @Column(nullable = false, unique = true)
    private Long userId;

    private String accountEmail;

    @Column(unique = true, length = 128)
    private String persistentSessionId;

    // never logged
    @ToString.Exclude
    @Column(nullable = false, length = 4096)
    private String accessToken;

    @ToString.Exclude
    @Column(length = 4096)
    private String refreshToken;

    @Column(length = 1000)
    private String scope;

    private Instant tokenExpiresAt;
    private Instant lastRefreshAt;
    private Instant lastActivityAt;

    @Builder.Default
    @Column(nullable = false)
    private boolean persistent = true;

    @Builder.Default
    @Column(nullable = false)
    private boolean autoRefreshEnabled = true;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Column(length = 100)
    private String deactivatedReason;
    private Instant deactivatedAt;

    @Builder.Default
    @Column(nullable = false)
    private int refreshAttempts = 0;

    @Builder.Default
    @Column(nullable = false)
    private int maxRefreshFailures = 5;

    private Long driveQuotaTotal;
    private Long driveQuotaUsed;
    private Instant lastQuotaCheck;

    // derived from driveQuotaUsed / driveQuotaTotal only
    @Setter(AccessLevel.NONE)
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QuotaWarningLevel quotaWarningLevel = QuotaWarningLevel.NONE;

    @Setter(AccessLevel.NONE)
    @Builder.Default
    @Convert(converter = QuotaWarningHistoryConverter.class)
    @Column(length = 8000)
    private List<QuotaWarningRecord> quotaWarningsSent = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isTokenExpired(Instant now) {
        return tokenExpiresAt == null || !tokenExpiresAt.isAfter(now);
    }

    /** Expired, or expiring within {@code skew}. */
    public boolean isTokenStale(Instant now, Duration skew) {
        return tokenExpiresAt == null || !tokenExpiresAt.isAfter(now.plus(skew));
    }

    public boolean needsRefresh(Instant now, Duration skew) {
        return isTokenStale(now, skew) && autoRefreshEnabled && active;
    }

    public void recordRefreshSuccess(String newAccessToken, String newRefreshToken, Instant expiresAt, Instant at) {
        this.accessToken = newAccessToken;
        if (newRefreshToken != null && !newRefreshToken.isBlank()) {
            this.refreshToken = newRefreshToken;
        }
        this.tokenExpiresAt = expiresAt;
        this.refreshAttempts = 0;
        this.lastRefreshAt = at;
        this.lastActivityAt = at;
    }

    /** @return true when the failure budget is exhausted */
    public boolean recordRefreshFailure(Instant at) {
        this.refreshAttempts++;
        this.lastRefreshAt = at;
        return refreshAttempts >= maxRefreshFailures;
    }

    public void deactivate(String reason, Instant at) {
        this.active = false;
        this.deactivatedReason = reason;
        this.deactivatedAt = at;
    }

    public void reactivate() {
        this.active = true;
        this.refreshAttempts = 0;
        this.deactivatedReason = null;
        this.deactivatedAt = null;
    }

    public void touch(Instant at) {
        this.lastActivityAt = at;
    }

    /**
     * Stores a quota reading and re-derives the warning level from it.
     *
     * @return the level before this reading
     */
    public QuotaWarningLevel applyQuotaSnapshot(Long totalBytes, Long usedBytes, Instant at) {
        QuotaWarningLevel previous = quotaWarningLevel;
        this.driveQuotaTotal = totalBytes;
        this.driveQuotaUsed = usedBytes;
        this.lastQuotaCheck = at;
        this.quotaWarningLevel = QuotaThresholdEngine.levelFor(usedBytes, totalBytes);
        return previous == null ? QuotaWarningLevel.NONE : previous;
    }

    public double usagePercentage() {
        return QuotaThresholdEngine.usagePercentage(driveQuotaUsed, driveQuotaTotal);
    }

    public void appendWarningRecord(QuotaWarningRecord record, int limit) {
        List<QuotaWarningRecord> next = new ArrayList<>(quotaWarningsSent == null ? List.of() : quotaWarningsSent);
        next.add(record);
        if (next.size() > limit) {
            next = new ArrayList<>(next.subList(next.size() - limit, next.size()));
        }
        // new instance so the converted column is seen as dirty
        this.quotaWarningsSent = next;
    }
}
