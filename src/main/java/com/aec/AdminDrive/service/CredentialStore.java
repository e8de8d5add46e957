package com.aec.AdminDrive.service;

import com.aec.AdminDrive.Repository.AdminCredentialRepository;
import com.aec.AdminDrive.config.CredentialProperties;
import com.aec.AdminDrive.drive.TokenGrant;
import com.aec.AdminDrive.exception.CredentialException;
import com.aec.AdminDrive.model.AdminCredential;
import com.aec.AdminDrive.model.QuotaWarningLevel;
import com.aec.AdminDrive.model.QuotaWarningRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Every write re-reads the row under a {@code PESSIMISTIC_WRITE} lock in its own short transaction. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    public static final String REASON_REVOKED = "revoked";
    public static final String REASON_REFRESH_FAILURES = "refresh_failures_exceeded";
    public static final String REASON_MANUAL_REVOCATION = "manual_revocation";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AdminCredentialRepository repo;
    private final CredentialProperties props;

    public record RefreshFailure(AdminCredential credential, boolean concurrentlyRefreshed, boolean deactivated) {}

    public record QuotaUpdate(AdminCredential credential, QuotaWarningLevel previousLevel,
                              QuotaWarningLevel newLevel, boolean escalated) {
        public boolean levelChanged() {
            return previousLevel != newLevel;
        }
    }

    @Transactional(readOnly = true)
    public AdminCredential require(Long id) {
        return repo.findById(id).orElseThrow(() -> new CredentialException(
                CredentialException.Kind.UNAUTHENTICATED, "No admin Drive credential with id " + id));
    }

    /** Latest active credential, or the latest one at all so its deactivation can be reported. */
    @Transactional(readOnly = true)
    public Optional<AdminCredential> findPrimary() {
        Optional<AdminCredential> active = repo.findFirstByActiveTrueOrderByUpdatedAtDesc();
        return active.isPresent() ? active : repo.findFirstByOrderByUpdatedAtDesc();
    }

    @Transactional(readOnly = true)
    public AdminCredential requirePrimary() {
        return findPrimary().orElseThrow(() -> new CredentialException(
                CredentialException.Kind.UNAUTHENTICATED, "Admin Google Drive account is not connected"));
    }

    @Transactional(readOnly = true)
    public List<AdminCredential> findActive() {
        return repo.findAllByActiveTrueOrderByIdAsc();
    }

    @Transactional
    public void touchActivity(Long id, Instant at) {
        lock(id).touch(at);
    }

    @Transactional
    public AdminCredential applyRefreshSuccess(Long id, TokenGrant grant, Instant at) {
        AdminCredential c = lock(id);
        c.recordRefreshSuccess(grant.getAccessToken(), grant.getRefreshToken(), grant.getExpiresAt(), at);
        if (grant.getScope() != null) c.setScope(grant.getScope());
        return c;
    }

    /**
     * Records a failed refresh unless another caller stored a fresh token after
     * {@code expiresAtSeenByCaller} was read.
     */
    @Transactional
    public RefreshFailure applyRefreshFailure(Long id, Instant expiresAtSeenByCaller, boolean invalidGrant, Instant at) {
        AdminCredential c = lock(id);
        if (c.isActive()
                && !Objects.equals(c.getTokenExpiresAt(), expiresAtSeenByCaller)
                && !c.isTokenStale(at, props.getExpirySkew())) {
            return new RefreshFailure(c, true, false);
        }
        if (!c.isActive()) {
            return new RefreshFailure(c, false, true);
        }
        if (invalidGrant) {
            c.recordRefreshFailure(at);
            c.deactivate(REASON_REVOKED, at);
            log.error("Admin Drive credential {} deactivated: refresh token revoked", id);
            return new RefreshFailure(c, false, true);
        }
        if (c.recordRefreshFailure(at)) {
            c.deactivate(REASON_REFRESH_FAILURES, at);
            log.error("Admin Drive credential {} deactivated after {} failed refreshes", id, c.getRefreshAttempts());
            return new RefreshFailure(c, false, true);
        }
        log.warn("Admin Drive credential {} refresh failed ({}/{})", id, c.getRefreshAttempts(), c.getMaxRefreshFailures());
        return new RefreshFailure(c, false, false);
    }

    @Transactional
    public AdminCredential revoke(Long id, Instant at) {
        AdminCredential c = lock(id);
        c.setPersistent(false);
        c.setAutoRefreshEnabled(false);
        c.deactivate(REASON_MANUAL_REVOCATION, at);
        log.info("Admin Drive credential {} revoked manually", id);
        return c;
    }

    /**
     * One credential per admin user: re-authentication overwrites tokens and reactivates the row.
     */
    @Transactional
    public AdminCredential createOrUpdateFromGrant(Long userId, TokenGrant grant, String accountEmail, Instant at) {
        AdminCredential c = repo.findByUserId(userId)
                .flatMap(existing -> repo.findByIdForUpdate(existing.getId()))
                .orElse(null);
        boolean created = c == null;
        if (created) {
            c = AdminCredential.builder()
                    .userId(userId)
                    .createdAt(at)
                    .build();
        }
        c.recordRefreshSuccess(grant.getAccessToken(), grant.getRefreshToken(), grant.getExpiresAt(), at);
        c.setScope(grant.getScope());
        if (accountEmail != null) c.setAccountEmail(accountEmail);
        c.setPersistent(true);
        c.setAutoRefreshEnabled(true);
        c.setMaxRefreshFailures(props.getMaxRefreshFailures());
        c.reactivate();
        if (c.getPersistentSessionId() == null) {
            c.setPersistentSessionId(newSessionId());
        }
        AdminCredential saved = repo.save(c);
        log.info("Admin Drive credential {} {} for user {} (expires {})",
                saved.getId(), created ? "created" : "re-authenticated", userId, saved.getTokenExpiresAt());
        return saved;
    }

    @Transactional
    public QuotaUpdate applyQuotaSnapshot(Long id, Long totalBytes, Long usedBytes, Instant at, int historyLimit) {
        AdminCredential c = lock(id);
        QuotaWarningLevel previous = c.applyQuotaSnapshot(totalBytes, usedBytes, at);
        QuotaWarningLevel current = c.getQuotaWarningLevel();
        boolean escalated = current.isHigherThan(previous);
        if (current != previous) {
            c.appendWarningRecord(QuotaWarningRecord.builder()
                    .timestamp(at)
                    .oldLevel(previous)
                    .newLevel(current)
                    .usagePercentage(QuotaThresholdEngine.round2(c.usagePercentage()))
                    .alertSent(escalated)
                    .build(), historyLimit);
        }
        return new QuotaUpdate(c, previous, current, escalated);
    }

    private AdminCredential lock(Long id) {
        return repo.findByIdForUpdate(id).orElseThrow(() -> new CredentialException(
                CredentialException.Kind.UNAUTHENTICATED, "No admin Drive credential with id " + id));
    }

    private String newSessionId() {
        String candidate;
        do {
            byte[] bytes = new byte[32];
            RANDOM.nextBytes(bytes);
            candidate = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        } while (repo.existsByPersistentSessionId(candidate));
        return candidate;
    }
}
