package com.aec.AdminDrive.service;

import com.aec.AdminDrive.config.CredentialProperties;
import com.aec.AdminDrive.drive.DriveProviderClient;
import com.aec.AdminDrive.drive.TokenGrant;
import com.aec.AdminDrive.dto.CredentialStatusDto;
import com.aec.AdminDrive.dto.RevokeResult;
import com.aec.AdminDrive.dto.TokenRefreshResult;
import com.aec.AdminDrive.exception.CredentialException;
import com.aec.AdminDrive.exception.ProviderException;
import com.aec.AdminDrive.exception.ValidationException;
import com.aec.AdminDrive.model.AdminCredential;
import com.aec.AdminDrive.model.TokenState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Hands out usable access tokens; concurrent refreshes of one credential share a single provider call. */
@Slf4j
@Service
public class TokenLifecycleService {

    private static final int TOKEN_PREVIEW_LENGTH = 12;

    private final CredentialStore store;
    private final DriveProviderClient provider;
    private final RetryExecutor retry;
    private final CredentialProperties props;
    private final Clock clock;

    private final ConcurrentMap<Long, CompletableFuture<AdminCredential>> inFlight = new ConcurrentHashMap<>();

    public TokenLifecycleService(CredentialStore store, DriveProviderClient provider, RetryExecutor retry,
                                 CredentialProperties props, Clock clock) {
        this.store = store;
        this.provider = provider;
        this.retry = retry;
        this.props = props;
        this.clock = clock;
    }

    /** Token of the primary admin credential. */
    public String getValidToken() {
        return getValidToken(store.requirePrimary().getId());
    }

    /**
     * @throws CredentialException EXPIRED, DEACTIVATED or REFRESH_FAILED; never returns an expired token
     */
    public String getValidToken(Long credentialId) {
        AdminCredential c = store.require(credentialId);
        if (!c.isActive()) {
            throw new CredentialException(CredentialException.Kind.DEACTIVATED,
                    "Admin Drive credential is deactivated (" + c.getDeactivatedReason() + "); re-authentication required");
        }
        Instant now = clock.instant();
        Duration skew = props.getExpirySkew();

        if (!c.isTokenStale(now, skew)) {
            store.touchActivity(c.getId(), now);
            return c.getAccessToken();
        }
        if (!c.isAutoRefreshEnabled() || isBlank(c.getRefreshToken())) {
            if (!c.isTokenExpired(now)) {
                store.touchActivity(c.getId(), now);
                return c.getAccessToken();
            }
            throw new CredentialException(CredentialException.Kind.EXPIRED,
                    "Admin Drive access token expired and cannot be refreshed automatically");
        }

        try {
            AdminCredential refreshed = refresh(c);
            // callers that joined another refresh, or lost the race to one, record their own use
            store.touchActivity(refreshed.getId(), clock.instant());
            return refreshed.getAccessToken();
        } catch (CredentialException e) {
            Instant after = clock.instant();
            if (e.kind() == CredentialException.Kind.REFRESH_FAILED && !c.isTokenExpired(after)) {
                log.warn("Admin Drive credential {}: refresh failed, handing out current token until {}",
                        c.getId(), c.getTokenExpiresAt());
                store.touchActivity(c.getId(), after);
                return c.getAccessToken();
            }
            throw e;
        }
    }

    public TokenRefreshResult forceTokenRefresh() {
        return forceTokenRefresh(store.requirePrimary().getId());
    }

    public TokenRefreshResult forceTokenRefresh(Long credentialId) {
        AdminCredential c = store.require(credentialId);
        if (!c.isActive()) {
            throw new CredentialException(CredentialException.Kind.DEACTIVATED,
                    "Admin Drive credential is deactivated (" + c.getDeactivatedReason() + "); re-authentication required");
        }
        if (isBlank(c.getRefreshToken())) {
            throw new CredentialException(CredentialException.Kind.EXPIRED,
                    "No refresh token stored; re-authentication required");
        }
        AdminCredential refreshed = refresh(c);
        String token = refreshed.getAccessToken();
        return TokenRefreshResult.builder()
                .credentialId(refreshed.getId())
                .success(true)
                .tokenExpiresAt(refreshed.getTokenExpiresAt())
                .refreshedAt(refreshed.getLastRefreshAt())
                .tokenPreview(token.substring(0, Math.min(TOKEN_PREVIEW_LENGTH, token.length())) + "...")
                .build();
    }

    /**
     * Refreshes every active, auto-refreshing credential whose token is inside the skew window.
     *
     * @return number of credentials refreshed
     */
    public int refreshExpiringCredentials() {
        Instant now = clock.instant();
        int refreshed = 0;
        for (AdminCredential c : store.findActive()) {
            if (!c.needsRefresh(now, props.getExpirySkew()) || isBlank(c.getRefreshToken())) continue;
            try {
                refresh(c);
                refreshed++;
            } catch (CredentialException e) {
                log.warn("Proactive refresh of credential {} failed: {}", c.getId(), e.getMessage());
            }
        }
        return refreshed;
    }

    public RevokeResult revokePersistentSession(Boolean confirm) {
        requireConfirmation(confirm);
        return revokePersistentSession(store.requirePrimary().getId(), confirm);
    }

    public RevokeResult revokePersistentSession(Long credentialId, Boolean confirm) {
        requireConfirmation(confirm);
        AdminCredential c = store.require(credentialId);

        boolean providerRevoked = false;
        String token = !isBlank(c.getRefreshToken()) ? c.getRefreshToken() : c.getAccessToken();
        if (!isBlank(token)) {
            try {
                retry.run("token_revoke", () -> provider.revokeToken(token));
                providerRevoked = true;
            } catch (ProviderException e) {
                log.warn("Provider revocation for credential {} failed ({}); deactivating locally anyway",
                        credentialId, e.kind());
            }
        }
        Instant at = clock.instant();
        AdminCredential revoked = store.revoke(credentialId, at);
        return RevokeResult.builder()
                .credentialId(revoked.getId())
                .revoked(true)
                .providerRevoked(providerRevoked)
                .reason(revoked.getDeactivatedReason())
                .revokedAt(at)
                .build();
    }

    public CredentialStatusDto getDetailedStatus() {
        return store.findPrimary()
                .map(this::toStatus)
                .orElseGet(() -> CredentialStatusDto.builder()
                        .authenticated(false)
                        .state(TokenState.UNAUTHENTICATED)
                        .build());
    }

    public CredentialStatusDto getDetailedStatus(Long credentialId) {
        return toStatus(store.require(credentialId));
    }

    public TokenState stateOf(AdminCredential c) {
        if (c == null) return TokenState.UNAUTHENTICATED;
        if (!c.isActive()) return TokenState.DEACTIVATED;
        if (c.getId() != null && inFlight.containsKey(c.getId())) return TokenState.REFRESHING;
        if (c.isTokenExpired(clock.instant())) return TokenState.EXPIRED;
        return TokenState.ACTIVE;
    }

    private CredentialStatusDto toStatus(AdminCredential c) {
        Instant now = clock.instant();
        Long untilExpiry = c.getTokenExpiresAt() == null ? null
                : Math.max(0L, Duration.between(now, c.getTokenExpiresAt()).getSeconds());
        boolean authenticated = c.isActive() && (!c.isTokenExpired(now) || !isBlank(c.getRefreshToken()));
        return CredentialStatusDto.builder()
                .authenticated(authenticated)
                .credentialId(c.getId())
                .state(stateOf(c))
                .accountEmail(c.getAccountEmail())
                .persistent(c.isPersistent())
                .sessionId(c.getPersistentSessionId())
                .tokenExpiresAt(c.getTokenExpiresAt())
                .timeUntilExpirySeconds(untilExpiry)
                .autoRefreshEnabled(c.isAutoRefreshEnabled())
                .active(c.isActive())
                .deactivatedReason(c.getDeactivatedReason())
                .refreshAttempts(c.getRefreshAttempts())
                .maxRefreshFailures(c.getMaxRefreshFailures())
                .lastRefreshAt(c.getLastRefreshAt())
                .lastActivityAt(c.getLastActivityAt())
                .quotaTotal(c.getDriveQuotaTotal())
                .quotaUsed(c.getDriveQuotaUsed())
                .usagePercentage(QuotaThresholdEngine.round2(c.usagePercentage()))
                .warningLevel(c.getQuotaWarningLevel())
                .lastQuotaCheck(c.getLastQuotaCheck())
                .build();
    }

    /** Single-flight refresh: a caller arriving mid-refresh waits for the running one. */
    private AdminCredential refresh(AdminCredential c) {
        CompletableFuture<AdminCredential> mine = new CompletableFuture<>();
        CompletableFuture<AdminCredential> running = inFlight.putIfAbsent(c.getId(), mine);
        if (running != null) {
            return await(running);
        }
        try {
            AdminCredential result = doRefresh(c);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(c.getId(), mine);
        }
    }

    private AdminCredential doRefresh(AdminCredential c) {
        try {
            TokenGrant grant = retry.execute("token_refresh", () -> provider.refreshAccessToken(c.getRefreshToken()));
            AdminCredential updated = store.applyRefreshSuccess(c.getId(), grant, clock.instant());
            log.info("Admin Drive credential {} refreshed, expires {}", c.getId(), updated.getTokenExpiresAt());
            return updated;
        } catch (ProviderException e) {
            boolean invalidGrant = e.kind() == ProviderException.Kind.INVALID_GRANT;
            CredentialStore.RefreshFailure failure =
                    store.applyRefreshFailure(c.getId(), c.getTokenExpiresAt(), invalidGrant, clock.instant());
            if (failure.concurrentlyRefreshed()) {
                return failure.credential();
            }
            if (failure.deactivated()) {
                throw new CredentialException(CredentialException.Kind.DEACTIVATED,
                        "Admin Drive credential deactivated (" + failure.credential().getDeactivatedReason()
                                + "); re-authentication required", e);
            }
            throw new CredentialException(CredentialException.Kind.REFRESH_FAILED,
                    "Token refresh failed (" + e.kind() + "), attempt "
                            + failure.credential().getRefreshAttempts() + "/" + failure.credential().getMaxRefreshFailures(), e);
        }
    }

    private static AdminCredential await(CompletableFuture<AdminCredential> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private static void requireConfirmation(Boolean confirm) {
        if (!Boolean.TRUE.equals(confirm)) {
            throw new ValidationException(ValidationException.Kind.MISSING_CONFIRMATION,
                    "Revoking the persistent session requires confirm=true");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
