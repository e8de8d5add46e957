package com.aec.AdminDrive.service;

import com.aec.AdminDrive.Repository.OAuthStateNonceRepository;
import com.aec.AdminDrive.config.OAuthProperties;
import com.aec.AdminDrive.drive.DriveProviderClient;
import com.aec.AdminDrive.drive.DriveQuota;
import com.aec.AdminDrive.drive.TokenGrant;
import com.aec.AdminDrive.dto.OAuthCallbackResult;
import com.aec.AdminDrive.exception.CredentialException;
import com.aec.AdminDrive.exception.ProviderException;
import com.aec.AdminDrive.model.AdminCredential;
import com.aec.AdminDrive.model.OAuthStateNonce;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

@Slf4j
@Service
public class OAuthSessionBridge {

    static final String SESSION_STATE = "admin_drive_oauth_state";
    static final String SESSION_USER = "admin_drive_oauth_user";
    static final String SESSION_EXPIRES = "admin_drive_oauth_expires";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final OAuthStateNonceRepository nonces;
    private final CredentialStore store;
    private final DriveProviderClient provider;
    private final RetryExecutor retry;
    private final StorageQuotaService quotaService;
    private final OAuthProperties props;
    private final Clock clock;

    public OAuthSessionBridge(OAuthStateNonceRepository nonces, CredentialStore store, DriveProviderClient provider,
                              RetryExecutor retry, StorageQuotaService quotaService,
                              OAuthProperties props, Clock clock) {
        this.nonces = nonces;
        this.store = store;
        this.provider = provider;
        this.retry = retry;
        this.quotaService = quotaService;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    public String initiateOAuth(Long adminUserId, HttpSession session) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(props.getStateTtl());
        String state = newState();

        nonces.save(OAuthStateNonce.builder()
                .state(state)
                .adminUserId(adminUserId)
                .createdAt(now)
                .expiresAt(expiresAt)
                .build());
        if (session != null) {
            session.setAttribute(SESSION_STATE, state);
            session.setAttribute(SESSION_USER, adminUserId);
            session.setAttribute(SESSION_EXPIRES, expiresAt);
        }
        log.info("OAuth handshake started for admin user {}, state valid until {}", adminUserId, expiresAt);
        return provider.buildAuthorizationUrl(state);
    }

    /**
     * Validates the state (database first, then session), exchanges the code and stores the credential.
     *
     * @throws CredentialException INVALID_STATE for unknown, expired or already used states
     */
    public OAuthCallbackResult handleOAuthCallback(String code, String state, HttpSession session) {
        Long adminUserId = consumeState(state, session);
        if (code == null || code.isBlank()) {
            throw new CredentialException(CredentialException.Kind.INVALID_STATE, "Missing authorization code");
        }

        TokenGrant grant = retry.execute("token_exchange", () -> provider.exchangeAuthorizationCode(code));

        String email = null;
        try {
            DriveQuota quota = retry.execute("quota_read", () -> provider.fetchStorageQuota(grant.getAccessToken()));
            email = quota.getAccountEmail();
        } catch (ProviderException e) {
            log.warn("Could not read account e-mail after OAuth exchange: {}", e.getMessage());
        }

        AdminCredential c = store.createOrUpdateFromGrant(adminUserId, grant, email, clock.instant());

        boolean quotaChecked = false;
        try {
            quotaService.checkStorageQuota(c.getId());
            quotaChecked = true;
        } catch (CredentialException | ProviderException e) {
            log.warn("Initial quota check for credential {} failed: {}", c.getId(), e.getMessage());
        }

        return OAuthCallbackResult.builder()
                .credentialId(c.getId())
                .accountEmail(c.getAccountEmail())
                .sessionId(c.getPersistentSessionId())
                .tokenExpiresAt(c.getTokenExpiresAt())
                .initialQuotaChecked(quotaChecked)
                .message("Admin Google Drive connected")
                .build();
    }

    @Scheduled(fixedDelayString = "${google.oauth.state-cleanup-interval:PT10M}")
    @Transactional
    public void cleanupExpiredStates() {
        int removed = nonces.deleteExpired(clock.instant());
        if (removed > 0) {
            log.info("Removed {} expired OAuth state(s)", removed);
        }
    }

    /** Single use: the state is removed from both stores once seen. */
    Long consumeState(String state, HttpSession session) {
        if (state == null || state.isBlank()) {
            throw invalidState("Missing OAuth state");
        }
        Instant now = clock.instant();

        Optional<OAuthStateNonce> durable = nonces.findById(state);
        if (durable.isPresent()) {
            OAuthStateNonce n = durable.get();
            int claimed = nonces.deleteByState(state);
            clearSession(session, state);
            if (claimed == 0) {
                throw invalidState("OAuth state already used");
            }
            if (n.isExpired(now)) {
                throw invalidState("OAuth state expired");
            }
            return n.getAdminUserId();
        }

        if (session != null && state.equals(session.getAttribute(SESSION_STATE))) {
            Object user = session.getAttribute(SESSION_USER);
            Object expires = session.getAttribute(SESSION_EXPIRES);
            clearSession(session, state);
            if (!(expires instanceof Instant exp) || !exp.isAfter(now)) {
                throw invalidState("OAuth state expired");
            }
            if (!(user instanceof Long userId)) {
                throw invalidState("OAuth state has no owner");
            }
            log.info("OAuth state resolved from HTTP session");
            return userId;
        }

        throw invalidState("Unknown OAuth state");
    }

    private static void clearSession(HttpSession session, String state) {
        if (session == null) return;
        try {
            if (state.equals(session.getAttribute(SESSION_STATE))) {
                session.removeAttribute(SESSION_STATE);
                session.removeAttribute(SESSION_USER);
                session.removeAttribute(SESSION_EXPIRES);
            }
        } catch (IllegalStateException e) {
            log.debug("HTTP session already invalidated");
        }
    }

    private static CredentialException invalidState(String message) {
        log.warn("OAuth callback rejected: {}", message);
        return new CredentialException(CredentialException.Kind.INVALID_STATE, message);
    }

    private static String newState() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
