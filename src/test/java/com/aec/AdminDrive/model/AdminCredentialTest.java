package com.aec.AdminDrive.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AdminCredentialTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private AdminCredential credential(Instant expiresAt) {
        return AdminCredential.builder()
                .id(1L)
                .userId(10L)
                .accessToken("access")
                .refreshToken("refresh")
                .tokenExpiresAt(expiresAt)
                .build();
    }

    @Test
    void stale_inside_skew_window_but_not_expired() {
        AdminCredential c = credential(NOW.plus(Duration.ofMinutes(3)));

        assertFalse(c.isTokenExpired(NOW));
        assertTrue(c.isTokenStale(NOW, Duration.ofMinutes(5)));
        assertTrue(c.needsRefresh(NOW, Duration.ofMinutes(5)));

        c.setAutoRefreshEnabled(false);
        assertFalse(c.needsRefresh(NOW, Duration.ofMinutes(5)));
    }

    @Test
    void failure_budget_is_exhausted_at_max() {
        AdminCredential c = credential(NOW);
        c.setMaxRefreshFailures(3);

        assertFalse(c.recordRefreshFailure(NOW));
        assertFalse(c.recordRefreshFailure(NOW));
        assertTrue(c.recordRefreshFailure(NOW));
        assertEquals(3, c.getRefreshAttempts());
    }

    @Test
    void successful_refresh_resets_attempts_and_keeps_refresh_token_when_omitted() {
        AdminCredential c = credential(NOW);
        c.recordRefreshFailure(NOW);

        c.recordRefreshSuccess("access-2", null, NOW.plusSeconds(3600), NOW);

        assertEquals("access-2", c.getAccessToken());
        assertEquals("refresh", c.getRefreshToken());
        assertEquals(0, c.getRefreshAttempts());
        assertEquals(NOW, c.getLastRefreshAt());
    }

    @Test
    void warning_level_follows_usage_ratio() {
        AdminCredential c = credential(NOW);

        QuotaWarningLevel before = c.applyQuotaSnapshot(100L, 91L, NOW);

        assertEquals(QuotaWarningLevel.NONE, before);
        assertEquals(QuotaWarningLevel.HIGH, c.getQuotaWarningLevel());
        assertEquals(91.0, c.usagePercentage());

        assertEquals(QuotaWarningLevel.HIGH, c.applyQuotaSnapshot(0L, 0L, NOW));
        assertEquals(QuotaWarningLevel.NONE, c.getQuotaWarningLevel());
    }

    @Test
    void warning_history_keeps_the_latest_entries() {
        AdminCredential c = credential(NOW);
        for (int i = 0; i < 25; i++) {
            c.appendWarningRecord(QuotaWarningRecord.builder()
                    .timestamp(NOW.plusSeconds(i))
                    .oldLevel(QuotaWarningLevel.NONE)
                    .newLevel(QuotaWarningLevel.LOW)
                    .usagePercentage(80 + i / 10.0)
                    .alertSent(true)
                    .build(), 20);
        }

        List<QuotaWarningRecord> history = c.getQuotaWarningsSent();
        assertThat(history).hasSize(20);
        assertEquals(NOW.plusSeconds(5), history.get(0).getTimestamp());
        assertEquals(NOW.plusSeconds(24), history.get(19).getTimestamp());
    }

    @Test
    void reactivation_clears_deactivation() {
        AdminCredential c = credential(NOW);
        c.recordRefreshFailure(NOW);
        c.deactivate("revoked", NOW);
        assertFalse(c.isActive());

        c.reactivate();

        assertTrue(c.isActive());
        assertNull(c.getDeactivatedReason());
        assertNull(c.getDeactivatedAt());
        assertEquals(0, c.getRefreshAttempts());
    }
}
