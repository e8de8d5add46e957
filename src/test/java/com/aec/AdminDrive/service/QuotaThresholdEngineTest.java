package com.aec.AdminDrive.service;

import com.aec.AdminDrive.model.QuotaUsage;
import com.aec.AdminDrive.model.QuotaWarningLevel;
import com.aec.AdminDrive.model.StorageAlert;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class QuotaThresholdEngineTest {

    private static final long GIB = 1024L * 1024L * 1024L;

    @Test
    void level_is_monotonic_over_percentage() {
        QuotaWarningLevel previous = QuotaWarningLevel.NONE;
        for (int tenths = 0; tenths < 1000; tenths++) {
            QuotaWarningLevel level = QuotaThresholdEngine.levelFor(tenths / 10.0);
            assertThat(level.compareTo(previous)).isGreaterThanOrEqualTo(0);
            previous = level;
        }
        assertEquals(QuotaWarningLevel.CRITICAL, previous);
    }

    @Test
    void boundaries() {
        assertEquals(QuotaWarningLevel.NONE, QuotaThresholdEngine.levelFor(79.999));
        assertEquals(QuotaWarningLevel.LOW, QuotaThresholdEngine.levelFor(80.0));
        assertEquals(QuotaWarningLevel.LOW, QuotaThresholdEngine.levelFor(84.999));
        assertEquals(QuotaWarningLevel.MEDIUM, QuotaThresholdEngine.levelFor(85.0));
        assertEquals(QuotaWarningLevel.HIGH, QuotaThresholdEngine.levelFor(90.0));
        assertEquals(QuotaWarningLevel.HIGH, QuotaThresholdEngine.levelFor(94.999));
        assertEquals(QuotaWarningLevel.CRITICAL, QuotaThresholdEngine.levelFor(95.0));
    }

    @Test
    void zero_or_unset_quota_is_no_usage() {
        assertEquals(0.0, QuotaThresholdEngine.usagePercentage(0L, 0L));
        assertEquals(0.0, QuotaThresholdEngine.usagePercentage(null, 10L));
        assertEquals(0.0, QuotaThresholdEngine.usagePercentage(5L, null));
        assertEquals(QuotaWarningLevel.NONE, QuotaThresholdEngine.levelFor(0L, 0L));
    }

    @Test
    void twelve_of_fifteen_gb_is_exactly_eighty_percent_low() {
        double pct = QuotaThresholdEngine.usagePercentage(12 * GIB, 15 * GIB);
        assertEquals(80.0, pct);
        assertEquals(QuotaWarningLevel.LOW, QuotaThresholdEngine.levelFor(pct));
    }

    @Test
    void nine_and_a_half_of_ten_gb_is_critical() {
        double pct = QuotaThresholdEngine.usagePercentage(95 * GIB / 10, 10 * GIB);
        assertEquals(95.0, pct);
        assertEquals(QuotaWarningLevel.CRITICAL, QuotaThresholdEngine.levelFor(pct));
    }

    @Test
    void usage_converts_to_rounded_gigabytes() {
        QuotaUsage usage = QuotaThresholdEngine.usage(12 * GIB, 15 * GIB);
        assertEquals(15.0, usage.getTotalGb());
        assertEquals(12.0, usage.getUsedGb());
        assertEquals(3.0, usage.getAvailableGb());
        assertEquals(3 * GIB, usage.getAvailableBytes());
        assertEquals(80.0, usage.getUsagePercentage());
        assertEquals(QuotaWarningLevel.LOW, usage.getWarningLevel());
    }

    @Test
    void critical_alert_demands_immediate_action() {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        StorageAlert alert = QuotaThresholdEngine.buildAlert(96 * GIB, 100 * GIB, at);

        assertEquals(QuotaWarningLevel.CRITICAL, alert.getLevel());
        assertThat(alert.getMessage()).startsWith("CRITICAL").contains("96.0%").contains("4.0 GB");
        assertThat(alert.getRecommendations()).first().asString().contains("IMMEDIATE ACTION");
        assertEquals(at, alert.getTimestamp());
    }

    @Test
    void no_recommendations_without_warning() {
        assertThat(QuotaThresholdEngine.recommendations(QuotaWarningLevel.NONE)).isEmpty();
        assertThat(QuotaThresholdEngine.recommendations(QuotaWarningLevel.LOW)).isNotEmpty();
    }

    @Test
    void cleanup_advice_tightens_with_usage() {
        assertThat(QuotaThresholdEngine.cleanupRecommendations(92)).first().asString().startsWith("URGENT");
        assertThat(QuotaThresholdEngine.cleanupRecommendations(82)).contains("Review files larger than 50MB");
        assertThat(QuotaThresholdEngine.cleanupRecommendations(10)).contains("Monitor storage usage monthly");
    }
}
