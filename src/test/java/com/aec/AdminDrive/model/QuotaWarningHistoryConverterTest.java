package com.aec.AdminDrive.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class QuotaWarningHistoryConverterTest {

    private final QuotaWarningHistoryConverter converter = new QuotaWarningHistoryConverter();

    @Test
    void stores_levels_and_iso_timestamps() {
        QuotaWarningRecord record = QuotaWarningRecord.builder()
                .timestamp(Instant.parse("2026-05-01T08:00:00Z"))
                .oldLevel(QuotaWarningLevel.LOW)
                .newLevel(QuotaWarningLevel.CRITICAL)
                .usagePercentage(96.5)
                .alertSent(true)
                .build();

        String json = converter.convertToDatabaseColumn(List.of(record));

        assertThat(json).contains("\"CRITICAL\"").contains("2026-05-01T08:00:00Z");
        assertEquals(List.of(record), converter.convertToEntityAttribute(json));
    }

    @Test
    void empty_column_reads_as_mutable_empty_list() {
        List<QuotaWarningRecord> none = converter.convertToEntityAttribute(null);
        assertTrue(none.isEmpty());
        none.add(new QuotaWarningRecord());
        assertEquals("[]", converter.convertToDatabaseColumn(null));
    }
}
