package com.aec.AdminDrive.model;

import java.util.Locale;

/**
 * Storage warning tier. Declaration order is severity order, so {@link #compareTo} is meaningful.
 */
public enum QuotaWarningLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHigherThan(QuotaWarningLevel other) {
        return other == null ? this != NONE : compareTo(other) > 0;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
