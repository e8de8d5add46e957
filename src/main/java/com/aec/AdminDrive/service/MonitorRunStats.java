package com.aec.AdminDrive.service;

import com.aec.AdminDrive.dto.MonitorStatsSnapshot;

import java.time.Duration;
import java.time.Instant;

final class MonitorRunStats {

    private Instant serviceStarted;
    private Instant lastCheck;
    private long totalChecks;
    private long totalAlertsSent;
    private String lastError;
    private int consecutiveErrors;

    synchronized void markStarted(Instant at) {
        serviceStarted = at;
    }

    synchronized void recordPass(Instant at, int alertsSent, String error) {
        lastCheck = at;
        totalChecks++;
        totalAlertsSent += alertsSent;
        if (error == null) {
            consecutiveErrors = 0;
        } else {
            lastError = error;
            consecutiveErrors++;
        }
    }

    synchronized void recordError(Instant at, String error) {
        lastError = error;
        consecutiveErrors++;
    }

    synchronized int consecutiveErrors() {
        return consecutiveErrors;
    }

    synchronized MonitorStatsSnapshot snapshot(Instant now) {
        return MonitorStatsSnapshot.builder()
                .serviceStarted(serviceStarted)
                .lastCheck(lastCheck)
                .totalChecks(totalChecks)
                .totalAlertsSent(totalAlertsSent)
                .lastError(lastError)
                .consecutiveErrors(consecutiveErrors)
                .uptimeSeconds(serviceStarted == null ? null : Duration.between(serviceStarted, now).getSeconds())
                .build();
    }
}
