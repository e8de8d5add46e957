package com.aec.AdminDrive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "admin-drive.monitor")
public class StorageMonitorProperties {
    public static final int MIN_INTERVAL_MINUTES = 5;

    private boolean enabled = true;
    private int intervalMinutes = 60;
    /** Wait after a failed pass, instead of the full interval. */
    private Duration errorRecoveryInterval = Duration.ofMinutes(5);
    private Duration stopTimeout = Duration.ofSeconds(10);
    private boolean autoStart = true;
    private int warningHistoryLimit = 20;
}
