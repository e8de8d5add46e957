package com.aec.AdminDrive.config;

import com.aec.AdminDrive.exception.ConfigException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupConfigValidator {

    private final OAuthProperties oauth;
    private final CredentialProperties credential;
    private final StorageMonitorProperties monitor;
    private final RetryProperties retry;

    @PostConstruct
    void validate() {
        if (isBlank(oauth.getClientId()) || isBlank(oauth.getClientSecret()) || isBlank(oauth.getRedirectUri())) {
            throw new ConfigException(ConfigException.Kind.MISSING_CREDENTIALS,
                    "google.oauth.client-id, client-secret and redirect-uri must be set");
        }
        if (monitor.getIntervalMinutes() < StorageMonitorProperties.MIN_INTERVAL_MINUTES) {
            throw new ConfigException(ConfigException.Kind.INVALID_INTERVAL,
                    "admin-drive.monitor.interval-minutes must be at least "
                            + StorageMonitorProperties.MIN_INTERVAL_MINUTES + ", got " + monitor.getIntervalMinutes());
        }
        if (credential.getMaxRefreshFailures() <= 0) {
            throw new IllegalStateException("admin-drive.credential.max-refresh-failures must be positive");
        }
        if (retry.getMaxAttempts() <= 0) {
            throw new IllegalStateException("admin-drive.retry.max-attempts must be positive");
        }
        log.info("Admin drive config OK: monitor every {} min (enabled={}), max refresh failures {}, retry attempts {}",
                monitor.getIntervalMinutes(), monitor.isEnabled(), credential.getMaxRefreshFailures(), retry.getMaxAttempts());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
