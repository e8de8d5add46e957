package com.aec.AdminDrive.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "admin-drive.credential", name = "proactive-refresh-enabled", havingValue = "true", matchIfMissing = true)
public class TokenRefreshWorker {

    private final TokenLifecycleService lifecycle;

    @Scheduled(fixedDelayString = "${admin-drive.credential.proactive-refresh-interval:PT15M}",
               initialDelayString = "${admin-drive.credential.proactive-refresh-interval:PT15M}")
    public void runOnce() {
        try {
            int refreshed = lifecycle.refreshExpiringCredentials();
            if (refreshed > 0) {
                log.info("Proactive refresh renewed {} admin Drive credential(s)", refreshed);
            }
        } catch (Exception e) {
            log.error("Proactive token refresh pass failed", e);
        }
    }
}
