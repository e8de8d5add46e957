package com.aec.AdminDrive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "admin-drive.credential")
public class CredentialProperties {
    /** Consecutive refresh failures before the credential is deactivated. */
    private int maxRefreshFailures = 5;
    /** Tokens expiring within this window are refreshed before being handed out. */
    private Duration expirySkew = Duration.ofMinutes(5);
    private boolean proactiveRefreshEnabled = true;
    private Duration proactiveRefreshInterval = Duration.ofMinutes(15);
}
