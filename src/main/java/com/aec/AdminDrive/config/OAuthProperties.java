package com.aec.AdminDrive.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "google.oauth")
public class OAuthProperties {
    private String clientId;
    private String clientSecret;
    private String redirectUri; // .../api/admin/drive/oauth2/callback
    private List<String> scopes = new ArrayList<>(List.of("https://www.googleapis.com/auth/drive"));
    /** Lifetime of an issued authorization "state". */
    private Duration stateTtl = Duration.ofMinutes(10);
    private String applicationName = "AEC-AdminDrive";

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
    public String getRedirectUri() { return redirectUri; }
    public void setRedirectUri(String redirectUri) { this.redirectUri = redirectUri; }
    public List<String> getScopes() { return scopes; }
    public void setScopes(List<String> scopes) { this.scopes = scopes; }
    public Duration getStateTtl() { return stateTtl; }
    public void setStateTtl(Duration stateTtl) { this.stateTtl = stateTtl; }
    public String getApplicationName() { return applicationName; }
    public void setApplicationName(String applicationName) { this.applicationName = applicationName; }
}
