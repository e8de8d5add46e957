package com.aec.AdminDrive.drive;

import com.aec.AdminDrive.config.OAuthProperties;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.auth.oauth2.GoogleRefreshTokenRequest;
import com.google.api.client.googleapis.auth.oauth2.GoogleTokenResponse;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.UrlEncodedContent;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.About;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class GoogleDriveProviderClient implements DriveProviderClient {

    static final long DEFAULT_EXPIRES_IN_SECONDS = 3300;
    private static final String AUTH_URI = "https://accounts.google.com/o/oauth2/auth";
    private static final String TOKEN_URI = "https://oauth2.googleapis.com/token";
    private static final String REVOKE_URI = "https://oauth2.googleapis.com/revoke";

    private final OAuthProperties props;
    private final NetHttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final Clock clock;

    public GoogleDriveProviderClient(OAuthProperties props, NetHttpTransport httpTransport,
                                     JsonFactory jsonFactory, Clock clock) {
        this.props = props;
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.clock = clock;
    }

    private GoogleClientSecrets clientSecrets() {
        GoogleClientSecrets.Details web = new GoogleClientSecrets.Details()
            .setClientId(props.getClientId())
            .setClientSecret(props.getClientSecret())
            .setRedirectUris(List.of(props.getRedirectUri()))
            .setAuthUri(AUTH_URI)
            .setTokenUri(TOKEN_URI);
        return new GoogleClientSecrets().setWeb(web);
    }

    private GoogleAuthorizationCodeFlow buildFlow() {
        return new GoogleAuthorizationCodeFlow.Builder(
                httpTransport, jsonFactory, clientSecrets(), props.getScopes())
            .setAccessType("offline")
            .setApprovalPrompt("force")
            .build();
    }

    @Override
    public String buildAuthorizationUrl(String state) {
        return buildFlow().newAuthorizationUrl()
            .setRedirectUri(props.getRedirectUri())
            .setState(state)
            .setAccessType("offline")
            .setApprovalPrompt("force")
            .build();
    }

    @Override
    public TokenGrant exchangeAuthorizationCode(String code) {
        try {
            GoogleTokenResponse response = buildFlow().newTokenRequest(code)
                .setRedirectUri(props.getRedirectUri())
                .execute();
            return toGrant(response);
        } catch (IOException e) {
            throw ProviderErrorClassifier.translate("token exchange", e);
        }
    }

    @Override
    public TokenGrant refreshAccessToken(String refreshToken) {
        try {
            GoogleTokenResponse response = new GoogleRefreshTokenRequest(
                    httpTransport, jsonFactory,
                    refreshToken, props.getClientId(), props.getClientSecret())
                .execute();
            return toGrant(response);
        } catch (IOException e) {
            throw ProviderErrorClassifier.translate("token refresh", e);
        }
    }

    @Override
    public DriveQuota fetchStorageQuota(String accessToken) {
        Drive drive = new Drive.Builder(httpTransport, jsonFactory,
                request -> request.getHeaders().setAuthorization("Bearer " + accessToken))
            .setApplicationName(props.getApplicationName())
            .build();
        try {
            About about = drive.about().get()
                .setFields("user(emailAddress),storageQuota(limit,usage)")
                .execute();
            String email = about.getUser() != null ? about.getUser().getEmailAddress() : null;
            About.StorageQuota quota = about.getStorageQuota();
            return new DriveQuota(email,
                quota != null ? quota.getLimit() : null,
                quota != null ? quota.getUsage() : null);
        } catch (IOException e) {
            throw ProviderErrorClassifier.translate("quota read", e);
        }
    }

    @Override
    public void revokeToken(String token) {
        try {
            HttpResponse response = httpTransport.createRequestFactory()
                .buildPostRequest(new GenericUrl(REVOKE_URI), new UrlEncodedContent(Map.of("token", token)))
                .execute();
            response.disconnect();
        } catch (IOException e) {
            throw ProviderErrorClassifier.translate("token revoke", e);
        }
    }

    private TokenGrant toGrant(GoogleTokenResponse response) {
        Long expiresIn = response.getExpiresInSeconds();
        Instant expiresAt = clock.instant().plusSeconds(expiresIn != null ? expiresIn : DEFAULT_EXPIRES_IN_SECONDS);
        return TokenGrant.builder()
            .accessToken(response.getAccessToken())
            .refreshToken(response.getRefreshToken())
            .expiresAt(expiresAt)
            .scope(response.getScope())
            .build();
    }
}
