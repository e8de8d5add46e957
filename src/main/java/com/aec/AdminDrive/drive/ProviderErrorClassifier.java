package com.aec.AdminDrive.drive;

import com.aec.AdminDrive.exception.ProviderException;
import com.aec.AdminDrive.exception.ProviderException.Kind;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;

import java.io.IOException;
import java.util.Set;

public final class ProviderErrorClassifier {

    private static final Set<String> RATE_LIMIT_REASONS =
            Set.of("rateLimitExceeded", "userRateLimitExceeded");

    private ProviderErrorClassifier() {}

    public static Kind classify(int status, String oauthError, String reason) {
        if ("invalid_grant".equals(oauthError)) return Kind.INVALID_GRANT;
        if (status == 429) return Kind.RATE_LIMITED;
        if (status == 403 && reason != null && RATE_LIMIT_REASONS.contains(reason)) return Kind.RATE_LIMITED;
        return Kind.TRANSIENT;
    }

    public static ProviderException translate(String operation, IOException e) {
        if (e instanceof TokenResponseException tre) {
            String error = tre.getDetails() != null ? tre.getDetails().getError() : null;
            Kind kind = classify(tre.getStatusCode(), error, null);
            return new ProviderException(kind, tre.getStatusCode(),
                    operation + " failed: HTTP " + tre.getStatusCode() + (error != null ? " " + error : ""), e);
        }
        if (e instanceof GoogleJsonResponseException gjre) {
            String reason = firstReason(gjre.getDetails());
            Kind kind = classify(gjre.getStatusCode(), null, reason);
            return new ProviderException(kind, gjre.getStatusCode(),
                    operation + " failed: HTTP " + gjre.getStatusCode() + (reason != null ? " " + reason : ""), e);
        }
        if (e instanceof HttpResponseException hre) {
            Kind kind = classify(hre.getStatusCode(), null, null);
            return new ProviderException(kind, hre.getStatusCode(),
                    operation + " failed: HTTP " + hre.getStatusCode(), e);
        }
        return new ProviderException(Kind.TRANSIENT, null, operation + " failed: " + e.getClass().getSimpleName(), e);
    }

    private static String firstReason(GoogleJsonError details) {
        if (details == null || details.getErrors() == null || details.getErrors().isEmpty()) return null;
        return details.getErrors().get(0).getReason();
    }
}
