package com.aec.AdminDrive.drive;

import com.aec.AdminDrive.exception.ProviderException;

/**
 * Outbound calls to the storage provider. Every method performs blocking network I/O
 * and reports failures as a classified {@link ProviderException}.
 */
public interface DriveProviderClient {

    String buildAuthorizationUrl(String state);

    TokenGrant exchangeAuthorizationCode(String code);

    TokenGrant refreshAccessToken(String refreshToken);

    DriveQuota fetchStorageQuota(String accessToken);

    void revokeToken(String token);
}
