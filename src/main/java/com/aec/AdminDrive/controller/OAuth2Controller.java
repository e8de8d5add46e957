package com.aec.AdminDrive.controller;

import com.aec.AdminDrive.dto.CredentialStatusDto;
import com.aec.AdminDrive.dto.OAuthCallbackResult;
import com.aec.AdminDrive.dto.RevokeResult;
import com.aec.AdminDrive.dto.TokenRefreshResult;
import com.aec.AdminDrive.service.OAuthSessionBridge;
import com.aec.AdminDrive.service.TokenLifecycleService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/admin/drive/oauth2")
@RequiredArgsConstructor
public class OAuth2Controller {

    private final OAuthSessionBridge bridge;
    private final TokenLifecycleService lifecycle;

    @GetMapping("/url")
    public ResponseEntity<Map<String, String>> authUrl(@AuthenticationPrincipal Jwt jwt, HttpServletRequest request) {
        String url = bridge.initiateOAuth(adminUserId(jwt), request.getSession(true));
        return ResponseEntity.ok(Map.of("authorizationUrl", url));
    }

    @GetMapping("/callback")
    public ResponseEntity<OAuthCallbackResult> callback(@RequestParam(value = "code", required = false) String code,
                                                        @RequestParam(value = "state", required = false) String state,
                                                        HttpServletRequest request) {
        return ResponseEntity.ok(bridge.handleOAuthCallback(code, state, request.getSession(false)));
    }

    @PostMapping("/refresh")
    public ResponseEntity<TokenRefreshResult> refresh() {
        return ResponseEntity.ok(lifecycle.forceTokenRefresh());
    }

    @GetMapping("/status")
    public ResponseEntity<CredentialStatusDto> status() {
        return ResponseEntity.ok(lifecycle.getDetailedStatus());
    }

    @PostMapping("/revoke")
    public ResponseEntity<RevokeResult> revoke(@RequestParam(value = "confirm", required = false) Boolean confirm) {
        return ResponseEntity.ok(lifecycle.revokePersistentSession(confirm));
    }

    /** Admin user id from the gateway-issued JWT: "userId" claim, else the numeric subject. */
    static Long adminUserId(Jwt jwt) {
        Object claim = jwt.getClaims().get("userId");
        if (claim instanceof Number n) return n.longValue();
        String raw = claim != null ? claim.toString() : jwt.getSubject();
        try {
            return Long.valueOf(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("JWT carries no numeric user id");
        }
    }
}
