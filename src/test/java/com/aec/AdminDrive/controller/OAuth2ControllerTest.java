package com.aec.AdminDrive.controller;

import com.aec.AdminDrive.Repository.AdminCredentialRepository;
import com.aec.AdminDrive.Repository.OAuthStateNonceRepository;
import com.aec.AdminDrive.drive.DriveProviderClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class OAuth2ControllerTest {

    @MockBean
    DriveProviderClient provider;

    @Autowired
    MockMvc mvc;

    @Autowired
    AdminCredentialRepository credentials;

    @Autowired
    OAuthStateNonceRepository nonces;

    @BeforeEach
    void clean() {
        credentials.deleteAll();
        nonces.deleteAll();
    }

    private static RequestPostProcessor admin() {
        return jwt().jwt(j -> j.claim("userId", 7L).claim("role", "ROL_ADMIN"))
                .authorities(new SimpleGrantedAuthority("ROL_ADMIN"));
    }

    @Test
    void admin_api_requires_a_token() throws Exception {
        mvc.perform(get("/api/admin/drive/oauth2/status"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void non_admin_role_is_forbidden() throws Exception {
        mvc.perform(get("/api/admin/drive/oauth2/status")
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROL_CLIENTE"))))
                .andExpect(status().isForbidden());
    }

    @Test
    void status_without_credential_is_unauthenticated() throws Exception {
        mvc.perform(get("/api/admin/drive/oauth2/status").with(admin()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false))
                .andExpect(jsonPath("$.state").value("UNAUTHENTICATED"));
    }

    @Test
    void authorization_url_carries_a_state() throws Exception {
        when(provider.buildAuthorizationUrl(anyString()))
                .thenAnswer(inv -> "https://accounts.google.com/o/oauth2/auth?state=" + inv.getArgument(0));

        mvc.perform(get("/api/admin/drive/oauth2/url").with(admin()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authorizationUrl", startsWith("https://accounts.google.com/o/oauth2/auth?state=")));
    }

    @Test
    void refresh_without_credential_asks_to_reauthenticate() throws Exception {
        mvc.perform(post("/api/admin/drive/oauth2/refresh").with(admin()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"))
                .andExpect(jsonPath("$.action").value("REAUTHENTICATE"));
    }

    @Test
    void revoke_without_confirm_is_a_bad_request() throws Exception {
        mvc.perform(post("/api/admin/drive/oauth2/revoke").with(admin()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_CONFIRMATION"));
    }

    @Test
    void callback_is_public_and_rejects_unknown_state() throws Exception {
        mvc.perform(get("/api/admin/drive/oauth2/callback").param("code", "c").param("state", "forged"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"));
    }

    @Test
    void monitor_interval_below_minimum_is_rejected() throws Exception {
        mvc.perform(put("/api/admin/drive/monitor/config").with(admin())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"intervalMinutes\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INTERVAL"));
    }

    @Test
    void monitor_status_is_reported() throws Exception {
        mvc.perform(get("/api/admin/drive/monitor/status").with(admin()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intervalMinutes").value(60))
                .andExpect(jsonPath("$.running").value(false));
    }
}
