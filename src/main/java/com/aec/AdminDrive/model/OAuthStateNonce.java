package com.aec.AdminDrive.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Anti-CSRF state for one authorization redirect. */
@Entity
@Table(name = "oauth_state_nonces", indexes = @Index(name = "idx_oauth_state_expires", columnList = "expiresAt"))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OAuthStateNonce {

    @Id
    @Column(length = 128)
    private String state;

    @Column(nullable = false)
    private Long adminUserId;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
