package com.portfoliosync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the accounts table.
 * One row per Kite brokerage account: API credentials, the latest request token captured
 * from the OAuth redirect or automated login, and the login material used by sync-all.
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "api_key", length = 64)
    private String apiKey;

    @Column(name = "api_secret", length = 64)
    private String apiSecret;

    @Column(name = "request_token", length = 64)
    private String requestToken;

    /** Kite login id (e.g. AB1234), used by automated login. */
    @Column(name = "user_id", length = 20)
    private String userId;

    @Column(length = 100)
    private String password;

    @Column(name = "totp_secret", length = 64)
    private String totpSecret;

    @Column(length = 255)
    private String description;

    @Builder.Default
    @Column(name = "is_active")
    private boolean active = true;

    @Column(name = "last_sync")
    private LocalDateTime lastSync;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
