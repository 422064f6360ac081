package com.portfoliosync.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Account as exposed over the API. Secrets are never returned; the flags tell the client
 * which parts of the login material are configured.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {

    private Long id;
    private String name;
    private String userId;
    private String description;
    private boolean active;
    private boolean hasApiCredentials;
    private boolean hasRequestToken;
    private boolean hasTotpSecret;
    private LocalDateTime lastSync;
    private LocalDateTime createdAt;
}
