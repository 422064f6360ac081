package com.portfoliosync.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for editing a Kite account. Null fields are left unchanged, so a client can
 * rotate a single credential (for example a fresh request token) without resending the rest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAccountRequest {

    @Size(min = 1, max = 100, message = "Account name must be 1 to 100 characters")
    private String name;

    @Size(max = 64)
    private String apiKey;

    @Size(max = 64)
    private String apiSecret;

    @Size(max = 64)
    private String requestToken;

    @Size(max = 20)
    private String userId;

    @Size(max = 100)
    private String password;

    @Size(max = 64)
    private String totpSecret;

    @Size(max = 255)
    private String description;
}
