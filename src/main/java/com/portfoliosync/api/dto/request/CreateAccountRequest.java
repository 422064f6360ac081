package com.portfoliosync.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a Kite account.
 * Only the name is required; credentials can be filled in later, but sync needs them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "Account name is required")
    @Size(max = 100, message = "Account name must be 100 characters or less")
    private String name;

    @Size(max = 64)
    private String apiKey;

    @Size(max = 64)
    private String apiSecret;

    /** Kite login id, used by automated login. */
    @Size(max = 20)
    private String userId;

    @Size(max = 100)
    private String password;

    /** Base32 TOTP secret from the Kite 2FA setup. */
    @Size(max = 64)
    private String totpSecret;

    @Size(max = 255)
    private String description;
}
