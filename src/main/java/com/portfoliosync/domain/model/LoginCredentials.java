package com.portfoliosync.domain.model;

import lombok.Builder;
import lombok.Getter;

/** Input for automated Kite login: the user's Kite login plus the TOTP seed. */
@Getter
@Builder
public class LoginCredentials {

    private final String apiKey;
    private final String userId;
    private final String password;

    /** Base32-encoded TOTP secret from the Kite 2FA setup. */
    private final String totpSecret;
}
