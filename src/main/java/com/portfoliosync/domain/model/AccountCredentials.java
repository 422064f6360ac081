package com.portfoliosync.domain.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Authentication material of one brokerage account for a single sync call.
 *
 * <p>The request token is short-lived and refreshed out-of-band (OAuth redirect or
 * automated login); a new instance is built from the account record on every call.
 */
@Getter
@Builder
public class AccountCredentials {

    private final String apiKey;
    private final String apiSecret;
    private final String requestToken;
}
