package com.portfoliosync.session;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Point-in-time view of the session for diagnostics. {@code sessionAge} and
 * {@code timeUntilExpiry} are zero when there is no session; the remaining time never
 * goes negative.
 */
@Getter
@Builder
public class SessionHealth {

    private final boolean authenticated;
    private final boolean hasValidToken;
    private final Duration sessionAge;
    private final Duration timeUntilExpiry;
    private final String userId;
    private final Instant issuedAt;
}
