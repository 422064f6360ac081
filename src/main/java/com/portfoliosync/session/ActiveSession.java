package com.portfoliosync.session;

import com.portfoliosync.broker.BrokerClient;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** The single authenticated broker session held by a {@link SessionManager}. Immutable. */
@Getter
@Builder
public class ActiveSession {

    /** API key the session was created for; only callers with the same key reuse it. */
    private final String ownerApiKey;

    private final String accessToken;
    private final String userId;
    private final Instant issuedAt;
    private final BrokerClient client;

    boolean hasToken() {
        return accessToken != null && !accessToken.isEmpty();
    }

    Duration age(Instant now) {
        return Duration.between(issuedAt, now);
    }

    boolean isLive(Instant now, Duration ttl) {
        return hasToken() && client != null && age(now).compareTo(ttl) < 0;
    }
}
