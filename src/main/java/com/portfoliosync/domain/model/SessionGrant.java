package com.portfoliosync.domain.model;

import lombok.Builder;
import lombok.Getter;

/** Result of exchanging a request token for an access token. */
@Getter
@Builder
public class SessionGrant {

    private final String accessToken;
    private final String userId;
    private final String userName;
}
