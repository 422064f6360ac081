package com.portfoliosync.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Session diagnostics with durations in milliseconds. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionHealthResponse {

    private boolean authenticated;
    private boolean hasValidToken;
    private long sessionAgeMs;
    private long timeUntilExpiryMs;
    private String userId;
    private Instant issuedAt;
}
