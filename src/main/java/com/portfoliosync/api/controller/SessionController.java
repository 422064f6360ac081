package com.portfoliosync.api.controller;

import com.portfoliosync.api.dto.response.SessionHealthResponse;
import com.portfoliosync.session.SessionHealth;
import com.portfoliosync.session.SessionManager;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Broker session diagnostics.
 *
 * <ul>
 *   <li>GET  /api/session/health - authentication state, age and time left</li>
 *   <li>POST /api/session/reset  - drop the session; the next sync logs in again</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private final SessionManager sessionManager;

    public SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping("/health")
    public SessionHealthResponse getHealth() {
        SessionHealth health = sessionManager.getSessionHealth();
        return SessionHealthResponse.builder()
                .authenticated(health.isAuthenticated())
                .hasValidToken(health.isHasValidToken())
                .sessionAgeMs(health.getSessionAge().toMillis())
                .timeUntilExpiryMs(health.getTimeUntilExpiry().toMillis())
                .userId(health.getUserId())
                .issuedAt(health.getIssuedAt())
                .build();
    }

    @PostMapping("/reset")
    public Map<String, String> reset() {
        sessionManager.resetSession();
        return Map.of("message", "Session reset");
    }
}
