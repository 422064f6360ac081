package com.portfoliosync.unit.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.portfoliosync.api.controller.SessionController;
import com.portfoliosync.config.ApiResponseAdvice;
import com.portfoliosync.exception.GlobalExceptionHandler;
import com.portfoliosync.session.SessionHealth;
import com.portfoliosync.session.SessionManager;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SessionManager sessionManager;

    @InjectMocks
    private SessionController sessionController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(sessionController)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/session/health reports age and time left in milliseconds")
    void health() throws Exception {
        when(sessionManager.getSessionHealth()).thenReturn(SessionHealth.builder()
                .authenticated(true)
                .hasValidToken(true)
                .sessionAge(Duration.ofMinutes(30))
                .timeUntilExpiry(Duration.ofHours(7).plusMinutes(30))
                .userId("AB1234")
                .build());

        mockMvc.perform(get("/api/session/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(true))
                .andExpect(jsonPath("$.data.hasValidToken").value(true))
                .andExpect(jsonPath("$.data.sessionAgeMs").value(1_800_000))
                .andExpect(jsonPath("$.data.timeUntilExpiryMs").value(27_000_000))
                .andExpect(jsonPath("$.data.userId").value("AB1234"));
    }

    @Test
    @DisplayName("GET /api/session/health with no session reports zeros")
    void healthWithoutSession() throws Exception {
        when(sessionManager.getSessionHealth()).thenReturn(SessionHealth.builder()
                .sessionAge(Duration.ZERO)
                .timeUntilExpiry(Duration.ZERO)
                .build());

        mockMvc.perform(get("/api/session/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(false))
                .andExpect(jsonPath("$.data.sessionAgeMs").value(0));
    }

    @Test
    @DisplayName("POST /api/session/reset drops the session")
    void reset() throws Exception {
        mockMvc.perform(post("/api/session/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Session reset"));

        verify(sessionManager).resetSession();
    }
}
