package com.portfoliosync.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.portfoliosync.broker.BrokerClient;
import com.portfoliosync.broker.KiteErrorTranslator;
import com.portfoliosync.config.KiteConfig;
import com.portfoliosync.config.SyncConfig;
import com.portfoliosync.domain.model.AccountCredentials;
import com.portfoliosync.exception.BrokerErrorKind;
import com.portfoliosync.exception.BrokerException;
import com.portfoliosync.session.BrokerOperation;
import com.portfoliosync.session.RetryOrchestrator;
import com.portfoliosync.session.SessionManager;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link RetryOrchestrator}: which failures are retried, how the session
 * is reset between attempts, and the linear backoff.
 */
@ExtendWith(MockitoExtension.class)
class RetryOrchestratorTest {

    @Mock
    private SessionManager sessionManager;

    @Mock
    private BrokerClient brokerClient;

    private SyncConfig syncConfig;
    private RetryOrchestrator retryOrchestrator;

    private final AccountCredentials credentials = AccountCredentials.builder()
            .apiKey("api-key")
            .apiSecret("api-secret")
            .requestToken("request-token")
            .build();

    @BeforeEach
    void setUp() {
        syncConfig = new SyncConfig();
        syncConfig.getRetry().setBackoff(Duration.ofMillis(1));
        retryOrchestrator = new RetryOrchestrator(sessionManager, syncConfig);
    }

    /** Operation that throws the given failures in order, then returns "ok". */
    private static BrokerOperation<String> failingThen(AtomicInteger calls, RuntimeException... failures) {
        return client -> {
            int call = calls.getAndIncrement();
            if (call < failures.length) {
                throw failures[call];
            }
            return "ok";
        };
    }

    private static BrokerException authFailure() {
        return new BrokerException(BrokerErrorKind.AUTHENTICATION, "Invalid `api_key` or `access_token`.");
    }

    @Nested
    @DisplayName("Success path")
    class SuccessTests {

        @Test
        @DisplayName("runs the operation once against the ensured client")
        void succeedsFirstTime() {
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            AtomicInteger calls = new AtomicInteger();

            String result = retryOrchestrator.runWithRetry(failingThen(calls), credentials);

            assertThat(result).isEqualTo("ok");
            assertThat(calls.get()).isEqualTo(1);
            verify(sessionManager, never()).validateSession();
            verify(sessionManager, never()).resetSession();
        }

        @Test
        @DisplayName("passes the session's client to the operation")
        void passesClient() {
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);

            BrokerClient seen = retryOrchestrator.runWithRetry(client -> client, credentials);

            assertThat(seen).isSameAs(brokerClient);
        }
    }

    @Nested
    @DisplayName("Authentication failures")
    class AuthenticationTests {

        @Test
        @DisplayName("retries once after a reset and returns the second attempt's result")
        void authFailureThenSuccess() {
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            when(sessionManager.validateSession()).thenReturn(true);
            AtomicInteger calls = new AtomicInteger();

            String result = retryOrchestrator.runWithRetry(failingThen(calls, authFailure()), credentials, 2);

            assertThat(result).isEqualTo("ok");
            assertThat(calls.get()).isEqualTo(2);
            verify(sessionManager, times(1)).resetSession();

            InOrder order = inOrder(sessionManager);
            order.verify(sessionManager).ensureSession(credentials);
            order.verify(sessionManager).resetSession();
            order.verify(sessionManager).ensureSession(credentials);
            order.verify(sessionManager).validateSession();
        }

        @Test
        @DisplayName("propagates the last authentication failure when attempts run out")
        void authFailureExhaustsAttempts() {
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            when(sessionManager.validateSession()).thenReturn(true);
            BrokerException last = authFailure();
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() ->
                            retryOrchestrator.runWithRetry(failingThen(calls, authFailure(), last), credentials, 2))
                    .isSameAs(last);

            assertThat(calls.get()).isEqualTo(2);
            // reset only between attempts, not after the final one
            verify(sessionManager, times(1)).resetSession();
        }

        @Test
        @DisplayName("re-initializes the session when validation fails before a retry")
        void invalidSessionIsRebuilt() {
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            when(sessionManager.validateSession()).thenReturn(false);
            AtomicInteger calls = new AtomicInteger();

            String result = retryOrchestrator.runWithRetry(failingThen(calls, authFailure()), credentials, 2);

            assertThat(result).isEqualTo("ok");
            verify(sessionManager, times(2)).resetSession();
            verify(sessionManager, times(3)).ensureSession(credentials);
        }

        @Test
        @DisplayName("waits attempt × backoff before retrying")
        void linearBackoff() {
            syncConfig.getRetry().setBackoff(Duration.ofMillis(150));
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            when(sessionManager.validateSession()).thenReturn(true);
            AtomicInteger calls = new AtomicInteger();

            long start = System.nanoTime();
            retryOrchestrator.runWithRetry(failingThen(calls, authFailure(), authFailure()), credentials, 3);
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

            // 1 × 150 ms after attempt 1, 2 × 150 ms after attempt 2
            assertThat(elapsedMillis).isGreaterThanOrEqualTo(450);
            assertThat(calls.get()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Non-retryable failures")
    class NonRetryableTests {

        @Test
        @DisplayName("token expiry propagates at once with no reset and no second attempt")
        void tokenExpiredIsTerminal() {
            syncConfig.getRetry().setBackoff(Duration.ofSeconds(5));
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            BrokerException expired = new BrokerException(BrokerErrorKind.TOKEN_EXPIRED, "Token is invalid or has expired.");
            AtomicInteger calls = new AtomicInteger();

            long start = System.nanoTime();
            assertThatThrownBy(() -> retryOrchestrator.runWithRetry(failingThen(calls, expired), credentials, 2))
                    .isSameAs(expired);
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertThat(calls.get()).isEqualTo(1);
            assertThat(elapsedMillis).isLessThan(5000);
            verify(sessionManager, never()).resetSession();
            verify(sessionManager, never()).validateSession();
        }

        @Test
        @DisplayName("a translated Kite TokenException naming api_key / access_token is not retried")
        void translatedTokenExceptionIsTerminal() {
            syncConfig.getRetry().setBackoff(Duration.ofSeconds(5));
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            KiteErrorTranslator translator = new KiteErrorTranslator(new KiteConfig());
            AtomicInteger calls = new AtomicInteger();
            BrokerOperation<String> operation = client -> {
                calls.incrementAndGet();
                throw translator.translate(
                        "fetch holdings", "api-key", new TokenException("Incorrect `api_key` or `access_token`.", 403));
            };

            long start = System.nanoTime();
            assertThatThrownBy(() -> retryOrchestrator.runWithRetry(operation, credentials, 2))
                    .isInstanceOfSatisfying(BrokerException.class,
                            e -> assertThat(e.getKind()).isEqualTo(BrokerErrorKind.TOKEN_EXPIRED));
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertThat(calls.get()).isEqualTo(1);
            assertThat(elapsedMillis).isLessThan(5000);
            verify(sessionManager, never()).resetSession();
        }

        @Test
        @DisplayName("other broker errors propagate without a reset")
        void otherBrokerErrorIsTerminal() {
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            BrokerException other = new BrokerException("Gateway timeout");
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> retryOrchestrator.runWithRetry(failingThen(calls, other), credentials))
                    .isSameAs(other);

            assertThat(calls.get()).isEqualTo(1);
            verify(sessionManager, never()).resetSession();
        }

        @Test
        @DisplayName("non-broker exceptions propagate without a reset")
        void genericErrorIsTerminal() {
            when(sessionManager.ensureSession(credentials)).thenReturn(brokerClient);
            IllegalStateException failure = new IllegalStateException("store unavailable");
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> retryOrchestrator.runWithRetry(failingThen(calls, failure), credentials))
                    .isSameAs(failure);

            assertThat(calls.get()).isEqualTo(1);
            verify(sessionManager, never()).resetSession();
        }

        @Test
        @DisplayName("a failing session initialization propagates without running the operation")
        void ensureSessionFailurePropagates() {
            BrokerException expired = new BrokerException(BrokerErrorKind.TOKEN_EXPIRED, "Token is invalid or has expired.");
            when(sessionManager.ensureSession(credentials)).thenThrow(expired);
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> retryOrchestrator.runWithRetry(failingThen(calls), credentials))
                    .isSameAs(expired);

            assertThat(calls.get()).isZero();
        }
    }
}
