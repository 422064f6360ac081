package com.portfoliosync.session;

import com.portfoliosync.broker.BrokerClient;
import com.portfoliosync.config.SyncConfig;
import com.portfoliosync.domain.model.AccountCredentials;
import com.portfoliosync.exception.BrokerErrorKind;
import com.portfoliosync.exception.BrokerException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs broker operations against a validated session and retries authentication failures.
 *
 * <p>Per attempt: ensure a session; from the second attempt on, probe it and rebuild it
 * if the probe fails; then run the operation. Only {@link BrokerErrorKind#AUTHENTICATION}
 * failures are retried, after a session reset and a linear backoff of
 * {@code attempt × sync.retry.backoff}. Token-expired and all other failures propagate on
 * the attempt that raised them. The backoff is a blocking sleep.
 *
 * <p>A fresh resilience4j {@link Retry} is built per call so attempt counters are never
 * shared between callers.
 */
@Service
public class RetryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetryOrchestrator.class);

    private final SessionManager sessionManager;
    private final SyncConfig.RetryPolicy retryPolicy;

    public RetryOrchestrator(SessionManager sessionManager, SyncConfig syncConfig) {
        this.sessionManager = sessionManager;
        this.retryPolicy = syncConfig.getRetry();
    }

    public <T> T runWithRetry(BrokerOperation<T> operation, AccountCredentials credentials) {
        return runWithRetry(operation, credentials, retryPolicy.getMaxAttempts());
    }

    public <T> T runWithRetry(BrokerOperation<T> operation, AccountCredentials credentials, int maxAttempts) {
        long backoffMillis = retryPolicy.getBackoff().toMillis();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(attempt -> attempt * backoffMillis)
                .retryOnException(RetryOrchestrator::isRetryable)
                .build();
        Retry retry = Retry.of("broker-operation", config);

        // fires before the backoff wait, only when another attempt follows
        retry.getEventPublisher().onRetry(event -> {
            log.warn("Authentication failure on attempt {}/{}, resetting session and retrying in {} ms: {}",
                    event.getNumberOfRetryAttempts(),
                    maxAttempts,
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null);
            sessionManager.resetSession();
        });

        AtomicInteger attempts = new AtomicInteger();
        return retry.executeSupplier(() -> attempt(operation, credentials, attempts.incrementAndGet()));
    }

    private <T> T attempt(BrokerOperation<T> operation, AccountCredentials credentials, int attempt) {
        BrokerClient client = sessionManager.ensureSession(credentials);

        if (attempt > 1 && !sessionManager.validateSession()) {
            log.info("Session invalid before attempt {}, re-initializing", attempt);
            sessionManager.resetSession();
            client = sessionManager.ensureSession(credentials);
        }

        return operation.execute(client);
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof BrokerException brokerException
                && brokerException.getKind() == BrokerErrorKind.AUTHENTICATION;
    }
}
