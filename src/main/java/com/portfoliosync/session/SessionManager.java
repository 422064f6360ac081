package com.portfoliosync.session;

import com.portfoliosync.broker.BrokerClient;
import com.portfoliosync.broker.BrokerClientFactory;
import com.portfoliosync.config.KiteConfig;
import com.portfoliosync.config.SyncConfig;
import com.portfoliosync.domain.model.AccountCredentials;
import com.portfoliosync.domain.model.SessionGrant;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the one live broker session and serializes its creation.
 *
 * <p>Single-flight initialization: the first caller without a usable session publishes a
 * pending {@link CompletableFuture} under {@link #lock} and performs the token exchange
 * outside the lock. Concurrent callers find the pending future, wait for it, and then
 * reuse the installed session if it belongs to their API key. Only the thread whose
 * future is still the pending marker may install its result, so an exchange overtaken by
 * {@link #resetSession()} serves its own caller and is never published.
 *
 * <p>A session is usable while it has a token and is younger than {@code sync.session.ttl}.
 * Expiry is detected lazily on the next call; there is no background timer.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final BrokerClientFactory brokerClientFactory;
    private final Clock clock;
    private final Duration sessionTtl;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile ActiveSession activeSession;

    /** Guarded by {@link #lock}. Non-null while an exchange is in flight. */
    private CompletableFuture<ActiveSession> pendingInitialization;

    public SessionManager(BrokerClientFactory brokerClientFactory, Clock clock, SyncConfig syncConfig) {
        this.brokerClientFactory = brokerClientFactory;
        this.clock = clock;
        this.sessionTtl = syncConfig.getSession().getTtl();
    }

    /**
     * Returns an authenticated client for the given credentials, creating the session if
     * needed.
     *
     * @throws com.portfoliosync.exception.BrokerException if the token exchange fails; the
     *     session is cleared and the original exception propagates unchanged
     */
    public BrokerClient ensureSession(AccountCredentials credentials) {
        while (true) {
            CompletableFuture<ActiveSession> pending;
            boolean owner = false;

            lock.lock();
            try {
                ActiveSession current = activeSession;
                if (current != null
                        && current.isLive(clock.instant(), sessionTtl)
                        && current.getOwnerApiKey().equals(credentials.getApiKey())) {
                    return current.getClient();
                }
                if (pendingInitialization != null) {
                    pending = pendingInitialization;
                } else {
                    pending = new CompletableFuture<>();
                    pendingInitialization = pending;
                    owner = true;
                }
            } finally {
                lock.unlock();
            }

            if (owner) {
                return initialize(credentials, pending).getClient();
            }

            log.debug("Waiting for in-flight session initialization");
            pending.handle((session, error) -> null).join();
            // loop: re-check for a live session with this API key, or start our own
        }
    }

    private ActiveSession initialize(AccountCredentials credentials, CompletableFuture<ActiveSession> marker) {
        log.info("Initializing broker session for API key {}", KiteConfig.mask(credentials.getApiKey()));
        try {
            BrokerClient client = brokerClientFactory.create(credentials.getApiKey());
            SessionGrant grant = client.exchangeSession(credentials.getRequestToken(), credentials.getApiSecret());

            ActiveSession session = ActiveSession.builder()
                    .ownerApiKey(credentials.getApiKey())
                    .accessToken(grant.getAccessToken())
                    .userId(grant.getUserId())
                    .issuedAt(clock.instant())
                    .client(client)
                    .build();

            lock.lock();
            try {
                if (pendingInitialization == marker) {
                    activeSession = session;
                    pendingInitialization = null;
                    log.info("Broker session established for user {} (token {})",
                            grant.getUserId(), KiteConfig.mask(grant.getAccessToken()));
                } else {
                    log.info("Session was reset during initialization; not publishing session for user {}",
                            grant.getUserId());
                }
            } finally {
                lock.unlock();
            }

            marker.complete(session);
            return session;
        } catch (RuntimeException | Error e) {
            lock.lock();
            try {
                if (pendingInitialization == marker) {
                    activeSession = null;
                    pendingInitialization = null;
                }
            } finally {
                lock.unlock();
            }
            log.error("Broker session initialization failed: {}", e.getMessage());
            marker.completeExceptionally(e);
            throw e;
        }
    }

    /** Drops the session and any pending initialization marker. */
    public void resetSession() {
        lock.lock();
        try {
            activeSession = null;
            pendingInitialization = null;
        } finally {
            lock.unlock();
        }
        log.info("Broker session reset");
    }

    public boolean isAuthenticated() {
        ActiveSession session = activeSession;
        return session != null && session.isLive(clock.instant(), sessionTtl);
    }

    /**
     * Probes the live session with a profile call. Returns false when there is no session;
     * on a failed probe the session is reset first.
     */
    public boolean validateSession() {
        ActiveSession session = activeSession;
        if (session == null || session.getClient() == null) {
            return false;
        }
        try {
            session.getClient().getProfile();
            return true;
        } catch (RuntimeException e) {
            log.warn("Session validation failed: {}", e.getMessage());
            resetSession();
            return false;
        }
    }

    public SessionHealth getSessionHealth() {
        ActiveSession session = activeSession;
        if (session == null) {
            return SessionHealth.builder()
                    .authenticated(false)
                    .hasValidToken(false)
                    .sessionAge(Duration.ZERO)
                    .timeUntilExpiry(Duration.ZERO)
                    .build();
        }

        Instant now = clock.instant();
        Duration age = session.age(now);
        Duration remaining = sessionTtl.minus(age);
        return SessionHealth.builder()
                .authenticated(session.isLive(now, sessionTtl))
                .hasValidToken(session.hasToken())
                .sessionAge(age)
                .timeUntilExpiry(remaining.isNegative() ? Duration.ZERO : remaining)
                .userId(session.getUserId())
                .issuedAt(session.getIssuedAt())
                .build();
    }
}
