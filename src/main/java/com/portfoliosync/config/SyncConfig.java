package com.portfoliosync.config;

import java.time.Clock;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Session, retry and account-sync settings bound to the {@code sync.*} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "sync")
@Getter
@Setter
public class SyncConfig {

    private Session session = new Session();

    private RetryPolicy retry = new RetryPolicy();

    private Accounts accounts = new Accounts();

    private Margins margins = new Margins();

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Getter
    @Setter
    public static class Session {

        /** A session older than this is treated as dead on next use. */
        private Duration ttl = Duration.ofHours(8);
    }

    @Getter
    @Setter
    public static class RetryPolicy {

        private int maxAttempts = 2;

        /** Linear backoff unit: the wait after attempt n is n times this. */
        private Duration backoff = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Accounts {

        /** Pause between accounts during sync-all. */
        private Duration pauseBetween = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Margins {

        private String segment = "equity";
    }
}
