package com.portfoliosync.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and bean definitions for Kite Connect API integration.
 *
 * <p>Binds to the {@code kite.*} prefix. API keys and secrets are per account (stored on
 * the account record), so this class only carries endpoints and timeouts. Provides:
 * <ul>
 *   <li>A {@link RestClient} bean for the Kite REST endpoints the SDK does not cover
 *       (order margin calculation), with a bounded read timeout.</li>
 *   <li>The login URL template used for the manual OAuth flow.</li>
 *   <li>Headless-browser settings for automated login.</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    /** Root of the Kite Connect REST API. */
    private String apiRoot = "https://api.kite.trade";

    /** Kite OAuth login URL template; {@code %s} is replaced with the account's API key. */
    private String loginUrl = "https://kite.zerodha.com/connect/login?v=3&api_key=%s";

    private MarginCalculation marginCalculation = new MarginCalculation();

    private AutoLogin autoLogin = new AutoLogin();

    @Bean
    public RestClient kiteRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(marginCalculation.getConnectTimeout());
        requestFactory.setReadTimeout(marginCalculation.getTimeout());
        return RestClient.builder()
                .baseUrl(apiRoot)
                .requestFactory(requestFactory)
                .defaultHeader("X-Kite-Version", "3")
                .build();
    }

    public String loginUrlFor(String apiKey) {
        return String.format(loginUrl, apiKey);
    }

    /** Masks a key or token for logging, keeping the first four characters. */
    public static String mask(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }

    @Getter
    @Setter
    public static class MarginCalculation {

        private Duration connectTimeout = Duration.ofSeconds(5);

        /** Upper bound for one batched margin calculation request. */
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class AutoLogin {

        /** Run Chromium headless. Turn off to watch the login flow. */
        private boolean headless = true;

        /** Wait for each login form element. */
        private Duration elementTimeout = Duration.ofSeconds(10);

        /** Wait for the OAuth redirect carrying the request token. */
        private Duration redirectTimeout = Duration.ofSeconds(30);
    }
}
