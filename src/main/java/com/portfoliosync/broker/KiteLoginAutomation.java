package com.portfoliosync.broker;

import com.eatthepath.otp.TimeBasedOneTimePasswordGenerator;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.Request;
import com.portfoliosync.config.KiteConfig;
import com.portfoliosync.domain.model.LoginCredentials;
import com.portfoliosync.exception.BrokerException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.time.Clock;
import java.util.Locale;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Automates the Kite Connect OAuth login for one account using Playwright (Chromium).
 *
 * <p>Flow:
 * <ol>
 *   <li>Open the account's Kite login URL</li>
 *   <li>Submit user id and password</li>
 *   <li>Type the current TOTP code generated from the account's base32 secret</li>
 *   <li>Capture the outgoing redirect request and read {@code request_token} from it</li>
 * </ol>
 *
 * <p>The redirect target does not need to be reachable; only the request URL is used.
 *
 * <p>Requires Playwright browsers: {@code mvn exec:java -e -D exec.mainClass=com.microsoft.playwright.CLI
 * -D exec.args="install chromium"}
 */
@Service
public class KiteLoginAutomation implements LoginAutomation {

    private static final Logger log = LoggerFactory.getLogger(KiteLoginAutomation.class);

    private static final String USER_ID_INPUT = "input#userid";
    private static final String PASSWORD_INPUT = "input#password";
    private static final String SUBMIT_BUTTON = "button[type='submit']";
    private static final String TOTP_INPUT = "input[type='number'], input[type='text'][autocomplete='one-time-code']";

    private static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

    private final KiteConfig kiteConfig;
    private final Clock clock;

    public KiteLoginAutomation(KiteConfig kiteConfig, Clock clock) {
        this.kiteConfig = kiteConfig;
        this.clock = clock;
    }

    @Override
    public String obtainRequestToken(LoginCredentials credentials) {
        KiteConfig.AutoLogin autoLogin = kiteConfig.getAutoLogin();
        double elementTimeout = autoLogin.getElementTimeout().toMillis();
        double redirectTimeout = autoLogin.getRedirectTimeout().toMillis();

        log.info("Starting automated Kite login for user {}", credentials.getUserId());

        try (Playwright playwright = Playwright.create()) {
            BrowserType.LaunchOptions launchOptions =
                    new BrowserType.LaunchOptions().setHeadless(autoLogin.isHeadless());

            try (Browser browser = playwright.chromium().launch(launchOptions)) {
                Page page = browser.newPage();
                page.navigate(kiteConfig.loginUrlFor(credentials.getApiKey()));

                page.waitForSelector(USER_ID_INPUT, new Page.WaitForSelectorOptions().setTimeout(elementTimeout));
                page.fill(USER_ID_INPUT, credentials.getUserId());
                page.fill(PASSWORD_INPUT, credentials.getPassword());
                page.click(SUBMIT_BUTTON);

                page.waitForSelector(TOTP_INPUT, new Page.WaitForSelectorOptions().setTimeout(elementTimeout));
                String totp = generateTotp(credentials.getTotpSecret());

                // waitForRequest registers the listener before typing, so the redirect cannot be missed
                Request redirect = page.waitForRequest(
                        request -> request.url().contains("request_token="),
                        new Page.WaitForRequestOptions().setTimeout(redirectTimeout),
                        () -> page.locator(TOTP_INPUT)
                                .first()
                                .pressSequentially(totp, new Locator.PressSequentiallyOptions().setDelay(50)));

                String requestToken = extractRequestToken(redirect.url());
                if (requestToken == null || requestToken.isBlank()) {
                    throw new BrokerException("request_token not found in redirect URL");
                }

                log.info("Obtained request token for user {} via automated login", credentials.getUserId());
                return requestToken;
            }
        } catch (BrokerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BrokerException("Automated Kite login failed for user "
                    + credentials.getUserId() + ": " + e.getMessage(), e);
        }
    }

    /** RFC 6238 code (HMAC-SHA1, 6 digits, 30 s step) as Zerodha expects it, zero padded. */
    public String generateTotp(String base32Secret) {
        try {
            SecretKeySpec key = new SecretKeySpec(base32Decode(base32Secret), "HmacSHA1");
            int otp = new TimeBasedOneTimePasswordGenerator().generateOneTimePassword(key, clock.instant());
            return String.format("%06d", otp);
        } catch (InvalidKeyException | IllegalArgumentException e) {
            throw new BrokerException("Failed to generate TOTP: " + e.getMessage(), e);
        }
    }

    public static byte[] base32Decode(String base32) {
        String normalized = base32.replace("=", "").replace(" ", "").toUpperCase(Locale.ROOT);

        byte[] result = new byte[normalized.length() * 5 / 8];
        int buffer = 0;
        int bitsInBuffer = 0;
        int index = 0;

        for (char c : normalized.toCharArray()) {
            int value = BASE32_ALPHABET.indexOf(c);
            if (value < 0) {
                throw new IllegalArgumentException("Invalid base32 character: " + c);
            }
            buffer = (buffer << 5) | value;
            bitsInBuffer += 5;
            if (bitsInBuffer >= 8) {
                result[index++] = (byte) (buffer >> (bitsInBuffer - 8));
                bitsInBuffer -= 8;
                buffer &= (1 << bitsInBuffer) - 1;
            }
        }
        return result;
    }

    public static String extractRequestToken(String url) {
        String query;
        try {
            query = URI.create(url).getRawQuery();
        } catch (IllegalArgumentException e) {
            log.warn("Failed to parse redirect URL: {}", e.getMessage());
            return null;
        }
        if (query == null) {
            return null;
        }
        for (String param : query.split("&")) {
            String[] parts = param.split("=", 2);
            if (parts.length == 2 && "request_token".equals(parts[0])) {
                return URLDecoder.decode(parts[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
