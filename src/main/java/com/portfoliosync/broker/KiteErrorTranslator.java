package com.portfoliosync.broker;

import com.portfoliosync.config.KiteConfig;
import com.portfoliosync.exception.BrokerErrorKind;
import com.portfoliosync.exception.BrokerException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.InputException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.PermissionException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;

/**
 * Turns Kite SDK and HTTP failures into classified {@link BrokerException}s.
 *
 * <p>A {@link TokenException} is always {@link BrokerErrorKind#TOKEN_EXPIRED}, whatever its
 * message says. Everything else is classified in this order:
 * <ol>
 *   <li>Explicit expiry wording ("expired", "token is invalid") is {@link BrokerErrorKind#TOKEN_EXPIRED}.</li>
 *   <li>Key or token wording ("api_key", "access_token", "invalid ... key/token") is
 *       {@link BrokerErrorKind#AUTHENTICATION}.</li>
 *   <li>HTTP 403 with no matching wording is token-expired.</li>
 *   <li>HTTP 401, {@link PermissionException} and {@link InputException} are authentication.</li>
 *   <li>Everything else is {@link BrokerErrorKind#OTHER}.</li>
 * </ol>
 *
 * <p>Token-expired errors carry a {@code loginUrl} detail so the caller can send the user
 * through the OAuth flow again.
 */
@Component
public class KiteErrorTranslator {

    public static final String LOGIN_URL_DETAIL = "loginUrl";

    private final KiteConfig kiteConfig;

    public KiteErrorTranslator(KiteConfig kiteConfig) {
        this.kiteConfig = kiteConfig;
    }

    public BrokerException translate(String operation, String apiKey, KiteException e) {
        if (e instanceof TokenException) {
            return build(BrokerErrorKind.TOKEN_EXPIRED, operation, apiKey, e.message, e);
        }
        // PermissionException is also a 403 but never means the token is gone
        BrokerErrorKind kind = classify(e.message, 0);
        if (kind == BrokerErrorKind.OTHER && (e instanceof PermissionException || e instanceof InputException)) {
            kind = BrokerErrorKind.AUTHENTICATION;
        }
        return build(kind, operation, apiKey, e.message, e);
    }

    public BrokerException translate(String operation, String apiKey, RestClientResponseException e) {
        BrokerErrorKind kind = classify(e.getResponseBodyAsString(), e.getStatusCode().value());
        return build(kind, operation, apiKey, e.getStatusText(), e);
    }

    /** For transport and parse failures (IO, JSON): never auth-shaped. */
    public BrokerException translate(String operation, Exception e) {
        return new BrokerException(BrokerErrorKind.OTHER, "Error during " + operation + ": " + e.getMessage(), e);
    }

    BrokerErrorKind classify(String message, int httpStatus) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);

        if (text.contains("expired") || text.contains("token is invalid")) {
            return BrokerErrorKind.TOKEN_EXPIRED;
        }
        if (text.contains("api_key")
                || text.contains("access_token")
                || (text.contains("invalid") && (text.contains("key") || text.contains("token")))) {
            return BrokerErrorKind.AUTHENTICATION;
        }
        if (httpStatus == HttpStatus.FORBIDDEN.value()) {
            return BrokerErrorKind.TOKEN_EXPIRED;
        }
        if (httpStatus == HttpStatus.UNAUTHORIZED.value()) {
            return BrokerErrorKind.AUTHENTICATION;
        }
        return BrokerErrorKind.OTHER;
    }

    private BrokerException build(
            BrokerErrorKind kind, String operation, String apiKey, String brokerMessage, Throwable cause) {
        String message = "Failed to " + operation + ": " + brokerMessage;
        if (kind != BrokerErrorKind.TOKEN_EXPIRED) {
            return new BrokerException(kind, message, cause);
        }
        Map<String, Object> details = new HashMap<>();
        details.put(LOGIN_URL_DETAIL, kiteConfig.loginUrlFor(apiKey));
        return new BrokerException(kind, message, details, cause);
    }
}
