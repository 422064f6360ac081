package com.portfoliosync.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;

import com.portfoliosync.broker.KiteErrorTranslator;
import com.portfoliosync.config.KiteConfig;
import com.portfoliosync.exception.BrokerErrorKind;
import com.portfoliosync.exception.BrokerException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.GeneralException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.InputException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.NetworkException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.PermissionException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;

/**
 * Unit tests for {@link KiteErrorTranslator}: every broker failure gets exactly one kind,
 * and token expiry carries the re-login URL.
 */
class KiteErrorTranslatorTest {

    private KiteErrorTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new KiteErrorTranslator(new KiteConfig());
    }

    @Nested
    @DisplayName("Kite SDK exceptions")
    class SdkExceptionTests {

        @Test
        @DisplayName("token expiry wording is TOKEN_EXPIRED with a login URL")
        void tokenExpired() {
            TokenException cause = new TokenException("Token is invalid or has expired.", 403);

            BrokerException result = translator.translate("fetch holdings", "api-key", cause);

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.TOKEN_EXPIRED);
            assertThat(result.isTokenExpired()).isTrue();
            assertThat(result.getCause()).isSameAs(cause);
            assertThat(result.getMessage()).contains("fetch holdings").contains("Token is invalid");
            assertThat(result.getDetails())
                    .containsEntry(KiteErrorTranslator.LOGIN_URL_DETAIL,
                            "https://kite.zerodha.com/connect/login?v=3&api_key=api-key");
        }

        @Test
        @DisplayName("a TokenException naming api_key / access_token is still TOKEN_EXPIRED")
        void incorrectKeyOrTokenIsTokenExpired() {
            BrokerException result = translator.translate(
                    "fetch holdings", "api-key", new TokenException("Incorrect `api_key` or `access_token`.", 403));

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.TOKEN_EXPIRED);
            assertThat(result.getDetails()).containsKey(KiteErrorTranslator.LOGIN_URL_DETAIL);
        }

        @Test
        @DisplayName("a GeneralException naming api_key / access_token is AUTHENTICATION")
        void invalidKeyOrTokenOnGeneralException() {
            BrokerException result = translator.translate(
                    "fetch holdings", "api-key", new GeneralException("Invalid `api_key` or `access_token`.", 400));

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.AUTHENTICATION);
            assertThat(result.getDetails()).isEmpty();
        }

        @Test
        @DisplayName("a TokenException without recognisable wording is still TOKEN_EXPIRED")
        void bareTokenException() {
            BrokerException result =
                    translator.translate("fetch profile", "api-key", new TokenException("Session closed", 403));

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("expiry wording wins regardless of exception type")
        void expiryWordingOnGeneralException() {
            BrokerException result =
                    translator.translate("fetch margins", "api-key", new GeneralException("Session expired", 500));

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("PermissionException is AUTHENTICATION, not token expiry")
        void permissionException() {
            BrokerException result = translator.translate(
                    "fetch positions", "api-key", new PermissionException("Insufficient permission for that call.", 403));

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.AUTHENTICATION);
        }

        @Test
        @DisplayName("InputException is AUTHENTICATION")
        void inputException() {
            BrokerException result = translator.translate(
                    "exchange request token", "api-key", new InputException("Invalid checksum", 400));

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.AUTHENTICATION);
        }

        @Test
        @DisplayName("network errors are OTHER")
        void networkException() {
            BrokerException result = translator.translate(
                    "fetch holdings", "api-key", new NetworkException("Too many requests", 429));

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.OTHER);
        }

        @Test
        @DisplayName("IO and parse failures are OTHER")
        void ioException() {
            IOException cause = new IOException("Connection reset");

            BrokerException result = translator.translate("fetch holdings", cause);

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.OTHER);
            assertThat(result.getCause()).isSameAs(cause);
        }
    }

    @Nested
    @DisplayName("HTTP errors")
    class HttpErrorTests {

        @Test
        @DisplayName("403 is TOKEN_EXPIRED")
        void forbidden() {
            HttpClientErrorException cause = HttpClientErrorException.create(
                    HttpStatus.FORBIDDEN, "Forbidden", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

            BrokerException result = translator.translate("calculate order margins", "api-key", cause);

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.TOKEN_EXPIRED);
            assertThat(result.getDetails()).containsKey(KiteErrorTranslator.LOGIN_URL_DETAIL);
        }

        @Test
        @DisplayName("403 whose body names the api_key is AUTHENTICATION")
        void forbiddenWithKeyWording() {
            byte[] body = "{\"status\":\"error\",\"message\":\"Invalid `api_key` or `access_token`.\"}"
                    .getBytes(StandardCharsets.UTF_8);
            HttpClientErrorException cause = HttpClientErrorException.create(
                    HttpStatus.FORBIDDEN, "Forbidden", HttpHeaders.EMPTY, body, StandardCharsets.UTF_8);

            BrokerException result = translator.translate("calculate order margins", "api-key", cause);

            assertThat(result.getKind()).isEqualTo(BrokerErrorKind.AUTHENTICATION);
        }

        @Test
        @DisplayName("401 is AUTHENTICATION")
        void unauthorized() {
            HttpClientErrorException cause = HttpClientErrorException.create(
                    HttpStatus.UNAUTHORIZED, "Unauthorized", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

            assertThat(translator.translate("calculate order margins", "api-key", cause).getKind())
                    .isEqualTo(BrokerErrorKind.AUTHENTICATION);
        }

        @Test
        @DisplayName("5xx is OTHER")
        void serverError() {
            HttpServerErrorException cause = HttpServerErrorException.create(
                    HttpStatus.BAD_GATEWAY, "Bad Gateway", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

            assertThat(translator.translate("calculate order margins", "api-key", cause).getKind())
                    .isEqualTo(BrokerErrorKind.OTHER);
        }
    }
}
