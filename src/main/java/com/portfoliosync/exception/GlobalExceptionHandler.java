package com.portfoliosync.exception;

import com.portfoliosync.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders every failure as an {@link ApiErrorResponse}.
 *
 * <p>Broker failures keep the classification assigned when the broker call failed:
 * token expiry carries the {@code loginUrl} detail so the frontend can offer a re-login,
 * authentication failures ask the user to check their credentials, and everything else
 * is reported without broker internals.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TOKEN_EXPIRED_MESSAGE =
            "Token is invalid or has expired. Please login again to get a new request token.";
    static final String AUTHENTICATION_FAILED_MESSAGE =
            "Invalid API credentials. Please check your API key and secret.";
    static final String BROKER_FAILED_MESSAGE = "Broker request failed";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new HashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    @ExceptionHandler(BrokerException.class)
    public ResponseEntity<ApiErrorResponse> handleBroker(BrokerException ex, HttpServletRequest request) {
        return switch (ex.getKind()) {
            case TOKEN_EXPIRED -> {
                log.warn("Broker token expired: {}", ex.getMessage());
                yield buildResponse(ErrorCode.TOKEN_EXPIRED, TOKEN_EXPIRED_MESSAGE, ex.getDetails(), request);
            }
            case AUTHENTICATION -> {
                log.warn("Broker authentication failed: {}", ex.getMessage());
                yield buildResponse(ErrorCode.AUTHENTICATION_FAILED, AUTHENTICATION_FAILED_MESSAGE, null, request);
            }
            case OTHER -> {
                log.error("Broker error: {}", ex.getMessage(), ex);
                yield buildResponse(ErrorCode.BROKER_ERROR, BROKER_FAILED_MESSAGE, null, request);
            }
        };
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("Server error: {}", ex.getMessage(), ex);
        } else {
            log.warn("Client error: {}", ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error", ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.of(errorCode, message, details, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
