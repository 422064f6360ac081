package com.portfoliosync.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the service's runtime exceptions. The {@link ErrorCode} picks the HTTP status,
 * and {@code details} is rendered as the error body's {@code details} object (for example
 * the {@code loginUrl} a token-expired broker error carries).
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
