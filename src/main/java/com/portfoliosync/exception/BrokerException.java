package com.portfoliosync.exception;

import java.util.Map;
import lombok.Getter;

/** A failed call to the broker, classified by {@link BrokerErrorKind}. */
@Getter
public class BrokerException extends BaseException {

    private final BrokerErrorKind kind;

    public BrokerException(String message) {
        this(BrokerErrorKind.OTHER, message);
    }

    public BrokerException(String message, Throwable cause) {
        this(BrokerErrorKind.OTHER, message, cause);
    }

    public BrokerException(BrokerErrorKind kind, String message) {
        super(kind.getErrorCode(), message);
        this.kind = kind;
    }

    public BrokerException(BrokerErrorKind kind, String message, Throwable cause) {
        super(kind.getErrorCode(), message, cause);
        this.kind = kind;
    }

    public BrokerException(BrokerErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(kind.getErrorCode(), message, details, cause);
        this.kind = kind;
    }

    public boolean isTokenExpired() {
        return kind == BrokerErrorKind.TOKEN_EXPIRED;
    }
}
