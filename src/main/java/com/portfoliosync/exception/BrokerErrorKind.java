package com.portfoliosync.exception;

/**
 * Classification of a failed broker call, assigned where the failure is first observed.
 *
 * <p>{@link com.portfoliosync.session.RetryOrchestrator} retries only {@link #AUTHENTICATION};
 * everything else surfaces to the caller on the first failure.
 */
public enum BrokerErrorKind {

    /** Access token rejected as invalid or expired. Needs a new request token from a login flow. */
    TOKEN_EXPIRED(ErrorCode.TOKEN_EXPIRED),

    /** Invalid api_key / access_token style rejection, usually a stale or raced session. */
    AUTHENTICATION(ErrorCode.AUTHENTICATION_FAILED),

    /** Network failures, unexpected payloads and anything else. */
    OTHER(ErrorCode.BROKER_ERROR);

    private final ErrorCode errorCode;

    BrokerErrorKind(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
