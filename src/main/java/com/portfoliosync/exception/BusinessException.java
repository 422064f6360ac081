package com.portfoliosync.exception;

/** A request the service refuses on business grounds, rendered as 400. */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
