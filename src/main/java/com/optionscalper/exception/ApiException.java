package com.optionscalper.exception;

/**
 * Failure of a call against the broker API (REST). Subclasses distinguish failures that
 * the next scheduled pass may recover from ({@link TransientApiException}) from explicit
 * broker rejections ({@link RejectedOrderException}).
 */
public class ApiException extends BaseException {

    public ApiException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public ApiException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }

    protected ApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
