package com.optionscalper.exception;

/**
 * The broker explicitly refused an order (margin, invalid params, market closed).
 * Surfaced to the caller and never retried automatically.
 */
public class RejectedOrderException extends ApiException {

    public RejectedOrderException(String message) {
        super(ErrorCode.ORDER_REJECTED, message, null);
    }

    public RejectedOrderException(String message, Throwable cause) {
        super(ErrorCode.ORDER_REJECTED, message, cause);
    }
}
