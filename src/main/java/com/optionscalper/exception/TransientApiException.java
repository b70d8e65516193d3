package com.optionscalper.exception;

/**
 * Network hiccup, timeout, 5xx or a call skipped because its circuit is open.
 * Retried by Resilience4j and by the next reconciliation pass; never fatal.
 */
public class TransientApiException extends ApiException {

    public TransientApiException(String message) {
        super(ErrorCode.BROKER_UNAVAILABLE, message, null);
    }

    public TransientApiException(String message, Throwable cause) {
        super(ErrorCode.BROKER_UNAVAILABLE, message, cause);
    }
}
