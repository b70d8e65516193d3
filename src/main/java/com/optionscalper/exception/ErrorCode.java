package com.optionscalper.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    ORDER_REJECTED("ORDER_REJECTED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    BROKER_ERROR("BROKER_ERROR", 502),
    BROKER_UNAVAILABLE("BROKER_UNAVAILABLE", 503),
    STALE_CONNECTION("STALE_CONNECTION", 503);

    private final String code;
    private final int httpStatus;
}
