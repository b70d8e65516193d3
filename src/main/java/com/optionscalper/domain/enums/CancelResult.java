package com.optionscalper.domain.enums;

/**
 * Outcome of a cancel request. "Already executed / already cancelled" and "unknown order"
 * are expected under leg races and come back as values instead of exceptions.
 */
public enum CancelResult {
    CANCELLED,
    ALREADY_TERMINAL,
    NOT_FOUND
}
