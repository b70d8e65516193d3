package com.optionscalper.domain.enums;

public enum RefreshOutcome {
    SUCCESS,
    FAILED,
    SKIPPED_IN_PROGRESS,
    SKIPPED_CIRCUIT_OPEN
}
