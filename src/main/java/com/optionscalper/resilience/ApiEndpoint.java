package com.optionscalper.resilience;

/** Upstream call categories guarded by independent circuit breakers. */
public enum ApiEndpoint {
    PROFILE,
    MARGINS,
    POSITIONS,
    ORDERS
}
