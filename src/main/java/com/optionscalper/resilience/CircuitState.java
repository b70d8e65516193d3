package com.optionscalper.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
