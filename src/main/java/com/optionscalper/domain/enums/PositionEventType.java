package com.optionscalper.domain.enums;

public enum PositionEventType {
    ADDED,
    REMOVED
}
