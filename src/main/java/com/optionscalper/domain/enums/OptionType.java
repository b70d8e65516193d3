package com.optionscalper.domain.enums;

public enum OptionType {
    CALL,
    PUT,
    NONE
}
