package com.optionscalper.domain.enums;

/** Order types supported by Kite (SL_M is sent as "SL-M"). */
public enum OrderType {
    MARKET,
    LIMIT,
    SL,
    SL_M
}
