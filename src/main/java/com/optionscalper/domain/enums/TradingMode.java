package com.optionscalper.domain.enums;

/**
 * Which execution interface backs the running instance.
 *
 * <p>PAPER routes every order through the paper matching engine against live ticks;
 * LIVE sends them to Kite.
 */
public enum TradingMode {
    PAPER,
    LIVE
}
