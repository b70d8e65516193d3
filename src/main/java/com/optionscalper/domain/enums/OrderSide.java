package com.optionscalper.domain.enums;

/** Buy or sell side of an order. Maps to Kite API's transaction_type field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for exit orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
