package com.optionscalper.domain.enums;

/**
 * Broker order status vocabulary. Kite sends these as strings ("TRIGGER PENDING",
 * "AMO REQ RECEIVED", ...); the broker mappers convert them at the boundary.
 */
public enum OrderStatus {
    OPEN,
    TRIGGER_PENDING,
    AMO_REQ_RECEIVED,
    COMPLETE,
    REJECTED,
    CANCELLED,
    UNKNOWN;

    /** Orders still working at the broker: open, waiting for a trigger, or queued for market open. */
    public boolean isPending() {
        return this == OPEN || this == TRIGGER_PENDING || this == AMO_REQ_RECEIVED;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == REJECTED || this == CANCELLED;
    }
}
