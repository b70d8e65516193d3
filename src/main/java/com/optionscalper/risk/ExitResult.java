package com.optionscalper.risk;

/** Outcome of one exit attempt for a position. */
public record ExitResult(String tradingSymbol, Status status, String orderId, String message) {

    public enum Status {
        SUBMITTED,
        ALREADY_EXITING,
        FAILED
    }

    static ExitResult submitted(String tradingSymbol, String orderId) {
        return new ExitResult(tradingSymbol, Status.SUBMITTED, orderId, null);
    }

    static ExitResult alreadyExiting(String tradingSymbol) {
        return new ExitResult(tradingSymbol, Status.ALREADY_EXITING, null, "Exit already in progress");
    }

    static ExitResult failed(String tradingSymbol, String message) {
        return new ExitResult(tradingSymbol, Status.FAILED, null, message);
    }
}
