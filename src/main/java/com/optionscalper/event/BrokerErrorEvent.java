package com.optionscalper.event;

import org.springframework.context.ApplicationEvent;

/**
 * A broker call failed inside the trading core. Carries the operation name and message so
 * consumers can surface it; the failure itself never propagates into the tick path.
 */
public class BrokerErrorEvent extends ApplicationEvent {

    private final String operation;
    private final String message;
    private final Throwable cause;

    public BrokerErrorEvent(Object source, String operation, String message, Throwable cause) {
        super(source);
        this.operation = operation;
        this.message = message;
        this.cause = cause;
    }

    public String getOperation() {
        return operation;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }
}
