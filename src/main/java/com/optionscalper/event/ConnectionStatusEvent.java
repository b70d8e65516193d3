package com.optionscalper.event;

import com.optionscalper.streaming.ConnectionStatus;
import org.springframework.context.ApplicationEvent;

public class ConnectionStatusEvent extends ApplicationEvent {

    private final ConnectionStatus status;
    private final String reason;

    public ConnectionStatusEvent(Object source, ConnectionStatus status, String reason) {
        super(source);
        this.status = status;
        this.reason = reason;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }
}
