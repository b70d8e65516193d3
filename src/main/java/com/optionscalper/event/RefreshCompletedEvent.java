package com.optionscalper.event;

import org.springframework.context.ApplicationEvent;

public class RefreshCompletedEvent extends ApplicationEvent {

    private final boolean success;

    public RefreshCompletedEvent(Object source, boolean success) {
        super(source);
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }
}
