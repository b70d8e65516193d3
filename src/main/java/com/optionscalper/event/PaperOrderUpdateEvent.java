package com.optionscalper.event;

import com.optionscalper.simulator.PaperOrder;
import org.springframework.context.ApplicationEvent;

/** A paper order changed state (placed, filled, cancelled, rejected). */
public class PaperOrderUpdateEvent extends ApplicationEvent {

    private final PaperOrder order;

    public PaperOrderUpdateEvent(Object source, PaperOrder order) {
        super(source);
        this.order = order;
    }

    public PaperOrder getOrder() {
        return order;
    }
}
