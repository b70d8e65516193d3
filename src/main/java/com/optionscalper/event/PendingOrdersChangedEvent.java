package com.optionscalper.event;

import com.optionscalper.domain.model.PendingOrder;
import java.util.List;
import org.springframework.context.ApplicationEvent;

public class PendingOrdersChangedEvent extends ApplicationEvent {

    private final List<PendingOrder> pendingOrders;

    public PendingOrdersChangedEvent(Object source, List<PendingOrder> pendingOrders) {
        super(source);
        this.pendingOrders = pendingOrders;
    }

    public List<PendingOrder> getPendingOrders() {
        return pendingOrders;
    }
}
