package com.optionscalper.event;

import com.optionscalper.domain.model.RawOrder;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published during every successful reconciliation pass, after the broker order list is fetched
 * and before the position set is replaced. The OCO leg manager reconciles protective legs on it.
 */
public class BrokerOrdersFetchedEvent extends ApplicationEvent {

    private final List<RawOrder> orders;

    public BrokerOrdersFetchedEvent(Object source, List<RawOrder> orders) {
        super(source);
        this.orders = orders;
    }

    public List<RawOrder> getOrders() {
        return orders;
    }
}
