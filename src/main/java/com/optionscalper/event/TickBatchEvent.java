package com.optionscalper.event;

import com.optionscalper.domain.model.Tick;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * One batch of ticks from the streaming connection, published by the supervisor's single
 * processor thread. Listeners run synchronously, so a batch is fully handled before the next.
 *
 * <p>Listener order:
 * <ul>
 *   <li>@Order(1) PaperMatchingEngine: last prices and pending paper fills</li>
 *   <li>@Order(2) RiskTriggerEngine: P&L update and exit triggers</li>
 * </ul>
 */
public class TickBatchEvent extends ApplicationEvent {

    private final List<Tick> ticks;

    public TickBatchEvent(Object source, List<Tick> ticks) {
        super(source);
        this.ticks = ticks;
    }

    public List<Tick> getTicks() {
        return ticks;
    }
}
