package com.optionscalper.event;

import com.optionscalper.domain.enums.PositionEventType;
import com.optionscalper.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the PositionStore when a single position enters or leaves the store.
 *
 * <p>REMOVED covers reconciliation closes, optimistic local exits and expiry cleanup alike.
 * Listeners that only need "something changed" should use {@link PositionsChangedEvent}.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
