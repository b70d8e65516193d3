package com.optionscalper.event;

import com.optionscalper.domain.model.Position;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/** Batched notification that the open position set (or its prices/P&L) changed. */
public class PositionsChangedEvent extends ApplicationEvent {

    private final List<Position> positions;

    public PositionsChangedEvent(Object source, List<Position> positions) {
        super(source);
        this.positions = positions;
    }

    public List<Position> getPositions() {
        return positions;
    }
}
