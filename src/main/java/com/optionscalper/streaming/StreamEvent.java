package com.optionscalper.streaming;

import com.optionscalper.domain.model.Tick;
import java.util.List;

/** Transport callback turned into a message for the supervisor's processor thread. */
final class StreamEvent {

    enum Type {
        CONNECTED,
        TICKS,
        ERROR,
        CLOSED
    }

    private final Type type;
    private final List<Tick> ticks;
    private final String reason;

    private StreamEvent(Type type, List<Tick> ticks, String reason) {
        this.type = type;
        this.ticks = ticks;
        this.reason = reason;
    }

    static StreamEvent connected() {
        return new StreamEvent(Type.CONNECTED, List.of(), null);
    }

    static StreamEvent ticks(List<Tick> ticks) {
        return new StreamEvent(Type.TICKS, ticks, null);
    }

    static StreamEvent error(String message) {
        return new StreamEvent(Type.ERROR, List.of(), message);
    }

    static StreamEvent closed(String reason) {
        return new StreamEvent(Type.CLOSED, List.of(), reason);
    }

    Type getType() {
        return type;
    }

    List<Tick> getTicks() {
        return ticks;
    }

    String getReason() {
        return reason;
    }
}
