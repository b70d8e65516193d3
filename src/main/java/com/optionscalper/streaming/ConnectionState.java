package com.optionscalper.streaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Streaming connection bookkeeping. Mutated only by {@link StreamingConnectionSupervisor};
 * everyone else sees it through {@link #snapshot()}.
 */
public class ConnectionState {

    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile boolean running;
    private volatile Instant lastTickAt;
    private volatile int reconnectAttempts;

    /** Tokens the consumers want. Applied in full whenever a connection opens. */
    private final Set<Long> desiredTokens = new LinkedHashSet<>();

    /** Tokens actually subscribed on the current connection. */
    private final Set<Long> subscribedTokens = new LinkedHashSet<>();

    ConnectionStatus getStatus() {
        return status;
    }

    void setStatus(ConnectionStatus status) {
        this.status = status;
    }

    boolean isRunning() {
        return running;
    }

    void setRunning(boolean running) {
        this.running = running;
    }

    Instant getLastTickAt() {
        return lastTickAt;
    }

    void setLastTickAt(Instant lastTickAt) {
        this.lastTickAt = lastTickAt;
    }

    int getReconnectAttempts() {
        return reconnectAttempts;
    }

    void setReconnectAttempts(int reconnectAttempts) {
        this.reconnectAttempts = reconnectAttempts;
    }

    Set<Long> getDesiredTokens() {
        return desiredTokens;
    }

    Set<Long> getSubscribedTokens() {
        return subscribedTokens;
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(
                status,
                running,
                lastTickAt,
                reconnectAttempts,
                Collections.unmodifiableSet(new LinkedHashSet<>(desiredTokens)),
                Collections.unmodifiableSet(new LinkedHashSet<>(subscribedTokens)));
    }

    public record Snapshot(
            ConnectionStatus status,
            boolean running,
            Instant lastTickAt,
            int reconnectAttempts,
            Set<Long> desiredTokens,
            Set<Long> subscribedTokens) {}
}
