package com.optionscalper.streaming;

import java.util.List;

/**
 * Push-based market-data connection keyed by integer instrument tokens.
 *
 * <p>Implementations report lifecycle and data through the registered {@link TransportListener},
 * typically from their own I/O thread. They must not reconnect on their own; reconnection is
 * driven by {@link StreamingConnectionSupervisor}.
 */
public interface MarketDataTransport {

    void setListener(TransportListener listener);

    /** Opens a new connection. May complete asynchronously via {@link TransportListener#onConnected()}. */
    void connect();

    /** Closes the current connection, if any. Safe to call repeatedly. */
    void close();

    void subscribe(List<Long> tokens);

    void unsubscribe(List<Long> tokens);
}
