package com.optionscalper.observability;

import com.optionscalper.domain.enums.PositionEventType;
import com.optionscalper.event.BrokerErrorEvent;
import com.optionscalper.event.ConnectionStatusEvent;
import com.optionscalper.event.PositionEvent;
import com.optionscalper.event.RefreshCompletedEvent;
import com.optionscalper.position.PositionStore;
import com.optionscalper.resilience.ApiCircuitBreaker;
import com.optionscalper.resilience.ApiCircuitBreakers;
import com.optionscalper.resilience.ApiEndpoint;
import com.optionscalper.streaming.ConnectionStatus;
import com.optionscalper.streaming.StreamingConnectionSupervisor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the trading core:
 * <ul>
 *   <li><b>scalper.positions.closed</b> (counter): positions leaving the store</li>
 *   <li><b>scalper.reconciliation.failures</b> (counter): failed refresh passes</li>
 *   <li><b>scalper.broker.errors</b> (counter): broker call failures reported by the core</li>
 *   <li><b>scalper.stream.stale.reconnects</b> (counter): reconnects forced by the heartbeat</li>
 *   <li><b>scalper.positions.open</b>, <b>scalper.pnl.floating</b> (gauges)</li>
 *   <li><b>scalper.circuit.state</b> (gauge per endpoint): 0 closed, 1 half-open, 2 open</li>
 * </ul>
 *
 * <p>Gauges are read by Micrometer at scrape time; counters follow application events.
 */
@Service
public class TradingMetrics {

    private final Counter positionsClosedCounter;
    private final Counter reconciliationFailureCounter;
    private final Counter brokerErrorCounter;
    private final Counter staleReconnectCounter;

    public TradingMetrics(
            MeterRegistry meterRegistry, PositionStore positionStore, ApiCircuitBreakers apiCircuitBreakers) {
        this.positionsClosedCounter = Counter.builder("scalper.positions.closed")
                .description("Positions removed from the store (exits, reconciliation closes, expiry)")
                .register(meterRegistry);
        this.reconciliationFailureCounter = Counter.builder("scalper.reconciliation.failures")
                .description("Refresh passes that failed against the broker")
                .register(meterRegistry);
        this.brokerErrorCounter = Counter.builder("scalper.broker.errors")
                .description("Broker call failures reported by the trading core")
                .register(meterRegistry);
        this.staleReconnectCounter = Counter.builder("scalper.stream.stale.reconnects")
                .description("Stream reconnects forced by the heartbeat check")
                .register(meterRegistry);

        Gauge.builder("scalper.positions.open", positionStore, store -> store.getAllPositions().size())
                .register(meterRegistry);
        Gauge.builder("scalper.pnl.floating", positionStore, store -> store.getTotalFloatingPnl().doubleValue())
                .register(meterRegistry);
        for (ApiEndpoint endpoint : ApiEndpoint.values()) {
            ApiCircuitBreaker breaker = apiCircuitBreakers.get(endpoint);
            Gauge.builder("scalper.circuit.state", breaker, TradingMetrics::circuitStateValue)
                    .tag("endpoint", endpoint.name())
                    .register(meterRegistry);
        }
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.REMOVED) {
            positionsClosedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRefreshCompleted(RefreshCompletedEvent event) {
        if (!event.isSuccess()) {
            reconciliationFailureCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onBrokerError(BrokerErrorEvent event) {
        brokerErrorCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onConnectionStatus(ConnectionStatusEvent event) {
        if (event.getStatus() == ConnectionStatus.DISCONNECTED
                && StreamingConnectionSupervisor.HEARTBEAT_TIMEOUT.equals(event.getReason())) {
            staleReconnectCounter.increment();
        }
    }

    private static double circuitStateValue(ApiCircuitBreaker breaker) {
        return switch (breaker.getState()) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
