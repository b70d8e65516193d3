package com.optionscalper.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.optionscalper.domain.enums.PositionEventType;
import com.optionscalper.domain.model.Position;
import com.optionscalper.event.BrokerErrorEvent;
import com.optionscalper.event.ConnectionStatusEvent;
import com.optionscalper.event.PositionEvent;
import com.optionscalper.event.RefreshCompletedEvent;
import com.optionscalper.observability.TradingMetrics;
import com.optionscalper.position.PositionStore;
import com.optionscalper.resilience.ApiCircuitBreakers;
import com.optionscalper.resilience.ApiEndpoint;
import com.optionscalper.streaming.ConnectionStatus;
import com.optionscalper.streaming.StreamingConnectionSupervisor;
import com.optionscalper.testutil.CircuitBreakerFixtures;
import com.optionscalper.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradingMetricsTest {

    @Mock
    private PositionStore positionStore;

    private SimpleMeterRegistry meterRegistry;
    private ApiCircuitBreakers apiCircuitBreakers;
    private TradingMetrics tradingMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        apiCircuitBreakers =
                new ApiCircuitBreakers(CircuitBreakerFixtures.registry(), new MutableClock(Instant.parse("2026-03-02T04:00:00Z")));
        tradingMetrics = new TradingMetrics(meterRegistry, positionStore, apiCircuitBreakers);
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("Counters follow the events they track")
    void countersFollowEvents() {
        Position position = Position.builder().tradingSymbol("NIFTY26MAR22000CE").quantity(75).build();

        tradingMetrics.onPositionEvent(new PositionEvent(this, position, PositionEventType.ADDED));
        tradingMetrics.onPositionEvent(new PositionEvent(this, position, PositionEventType.REMOVED));
        tradingMetrics.onRefreshCompleted(new RefreshCompletedEvent(this, true));
        tradingMetrics.onRefreshCompleted(new RefreshCompletedEvent(this, false));
        tradingMetrics.onBrokerError(new BrokerErrorEvent(this, "getOrders", "timeout", null));
        tradingMetrics.onConnectionStatus(new ConnectionStatusEvent(
                this, ConnectionStatus.DISCONNECTED, StreamingConnectionSupervisor.HEARTBEAT_TIMEOUT));
        tradingMetrics.onConnectionStatus(
                new ConnectionStatusEvent(this, ConnectionStatus.DISCONNECTED, "Disconnected by server"));

        assertThat(counter("scalper.positions.closed")).isEqualTo(1.0);
        assertThat(counter("scalper.reconciliation.failures")).isEqualTo(1.0);
        assertThat(counter("scalper.broker.errors")).isEqualTo(1.0);
        assertThat(counter("scalper.stream.stale.reconnects")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Gauges read the store and the circuit breakers")
    void gauges() {
        when(positionStore.getAllPositions())
                .thenReturn(List.of(Position.builder().tradingSymbol("A").build()));
        when(positionStore.getTotalFloatingPnl()).thenReturn(new BigDecimal("-420.5"));
        for (int i = 0; i < 3; i++) {
            apiCircuitBreakers.get(ApiEndpoint.ORDERS).recordFailure();
        }

        assertThat(meterRegistry.get("scalper.positions.open").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.get("scalper.pnl.floating").gauge().value()).isEqualTo(-420.5);
        assertThat(meterRegistry.get("scalper.circuit.state").tag("endpoint", "ORDERS").gauge().value())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("scalper.circuit.state").tag("endpoint", "PROFILE").gauge().value())
                .isEqualTo(0.0);
    }
}
