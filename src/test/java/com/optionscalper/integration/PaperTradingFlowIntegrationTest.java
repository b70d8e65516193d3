package com.optionscalper.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

import com.optionscalper.config.ScalperProperties;
import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.OrderType;
import com.optionscalper.domain.enums.PositionEventType;
import com.optionscalper.domain.enums.RefreshOutcome;
import com.optionscalper.domain.model.Contract;
import com.optionscalper.domain.model.Position;
import com.optionscalper.domain.model.Tick;
import com.optionscalper.event.BrokerOrdersFetchedEvent;
import com.optionscalper.event.PositionEvent;
import com.optionscalper.event.TickBatchEvent;
import com.optionscalper.instrument.InstrumentRegistry;
import com.optionscalper.journal.DailyPnlService;
import com.optionscalper.journal.TradeJournalService;
import com.optionscalper.oms.OcoLegManager;
import com.optionscalper.oms.OrderRequest;
import com.optionscalper.position.PositionStore;
import com.optionscalper.resilience.ApiCircuitBreakers;
import com.optionscalper.risk.PositionExitService;
import com.optionscalper.risk.RiskTriggerEngine;
import com.optionscalper.simulator.PaperBrokerGateway;
import com.optionscalper.simulator.PaperLedger;
import com.optionscalper.simulator.PaperMatchingEngine;
import com.optionscalper.simulator.PaperOrder;
import com.optionscalper.testutil.CircuitBreakerFixtures;
import com.optionscalper.testutil.MutableClock;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Paper trading end to end: orders go through {@link PaperBrokerGateway}, ticks are routed to the
 * matching engine and then the risk engine in listener order, and reconciliation drives the OCO
 * leg manager through {@link BrokerOrdersFetchedEvent}. Spring event dispatch is simulated by a
 * routing publisher.
 */
@ExtendWith(MockitoExtension.class)
class PaperTradingFlowIntegrationTest {

    private static final String SYMBOL = "NIFTY26MAR22000CE";
    private static final long TOKEN = 9604354L;

    @TempDir
    Path tempDir;

    @Mock
    private InstrumentRegistry instrumentRegistry;

    @Mock
    private TradeJournalService tradeJournalService;

    @Mock
    private DailyPnlService dailyPnlService;

    private final List<Object> publishedEvents = new ArrayList<>();

    private ApplicationEventPublisher eventPublisher;
    private PaperMatchingEngine paperMatchingEngine;
    private PaperBrokerGateway brokerGateway;
    private PositionStore positionStore;
    private OcoLegManager ocoLegManager;
    private RiskTriggerEngine riskTriggerEngine;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T04:00:00Z"));
        ScalperProperties properties = new ScalperProperties();
        properties.getPaper().setLedgerFile(tempDir.resolve("paper_account.json"));

        lenient()
                .when(instrumentRegistry.findBySymbol(SYMBOL))
                .thenReturn(Optional.of(Contract.builder()
                        .tradingSymbol(SYMBOL)
                        .instrumentToken(TOKEN)
                        .lotSize(75)
                        .build()));

        eventPublisher = event -> {
            publishedEvents.add(event);
            if (event instanceof TickBatchEvent tickBatch) {
                paperMatchingEngine.onTickBatch(tickBatch);
                riskTriggerEngine.onTickBatch(tickBatch);
            } else if (event instanceof BrokerOrdersFetchedEvent fetched) {
                ocoLegManager.onBrokerOrdersFetched(fetched);
            }
        };

        PaperLedger paperLedger = new PaperLedger(properties);
        paperLedger.load();
        paperMatchingEngine =
                new PaperMatchingEngine(paperLedger, instrumentRegistry, tradeJournalService, eventPublisher, clock);
        brokerGateway = new PaperBrokerGateway(paperMatchingEngine, paperLedger);
        positionStore = new PositionStore(
                brokerGateway,
                instrumentRegistry,
                new ApiCircuitBreakers(CircuitBreakerFixtures.registry(), clock),
                dailyPnlService,
                tradeJournalService,
                eventPublisher,
                clock);
        ocoLegManager = new OcoLegManager(brokerGateway, positionStore);
        PositionExitService positionExitService =
                new PositionExitService(brokerGateway, positionStore, ocoLegManager, eventPublisher);
        riskTriggerEngine = new RiskTriggerEngine(positionStore, positionExitService, ocoLegManager, clock);
    }

    private void tick(String price) {
        eventPublisher.publishEvent(new TickBatchEvent(this, List.of(Tick.builder()
                .instrumentToken(TOKEN)
                .lastPrice(new BigDecimal(price))
                .receivedAt(Instant.now())
                .build())));
    }

    private void openLongPosition() {
        tick("100");
        brokerGateway.placeOrder(OrderRequest.market(SYMBOL, "NFO", "MIS", OrderSide.BUY, 75));
        assertThat(positionStore.refreshFromBroker()).isEqualTo(RefreshOutcome.SUCCESS);
    }

    private long removedEventsFor(String symbol) {
        return publishedEvents.stream()
                .filter(e -> e instanceof PositionEvent)
                .map(e -> (PositionEvent) e)
                .filter(e -> e.getEventType() == PositionEventType.REMOVED)
                .filter(e -> e.getPosition().getTradingSymbol().equals(symbol))
                .count();
    }

    private PaperOrder order(String orderId) {
        return paperMatchingEngine.getOrder(orderId).orElseThrow();
    }

    @Test
    @DisplayName("Paper fill shows up in the store with its contract after reconciliation")
    void fillReconciledIntoStore() {
        openLongPosition();

        Position position = positionStore.getPosition(SYMBOL).orElseThrow();
        assertThat(position.getQuantity()).isEqualTo(75);
        assertThat(position.getInstrumentToken()).isEqualTo(TOKEN);
        assertThat(position.getAveragePrice()).isEqualByComparingTo("100");
        assertThat(positionStore.getContractTokens()).containsExactly(TOKEN);
    }

    @Test
    @DisplayName("Target leg fills, reconciliation cancels the stop leg and closes the position once")
    void targetLegCancelsStopLeg() {
        openLongPosition();
        ocoLegManager.updateProtection(SYMBOL, new BigDecimal("90"), new BigDecimal("120"), null);
        Position protectedPosition = positionStore.getPosition(SYMBOL).orElseThrow();
        String stopLegId = protectedPosition.getStopLossOrderId();
        String targetLegId = protectedPosition.getTargetOrderId();
        assertThat(order(stopLegId).getOrderType()).isEqualTo(OrderType.SL_M);
        assertThat(order(targetLegId).getStatus()).isEqualTo(OrderStatus.OPEN);

        tick("121");

        assertThat(order(targetLegId).getStatus()).isEqualTo(OrderStatus.COMPLETE);
        assertThat(order(stopLegId).getStatus()).isEqualTo(OrderStatus.TRIGGER_PENDING);

        positionStore.refreshFromBroker();

        assertThat(order(stopLegId).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(positionStore.getPosition(SYMBOL)).isEmpty();
        assertThat(removedEventsFor(SYMBOL)).isEqualTo(1);
        assertThat(positionStore.getRealizedPnlToday()).isEqualByComparingTo("1575");
        verify(dailyPnlService).record(eq(LocalDate.of(2026, 3, 2)), any());
    }

    @Test
    @DisplayName("Local stop-loss exits at market on the tick and the next pass does not close it again")
    void localStopLossExit() {
        openLongPosition();
        positionStore.getPosition(SYMBOL).orElseThrow().setStopLoss(new BigDecimal("90"));

        tick("89");

        assertThat(positionStore.getPosition(SYMBOL)).isEmpty();
        assertThat(paperMatchingEngine.getPositions()).isEmpty();

        positionStore.refreshFromBroker();
        tick("85");

        assertThat(positionStore.getPosition(SYMBOL)).isEmpty();
        assertThat(removedEventsFor(SYMBOL)).isEqualTo(1);
        assertThat(paperMatchingEngine.getOrders())
                .filteredOn(o -> o.getTransactionType() == OrderSide.SELL)
                .hasSize(1);
    }

    @Test
    @DisplayName("Trailing stop ratchets the broker stop leg, which then fills on the way down")
    void trailingStopMovesBrokerLeg() {
        openLongPosition();
        ocoLegManager.updateProtection(SYMBOL, new BigDecimal("90"), null, new BigDecimal("5"));
        String stopLegId = positionStore.getPosition(SYMBOL).orElseThrow().getStopLossOrderId();

        tick("111");

        assertThat(order(stopLegId).getTriggerPrice()).isEqualByComparingTo("100");

        tick("99");

        assertThat(order(stopLegId).getStatus()).isEqualTo(OrderStatus.COMPLETE);
        assertThat(order(stopLegId).getAveragePrice()).isEqualByComparingTo("99");
        assertThat(paperMatchingEngine.getPositions()).isEmpty();
    }
}
