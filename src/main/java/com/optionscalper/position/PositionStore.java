package com.optionscalper.position;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.PositionEventType;
import com.optionscalper.domain.enums.RefreshOutcome;
import com.optionscalper.domain.model.Contract;
import com.optionscalper.domain.model.PendingOrder;
import com.optionscalper.domain.model.Position;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.domain.model.RawPosition;
import com.optionscalper.event.BrokerErrorEvent;
import com.optionscalper.event.BrokerOrdersFetchedEvent;
import com.optionscalper.event.PendingOrdersChangedEvent;
import com.optionscalper.event.PositionEvent;
import com.optionscalper.event.PositionsChangedEvent;
import com.optionscalper.event.RefreshCompletedEvent;
import com.optionscalper.instrument.InstrumentRegistry;
import com.optionscalper.journal.DailyPnlService;
import com.optionscalper.journal.TradeJournalService;
import com.optionscalper.journal.TradeRecord;
import com.optionscalper.resilience.ApiCircuitBreaker;
import com.optionscalper.resilience.ApiCircuitBreakers;
import com.optionscalper.resilience.ApiEndpoint;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Authoritative in-memory ledger of open positions and pending orders.
 *
 * <p>Two writers touch the store: the reconciliation pass ({@link #refreshFromBroker()}), which
 * replaces local state with the broker's snapshot, and the tick path (risk engine), which updates
 * prices and removes positions optimistically after an exit order is accepted. There is no general
 * lock between them. Overlapping refreshes are refused by a re-entrancy guard, and a position whose
 * exit is in flight is left alone by the tick path until the flag clears.
 *
 * <p>Local state is a forecast: whatever the broker reports on the next pass wins. When a broker call
 * fails the existing positions are kept (stale but safe) and a {@link BrokerErrorEvent} is published.
 *
 * <p>Notifications (all Spring application events):
 * <ul>
 *   <li>{@link PositionEvent} ADDED / REMOVED per symbol</li>
 *   <li>{@link PositionsChangedEvent} once per batch of changes</li>
 *   <li>{@link PendingOrdersChangedEvent} after each successful refresh</li>
 *   <li>{@link BrokerOrdersFetchedEvent} during a refresh, before the position set is replaced</li>
 *   <li>{@link RefreshCompletedEvent} at the end of every refresh attempt</li>
 * </ul>
 */
@Service
public class PositionStore {

    private static final Logger log = LoggerFactory.getLogger(PositionStore.class);

    private final BrokerGateway brokerGateway;
    private final InstrumentRegistry instrumentRegistry;
    private final ApiCircuitBreakers circuitBreakers;
    private final DailyPnlService dailyPnlService;
    private final TradeJournalService tradeJournalService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private volatile List<PendingOrder> pendingOrders = List.of();
    private final AtomicBoolean refreshInProgress = new AtomicBoolean(false);

    /** Symbols removed locally after an exit, with the exit order id and the P&L folded at removal. */
    private final Map<String, LocalExit> locallyClosed = new ConcurrentHashMap<>();

    private final Set<String> placeholderWarned = ConcurrentHashMap.newKeySet();

    private BigDecimal realizedPnlToday = BigDecimal.ZERO;
    private LocalDate realizedPnlDate;
    private int closedTradeCount;
    private int winningTradeCount;
    private volatile Instant lastRefreshAt;

    public PositionStore(
            BrokerGateway brokerGateway,
            InstrumentRegistry instrumentRegistry,
            ApiCircuitBreakers circuitBreakers,
            DailyPnlService dailyPnlService,
            TradeJournalService tradeJournalService,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.instrumentRegistry = instrumentRegistry;
        this.circuitBreakers = circuitBreakers;
        this.dailyPnlService = dailyPnlService;
        this.tradeJournalService = tradeJournalService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.realizedPnlDate = LocalDate.now(clock);
    }

    /**
     * Reconciles against the broker: fetches net positions and orders, lets the OCO leg manager
     * reconcile protective legs, replaces the position set and the pending-order list.
     *
     * <p>A refresh already in flight makes this call a no-op. Broker failures (including a call
     * skipped because its circuit is open) are reported as events and leave local state untouched.
     */
    public RefreshOutcome refreshFromBroker() {
        if (!refreshInProgress.compareAndSet(false, true)) {
            log.debug("Refresh already in progress, skipping");
            return RefreshOutcome.SKIPPED_IN_PROGRESS;
        }
        try {
            Fetched<List<RawPosition>> rawPositions =
                    fetch(circuitBreakers.get(ApiEndpoint.POSITIONS), brokerGateway::getPositions, "getPositions");
            if (rawPositions.outcome() != RefreshOutcome.SUCCESS) {
                return failRefresh(rawPositions.outcome());
            }

            Fetched<List<RawOrder>> rawOrders =
                    fetch(circuitBreakers.get(ApiEndpoint.ORDERS), brokerGateway::getOrders, "getOrders");
            if (rawOrders.outcome() != RefreshOutcome.SUCCESS) {
                return failRefresh(rawOrders.outcome());
            }

            applyBrokerSnapshot(rawPositions.value(), rawOrders.value());
            lastRefreshAt = clock.instant();
            eventPublisher.publishEvent(new RefreshCompletedEvent(this, true));
            return RefreshOutcome.SUCCESS;
        } finally {
            refreshInProgress.set(false);
        }
    }

    /**
     * Maps one broker position record into the internal model. Returns null only when the record has
     * no trading symbol. Without instrument metadata the position gets a placeholder contract (null
     * token): quantity and prices are tracked but ticks cannot reach it.
     */
    public Position convertBrokerPosition(RawPosition raw) {
        if (raw == null || raw.getTradingSymbol() == null || raw.getTradingSymbol().isBlank()) {
            return null;
        }
        String symbol = raw.getTradingSymbol();
        Long token = instrumentRegistry.findBySymbol(symbol).map(Contract::getInstrumentToken).orElse(null);
        if (token == null && placeholderWarned.add(symbol)) {
            log.warn("Data integrity: no instrument metadata for {}; tracking without live ticks", symbol);
        }

        BigDecimal averagePrice = raw.getAveragePrice() != null ? raw.getAveragePrice() : BigDecimal.ZERO;
        Position position = Position.builder()
                .tradingSymbol(symbol)
                .instrumentToken(token)
                .exchange(raw.getExchange())
                .product(raw.getProduct())
                .quantity(raw.getQuantity())
                .averagePrice(averagePrice)
                .lastPrice(raw.getLastPrice() != null ? raw.getLastPrice() : averagePrice)
                .pnl(raw.getPnl())
                .lastUpdated(LocalDateTime.now(clock))
                .build();
        if (position.getPnl() == null) {
            position.recalculatePnl();
        }
        return position;
    }

    /**
     * Replaces the position set with {@code newPositions}. Symbols that disappear are treated as closed:
     * their last P&L is folded into realized P&L (also persisted for today) and a REMOVED event fires
     * for each. Expiry cleanup runs afterwards and, if anything expired, one PositionsChanged follows.
     */
    public void synchronize(List<Position> newPositions) {
        Map<String, Position> incoming = new LinkedHashMap<>();
        for (Position position : newPositions) {
            incoming.put(position.getTradingSymbol(), position);
        }

        for (Position previous : new ArrayList<>(positions.values())) {
            if (!incoming.containsKey(previous.getTradingSymbol())) {
                positions.remove(previous.getTradingSymbol());
                log.info(
                        "Position {} closed at broker (pnl={})", previous.getTradingSymbol(), previous.getPnl());
                if (!previous.isRealizedLocally()) {
                    recordClose(previous);
                }
                eventPublisher.publishEvent(new PositionEvent(this, previous, PositionEventType.REMOVED));
            }
        }
        positions.putAll(incoming);

        int expired = removeExpiredPositions();
        if (expired > 0) {
            publishPositionsChanged();
        }
    }

    /** Optimistic insert after a confirmed buy fill. Protective settings of an existing entry are kept. */
    public void addPosition(Position position) {
        if (position.getInstrumentToken() == null) {
            instrumentRegistry
                    .findBySymbol(position.getTradingSymbol())
                    .ifPresent(contract -> position.setInstrumentToken(contract.getInstrumentToken()));
        }
        Position existing = positions.get(position.getTradingSymbol());
        if (existing != null) {
            carryOverLocalState(existing, position);
        }
        position.setRealizedLocally(false);
        positions.put(position.getTradingSymbol(), position);
        locallyClosed.remove(position.getTradingSymbol());
        log.info(
                "Position added: {} qty={} avg={}",
                position.getTradingSymbol(),
                position.getQuantity(),
                position.getAveragePrice());
        eventPublisher.publishEvent(new PositionEvent(this, position, PositionEventType.ADDED));
        publishPositionsChanged();
    }

    /** Optimistic removal after a confirmed exit fill. Removing an absent symbol is a no-op. */
    public boolean removePosition(String tradingSymbol) {
        return removePosition(tradingSymbol, null);
    }

    /**
     * Optimistic removal after an exit order was accepted: folds P&L into realized, journals the trade
     * under {@code exitOrderId} (or a synthetic id) and fires REMOVED + PositionsChanged.
     */
    public boolean removePosition(String tradingSymbol, String exitOrderId) {
        Position removed = positions.remove(tradingSymbol);
        if (removed == null) {
            return false;
        }
        BigDecimal folded = recordClose(removed);
        locallyClosed.put(tradingSymbol, new LocalExit(exitOrderId, folded));
        journalExit(removed, exitOrderId);
        log.info("Position {} removed locally (exitOrder={}, pnl={})", tradingSymbol, exitOrderId, removed.getPnl());
        eventPublisher.publishEvent(new PositionEvent(this, removed, PositionEventType.REMOVED));
        publishPositionsChanged();
        return true;
    }

    /**
     * Drops positions whose expiry, derived from the trading symbol, is strictly before today.
     * No trade record is written: the broker has already settled them. Symbols whose expiry cannot
     * be derived are kept.
     *
     * @return number of positions removed
     */
    public int removeExpiredPositions() {
        LocalDate today = LocalDate.now(clock);
        int removed = 0;
        for (Position position : new ArrayList<>(positions.values())) {
            Optional<LocalDate> expiry = ExpirySymbolParser.parseExpiry(position.getTradingSymbol());
            if (expiry.isPresent() && expiry.get().isBefore(today)) {
                positions.remove(position.getTradingSymbol());
                log.info("Removed expired position {} (expiry {})", position.getTradingSymbol(), expiry.get());
                eventPublisher.publishEvent(new PositionEvent(this, position, PositionEventType.REMOVED));
                removed++;
            }
        }
        return removed;
    }

    /** Publishes one batched PositionsChanged with the current snapshot. */
    public void publishPositionsChanged() {
        eventPublisher.publishEvent(new PositionsChangedEvent(this, getAllPositions()));
    }

    public List<Position> getAllPositions() {
        List<Position> snapshot = new ArrayList<>(positions.values());
        snapshot.sort(Comparator.comparing(Position::getTradingSymbol));
        return snapshot;
    }

    public Optional<Position> getPosition(String tradingSymbol) {
        return Optional.ofNullable(positions.get(tradingSymbol));
    }

    public List<PendingOrder> getPendingOrders() {
        return pendingOrders;
    }

    /** Sum of open P&L, excluding positions whose P&L a local exit has already realized. */
    public BigDecimal getTotalFloatingPnl() {
        return positions.values().stream()
                .filter(position -> !position.isRealizedLocally())
                .map(Position::getPnl)
                .filter(pnl -> pnl != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public synchronized BigDecimal getRealizedPnlToday() {
        rollRealizedDay();
        return realizedPnlToday;
    }

    public boolean hasOpenPositions() {
        return !positions.isEmpty();
    }

    /** Tokens of positions that have a known contract, for tick subscriptions. */
    public List<Long> getContractTokens() {
        return positions.values().stream()
                .map(Position::getInstrumentToken)
                .filter(token -> token != null)
                .distinct()
                .toList();
    }

    public boolean isRefreshInProgress() {
        return refreshInProgress.get();
    }

    public Instant getLastRefreshAt() {
        return lastRefreshAt;
    }

    public synchronized SessionStats getSessionStats() {
        return new SessionStats(closedTradeCount, winningTradeCount);
    }

    private void applyBrokerSnapshot(List<RawPosition> rawPositions, List<RawOrder> rawOrders) {
        // Leg reconciliation sees the positions as they were before this pass
        eventPublisher.publishEvent(new BrokerOrdersFetchedEvent(this, rawOrders));

        Map<String, RawOrder> ordersById = new HashMap<>();
        for (RawOrder order : rawOrders) {
            if (order.getOrderId() != null) {
                ordersById.put(order.getOrderId(), order);
            }
        }

        List<Position> converted = new ArrayList<>();
        for (RawPosition raw : rawPositions) {
            if (raw == null || raw.getQuantity() == 0) {
                continue;
            }
            Position position = convertBrokerPosition(raw);
            if (position == null) {
                continue;
            }
            Position existing = positions.get(position.getTradingSymbol());
            if (existing != null) {
                carryOverLocalState(existing, position);
            }
            checkLocallyClosed(position, ordersById);
            converted.add(position);
        }
        locallyClosed.keySet().removeIf(symbol -> converted.stream()
                .noneMatch(p -> p.getTradingSymbol().equals(symbol)));

        synchronize(converted);

        pendingOrders = rawOrders.stream()
                .filter(order -> order.getStatus() != null && order.getStatus().isPending())
                .map(PendingOrder::from)
                .toList();

        log.debug("Reconciled {} positions, {} pending orders", positions.size(), pendingOrders.size());
        publishPositionsChanged();
        eventPublisher.publishEvent(new PendingOrdersChangedEvent(this, pendingOrders));
    }

    /**
     * A symbol closed locally that the broker still reports. Broker state wins and the position is
     * tracked again. If the exit order is still working (or filled and the broker lags) the position
     * stays flagged as exiting and as already realized, so neither the tick path nor the broker's
     * eventual close counts it twice. If the exit order was rejected or cancelled the position is
     * really open: the P&L folded at removal is taken back out.
     */
    private void checkLocallyClosed(Position position, Map<String, RawOrder> ordersById) {
        LocalExit localExit = locallyClosed.get(position.getTradingSymbol());
        if (localExit == null) {
            return;
        }
        String exitOrderId = localExit.exitOrderId();
        RawOrder exitOrder = exitOrderId != null ? ordersById.get(exitOrderId) : null;
        OrderStatus exitStatus = exitOrder != null ? exitOrder.getStatus() : null;
        log.warn(
                "Reconciliation conflict: {} was closed locally but broker reports qty={} (exit order {} {})",
                position.getTradingSymbol(),
                position.getQuantity(),
                exitOrderId != null ? exitOrderId : "n/a",
                exitStatus != null ? exitStatus : "not found");

        if (exitStatus == OrderStatus.REJECTED || exitStatus == OrderStatus.CANCELLED) {
            locallyClosed.remove(position.getTradingSymbol());
            reverseClose(position.getTradingSymbol(), localExit.realizedPnl());
            position.setRealizedLocally(false);
            position.setExitInProgress(false);
            return;
        }
        position.setRealizedLocally(true);
        if (exitStatus == null || !exitStatus.isTerminal()) {
            position.setExitInProgress(true);
        } else {
            locallyClosed.remove(position.getTradingSymbol());
        }
    }

    /**
     * Broker snapshot knows nothing about local protection or in-flight intent; carry those across.
     * Tick-driven prices are kept when the contract is known, since they are fresher than the REST snapshot.
     */
    private void carryOverLocalState(Position existing, Position incoming) {
        incoming.setStopLoss(existing.getStopLoss());
        incoming.setTarget(existing.getTarget());
        incoming.setTrailingDistance(existing.getTrailingDistance());
        incoming.setTrailingStepsApplied(existing.getTrailingStepsApplied());
        incoming.setStopLossOrderId(existing.getStopLossOrderId());
        incoming.setTargetOrderId(existing.getTargetOrderId());
        if (existing.isExitInProgress()) {
            incoming.setExitInProgress(true);
        }
        if (existing.isRealizedLocally()) {
            incoming.setRealizedLocally(true);
        }
        if (existing.hasContract() && existing.getLastPrice() != null && incoming.hasContract()) {
            incoming.setLastPrice(existing.getLastPrice());
            incoming.recalculatePnl();
        }
    }

    private synchronized BigDecimal recordClose(Position closed) {
        BigDecimal pnl = closed.getPnl() != null ? closed.getPnl() : BigDecimal.ZERO;
        rollRealizedDay();
        realizedPnlToday = realizedPnlToday.add(pnl);
        closedTradeCount++;
        if (pnl.signum() > 0) {
            winningTradeCount++;
        }
        persistRealized(closed.getTradingSymbol(), pnl);
        return pnl;
    }

    /** Takes back a local close that the broker never executed. */
    private synchronized void reverseClose(String tradingSymbol, BigDecimal pnl) {
        rollRealizedDay();
        realizedPnlToday = realizedPnlToday.subtract(pnl);
        closedTradeCount = Math.max(0, closedTradeCount - 1);
        if (pnl.signum() > 0) {
            winningTradeCount = Math.max(0, winningTradeCount - 1);
        }
        log.warn("Exit of {} did not execute; realized P&L {} reversed", tradingSymbol, pnl);
        persistRealized(tradingSymbol, pnl.negate());
    }

    private void persistRealized(String tradingSymbol, BigDecimal pnl) {
        try {
            dailyPnlService.record(realizedPnlDate, pnl);
        } catch (RuntimeException e) {
            log.error("Failed to persist realized P&L for {}: {}", tradingSymbol, e.getMessage(), e);
        }
    }

    private void rollRealizedDay() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(realizedPnlDate)) {
            realizedPnlDate = today;
            realizedPnlToday = BigDecimal.ZERO;
        }
    }

    private void journalExit(Position closed, String exitOrderId) {
        String orderId = exitOrderId != null
                ? exitOrderId
                : "closed_" + closed.getTradingSymbol() + "_" + clock.instant().getEpochSecond();
        OrderSide exitSide = closed.isLong() ? OrderSide.SELL : OrderSide.BUY;
        tradeJournalService.record(TradeRecord.builder()
                .orderId(orderId)
                .timestamp(LocalDateTime.now(clock))
                .tradingSymbol(closed.getTradingSymbol())
                .transactionType(exitSide.name())
                .quantity(Math.abs(closed.getQuantity()))
                .averagePrice(closed.getLastPrice())
                .status("COMPLETE")
                .product(closed.getProduct())
                .pnl(closed.getPnl())
                .build());
    }

    /** Runs one broker call through its circuit breaker; failures are reported here. */
    private <T> Fetched<T> fetch(ApiCircuitBreaker breaker, Supplier<T> call, String operation) {
        if (!breaker.canExecute()) {
            log.debug("{} skipped: circuit '{}' is open", operation, breaker.getName());
            return new Fetched<>(null, RefreshOutcome.SKIPPED_CIRCUIT_OPEN);
        }
        try {
            T result = call.get();
            breaker.recordSuccess();
            return new Fetched<>(result, RefreshOutcome.SUCCESS);
        } catch (RuntimeException e) {
            breaker.recordFailure(e);
            log.warn("Broker {} failed: {}", operation, e.getMessage());
            eventPublisher.publishEvent(new BrokerErrorEvent(this, operation, e.getMessage(), e));
            return new Fetched<>(null, RefreshOutcome.FAILED);
        }
    }

    private RefreshOutcome failRefresh(RefreshOutcome outcome) {
        eventPublisher.publishEvent(new RefreshCompletedEvent(this, false));
        return outcome;
    }

    private record Fetched<T>(T value, RefreshOutcome outcome) {}

    private record LocalExit(String exitOrderId, BigDecimal realizedPnl) {}

    /** Closed-trade statistics for the running session. */
    public record SessionStats(int closedTrades, int winningTrades) {}
}
