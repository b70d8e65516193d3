package com.optionscalper.simulator;

import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.OrderType;
import com.optionscalper.domain.model.Contract;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.domain.model.RawPosition;
import com.optionscalper.domain.model.Tick;
import com.optionscalper.event.PaperOrderUpdateEvent;
import com.optionscalper.event.TickBatchEvent;
import com.optionscalper.exception.RejectedOrderException;
import com.optionscalper.instrument.InstrumentRegistry;
import com.optionscalper.journal.TradeJournalService;
import com.optionscalper.journal.TradeRecord;
import com.optionscalper.oms.OrderRequest;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Simulates order execution for paper trading from the live tick stream.
 *
 * <p>Fill rules:
 * <ul>
 *   <li>MARKET: fills at the last known price; with no price yet it stays OPEN and fills on the
 *       first tick for its instrument</li>
 *   <li>LIMIT: fills at once at the last price when marketable (BUY limit >= LTP, SELL limit <= LTP),
 *       otherwise rests and fills at the limit price once a tick crosses it</li>
 *   <li>SL / SL_M: rest as TRIGGER_PENDING; BUY triggers when LTP >= trigger, SELL when LTP <= trigger.
 *       SL fills at its limit price (LTP if none), SL_M at LTP</li>
 * </ul>
 *
 * <p>Every fill is booked in the {@link PaperLedger} (which rewrites its file), written to the trade
 * journal and announced with a {@link PaperOrderUpdateEvent}. Tick handling runs before the risk
 * engine in the same batch, so a protective leg that fills here is already gone from the ledger when
 * the next reconciliation reads it.
 */
@Service
@ConditionalOnProperty(name = "scalper.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperMatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(PaperMatchingEngine.class);

    private final PaperLedger paperLedger;
    private final InstrumentRegistry instrumentRegistry;
    private final TradeJournalService tradeJournalService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final AtomicLong orderSequence = new AtomicLong();

    /** Last traded price per instrument token. */
    private final Map<Long, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    /** All orders of the session in placement order. */
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();

    public PaperMatchingEngine(
            PaperLedger paperLedger,
            InstrumentRegistry instrumentRegistry,
            TradeJournalService tradeJournalService,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.paperLedger = paperLedger;
        this.instrumentRegistry = instrumentRegistry;
        this.tradeJournalService = tradeJournalService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public synchronized String placeOrder(OrderRequest request) {
        if (request.getQuantity() <= 0) {
            throw new RejectedOrderException("Quantity must be positive: " + request.getQuantity());
        }
        if (request.getOrderType() == OrderType.LIMIT && !isPositive(request.getPrice())) {
            throw new RejectedOrderException("LIMIT order needs a price");
        }
        if ((request.getOrderType() == OrderType.SL || request.getOrderType() == OrderType.SL_M)
                && !isPositive(request.getTriggerPrice())) {
            throw new RejectedOrderException(request.getOrderType() + " order needs a trigger price");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        PaperOrder order = PaperOrder.builder()
                .orderId("paper_" + clock.millis() + "_" + orderSequence.incrementAndGet())
                .tradingSymbol(request.getTradingSymbol())
                .exchange(request.getExchange())
                .product(request.getProduct())
                .side(request.getSide())
                .orderType(request.getOrderType())
                .quantity(request.getQuantity())
                .price(request.getPrice())
                .triggerPrice(request.getTriggerPrice())
                .status(isStopOrder(request.getOrderType()) ? OrderStatus.TRIGGER_PENDING : OrderStatus.OPEN)
                .placedAt(now)
                .updatedAt(now)
                .build();
        orders.put(order.getOrderId(), order);
        log.info(
                "Paper order {} placed: {} {} {} x{} price={} trigger={}",
                order.getOrderId(),
                order.getSide(),
                order.getOrderType(),
                order.getTradingSymbol(),
                order.getQuantity(),
                order.getPrice(),
                order.getTriggerPrice());

        BigDecimal ltp = lastPriceOf(order.getTradingSymbol()).orElse(null);
        if (ltp != null && isMarketableOnArrival(order, ltp)) {
            fill(order, ltp);
        } else {
            publish(order);
        }
        return order.getOrderId();
    }

    public synchronized void modifyOrder(String orderId, OrderRequest request) {
        PaperOrder order = orders.get(orderId);
        if (order == null || !order.isWorking()) {
            throw new RejectedOrderException("Paper order " + orderId + " is not open");
        }
        if (request.getPrice() != null) {
            order.setPrice(request.getPrice());
        }
        if (request.getTriggerPrice() != null) {
            order.setTriggerPrice(request.getTriggerPrice());
        }
        if (request.getQuantity() > 0) {
            order.setQuantity(request.getQuantity());
        }
        order.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Paper order {} modified: price={} trigger={}", orderId, order.getPrice(), order.getTriggerPrice());
        publish(order);
    }

    public synchronized CancelResult cancelOrder(String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            return CancelResult.NOT_FOUND;
        }
        if (!order.isWorking()) {
            return CancelResult.ALREADY_TERMINAL;
        }
        order.setStatus(OrderStatus.CANCELLED);
        order.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Paper order {} cancelled", orderId);
        publish(order);
        return CancelResult.CANCELLED;
    }

    @EventListener
    @Order(1)
    public void onTickBatch(TickBatchEvent event) {
        onTicks(event.getTicks());
    }

    /** Records last prices, marks held positions and fills any working order the prices now reach. */
    public synchronized void onTicks(List<Tick> ticks) {
        for (Tick tick : ticks) {
            if (tick.getLastPrice() != null && tick.getLastPrice().signum() > 0) {
                lastPrices.put(tick.getInstrumentToken(), tick.getLastPrice());
            }
        }

        for (String symbol : paperLedger.getPositions().keySet()) {
            lastPriceOf(symbol).ifPresent(ltp -> paperLedger.markPrice(symbol, ltp));
        }

        for (PaperOrder order : new ArrayList<>(orders.values())) {
            if (!order.isWorking()) {
                continue;
            }
            Optional<BigDecimal> ltp = lastPriceOf(order.getTradingSymbol());
            if (ltp.isEmpty()) {
                continue;
            }
            BigDecimal fillPrice = matchRestingOrder(order, ltp.get());
            if (fillPrice != null) {
                fill(order, fillPrice);
            }
        }
    }

    public synchronized List<RawOrder> getOrders() {
        return orders.values().stream().map(PaperOrder::toRawOrder).toList();
    }

    public synchronized Optional<PaperOrder> getOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(o -> o.toBuilder().build());
    }

    public List<RawPosition> getPositions() {
        List<RawPosition> result = new ArrayList<>();
        paperLedger.getPositions().forEach((symbol, p) -> result.add(RawPosition.builder()
                .tradingSymbol(symbol)
                .exchange(p.getExchange())
                .product(p.getProduct())
                .instrumentToken(instrumentRegistry
                        .findBySymbol(symbol)
                        .map(Contract::getInstrumentToken)
                        .orElse(null))
                .quantity(p.getQuantity())
                .averagePrice(p.getAveragePrice())
                .lastPrice(p.getLastPrice())
                .pnl(p.getPnl())
                .build()));
        return result;
    }

    private boolean isMarketableOnArrival(PaperOrder order, BigDecimal ltp) {
        return switch (order.getOrderType()) {
            case MARKET -> true;
            case LIMIT -> order.getSide() == OrderSide.BUY
                    ? order.getPrice().compareTo(ltp) >= 0
                    : order.getPrice().compareTo(ltp) <= 0;
            case SL, SL_M -> false;
        };
    }

    /** Fill price for a resting order at the given LTP, or null if it does not fill. */
    private BigDecimal matchRestingOrder(PaperOrder order, BigDecimal ltp) {
        return switch (order.getOrderType()) {
            case MARKET -> ltp;
            case LIMIT -> {
                boolean crossed = order.getSide() == OrderSide.BUY
                        ? ltp.compareTo(order.getPrice()) <= 0
                        : ltp.compareTo(order.getPrice()) >= 0;
                yield crossed ? order.getPrice() : null;
            }
            case SL, SL_M -> {
                boolean triggered = order.getSide() == OrderSide.BUY
                        ? ltp.compareTo(order.getTriggerPrice()) >= 0
                        : ltp.compareTo(order.getTriggerPrice()) <= 0;
                if (!triggered) {
                    yield null;
                }
                yield order.getOrderType() == OrderType.SL && order.getPrice() != null ? order.getPrice() : ltp;
            }
        };
    }

    private void fill(PaperOrder order, BigDecimal price) {
        BigDecimal realizedPnl = paperLedger.applyFill(
                order.getTradingSymbol(),
                order.getExchange(),
                order.getProduct(),
                order.getSide(),
                order.getQuantity(),
                price);
        LocalDateTime now = LocalDateTime.now(clock);
        order.setStatus(OrderStatus.COMPLETE);
        order.setFilledQuantity(order.getQuantity());
        order.setAveragePrice(price);
        order.setPnl(realizedPnl);
        order.setUpdatedAt(now);
        paperLedger.save();
        log.info(
                "Paper trade executed: {} {} {} @ {} (order {})",
                order.getSide(),
                order.getQuantity(),
                order.getTradingSymbol(),
                price,
                order.getOrderId());

        tradeJournalService.record(TradeRecord.builder()
                .orderId(order.getOrderId())
                .timestamp(now)
                .tradingSymbol(order.getTradingSymbol())
                .transactionType(order.getSide().name())
                .quantity(order.getQuantity())
                .averagePrice(price)
                .status(OrderStatus.COMPLETE.name())
                .product(order.getProduct())
                .pnl(realizedPnl)
                .build());
        publish(order);
    }

    private Optional<BigDecimal> lastPriceOf(String tradingSymbol) {
        return instrumentRegistry
                .findBySymbol(tradingSymbol)
                .map(contract -> lastPrices.get(contract.getInstrumentToken()));
    }

    private void publish(PaperOrder order) {
        eventPublisher.publishEvent(new PaperOrderUpdateEvent(this, order.toBuilder().build()));
    }

    private static boolean isStopOrder(OrderType orderType) {
        return orderType == OrderType.SL || orderType == OrderType.SL_M;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
