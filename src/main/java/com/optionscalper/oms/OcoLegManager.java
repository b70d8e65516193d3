package com.optionscalper.oms;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.OrderType;
import com.optionscalper.domain.model.Position;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.event.BrokerOrdersFetchedEvent;
import com.optionscalper.position.PositionStore;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Keeps each position's protective order pair (stop-loss leg + target leg) one-cancels-other.
 *
 * <p>Invariant after {@link #reconcileLegs(List)}: no position holds two broker-live protective legs.
 * Cancels are best-effort. Under a race the opposite leg may already be complete or cancelled, which
 * comes back as {@link CancelResult#ALREADY_TERMINAL} and is fine; any other failure is logged and the
 * check runs again on the next reconciliation pass.
 *
 * <p>Legs are exits for the position's side: a long position gets SELL legs. The stop-loss leg is an
 * SL-M order triggered at the stop price, the target leg a LIMIT at the target price.
 */
@Service
public class OcoLegManager {

    private static final Logger log = LoggerFactory.getLogger(OcoLegManager.class);

    private final BrokerGateway brokerGateway;
    private final PositionStore positionStore;

    public OcoLegManager(BrokerGateway brokerGateway, PositionStore positionStore) {
        this.brokerGateway = brokerGateway;
        this.positionStore = positionStore;
    }

    /**
     * Places a stop-loss leg if the position has a stop-loss price and a target leg if it has a target.
     * Each leg is placed independently; a failure on one is logged and does not stop the other.
     */
    public void placeBracketOrder(Position position) {
        OrderSide exitSide = position.isLong() ? OrderSide.SELL : OrderSide.BUY;
        int quantity = Math.abs(position.getQuantity());

        if (position.getStopLoss() != null) {
            try {
                String orderId = brokerGateway.placeOrder(OrderRequest.builder()
                        .tradingSymbol(position.getTradingSymbol())
                        .exchange(exchangeOf(position))
                        .product(productOf(position))
                        .side(exitSide)
                        .quantity(quantity)
                        .orderType(OrderType.SL_M)
                        .triggerPrice(position.getStopLoss())
                        .build());
                position.setStopLossOrderId(orderId);
                log.info("Stop-loss leg placed for {}: {} @ {}", position.getTradingSymbol(), orderId, position.getStopLoss());
            } catch (RuntimeException e) {
                log.error("Failed to place stop-loss leg for {}: {}", position.getTradingSymbol(), e.getMessage());
            }
        }

        if (position.getTarget() != null) {
            try {
                String orderId = brokerGateway.placeOrder(OrderRequest.builder()
                        .tradingSymbol(position.getTradingSymbol())
                        .exchange(exchangeOf(position))
                        .product(productOf(position))
                        .side(exitSide)
                        .quantity(quantity)
                        .orderType(OrderType.LIMIT)
                        .price(position.getTarget())
                        .build());
                position.setTargetOrderId(orderId);
                log.info("Target leg placed for {}: {} @ {}", position.getTradingSymbol(), orderId, position.getTarget());
            } catch (RuntimeException e) {
                log.error("Failed to place target leg for {}: {}", position.getTradingSymbol(), e.getMessage());
            }
        }
    }

    @EventListener
    public void onBrokerOrdersFetched(BrokerOrdersFetchedEvent event) {
        reconcileLegs(event.getOrders());
    }

    /**
     * One OCO pass over all positions holding legs. When one leg is COMPLETE the other is cancelled and
     * both ids cleared; a leg that ended CANCELLED or REJECTED just has its id cleared.
     */
    public void reconcileLegs(List<RawOrder> brokerOrders) {
        Map<String, OrderStatus> statusById = new HashMap<>();
        for (RawOrder order : brokerOrders) {
            if (order.getOrderId() != null && order.getStatus() != null) {
                statusById.put(order.getOrderId(), order.getStatus());
            }
        }

        for (Position position : positionStore.getAllPositions()) {
            if (!position.hasProtectiveLegs()) {
                continue;
            }
            OrderStatus stopStatus = statusOf(statusById, position.getStopLossOrderId());
            OrderStatus targetStatus = statusOf(statusById, position.getTargetOrderId());

            if (stopStatus == OrderStatus.COMPLETE) {
                log.info(
                        "Stop-loss leg {} for {} executed; cancelling target leg",
                        position.getStopLossOrderId(),
                        position.getTradingSymbol());
                cancelLeg(position.getTargetOrderId(), targetStatus, position.getTradingSymbol());
                position.setStopLossOrderId(null);
                position.setTargetOrderId(null);
                continue;
            }
            if (targetStatus == OrderStatus.COMPLETE) {
                log.info(
                        "Target leg {} for {} executed; cancelling stop-loss leg",
                        position.getTargetOrderId(),
                        position.getTradingSymbol());
                cancelLeg(position.getStopLossOrderId(), stopStatus, position.getTradingSymbol());
                position.setStopLossOrderId(null);
                position.setTargetOrderId(null);
                continue;
            }

            if (isDead(stopStatus)) {
                log.info("Stop-loss leg {} for {} is {}", position.getStopLossOrderId(), position.getTradingSymbol(), stopStatus);
                position.setStopLossOrderId(null);
            }
            if (isDead(targetStatus)) {
                log.info("Target leg {} for {} is {}", position.getTargetOrderId(), position.getTradingSymbol(), targetStatus);
                position.setTargetOrderId(null);
            }
        }
    }

    /**
     * Replaces a position's protection: cancels existing legs, overwrites stop-loss / target / trailing
     * distance (null or non-positive clears a field) and places new legs. Logs and returns if the
     * position has already gone.
     */
    public void updateProtection(String tradingSymbol, BigDecimal stopLoss, BigDecimal target, BigDecimal trailingDistance) {
        Optional<Position> found = positionStore.getPosition(tradingSymbol);
        if (found.isEmpty()) {
            log.warn("Cannot update protection for {}: position no longer exists", tradingSymbol);
            return;
        }
        Position position = found.get();

        cancelLegs(position);
        position.setStopLoss(positiveOrNull(stopLoss));
        position.setTarget(positiveOrNull(target));
        position.setTrailingDistance(positiveOrNull(trailingDistance));
        position.setTrailingStepsApplied(0);
        log.info(
                "Protection updated for {}: sl={} target={} trail={}",
                tradingSymbol,
                position.getStopLoss(),
                position.getTarget(),
                position.getTrailingDistance());

        placeBracketOrder(position);
        positionStore.publishPositionsChanged();
    }

    /** Best-effort cancel of both legs; ids are cleared whatever the outcome. */
    public void cancelLegs(Position position) {
        if (position.getStopLossOrderId() != null) {
            cancelLeg(position.getStopLossOrderId(), null, position.getTradingSymbol());
            position.setStopLossOrderId(null);
        }
        if (position.getTargetOrderId() != null) {
            cancelLeg(position.getTargetOrderId(), null, position.getTradingSymbol());
            position.setTargetOrderId(null);
        }
    }

    /** Moves the broker stop-loss leg's trigger to the position's current (ratcheted) stop-loss. */
    public void syncStopLeg(Position position) {
        String orderId = position.getStopLossOrderId();
        if (orderId == null || position.getStopLoss() == null) {
            return;
        }
        try {
            brokerGateway.modifyOrder(orderId, OrderRequest.builder()
                    .tradingSymbol(position.getTradingSymbol())
                    .exchange(exchangeOf(position))
                    .product(productOf(position))
                    .quantity(Math.abs(position.getQuantity()))
                    .orderType(OrderType.SL_M)
                    .triggerPrice(position.getStopLoss())
                    .build());
            log.info("Stop-loss leg {} for {} moved to {}", orderId, position.getTradingSymbol(), position.getStopLoss());
        } catch (RuntimeException e) {
            log.error("Failed to move stop-loss leg {} for {}: {}", orderId, position.getTradingSymbol(), e.getMessage());
        }
    }

    private void cancelLeg(String orderId, OrderStatus knownStatus, String tradingSymbol) {
        if (orderId == null) {
            return;
        }
        if (knownStatus != null && knownStatus.isTerminal()) {
            log.debug("Leg {} for {} already {}; nothing to cancel", orderId, tradingSymbol, knownStatus);
            return;
        }
        try {
            CancelResult result = brokerGateway.cancelOrder(OrderRequest.VARIETY_REGULAR, orderId);
            if (result == CancelResult.CANCELLED) {
                log.info("Cancelled leg {} for {}", orderId, tradingSymbol);
            } else {
                log.info("Leg {} for {} not cancelled: {}", orderId, tradingSymbol, result);
            }
        } catch (RuntimeException e) {
            log.warn("Cancel of leg {} for {} failed: {}", orderId, tradingSymbol, e.getMessage());
        }
    }

    private static OrderStatus statusOf(Map<String, OrderStatus> statusById, String orderId) {
        return orderId != null ? statusById.get(orderId) : null;
    }

    private static boolean isDead(OrderStatus status) {
        return status == OrderStatus.CANCELLED || status == OrderStatus.REJECTED;
    }

    private static BigDecimal positiveOrNull(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : null;
    }

    private static String exchangeOf(Position position) {
        return position.getExchange() != null ? position.getExchange() : "NFO";
    }

    private static String productOf(Position position) {
        return position.getProduct() != null ? position.getProduct() : "MIS";
    }
}
