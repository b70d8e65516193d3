package com.optionscalper.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An open position keyed by trading symbol. Quantity is signed (positive = long) and never zero
 * while the position is held by the store.
 *
 * <p>{@code instrumentToken} indexes the contract arena. A null token marks a placeholder contract:
 * quantity and prices are still tracked, but ticks cannot be routed to the position.
 *
 * <p>Protective state: optional stop-loss / target / trailing distance, plus the broker order ids
 * of the stop-loss and target legs when those legs were placed. {@code trailingStepsApplied} counts
 * the whole trailing increments already folded into {@code stopLoss}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String tradingSymbol;
    private Long instrumentToken;
    private String exchange;
    private String product;

    private int quantity;
    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private BigDecimal pnl;

    private BigDecimal stopLoss;
    private BigDecimal target;
    private BigDecimal trailingDistance;
    private int trailingStepsApplied;

    private String stopLossOrderId;
    private String targetOrderId;

    private volatile boolean exitInProgress;

    /** P&L already folded into realized by a local exit; the broker has not confirmed the close yet. */
    private boolean realizedLocally;

    private LocalDateTime lastUpdated;

    public boolean isLong() {
        return quantity > 0;
    }

    public boolean hasContract() {
        return instrumentToken != null;
    }

    public boolean hasProtectiveLegs() {
        return stopLossOrderId != null || targetOrderId != null;
    }

    /**
     * Marks the position as exiting. Returns false when an exit is already in flight,
     * so exactly one caller wins the right to submit the exit order.
     */
    public synchronized boolean tryBeginExit() {
        if (exitInProgress) {
            return false;
        }
        exitInProgress = true;
        return true;
    }

    public synchronized void clearExitInProgress() {
        exitInProgress = false;
    }

    /** Recomputes floating P&L as (lastPrice - averagePrice) x quantity. */
    public void recalculatePnl() {
        if (lastPrice == null || averagePrice == null) {
            return;
        }
        pnl = lastPrice.subtract(averagePrice).multiply(BigDecimal.valueOf(quantity));
    }
}
