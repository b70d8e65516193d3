package com.optionscalper.risk;

import com.optionscalper.domain.model.Position;
import com.optionscalper.domain.model.Tick;
import com.optionscalper.event.TickBatchEvent;
import com.optionscalper.oms.OcoLegManager;
import com.optionscalper.position.PositionStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Evaluates stop-loss, target and trailing-stop for every open position on each tick batch.
 *
 * <p>Per batch: ticks are indexed by token; each position with a known contract and no exit in flight
 * gets its last price and floating P&L updated (only when the price actually moved), then its exit
 * conditions are checked in order stop-loss, target, trailing ratchet, stopping at the first exit.
 * One PositionsChanged is published at the end if any P&L changed.
 *
 * <p>Stop-loss and target fire locally only for long positions and only when no broker leg exists
 * for that condition; a live broker leg enforces it on the exchange. The trailing ratchet only ever
 * raises the stop-loss, in whole multiples of the trailing distance, and moves the broker stop-loss
 * leg along when one exists.
 *
 * <p>Runs on the stream processor thread, so batches are handled strictly one after another.
 * Nothing thrown here reaches the stream.
 */
@Service
public class RiskTriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskTriggerEngine.class);

    static final BigDecimal PRICE_EPSILON = new BigDecimal("1e-9");

    private final PositionStore positionStore;
    private final PositionExitService positionExitService;
    private final OcoLegManager ocoLegManager;
    private final Clock clock;

    public RiskTriggerEngine(
            PositionStore positionStore,
            PositionExitService positionExitService,
            OcoLegManager ocoLegManager,
            Clock clock) {
        this.positionStore = positionStore;
        this.positionExitService = positionExitService;
        this.ocoLegManager = ocoLegManager;
        this.clock = clock;
    }

    @EventListener
    @Order(2)
    public void onTickBatch(TickBatchEvent event) {
        onTicks(event.getTicks());
    }

    public void onTicks(List<Tick> ticks) {
        Map<Long, BigDecimal> lastPrices = new HashMap<>();
        for (Tick tick : ticks) {
            if (tick.getLastPrice() != null) {
                lastPrices.put(tick.getInstrumentToken(), tick.getLastPrice());
            }
        }
        if (lastPrices.isEmpty()) {
            return;
        }

        boolean changed = false;
        for (Position position : positionStore.getAllPositions()) {
            if (!position.hasContract() || position.isExitInProgress()) {
                continue;
            }
            BigDecimal ltp = lastPrices.get(position.getInstrumentToken());
            if (ltp == null) {
                continue;
            }
            try {
                if (updatePrice(position, ltp)) {
                    changed = true;
                }
                if (evaluateExitConditions(position, ltp)) {
                    changed = true;
                }
            } catch (RuntimeException e) {
                log.error("Risk evaluation failed for {}: {}", position.getTradingSymbol(), e.getMessage(), e);
            }
        }

        if (changed) {
            positionStore.publishPositionsChanged();
        }
    }

    private boolean updatePrice(Position position, BigDecimal ltp) {
        BigDecimal previous = position.getLastPrice();
        if (previous != null && ltp.subtract(previous).abs().compareTo(PRICE_EPSILON) <= 0) {
            return false;
        }
        position.setLastPrice(ltp);
        position.recalculatePnl();
        position.setLastUpdated(LocalDateTime.now(clock));
        return true;
    }

    /** Returns true when the position's protective state changed without an exit. */
    private boolean evaluateExitConditions(Position position, BigDecimal ltp) {
        if (!position.isLong()) {
            return false;
        }

        BigDecimal stopLoss = position.getStopLoss();
        if (stopLoss != null && ltp.compareTo(stopLoss) <= 0) {
            if (position.getStopLossOrderId() == null) {
                log.info("Stop-loss hit for {}: ltp={} sl={}", position.getTradingSymbol(), ltp, stopLoss);
                positionExitService.exit(position, "stop-loss");
            }
            return false;
        }

        BigDecimal target = position.getTarget();
        if (target != null && ltp.compareTo(target) >= 0) {
            if (position.getTargetOrderId() == null) {
                log.info("Target hit for {}: ltp={} target={}", position.getTradingSymbol(), ltp, target);
                positionExitService.exit(position, "target");
            }
            return false;
        }

        return applyTrailingStop(position, ltp);
    }

    private boolean applyTrailingStop(Position position, BigDecimal ltp) {
        BigDecimal trailingDistance = position.getTrailingDistance();
        BigDecimal stopLoss = position.getStopLoss();
        if (trailingDistance == null || trailingDistance.signum() <= 0 || stopLoss == null) {
            return false;
        }
        BigDecimal points = ltp.subtract(position.getAveragePrice());
        if (points.signum() <= 0) {
            return false;
        }

        int steps = points.divide(trailingDistance, 0, RoundingMode.FLOOR).intValue();
        int applied = position.getTrailingStepsApplied();
        if (steps <= applied) {
            return false;
        }

        BigDecimal newStopLoss = stopLoss.add(trailingDistance.multiply(BigDecimal.valueOf(steps - applied)));
        position.setStopLoss(newStopLoss);
        position.setTrailingStepsApplied(steps);
        log.info(
                "Trailing stop for {} raised {} -> {} (ltp={}, steps={})",
                position.getTradingSymbol(),
                stopLoss,
                newStopLoss,
                ltp,
                steps);
        if (position.getStopLossOrderId() != null) {
            ocoLegManager.syncStopLeg(position);
        }
        return true;
    }
}
