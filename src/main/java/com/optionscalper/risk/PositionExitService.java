package com.optionscalper.risk;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.model.Position;
import com.optionscalper.event.BrokerErrorEvent;
import com.optionscalper.exception.ResourceNotFoundException;
import com.optionscalper.oms.OcoLegManager;
import com.optionscalper.oms.OrderRequest;
import com.optionscalper.position.PositionStore;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Closes positions with market orders. Used by the risk trigger engine and by manual exits.
 *
 * <p>Procedure: claim the position's exit flag (only one caller wins), cancel its protective legs,
 * submit a market order opposite to the position for the full quantity, then remove it from the
 * store optimistically. If submission fails the flag is cleared so a later tick can retry, and the
 * protective legs are placed again. Once the broker has accepted the exit order the attempt counts
 * as submitted, whatever happens to the local bookkeeping afterwards.
 */
@Service
public class PositionExitService {

    private static final Logger log = LoggerFactory.getLogger(PositionExitService.class);

    private final BrokerGateway brokerGateway;
    private final PositionStore positionStore;
    private final OcoLegManager ocoLegManager;
    private final ApplicationEventPublisher eventPublisher;

    public PositionExitService(
            BrokerGateway brokerGateway,
            PositionStore positionStore,
            OcoLegManager ocoLegManager,
            ApplicationEventPublisher eventPublisher) {
        this.brokerGateway = brokerGateway;
        this.positionStore = positionStore;
        this.ocoLegManager = ocoLegManager;
        this.eventPublisher = eventPublisher;
    }

    public ExitResult exit(Position position, String reason) {
        String symbol = position.getTradingSymbol();
        if (!position.tryBeginExit()) {
            log.debug("Exit for {} already in progress", symbol);
            return ExitResult.alreadyExiting(symbol);
        }

        boolean hadLegs = position.hasProtectiveLegs();
        ocoLegManager.cancelLegs(position);

        OrderSide side = position.isLong() ? OrderSide.SELL : OrderSide.BUY;
        int quantity = Math.abs(position.getQuantity());
        String orderId;
        try {
            orderId = brokerGateway.placeOrder(OrderRequest.market(
                    symbol, position.getExchange(), position.getProduct(), side, quantity));
        } catch (RuntimeException e) {
            position.clearExitInProgress();
            log.error("Exit for {} ({}) failed: {}", symbol, reason, e.getMessage());
            eventPublisher.publishEvent(new BrokerErrorEvent(this, "exit " + symbol, e.getMessage(), e));
            if (hadLegs) {
                ocoLegManager.placeBracketOrder(position);
            }
            return ExitResult.failed(symbol, e.getMessage());
        }
        log.info("Exit submitted for {} ({}): {} {} @ market, order {}", symbol, reason, side, quantity, orderId);

        // The order is live at the broker from here on: the position stays flagged as exiting.
        try {
            positionStore.removePosition(symbol, orderId);
        } catch (RuntimeException e) {
            log.error("Exit order {} for {} accepted but local removal failed: {}", orderId, symbol, e.getMessage(), e);
            eventPublisher.publishEvent(
                    new BrokerErrorEvent(this, "removePosition " + symbol, e.getMessage(), e));
        }
        return ExitResult.submitted(symbol, orderId);
    }

    /** Manual exit of one position. */
    public ExitResult exitPosition(String tradingSymbol) {
        Position position = positionStore
                .getPosition(tradingSymbol)
                .orElseThrow(() -> new ResourceNotFoundException("Position", tradingSymbol));
        return exit(position, "manual");
    }

    /**
     * Exits every open position, continuing past individual failures, then reconciles so the store
     * reflects the broker's view.
     */
    public List<ExitResult> exitAllPositions() {
        List<Position> open = positionStore.getAllPositions();
        log.info("Exiting all {} positions", open.size());
        List<ExitResult> results = new ArrayList<>();
        for (Position position : open) {
            results.add(exit(position, "exit all"));
        }
        positionStore.refreshFromBroker();
        return results;
    }
}
