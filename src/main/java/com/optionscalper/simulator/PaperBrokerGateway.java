package com.optionscalper.simulator;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.model.MarginSnapshot;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.domain.model.RawPosition;
import com.optionscalper.domain.model.UserProfile;
import com.optionscalper.oms.OrderRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of {@link BrokerGateway}: orders go to the {@link PaperMatchingEngine},
 * positions and margins come from the {@link PaperLedger}.
 *
 * <p>Margins report the cash balance as available and the notional of open positions as utilised.
 */
@Service
@ConditionalOnProperty(name = "scalper.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerGateway.class);

    static final String PAPER_USER_ID = "PAPER";

    private final PaperMatchingEngine paperMatchingEngine;
    private final PaperLedger paperLedger;

    public PaperBrokerGateway(PaperMatchingEngine paperMatchingEngine, PaperLedger paperLedger) {
        this.paperMatchingEngine = paperMatchingEngine;
        this.paperLedger = paperLedger;
    }

    @Override
    public String placeOrder(OrderRequest orderRequest) {
        log.debug(
                "Paper placeOrder: {} {} {} qty={}",
                orderRequest.getSide(),
                orderRequest.getOrderType(),
                orderRequest.getTradingSymbol(),
                orderRequest.getQuantity());
        return paperMatchingEngine.placeOrder(orderRequest);
    }

    @Override
    public void modifyOrder(String orderId, OrderRequest orderRequest) {
        paperMatchingEngine.modifyOrder(orderId, orderRequest);
    }

    @Override
    public CancelResult cancelOrder(String variety, String orderId) {
        return paperMatchingEngine.cancelOrder(orderId);
    }

    @Override
    public List<RawPosition> getPositions() {
        return paperMatchingEngine.getPositions();
    }

    @Override
    public List<RawOrder> getOrders() {
        return paperMatchingEngine.getOrders();
    }

    @Override
    public MarginSnapshot getMargins() {
        return MarginSnapshot.builder()
                .available(paperLedger.getBalance())
                .utilised(paperLedger.getUsedMargin())
                .build();
    }

    @Override
    public UserProfile getProfile() {
        return UserProfile.builder().userId(PAPER_USER_ID).userName("Paper Trading").build();
    }
}
