package com.optionscalper.broker;

import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.model.MarginSnapshot;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.domain.model.RawPosition;
import com.optionscalper.domain.model.UserProfile;
import com.optionscalper.oms.OrderRequest;
import java.util.List;

/**
 * Execution interface of the trading core. Implemented by {@link KiteBrokerGateway} for live
 * trading and by {@link com.optionscalper.simulator.PaperBrokerGateway} for paper trading;
 * exactly one is active, selected by {@code scalper.trading-mode}.
 *
 * <p>Failures surface as {@link com.optionscalper.exception.ApiException} subclasses:
 * {@link com.optionscalper.exception.RejectedOrderException} when the broker refuses an order,
 * {@link com.optionscalper.exception.TransientApiException} for everything that may succeed later.
 * Cancelling an order that already finished or does not exist is not an error; see {@link CancelResult}.
 */
public interface BrokerGateway {

    /** Places an order and returns the broker order id. */
    String placeOrder(OrderRequest orderRequest);

    /** Modifies price / trigger price / quantity of a working order. */
    void modifyOrder(String orderId, OrderRequest orderRequest);

    CancelResult cancelOrder(String variety, String orderId);

    /** Net positions for the account, including ones with zero quantity if the broker reports them. */
    List<RawPosition> getPositions();

    /** All orders of the trading day. */
    List<RawOrder> getOrders();

    MarginSnapshot getMargins();

    UserProfile getProfile();
}
