package com.optionscalper.broker;

import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.model.MarginSnapshot;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.domain.model.RawPosition;
import com.optionscalper.domain.model.UserProfile;
import com.optionscalper.oms.OrderRequest;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Live {@link BrokerGateway}: delegates to the Kite order and account services. */
@Component
@ConditionalOnProperty(name = "scalper.trading-mode", havingValue = "LIVE")
public class KiteBrokerGateway implements BrokerGateway {

    private final KiteOrderService kiteOrderService;
    private final KiteAccountService kiteAccountService;

    public KiteBrokerGateway(KiteOrderService kiteOrderService, KiteAccountService kiteAccountService) {
        this.kiteOrderService = kiteOrderService;
        this.kiteAccountService = kiteAccountService;
    }

    @Override
    public String placeOrder(OrderRequest orderRequest) {
        return kiteOrderService.placeOrder(orderRequest);
    }

    @Override
    public void modifyOrder(String orderId, OrderRequest orderRequest) {
        kiteOrderService.modifyOrder(orderId, orderRequest);
    }

    @Override
    public CancelResult cancelOrder(String variety, String orderId) {
        return kiteOrderService.cancelOrder(variety, orderId);
    }

    @Override
    public List<RawPosition> getPositions() {
        return kiteAccountService.getPositions();
    }

    @Override
    public List<RawOrder> getOrders() {
        return kiteOrderService.getOrders();
    }

    @Override
    public MarginSnapshot getMargins() {
        return kiteAccountService.getMargins();
    }

    @Override
    public UserProfile getProfile() {
        return kiteAccountService.getProfile();
    }
}
