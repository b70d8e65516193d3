package com.optionscalper.domain.model;

import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Broker order that has not reached a terminal state. Replaced wholesale on every reconciliation. */
@Value
@Builder
public class PendingOrder {

    String orderId;
    String tradingSymbol;
    OrderSide transactionType;
    int quantity;
    BigDecimal price;
    BigDecimal triggerPrice;
    OrderStatus status;

    public static PendingOrder from(RawOrder rawOrder) {
        return PendingOrder.builder()
                .orderId(rawOrder.getOrderId())
                .tradingSymbol(rawOrder.getTradingSymbol())
                .transactionType(rawOrder.getTransactionType())
                .quantity(rawOrder.getQuantity())
                .price(rawOrder.getPrice())
                .triggerPrice(rawOrder.getTriggerPrice())
                .status(rawOrder.getStatus())
                .build();
    }
}
