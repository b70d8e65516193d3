package com.optionscalper.simulator;

import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.OrderType;
import com.optionscalper.domain.model.RawOrder;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A simulated order held by the {@link PaperMatchingEngine}. Mutable: status, fill price and
 * realized P&L change as the order works.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaperOrder {

    private String orderId;
    private String tradingSymbol;
    private String exchange;
    private String product;
    private OrderSide side;
    private OrderType orderType;
    private int quantity;
    private BigDecimal price;
    private BigDecimal triggerPrice;
    private OrderStatus status;
    private int filledQuantity;
    private BigDecimal averagePrice;

    /** Realized P&L of the fill, set only when the fill reduced an existing position. */
    private BigDecimal pnl;

    private String statusMessage;
    private LocalDateTime placedAt;
    private LocalDateTime updatedAt;

    public boolean isWorking() {
        return status != null && status.isPending();
    }

    public RawOrder toRawOrder() {
        return RawOrder.builder()
                .orderId(orderId)
                .tradingSymbol(tradingSymbol)
                .exchange(exchange)
                .product(product)
                .transactionType(side)
                .orderType(orderType)
                .quantity(quantity)
                .filledQuantity(filledQuantity)
                .price(price)
                .triggerPrice(triggerPrice)
                .averagePrice(averagePrice)
                .status(status)
                .statusMessage(statusMessage)
                .orderTimestamp(placedAt)
                .build();
    }
}
