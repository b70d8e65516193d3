package com.optionscalper.domain.model;

import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Order record as reported by the execution interface, with the status already normalised. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawOrder {

    private String orderId;
    private String tradingSymbol;
    private String exchange;
    private String product;
    private OrderSide transactionType;
    private OrderType orderType;
    private int quantity;
    private int filledQuantity;
    private BigDecimal price;
    private BigDecimal triggerPrice;
    private BigDecimal averagePrice;
    private OrderStatus status;
    private String statusMessage;
    private LocalDateTime orderTimestamp;
}
