package com.optionscalper.oms;

import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order placement parameters for the execution interface.
 *
 * <p>{@code price} is used by LIMIT/SL orders, {@code triggerPrice} by SL/SL_M.
 * Variety defaults to "regular", exchange to "NFO" and product to "MIS".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {

    public static final String VARIETY_REGULAR = "regular";

    @Builder.Default
    private String variety = VARIETY_REGULAR;

    @Builder.Default
    private String exchange = "NFO";

    private String tradingSymbol;
    private OrderSide side;
    private int quantity;

    @Builder.Default
    private String product = "MIS";

    private OrderType orderType;
    private BigDecimal price;
    private BigDecimal triggerPrice;

    /** Market order closing {@code quantity} units on the given side. */
    public static OrderRequest market(
            String tradingSymbol, String exchange, String product, OrderSide side, int quantity) {
        return OrderRequest.builder()
                .tradingSymbol(tradingSymbol)
                .exchange(exchange != null ? exchange : "NFO")
                .product(product != null ? product : "MIS")
                .side(side)
                .quantity(quantity)
                .orderType(OrderType.MARKET)
                .build();
    }
}
