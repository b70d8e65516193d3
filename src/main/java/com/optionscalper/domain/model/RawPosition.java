package com.optionscalper.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Net position record exactly as the execution interface reports it. Converted into
 * {@link Position} by the position store; never passed deeper into the core.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawPosition {

    private String tradingSymbol;
    private String exchange;
    private String product;
    private Long instrumentToken;
    private int quantity;
    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private BigDecimal pnl;
}
