package com.optionscalper.simulator;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One simulated net position, in the shape it is persisted to the paper ledger file. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaperPosition {

    private int quantity;
    private BigDecimal averagePrice;
    private String exchange;
    private String product;
    private BigDecimal lastPrice;
    private BigDecimal pnl;
}
