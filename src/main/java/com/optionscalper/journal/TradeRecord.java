package com.optionscalper.journal;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** One executed (or closed) trade as written to the journal. */
@Value
@Builder
public class TradeRecord {

    String orderId;
    LocalDateTime timestamp;
    String tradingSymbol;
    String transactionType;
    int quantity;
    BigDecimal averagePrice;
    String status;
    String product;
    BigDecimal pnl;
}
