package com.optionscalper.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_records table: one row per broker order id, live and paper alike.
 * Saving a record with an existing order id replaces the previous row.
 */
@Entity
@Table(name = "trade_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeRecordEntity {

    @Id
    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;

    @Column(name = "trading_symbol", length = 64)
    private String tradingSymbol;

    @Column(name = "transaction_type", length = 8)
    private String transactionType;

    private int quantity;

    @Column(name = "average_price", precision = 15, scale = 2)
    private BigDecimal averagePrice;

    @Column(length = 24)
    private String status;

    @Column(length = 16)
    private String product;

    @Column(precision = 15, scale = 2)
    private BigDecimal pnl;
}
