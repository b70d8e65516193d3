package com.optionscalper.journal;

import com.optionscalper.entity.TradeRecordEntity;
import com.optionscalper.repository.jpa.TradeRecordJpaRepository;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trade history for live and paper trading. Records are keyed by broker order id; writing the
 * same order id again replaces the earlier record.
 *
 * <p>Journal writes are best-effort from the trading path: a storage failure is logged and never
 * fails the exit or fill that produced the record.
 */
@Service
public class TradeJournalService {

    private static final Logger log = LoggerFactory.getLogger(TradeJournalService.class);

    private final TradeRecordJpaRepository tradeRecordJpaRepository;

    public TradeJournalService(TradeRecordJpaRepository tradeRecordJpaRepository) {
        this.tradeRecordJpaRepository = tradeRecordJpaRepository;
    }

    /** Runs without a transaction of its own; the repository save commits independently. */
    public void record(TradeRecord tradeRecord) {
        try {
            tradeRecordJpaRepository.save(toEntity(tradeRecord));
            log.debug("Trade recorded: orderId={} symbol={}", tradeRecord.getOrderId(), tradeRecord.getTradingSymbol());
        } catch (RuntimeException e) {
            log.error("Failed to record trade {}: {}", tradeRecord.getOrderId(), e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<TradeRecord> getAllTrades() {
        return tradeRecordJpaRepository.findAllByOrderByExecutedAtDesc().stream()
                .map(this::toRecord)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TradeRecord> getTradesFor(LocalDate date) {
        return tradeRecordJpaRepository
                .findByExecutedAtRange(date.atStartOfDay(), date.plusDays(1).atStartOfDay())
                .stream()
                .map(this::toRecord)
                .toList();
    }

    private TradeRecordEntity toEntity(TradeRecord tradeRecord) {
        return TradeRecordEntity.builder()
                .orderId(tradeRecord.getOrderId())
                .executedAt(tradeRecord.getTimestamp())
                .tradingSymbol(tradeRecord.getTradingSymbol())
                .transactionType(tradeRecord.getTransactionType())
                .quantity(tradeRecord.getQuantity())
                .averagePrice(tradeRecord.getAveragePrice())
                .status(tradeRecord.getStatus())
                .product(tradeRecord.getProduct())
                .pnl(tradeRecord.getPnl())
                .build();
    }

    private TradeRecord toRecord(TradeRecordEntity entity) {
        return TradeRecord.builder()
                .orderId(entity.getOrderId())
                .timestamp(entity.getExecutedAt())
                .tradingSymbol(entity.getTradingSymbol())
                .transactionType(entity.getTransactionType())
                .quantity(entity.getQuantity())
                .averagePrice(entity.getAveragePrice())
                .status(entity.getStatus())
                .product(entity.getProduct())
                .pnl(entity.getPnl())
                .build();
    }
}
