package com.optionscalper.unit.journal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionscalper.entity.TradeRecordEntity;
import com.optionscalper.journal.TradeJournalService;
import com.optionscalper.journal.TradeRecord;
import com.optionscalper.repository.jpa.TradeRecordJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class TradeJournalServiceTest {

    @Mock
    private TradeRecordJpaRepository tradeRecordJpaRepository;

    private TradeJournalService tradeJournalService;

    @BeforeEach
    void setUp() {
        tradeJournalService = new TradeJournalService(tradeRecordJpaRepository);
    }

    private static TradeRecord trade() {
        return TradeRecord.builder()
                .orderId("240302000123")
                .timestamp(LocalDateTime.of(2026, 3, 2, 10, 15))
                .tradingSymbol("NIFTY26MAR22000CE")
                .transactionType("SELL")
                .quantity(75)
                .averagePrice(new BigDecimal("112.5"))
                .status("COMPLETE")
                .product("MIS")
                .pnl(new BigDecimal("937.5"))
                .build();
    }

    @Test
    @DisplayName("Records are stored keyed by order id")
    void recordStoresEntity() {
        tradeJournalService.record(trade());

        ArgumentCaptor<TradeRecordEntity> captor = ArgumentCaptor.forClass(TradeRecordEntity.class);
        verify(tradeRecordJpaRepository).save(captor.capture());
        assertThat(captor.getValue().getOrderId()).isEqualTo("240302000123");
        assertThat(captor.getValue().getExecutedAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 10, 15));
        assertThat(captor.getValue().getPnl()).isEqualByComparingTo("937.5");
    }

    @Test
    @DisplayName("A storage failure is logged and never reaches the trading path")
    void storageFailureSwallowedAtBoundary() {
        when(tradeRecordJpaRepository.save(any())).thenThrow(new DataAccessResourceFailureException("disk full"));

        assertThatCode(() -> tradeJournalService.record(trade())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Trades for a date query the half-open day range")
    void tradesForDate() {
        LocalDate date = LocalDate.of(2026, 3, 2);
        when(tradeRecordJpaRepository.findByExecutedAtRange(date.atStartOfDay(), date.plusDays(1).atStartOfDay()))
                .thenReturn(List.of(TradeRecordEntity.builder()
                        .orderId("240302000123")
                        .tradingSymbol("NIFTY26MAR22000CE")
                        .quantity(75)
                        .build()));

        List<TradeRecord> trades = tradeJournalService.getTradesFor(date);

        assertThat(trades).singleElement().satisfies(t -> {
            assertThat(t.getOrderId()).isEqualTo("240302000123");
            assertThat(t.getQuantity()).isEqualTo(75);
        });
    }
}
