package com.optionscalper.journal;

import com.optionscalper.entity.DailyPnlEntity;
import com.optionscalper.repository.jpa.DailyPnlJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Realized P&L per calendar day. {@link #record(LocalDate, BigDecimal)} adds to the stored
 * value for that date instead of replacing it.
 */
@Service
public class DailyPnlService {

    private static final Logger log = LoggerFactory.getLogger(DailyPnlService.class);

    private final DailyPnlJpaRepository dailyPnlJpaRepository;
    private final Clock clock;

    public DailyPnlService(DailyPnlJpaRepository dailyPnlJpaRepository, Clock clock) {
        this.dailyPnlJpaRepository = dailyPnlJpaRepository;
        this.clock = clock;
    }

    /** Adds {@code pnl} to the cumulative realized P&L of {@code date}. Returns the new total. */
    @Transactional
    public synchronized BigDecimal record(LocalDate date, BigDecimal pnl) {
        DailyPnlEntity entity = dailyPnlJpaRepository
                .findByPnlDate(date)
                .orElseGet(() -> DailyPnlEntity.builder()
                        .pnlDate(date)
                        .realizedPnl(BigDecimal.ZERO)
                        .build());
        BigDecimal total = entity.getRealizedPnl().add(pnl);
        entity.setRealizedPnl(total);
        entity.setUpdatedAt(LocalDateTime.now(clock));
        dailyPnlJpaRepository.save(entity);
        log.info("Daily P&L {}: {} (+{})", date, total, pnl);
        return total;
    }

    @Transactional(readOnly = true)
    public BigDecimal getPnlFor(LocalDate date) {
        return dailyPnlJpaRepository
                .findByPnlDate(date)
                .map(DailyPnlEntity::getRealizedPnl)
                .orElse(BigDecimal.ZERO);
    }

    /** All recorded days, most recent first. */
    @Transactional(readOnly = true)
    public Map<LocalDate, BigDecimal> getAll() {
        Map<LocalDate, BigDecimal> result = new LinkedHashMap<>();
        dailyPnlJpaRepository
                .findAllByOrderByPnlDateDesc()
                .forEach(entity -> result.put(entity.getPnlDate(), entity.getRealizedPnl()));
        return result;
    }
}
