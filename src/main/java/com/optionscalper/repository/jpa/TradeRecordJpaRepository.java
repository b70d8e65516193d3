package com.optionscalper.repository.jpa;

import com.optionscalper.entity.TradeRecordEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** JPA repository for trade_records. {@code save} is an upsert on the order id. */
@Repository
public interface TradeRecordJpaRepository extends JpaRepository<TradeRecordEntity, String> {

    List<TradeRecordEntity> findAllByOrderByExecutedAtDesc();

    @Query("SELECT t FROM TradeRecordEntity t WHERE t.executedAt >= :from AND t.executedAt < :to"
            + " ORDER BY t.executedAt DESC")
    List<TradeRecordEntity> findByExecutedAtRange(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
