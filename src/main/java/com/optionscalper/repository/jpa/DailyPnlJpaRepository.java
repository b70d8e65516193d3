package com.optionscalper.repository.jpa;

import com.optionscalper.entity.DailyPnlEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyPnlJpaRepository extends JpaRepository<DailyPnlEntity, Long> {

    Optional<DailyPnlEntity> findByPnlDate(LocalDate pnlDate);

    List<DailyPnlEntity> findAllByOrderByPnlDateDesc();
}
