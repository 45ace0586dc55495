package com.riskguard.repository.jpa;

import com.riskguard.entity.DailyPnlEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the daily_pnl table.
 * One row per account per trading day, written on every realized trade.
 */
@Repository
public interface DailyPnlJpaRepository extends JpaRepository<DailyPnlEntity, Long> {

    Optional<DailyPnlEntity> findByAccountIdAndTradeDate(String accountId, LocalDate tradeDate);

    @Query("SELECT d FROM DailyPnlEntity d WHERE d.accountId = :accountId ORDER BY d.tradeDate ASC")
    List<DailyPnlEntity> findHistory(@Param("accountId") String accountId);
}
