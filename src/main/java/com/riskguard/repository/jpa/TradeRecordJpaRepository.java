package com.riskguard.repository.jpa;

import com.riskguard.entity.TradeRecordEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_records table. Read back on startup to rebuild the
 * rolling trade windows.
 */
@Repository
public interface TradeRecordJpaRepository extends JpaRepository<TradeRecordEntity, Long> {

    List<TradeRecordEntity> findByAccountIdAndExecutedAtAfterOrderByExecutedAtAsc(String accountId, Instant since);

    boolean existsByAccountIdAndTradeId(String accountId, String tradeId);
}
