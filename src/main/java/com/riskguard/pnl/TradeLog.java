package com.riskguard.pnl;

import com.riskguard.domain.model.RiskEvent;
import com.riskguard.entity.TradeRecordEntity;
import com.riskguard.exception.PersistenceException;
import com.riskguard.repository.jpa.TradeRecordJpaRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Record of executed trades per account, half-turns included.
 *
 * <p>Two jobs: it deduplicates trades by broker trade id (a replayed fill after a restart
 * is recognised and skipped), and it answers rolling-window counts for the frequency rule.
 * Timestamps are kept in memory for the retention window and mirrored to trade_records;
 * {@link #reload(String)} rebuilds the window from the table on startup.
 */
@Service
public class TradeLog {

    private static final Logger log = LoggerFactory.getLogger(TradeLog.class);

    static final Duration RETENTION = Duration.ofHours(24);
    static final String SYNTHETIC_ID_PREFIX = "anon-";

    private final TradeRecordJpaRepository tradeRecordJpaRepository;
    private final Clock clock;

    private final Map<String, Deque<Instant>> executions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> seenTradeIds = new ConcurrentHashMap<>();

    public TradeLog(TradeRecordJpaRepository tradeRecordJpaRepository, Clock clock) {
        this.tradeRecordJpaRepository = tradeRecordJpaRepository;
        this.clock = clock;
    }

    /**
     * Records a TradeExecuted event that carries no P&L to book alongside it.
     *
     * @return false if this trade id was already recorded, in which case nothing changes
     * @throws PersistenceException if the record could not be written
     */
    public synchronized boolean record(RiskEvent trade) {
        String accountId = trade.getAccountId();
        String tradeId = trade.getEventId();
        if (tradeId != null && isDuplicate(accountId, tradeId)) {
            log.info("stage=trade.duplicate account={} tradeId={}", accountId, tradeId);
            return false;
        }
        remember(accountId, tradeId, insert(trade));
        return true;
    }

    /**
     * Writes the trade_records row without touching the in-memory window. Fills without a
     * broker id get a random synthetic id so two of them in the same millisecond never
     * collide on the (account, trade id) key.
     *
     * @return the execution time that was stored
     * @throws PersistenceException if the row could not be written
     */
    public Instant insert(RiskEvent trade) {
        String accountId = trade.getAccountId();
        String tradeId = trade.getEventId();
        Instant executedAt = trade.getTimestamp() != null ? trade.getTimestamp() : clock.instant();
        try {
            tradeRecordJpaRepository.saveAndFlush(TradeRecordEntity.builder()
                    .accountId(accountId)
                    .tradeId(tradeId != null ? tradeId : SYNTHETIC_ID_PREFIX + UUID.randomUUID())
                    .symbol(trade.getSymbol())
                    .realizedPnl(trade.getRealizedPnl())
                    .executedAt(executedAt)
                    .build());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to record trade " + tradeId + " for " + accountId, e);
        }
        return executedAt;
    }

    /** Adds a stored trade to the in-memory id set and window. */
    public synchronized void remember(String accountId, String tradeId, Instant executedAt) {
        if (tradeId != null) {
            seenTradeIds.computeIfAbsent(accountId, k -> new HashSet<>()).add(tradeId);
        }
        Deque<Instant> window = executions.computeIfAbsent(accountId, k -> new ArrayDeque<>());
        window.addLast(executedAt);
        prune(window);
    }

    /** True if a trade with this id has already been recorded for the account. */
    public synchronized boolean isRecorded(String accountId, String tradeId) {
        return tradeId != null && isDuplicate(accountId, tradeId);
    }

    /** Number of trades executed strictly after {@code since}. */
    public synchronized int countSince(String accountId, Instant since) {
        Deque<Instant> window = executions.get(accountId);
        if (window == null) {
            return 0;
        }
        prune(window);
        int count = 0;
        for (Instant executedAt : window) {
            if (executedAt.isAfter(since)) {
                count++;
            }
        }
        return count;
    }

    public int countInLast(String accountId, Duration window) {
        return countSince(accountId, clock.instant().minus(window));
    }

    /**
     * Rebuilds the in-memory window from trade_records.
     */
    public synchronized void reload(String accountId) {
        Instant since = clock.instant().minus(RETENTION);
        List<TradeRecordEntity> records;
        try {
            records = tradeRecordJpaRepository.findByAccountIdAndExecutedAtAfterOrderByExecutedAtAsc(accountId, since);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to reload trade records for " + accountId, e);
        }
        Deque<Instant> window = new ArrayDeque<>();
        Set<String> ids = new HashSet<>();
        for (TradeRecordEntity record : records) {
            window.addLast(record.getExecutedAt());
            ids.add(record.getTradeId());
        }
        executions.put(accountId, window);
        seenTradeIds.put(accountId, ids);
        log.info("Reloaded {} trade records for account {}", records.size(), accountId);
    }

    private boolean isDuplicate(String accountId, String tradeId) {
        Set<String> seen = seenTradeIds.get(accountId);
        if (seen != null && seen.contains(tradeId)) {
            return true;
        }
        try {
            return tradeRecordJpaRepository.existsByAccountIdAndTradeId(accountId, tradeId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to check trade " + tradeId + " for " + accountId, e);
        }
    }

    private void prune(Deque<Instant> window) {
        Instant cutoff = clock.instant().minus(RETENTION);
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.pollFirst();
        }
    }
}
