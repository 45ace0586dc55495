package com.riskguard.pnl;

import com.riskguard.calendar.ResetConfig;
import com.riskguard.domain.model.DailyPnl;
import com.riskguard.entity.DailyPnlEntity;
import com.riskguard.exception.PersistenceException;
import com.riskguard.repository.jpa.DailyPnlJpaRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Running realized P&L and trade count for the current trading day, one row per account
 * per calendar date in the account timezone.
 *
 * <p>Only trades that carry a realized component are added; opening (half-turn) fills are
 * filtered out by the caller. Each mutation is a read-add-write of the current row under
 * the accumulator's lock, mirrored to the daily_pnl table before the new total is returned.
 * If the write fails the in-memory row is discarded and reloaded from the table on next
 * access, so the caller's retry cannot double count.
 *
 * <p>{@link #resetDaily(String)} zeroes only the current date's row. Historical rows are
 * never rewritten.
 */
@Service
public class RealizedPnlAccumulator {

    private static final Logger log = LoggerFactory.getLogger(RealizedPnlAccumulator.class);

    private final DailyPnlJpaRepository dailyPnlJpaRepository;
    private final Clock clock;
    private final ZoneId zoneId;

    private final Map<String, DailyPnlEntity> currentRows = new ConcurrentHashMap<>();

    public RealizedPnlAccumulator(DailyPnlJpaRepository dailyPnlJpaRepository, ResetConfig resetConfig, Clock clock) {
        this.dailyPnlJpaRepository = dailyPnlJpaRepository;
        this.clock = clock;
        this.zoneId = ZoneId.of(resetConfig.getTimezone());
    }

    /**
     * Adds a realized P&L delta to today's row and returns the new daily total.
     *
     * @throws PersistenceException if the row could not be written
     */
    public synchronized BigDecimal addTrade(String accountId, BigDecimal pnlDelta) {
        LocalDate today = today();
        DailyPnlEntity row = loadRow(accountId, today);
        BigDecimal previousTotal = row.getRealizedPnl();
        int previousCount = row.getTradeCount();

        row.setRealizedPnl(previousTotal.add(pnlDelta).setScale(2, RoundingMode.HALF_UP));
        row.setTradeCount(previousCount + 1);
        row.setUpdatedAt(clock.instant());
        persist(accountId, today, row);

        log.info(
                "stage=pnl.trade account={} date={} delta={} total={} trades={}",
                accountId,
                today,
                pnlDelta,
                row.getRealizedPnl(),
                row.getTradeCount());
        return row.getRealizedPnl();
    }

    public synchronized DailyPnl getDaily(String accountId) {
        LocalDate today = today();
        DailyPnlEntity row = currentRows.get(rowKey(accountId, today));
        if (row == null) {
            row = findRow(accountId, today);
        }
        if (row == null) {
            return DailyPnl.empty(accountId, today);
        }
        return toDomain(row);
    }

    /**
     * Zeroes today's total and trade count. The row is kept so the date stays on record.
     */
    public synchronized void resetDaily(String accountId) {
        LocalDate today = today();
        DailyPnlEntity row = loadRow(accountId, today);
        BigDecimal previousTotal = row.getRealizedPnl();
        row.setRealizedPnl(BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP));
        row.setTradeCount(0);
        row.setUpdatedAt(clock.instant());
        persist(accountId, today, row);
        log.info("stage=pnl.reset account={} date={} previousTotal={}", accountId, today, previousTotal);
    }

    public List<DailyPnl> history(String accountId) {
        try {
            return dailyPnlJpaRepository.findHistory(accountId).stream()
                    .map(this::toDomain)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read P&L history for " + accountId, e);
        }
    }

    public PnlStats stats(String accountId) {
        List<DailyPnl> days = history(accountId);
        BigDecimal total = days.stream().map(DailyPnl::getTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
        int trades = days.stream().mapToInt(DailyPnl::getTradeCount).sum();
        DailyPnl best = days.stream().max(Comparator.comparing(DailyPnl::getTotal)).orElse(null);
        DailyPnl worst = days.stream().min(Comparator.comparing(DailyPnl::getTotal)).orElse(null);

        return PnlStats.builder()
                .accountId(accountId)
                .totalPnl(total)
                .totalTrades(trades)
                .daysTracked(days.size())
                .bestDay(best != null ? best.getDate() : null)
                .bestDayPnl(best != null ? best.getTotal() : null)
                .worstDay(worst != null ? worst.getDate() : null)
                .worstDayPnl(worst != null ? worst.getTotal() : null)
                .build();
    }

    /** Drops cached rows so the next access reads the table. Used by startup recovery. */
    public synchronized void evictCache() {
        currentRows.clear();
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zoneId));
    }

    // ==============================
    // PERSISTENCE
    // ==============================

    private DailyPnlEntity loadRow(String accountId, LocalDate date) {
        String key = rowKey(accountId, date);
        DailyPnlEntity row = currentRows.get(key);
        if (row != null) {
            return row;
        }
        // A new date means the previous row is now historical; drop it from the cache.
        currentRows.keySet().removeIf(k -> k.startsWith(accountId + "|"));

        row = findRow(accountId, date);
        if (row == null) {
            row = DailyPnlEntity.builder()
                    .accountId(accountId)
                    .tradeDate(date)
                    .realizedPnl(BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP))
                    .tradeCount(0)
                    .build();
        }
        currentRows.put(key, row);
        return row;
    }

    private DailyPnlEntity findRow(String accountId, LocalDate date) {
        try {
            return dailyPnlJpaRepository
                    .findByAccountIdAndTradeDate(accountId, date)
                    .orElse(null);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read daily P&L for " + accountId, e);
        }
    }

    private void persist(String accountId, LocalDate date, DailyPnlEntity row) {
        try {
            dailyPnlJpaRepository.saveAndFlush(row);
        } catch (DataAccessException e) {
            currentRows.remove(rowKey(accountId, date));
            log.error("stage=pnl.persist.failed account={} date={}: {}", accountId, date, e.getMessage());
            throw new PersistenceException("Failed to persist daily P&L for " + accountId, e);
        }
    }

    private DailyPnl toDomain(DailyPnlEntity row) {
        return DailyPnl.builder()
                .accountId(row.getAccountId())
                .date(row.getTradeDate())
                .total(row.getRealizedPnl())
                .tradeCount(row.getTradeCount())
                .build();
    }

    private static String rowKey(String accountId, LocalDate date) {
        return accountId + "|" + date;
    }
}
