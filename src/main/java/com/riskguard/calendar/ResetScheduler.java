package com.riskguard.calendar;

import com.riskguard.config.RiskGuardProperties;
import com.riskguard.domain.enums.ResetType;
import com.riskguard.entity.ResetLogEntity;
import com.riskguard.event.EventPublisherHelper;
import com.riskguard.exception.ConfigException;
import com.riskguard.exception.PersistenceException;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.repository.jpa.ResetLogJpaRepository;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Fires the daily (and optional weekly) reset that zeroes the realized P&L accumulator and
 * clears reset-bound lockouts.
 *
 * <p>The reset boundary is a wall-clock time in a configured timezone (17:00 America/New_York
 * by default). {@link #tick()} runs once a minute and fires a reset at most once per calendar
 * date, tracked by a last-reset marker persisted in reset_log so a restart does not fire the
 * same day's reset twice. Holidays never fire a reset.
 *
 * <p>{@link #nextResetTime(Instant)} is what lockout-installing rules call at breach time: a
 * breach before today's boundary unlocks at today's boundary, a breach at or after it unlocks
 * at the next non-holiday day's boundary. The result is an absolute instant computed once,
 * so a DST change during the lockout does not move the unlock moment.
 *
 * <p>Reset sequence: P&L reset, lockout clear, reset_log row. If any step fails the marker is
 * not advanced and the next tick retries.
 */
@Service
public class ResetScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResetScheduler.class);

    private final TradingCalendarService tradingCalendarService;
    private final RealizedPnlAccumulator realizedPnlAccumulator;
    private final LockoutManager lockoutManager;
    private final ResetLogJpaRepository resetLogJpaRepository;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final String accountId;

    private volatile LocalTime resetTime;
    private volatile ZoneId zoneId;
    private volatile DayOfWeek weeklyDay;
    private volatile LocalTime weeklyTime;

    private final Map<String, LocalDate> lastResetDates = new ConcurrentHashMap<>();

    public ResetScheduler(
            ResetConfig resetConfig,
            TradingCalendarService tradingCalendarService,
            RealizedPnlAccumulator realizedPnlAccumulator,
            LockoutManager lockoutManager,
            ResetLogJpaRepository resetLogJpaRepository,
            EventPublisherHelper eventPublisherHelper,
            RiskGuardProperties riskGuardProperties,
            Clock clock) {
        this.tradingCalendarService = tradingCalendarService;
        this.realizedPnlAccumulator = realizedPnlAccumulator;
        this.lockoutManager = lockoutManager;
        this.resetLogJpaRepository = resetLogJpaRepository;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.accountId = riskGuardProperties.getAccountId();

        schedule(parseTime(resetConfig.getTime(), "riskguard.reset.time"), parseZone(resetConfig.getTimezone()));
        this.weeklyDay = resetConfig.getWeeklyDay();
        this.weeklyTime = resetConfig.getWeeklyTime() != null
                ? parseTime(resetConfig.getWeeklyTime(), "riskguard.reset.weekly-time")
                : resetTime;
    }

    /**
     * Sets the daily reset boundary. Takes effect from the next tick.
     */
    public void schedule(LocalTime resetTimeOfDay, ZoneId timezone) {
        this.resetTime = resetTimeOfDay;
        this.zoneId = timezone;
        log.info("Daily reset scheduled at {} {}", resetTimeOfDay, timezone);
    }

    public boolean isHoliday(LocalDate date) {
        return tradingCalendarService.isHoliday(date);
    }

    // ==============================
    // BOUNDARY CALCULATION
    // ==============================

    /**
     * The instant at which a lockout set at {@code from} should end.
     */
    public Instant nextResetTime(Instant from) {
        ZonedDateTime local = from.atZone(zoneId);
        LocalDate date = local.toLocalDate();
        if (!local.toLocalTime().isBefore(resetTime)) {
            date = date.plusDays(1);
        }
        LocalDate resetDate = tradingCalendarService.firstMatching(date, candidate -> !isHoliday(candidate));
        return ZonedDateTime.of(resetDate, resetTime, zoneId).toInstant();
    }

    /**
     * Start of the current trading session: the most recent daily boundary at or before {@code now}.
     */
    public Instant currentSessionStart(Instant now) {
        ZonedDateTime local = now.atZone(zoneId);
        LocalDate date = local.toLocalDate();
        if (local.toLocalTime().isBefore(resetTime)) {
            date = date.minusDays(1);
        }
        return ZonedDateTime.of(date, resetTime, zoneId).toInstant();
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    public LocalTime getResetTime() {
        return resetTime;
    }

    // ==============================
    // SCHEDULED CHECK
    // ==============================

    @Scheduled(fixedRateString = "${riskguard.reset.check-interval-ms:60000}")
    public void tick() {
        tick(clock.instant());
    }

    /**
     * Testable overload: fires whichever resets are due at {@code now}.
     *
     * @return true if a reset fired
     */
    public boolean tick(Instant now) {
        if (accountId == null) {
            return false;
        }
        ZonedDateTime local = now.atZone(zoneId);
        LocalDate today = local.toLocalDate();
        if (isHoliday(today)) {
            return false;
        }

        boolean fired = false;
        if (!local.toLocalTime().isBefore(resetTime) && !today.equals(lastResetDate(ResetType.DAILY))) {
            performReset(ResetType.DAILY, today, now);
            fired = true;
        }
        if (weeklyDay != null
                && today.getDayOfWeek() == weeklyDay
                && !local.toLocalTime().isBefore(weeklyTime)
                && !today.equals(lastResetDate(ResetType.WEEKLY))) {
            performReset(ResetType.WEEKLY, today, now);
            fired = true;
        }
        return fired;
    }

    /**
     * Admin reset outside the schedule. Does not advance the daily marker, so the
     * scheduled reset still fires at its usual time.
     */
    public void triggerManualReset() {
        Instant now = clock.instant();
        log.warn("Manual reset requested for account {}", accountId);
        performReset(ResetType.MANUAL, now.atZone(zoneId).toLocalDate(), now);
    }

    private void performReset(ResetType type, LocalDate resetDate, Instant now) {
        realizedPnlAccumulator.resetDaily(accountId);
        int cleared = lockoutManager.clearResetBound(accountId);

        try {
            resetLogJpaRepository.save(ResetLogEntity.builder()
                    .accountId(accountId)
                    .resetType(type)
                    .resetDate(resetDate)
                    .triggeredAt(now)
                    .build());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to log " + type.getLabel() + " reset for " + accountId, e);
        }
        lastResetDates.put(type.name(), resetDate);

        log.info(
                "stage=reset.fired account={} type={} date={} lockoutsCleared={}",
                accountId,
                type.getLabel(),
                resetDate,
                cleared);
        eventPublisherHelper.publishReset(this, accountId, type, now);
    }

    private LocalDate lastResetDate(ResetType type) {
        return lastResetDates.computeIfAbsent(type.name(), name -> {
            try {
                return resetLogJpaRepository
                        .findFirstByAccountIdAndResetTypeOrderByTriggeredAtDesc(accountId, type)
                        .map(ResetLogEntity::getResetDate)
                        .orElse(LocalDate.MIN);
            } catch (DataAccessException e) {
                throw new PersistenceException("Failed to read reset log for " + accountId, e);
            }
        });
    }

    private static LocalTime parseTime(String value, String property) {
        if (value == null) {
            throw new ConfigException("Missing time for " + property);
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new ConfigException("Invalid time for " + property + ": " + value);
        }
    }

    private static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value);
        } catch (RuntimeException e) {
            throw new ConfigException("Invalid timezone: " + value);
        }
    }
}
