package com.riskguard.lockout;

import com.riskguard.domain.enums.LockoutKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.Lockout;
import com.riskguard.domain.model.LockoutKey;
import com.riskguard.domain.model.TimerAction.ClearLockout;
import com.riskguard.entity.LockoutEntity;
import com.riskguard.event.EventPublisherHelper;
import com.riskguard.exception.PersistenceException;
import com.riskguard.mapper.LockoutMapper;
import com.riskguard.repository.jpa.LockoutJpaRepository;
import com.riskguard.timer.TimerManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sole owner of the lockout table. Every other component reads and writes lockouts through
 * this service; none holds a reference to the underlying map.
 *
 * <p>Lockouts are keyed by (accountId, symbol), where a null symbol is account-wide.
 * At most one lockout exists per key: installing a new one replaces the old one entirely.
 *
 * <p>Two expiry paths exist and never overlap:
 * <ul>
 *   <li>HARD lockouts with an expiry are removed by {@link #sweepExpired()} (and lazily by
 *       {@link #isLockedOut}) once {@code expiresAt <= now}. Permanent HARD lockouts
 *       (null expiry) wait for {@link #clear}.</li>
 *   <li>COOLDOWN lockouts are removed only by their paired timer, which fires a
 *       {@link ClearLockout} action. The sweep ignores them.</li>
 * </ul>
 *
 * <p>Every mutation is written to the lockouts table before the in-memory map changes, so
 * a failed write leaves the previous state intact and surfaces as a
 * {@link PersistenceException}.
 */
@Service
public class LockoutManager {

    private static final Logger log = LoggerFactory.getLogger(LockoutManager.class);

    static final String TIMER_PREFIX = "lockout:";

    private final LockoutJpaRepository lockoutJpaRepository;
    private final TimerManager timerManager;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final LockoutMapper lockoutMapper = Mappers.getMapper(LockoutMapper.class);

    private final Map<LockoutKey, Lockout> lockouts = new ConcurrentHashMap<>();

    public LockoutManager(
            LockoutJpaRepository lockoutJpaRepository,
            TimerManager timerManager,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.lockoutJpaRepository = lockoutJpaRepository;
        this.timerManager = timerManager;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ==============================
    // INSTALL
    // ==============================

    @Transactional
    public Lockout setHard(String accountId, String symbol, String reason, Instant until) {
        return setHard(accountId, symbol, reason, until, null, false);
    }

    /**
     * Installs or replaces a HARD lockout.
     *
     * @param until absolute expiry, or null for a lockout that only a manual or broker clear removes
     * @param resetBound whether the daily reset also clears this lockout
     */
    @Transactional
    public synchronized Lockout setHard(
            String accountId, String symbol, String reason, Instant until, RuleKind source, boolean resetBound) {
        Lockout lockout = Lockout.builder()
                .accountId(accountId)
                .symbol(normalize(symbol))
                .reason(reason)
                .kind(LockoutKind.HARD)
                .expiresAt(until)
                .createdAt(clock.instant())
                .source(source)
                .resetBound(resetBound)
                .build();

        LockoutKey key = LockoutKey.of(accountId, symbol);
        Lockout previous = lockouts.get(key);
        persist(key, lockout);
        if (previous != null && previous.getKind() == LockoutKind.COOLDOWN) {
            timerManager.cancel(accountId, timerName(key));
        }
        lockouts.put(key, lockout);
        announceSet(lockout, previous);
        return lockout;
    }

    @Transactional
    public Lockout setCooldown(String accountId, String symbol, String reason, Duration duration) {
        return setCooldown(accountId, symbol, reason, duration, null);
    }

    /**
     * Installs or replaces a COOLDOWN lockout and arms its paired timer. Re-arming restarts
     * the countdown from now; cooldowns never stack.
     */
    @Transactional
    public synchronized Lockout setCooldown(
            String accountId, String symbol, String reason, Duration duration, RuleKind source) {
        Instant now = clock.instant();
        Lockout lockout = Lockout.builder()
                .accountId(accountId)
                .symbol(normalize(symbol))
                .reason(reason)
                .kind(LockoutKind.COOLDOWN)
                .expiresAt(now.plus(duration))
                .createdAt(now)
                .source(source)
                .resetBound(false)
                .build();

        LockoutKey key = LockoutKey.of(accountId, symbol);
        Lockout previous = lockouts.get(key);
        persist(key, lockout);
        timerManager.start(accountId, timerName(key), duration, new ClearLockout(accountId, lockout.getSymbol()));
        lockouts.put(key, lockout);
        announceSet(lockout, previous);
        return lockout;
    }

    // ==============================
    // QUERY
    // ==============================

    /**
     * True if the account is locked out account-wide, or (when symbol is given) locked out
     * for that symbol. A symbol lockout never blocks other symbols.
     */
    public boolean isLockedOut(String accountId, String symbol) {
        return effective(accountId, symbol) != null;
    }

    /**
     * The lockout stored under exactly this key, or null.
     */
    public Lockout info(String accountId, String symbol) {
        LockoutKey key = LockoutKey.of(accountId, symbol);
        Lockout lockout = lockouts.get(key);
        if (lockout != null && lockout.getKind() == LockoutKind.HARD && lockout.isExpired(clock.instant())) {
            expire(key, lockout);
            return null;
        }
        return lockout;
    }

    /**
     * The lockout that blocks trading in the symbol: the account-wide one if present,
     * otherwise the symbol's own.
     */
    public Lockout effective(String accountId, String symbol) {
        Lockout accountWide = info(accountId, null);
        if (accountWide != null || symbol == null) {
            return accountWide;
        }
        return info(accountId, symbol);
    }

    public List<Lockout> activeLockouts() {
        return lockouts.values().stream()
                .sorted(Comparator.comparing(Lockout::getCreatedAt))
                .collect(Collectors.toList());
    }

    public List<Lockout> activeLockouts(String accountId) {
        return activeLockouts().stream()
                .filter(lockout -> lockout.getAccountId().equals(accountId))
                .collect(Collectors.toList());
    }

    public int activeCount() {
        return lockouts.size();
    }

    // ==============================
    // CLEAR
    // ==============================

    @Transactional
    public boolean clear(String accountId, String symbol) {
        return clear(accountId, symbol, "manual");
    }

    /**
     * Removes the lockout under this key and cancels its paired timer, if any.
     *
     * @return false if there was nothing to clear
     */
    @Transactional
    public synchronized boolean clear(String accountId, String symbol, String cause) {
        LockoutKey key = LockoutKey.of(accountId, symbol);
        Lockout lockout = lockouts.get(key);
        if (lockout == null) {
            return false;
        }
        deleteRows(key);
        if (lockout.getKind() == LockoutKind.COOLDOWN) {
            timerManager.cancel(accountId, timerName(key));
        }
        lockouts.remove(key);
        announceCleared(lockout, cause);
        return true;
    }

    /**
     * Clears every lockout of the account matching the filter.
     *
     * @return the number of lockouts cleared
     */
    @Transactional
    public synchronized int clearMatching(String accountId, Predicate<Lockout> filter, String cause) {
        List<Lockout> matching = activeLockouts(accountId).stream().filter(filter).collect(Collectors.toList());
        for (Lockout lockout : matching) {
            clear(accountId, lockout.getSymbol(), cause);
        }
        return matching.size();
    }

    /** Clears the lockouts that the daily reset is responsible for. */
    @Transactional
    public int clearResetBound(String accountId) {
        return clearMatching(accountId, Lockout::isResetBound, "reset");
    }

    /** Clears lockouts installed by one rule kind, e.g. when the broker restores trading. */
    @Transactional
    public int clearBySource(String accountId, RuleKind source, String cause) {
        return clearMatching(accountId, lockout -> lockout.getSource() == source, cause);
    }

    /**
     * Removes every HARD lockout whose expiry has passed. COOLDOWN lockouts are left to their timers.
     *
     * @return the number of lockouts removed
     */
    @Transactional
    public synchronized int sweepExpired() {
        Instant now = clock.instant();
        List<Map.Entry<LockoutKey, Lockout>> expired = lockouts.entrySet().stream()
                .filter(entry -> entry.getValue().getKind() == LockoutKind.HARD)
                .filter(entry -> entry.getValue().isExpired(now))
                .collect(Collectors.toList());
        for (Map.Entry<LockoutKey, Lockout> entry : expired) {
            expire(entry.getKey(), entry.getValue());
        }
        return expired.size();
    }

    // ==============================
    // RECOVERY
    // ==============================

    /**
     * Replaces the in-memory table with the lockouts table contents. Duplicate rows for one
     * key are an invariant violation: the most restrictive row is kept and the rest deleted.
     * Expired HARD lockouts are swept immediately.
     *
     * @return the number of active lockouts after reload
     */
    @Transactional
    public synchronized int reload() {
        List<LockoutEntity> rows;
        try {
            rows = lockoutJpaRepository.findAll();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load lockouts", e);
        }

        Map<LockoutKey, List<LockoutEntity>> byKey = new HashMap<>();
        for (LockoutEntity row : rows) {
            byKey.computeIfAbsent(new LockoutKey(row.getAccountId(), row.getSymbolKey()), k -> new ArrayList<>())
                    .add(row);
        }

        lockouts.clear();
        for (Map.Entry<LockoutKey, List<LockoutEntity>> entry : byKey.entrySet()) {
            lockouts.put(entry.getKey(), resolve(entry.getKey(), entry.getValue()));
        }
        int swept = sweepExpired();
        log.info("Loaded {} lockouts from storage ({} expired during downtime)", lockouts.size(), swept);
        return lockouts.size();
    }

    /**
     * Starts a clearing timer for every cooldown that has none, e.g. when the timers table lost
     * a row. A cooldown already past its expiry gets a zero-length timer and clears on the next tick.
     *
     * @return the number of timers started
     */
    @Transactional
    public synchronized int rearmCooldownTimers() {
        Instant now = clock.instant();
        int started = 0;
        for (Map.Entry<LockoutKey, Lockout> entry : lockouts.entrySet()) {
            Lockout lockout = entry.getValue();
            LockoutKey key = entry.getKey();
            if (lockout.getKind() != LockoutKind.COOLDOWN || timerManager.has(key.accountId(), timerName(key))) {
                continue;
            }
            Duration remaining = lockout.getExpiresAt() != null && lockout.getExpiresAt().isAfter(now)
                    ? Duration.between(now, lockout.getExpiresAt())
                    : Duration.ZERO;
            timerManager.start(key.accountId(), timerName(key), remaining, new ClearLockout(key.accountId(), lockout.getSymbol()));
            started++;
        }
        if (started > 0) {
            log.warn("Re-armed {} cooldown timers missing after reload", started);
        }
        return started;
    }

    // ==============================
    // INTERNALS
    // ==============================

    private void expire(LockoutKey key, Lockout lockout) {
        synchronized (this) {
            if (lockouts.get(key) != lockout) {
                return;
            }
            deleteRows(key);
            lockouts.remove(key);
        }
        announceCleared(lockout, "expired");
    }

    private Lockout resolve(LockoutKey key, List<LockoutEntity> rows) {
        List<Lockout> candidates = lockoutMapper.toDomainList(rows);
        Lockout winner = candidates.get(0);
        for (Lockout candidate : candidates) {
            if (candidate.isMoreRestrictiveThan(winner)) {
                winner = candidate;
            }
        }
        if (rows.size() > 1) {
            log.error(
                    "stage=lockout.duplicate-rows account={} symbol={} rows={} keeping kind={} expiresAt={}",
                    key.accountId(),
                    key.symbolKey(),
                    rows.size(),
                    winner.getKind(),
                    winner.getExpiresAt());
            persist(key, winner);
        }
        return winner;
    }

    private void persist(LockoutKey key, Lockout lockout) {
        try {
            List<LockoutEntity> existing = lockoutJpaRepository.findByAccountIdAndSymbolKey(key.accountId(), key.symbolKey());
            LockoutEntity row = lockoutMapper.toEntity(lockout);
            if (!existing.isEmpty()) {
                row.setId(existing.get(0).getId());
                for (int i = 1; i < existing.size(); i++) {
                    lockoutJpaRepository.delete(existing.get(i));
                }
            }
            lockoutJpaRepository.saveAndFlush(row);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to persist lockout for " + key, e);
        }
    }

    private void deleteRows(LockoutKey key) {
        try {
            lockoutJpaRepository
                    .findByAccountIdAndSymbolKey(key.accountId(), key.symbolKey())
                    .forEach(lockoutJpaRepository::delete);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete lockout for " + key, e);
        }
    }

    private void announceSet(Lockout lockout, Lockout previous) {
        log.warn(
                "stage=lockout.set account={} symbol={} kind={} expiresAt={} source={} reason=\"{}\" replaced={}",
                lockout.getAccountId(),
                lockout.getSymbol() != null ? lockout.getSymbol() : "*",
                lockout.getKind(),
                lockout.getExpiresAt() != null ? lockout.getExpiresAt() : "never",
                lockout.getSource(),
                lockout.getReason(),
                previous != null);
        eventPublisherHelper.publishLockoutSet(this, lockout);
    }

    private void announceCleared(Lockout lockout, String cause) {
        log.info(
                "stage=lockout.cleared account={} symbol={} kind={} cause={}",
                lockout.getAccountId(),
                lockout.getSymbol() != null ? lockout.getSymbol() : "*",
                lockout.getKind(),
                cause);
        eventPublisherHelper.publishLockoutCleared(this, lockout, cause);
    }

    static String timerName(LockoutKey key) {
        return TIMER_PREFIX + key.symbolKey();
    }

    private static String normalize(String symbol) {
        return symbol == null ? null : symbol.toUpperCase();
    }
}
