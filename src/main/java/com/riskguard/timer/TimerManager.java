package com.riskguard.timer;

import com.riskguard.domain.model.Timer;
import com.riskguard.domain.model.TimerAction;
import com.riskguard.domain.model.TimerAction.CheckStopLoss;
import com.riskguard.domain.model.TimerAction.ClearLockout;
import com.riskguard.entity.TimerEntity;
import com.riskguard.exception.PersistenceException;
import com.riskguard.repository.jpa.TimerJpaRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Named countdown timers with persisted expiry actions.
 *
 * <p>Timers are unique per (accountId, name): starting a timer under an existing name
 * replaces it, so timers never stack. Each timer carries a {@link TimerAction} stored as
 * data in the timers table, which means a restart mid-countdown reloads the original
 * expiry instant instead of starting the countdown over.
 *
 * <p>{@link #tick(TimerActionHandler)} is driven by the engine's one-second background
 * loop. Expired timers are handed to the handler and then removed. A handler failure
 * caused by persistence leaves the timer in place so the action is retried on the next
 * tick; any other failure is logged and the timer is still removed.
 */
@Service
public class TimerManager {

    private static final Logger log = LoggerFactory.getLogger(TimerManager.class);

    private final TimerJpaRepository timerJpaRepository;
    private final Clock clock;

    private final Map<TimerKey, Timer> timers = new ConcurrentHashMap<>();

    public TimerManager(TimerJpaRepository timerJpaRepository, Clock clock) {
        this.timerJpaRepository = timerJpaRepository;
        this.clock = clock;
    }

    /**
     * Starts (or replaces) the named timer for an account.
     *
     * @throws IllegalArgumentException if duration is negative
     * @throws PersistenceException if the timer could not be stored
     */
    @Transactional
    public synchronized Timer start(String accountId, String name, Duration duration, TimerAction action) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Timer duration must be >= 0, got " + duration);
        }
        Instant now = clock.instant();
        Timer timer = Timer.builder()
                .accountId(accountId)
                .name(name)
                .expiresAt(now.plus(duration))
                .action(action)
                .createdAt(now)
                .build();

        persist(timer);
        Timer previous = timers.put(new TimerKey(accountId, name), timer);
        log.info(
                "stage=timer.started account={} name={} duration={}s expiresAt={} action={} replaced={}",
                accountId,
                name,
                duration.getSeconds(),
                timer.getExpiresAt(),
                action.type(),
                previous != null);
        return timer;
    }

    /** Time left on the named timer, or zero if it does not exist or has expired. */
    public Duration remaining(String accountId, String name) {
        Timer timer = timers.get(new TimerKey(accountId, name));
        return timer == null ? Duration.ZERO : timer.remaining(clock.instant());
    }

    public boolean has(String accountId, String name) {
        return timers.containsKey(new TimerKey(accountId, name));
    }

    /**
     * Cancels the named timer. Cancelling a timer that does not exist is a no-op.
     */
    @Transactional
    public synchronized void cancel(String accountId, String name) {
        TimerKey key = new TimerKey(accountId, name);
        if (!timers.containsKey(key)) {
            return;
        }
        deleteRow(accountId, name);
        timers.remove(key);
        log.info("stage=timer.cancelled account={} name={}", accountId, name);
    }

    /**
     * Fires every expired timer through the handler.
     *
     * @return the number of timers that fired and were removed
     */
    public int tick(TimerActionHandler handler) {
        Instant now = clock.instant();
        List<Timer> expired;
        synchronized (this) {
            expired = timers.values().stream()
                    .filter(timer -> timer.isExpired(now))
                    .sorted(Comparator.comparing(Timer::getExpiresAt))
                    .collect(Collectors.toList());
        }

        int fired = 0;
        for (Timer timer : expired) {
            try {
                handler.onExpire(timer);
            } catch (PersistenceException e) {
                log.error(
                        "stage=timer.retry account={} name={}: {}",
                        timer.getAccountId(),
                        timer.getName(),
                        e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.error(
                        "stage=timer.failed account={} name={} action={}",
                        timer.getAccountId(),
                        timer.getName(),
                        timer.getAction().type(),
                        e);
            }
            removeIfUnchanged(timer);
            fired++;
            log.info(
                    "stage=timer.fired account={} name={} action={}",
                    timer.getAccountId(),
                    timer.getName(),
                    timer.getAction().type());
        }
        return fired;
    }

    public List<Timer> activeTimers(String accountId) {
        return timers.values().stream()
                .filter(timer -> timer.getAccountId().equals(accountId))
                .sorted(Comparator.comparing(Timer::getExpiresAt))
                .collect(Collectors.toList());
    }

    public int count() {
        return timers.size();
    }

    /**
     * Replaces the in-memory timers with the contents of the timers table. Timers that
     * expired while the process was down fire on the next tick.
     *
     * @return the number of timers loaded
     */
    @Transactional
    public synchronized int reload() {
        List<TimerEntity> rows;
        try {
            rows = timerJpaRepository.findAll();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load timers", e);
        }
        timers.clear();
        List<TimerEntity> unreadable = new ArrayList<>();
        for (TimerEntity row : rows) {
            TimerAction action = toAction(row);
            if (action == null) {
                unreadable.add(row);
                continue;
            }
            timers.put(
                    new TimerKey(row.getAccountId(), row.getName()),
                    Timer.builder()
                            .accountId(row.getAccountId())
                            .name(row.getName())
                            .expiresAt(row.getExpiresAt())
                            .action(action)
                            .createdAt(row.getCreatedAt())
                            .build());
        }
        for (TimerEntity row : unreadable) {
            log.error("Dropping timer {} for {} with unknown action type {}", row.getName(), row.getAccountId(), row.getActionType());
            timerJpaRepository.delete(row);
        }
        log.info("Loaded {} timers from storage", timers.size());
        return timers.size();
    }

    // ==============================
    // PERSISTENCE
    // ==============================

    private void removeIfUnchanged(Timer fired) {
        synchronized (this) {
            TimerKey key = new TimerKey(fired.getAccountId(), fired.getName());
            // The handler may have re-armed the same name; keep the new timer in that case.
            if (timers.get(key) == fired) {
                timers.remove(key);
                deleteRow(fired.getAccountId(), fired.getName());
            }
        }
    }

    private void persist(Timer timer) {
        try {
            TimerEntity row = timerJpaRepository
                    .findByAccountIdAndName(timer.getAccountId(), timer.getName())
                    .orElseGet(TimerEntity::new);
            row.setAccountId(timer.getAccountId());
            row.setName(timer.getName());
            row.setExpiresAt(timer.getExpiresAt());
            row.setActionType(timer.getAction().type());
            row.setActionSymbol(timer.getAction().symbol());
            row.setActionRef(timer.getAction() instanceof CheckStopLoss ? ((CheckStopLoss) timer.getAction()).positionId() : null);
            row.setCreatedAt(timer.getCreatedAt());
            timerJpaRepository.saveAndFlush(row);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to persist timer " + timer.getName(), e);
        }
    }

    private void deleteRow(String accountId, String name) {
        try {
            timerJpaRepository.findByAccountIdAndName(accountId, name).ifPresent(timerJpaRepository::delete);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete timer " + name, e);
        }
    }

    private TimerAction toAction(TimerEntity row) {
        if (TimerAction.CLEAR_LOCKOUT.equals(row.getActionType())) {
            return new ClearLockout(row.getAccountId(), row.getActionSymbol());
        }
        if (TimerAction.CHECK_STOP_LOSS.equals(row.getActionType())) {
            return new CheckStopLoss(row.getAccountId(), row.getActionSymbol(), row.getActionRef());
        }
        return null;
    }

    private record TimerKey(String accountId, String name) {}
}
