package com.riskguard.recovery;

import com.riskguard.calendar.ResetScheduler;
import com.riskguard.config.RiskGuardProperties;
import com.riskguard.core.engine.RiskEngine;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.pnl.TradeLog;
import com.riskguard.timer.TimerManager;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Restores persisted state once the application is ready and then starts the event loop.
 *
 * <p>Sequence:
 * <ol>
 *   <li>Reload timers, then lockouts (duplicate lockouts are resolved and logged)</li>
 *   <li>Re-arm any cooldown whose clearing timer is missing</li>
 *   <li>Reload the trade log window and today's realized P&L</li>
 *   <li>Fire a daily reset that was missed while the process was down</li>
 *   <li>Run one engine tick so timers that expired during downtime fire</li>
 *   <li>Start the event loop</li>
 * </ol>
 * No events are consumed until every step has run. If recovery fails the loop is not started.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final LockoutManager lockoutManager;
    private final TimerManager timerManager;
    private final TradeLog tradeLog;
    private final RealizedPnlAccumulator realizedPnlAccumulator;
    private final ResetScheduler resetScheduler;
    private final RiskEngine riskEngine;
    private final RiskGuardProperties riskGuardProperties;
    private final Clock clock;

    public StartupRecoveryService(
            LockoutManager lockoutManager,
            TimerManager timerManager,
            TradeLog tradeLog,
            RealizedPnlAccumulator realizedPnlAccumulator,
            ResetScheduler resetScheduler,
            RiskEngine riskEngine,
            RiskGuardProperties riskGuardProperties,
            Clock clock) {
        this.lockoutManager = lockoutManager;
        this.timerManager = timerManager;
        this.tradeLog = tradeLog;
        this.realizedPnlAccumulator = realizedPnlAccumulator;
        this.resetScheduler = resetScheduler;
        this.riskEngine = riskEngine;
        this.riskGuardProperties = riskGuardProperties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting recovery sequence...");
        RecoveryResult result = RecoveryResult.builder().startedAt(clock.millis()).build();
        String accountId = riskGuardProperties.getAccountId();

        try {
            result.setTimersRestored(timerManager.reload());
            result.setLockoutsRestored(lockoutManager.reload());
            result.setCooldownTimersRearmed(lockoutManager.rearmCooldownTimers());

            if (accountId != null) {
                tradeLog.reload(accountId);
                realizedPnlAccumulator.evictCache();
                result.setRestoredDailyPnl(realizedPnlAccumulator.getDaily(accountId).getTotal());
            } else {
                log.warn("riskguard.account-id is not set; skipping P&L and trade restore");
            }

            result.setCatchUpResetFired(resetScheduler.tick(clock.instant()));
            riskEngine.tick();
            riskEngine.start();
            result.setSuccess(true);
        } catch (RuntimeException e) {
            result.setSuccess(false);
            result.setError(e.getMessage());
            log.error("Recovery sequence failed; event loop not started", e);
        }

        result.setDurationMs(clock.millis() - result.getStartedAt());
        log.info(
                "stage=recovery.done success={} durationMs={} lockouts={} timers={} rearmed={} dailyPnl={} catchUpReset={}",
                result.isSuccess(),
                result.getDurationMs(),
                result.getLockoutsRestored(),
                result.getTimersRestored(),
                result.getCooldownTimersRearmed(),
                result.getRestoredDailyPnl(),
                result.isCatchUpResetFired());
        return result;
    }
}
