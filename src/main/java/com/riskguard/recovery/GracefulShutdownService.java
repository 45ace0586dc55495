package com.riskguard.recovery;

import com.riskguard.config.EnforcementConfig;
import com.riskguard.core.engine.RiskEngine;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.timer.TimerManager;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown: stop accepting events, let in-flight enforcement finish within
 * {@code riskguard.enforcement.shutdown-timeout-ms}, then report what is left persisted.
 *
 * <p>State is written through on every change, so nothing needs flushing here. Runs in a high
 * phase so it stops before the datasource and the enforcement pool.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final RiskEngine riskEngine;
    private final LockoutManager lockoutManager;
    private final TimerManager timerManager;
    private final EnforcementConfig enforcementConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            RiskEngine riskEngine,
            LockoutManager lockoutManager,
            TimerManager timerManager,
            EnforcementConfig enforcementConfig) {
        this.riskEngine = riskEngine;
        this.lockoutManager = lockoutManager;
        this.timerManager = timerManager;
        this.enforcementConfig = enforcementConfig;
    }

    @Override
    public void start() {
        running.set(true);
        log.debug("Shutdown hook armed, timeout={}ms", enforcementConfig.getShutdownTimeoutMs());
    }

    @Override
    public void stop() {
        log.info("stage=shutdown.start queued={} inFlight={}", riskEngine.getQueueDepth(), riskEngine.inFlightCount());
        try {
            boolean drained = riskEngine.shutdown(Duration.ofMillis(enforcementConfig.getShutdownTimeoutMs()));
            if (!drained) {
                log.warn("stage=shutdown.timeout inFlight={}", riskEngine.inFlightCount());
            }
            log.info(
                    "stage=shutdown.done events={} activeLockouts={} activeTimers={}",
                    riskEngine.getProcessedEvents(),
                    lockoutManager.activeCount(),
                    timerManager.count());
        } catch (RuntimeException e) {
            log.error("stage=shutdown.failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }
}
