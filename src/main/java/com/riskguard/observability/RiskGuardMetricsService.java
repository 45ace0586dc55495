package com.riskguard.observability;

import com.riskguard.config.RiskGuardProperties;
import com.riskguard.core.engine.RiskEngine;
import com.riskguard.event.EnforcementEvent;
import com.riskguard.event.LockoutEvent;
import com.riskguard.event.LockoutEventType;
import com.riskguard.event.ResetEvent;
import com.riskguard.event.RuleBreachEvent;
import com.riskguard.event.StopAdjustmentEvent;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.timer.TimerManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the engine.
 *
 * <ul>
 *   <li><b>riskguard.rule.breaches</b> (counter, tags rule and enforced)</li>
 *   <li><b>riskguard.enforcement.actions</b> (counter, tags action and result)</li>
 *   <li><b>riskguard.lockouts.set</b> / <b>riskguard.lockouts.cleared</b> (counters, tag kind)</li>
 *   <li><b>riskguard.resets</b> (counter, tag type)</li>
 *   <li><b>riskguard.stop.adjustments</b> (counter, tag symbol)</li>
 *   <li><b>riskguard.lockouts.active</b>, <b>riskguard.timers.active</b>,
 *       <b>riskguard.engine.queue.depth</b>, <b>riskguard.daily.pnl</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are read by Micrometer at scrape time; counters are driven by application events.
 */
@Service
public class RiskGuardMetricsService {

    private final MeterRegistry meterRegistry;

    public RiskGuardMetricsService(
            MeterRegistry meterRegistry,
            LockoutManager lockoutManager,
            TimerManager timerManager,
            RiskEngine riskEngine,
            RealizedPnlAccumulator realizedPnlAccumulator,
            RiskGuardProperties riskGuardProperties) {
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("riskguard.lockouts.active", lockoutManager, LockoutManager::activeCount);
        meterRegistry.gauge("riskguard.timers.active", timerManager, TimerManager::count);
        meterRegistry.gauge("riskguard.engine.queue.depth", riskEngine, RiskEngine::getQueueDepth);

        String accountId = riskGuardProperties.getAccountId();
        if (accountId != null) {
            meterRegistry.gauge("riskguard.daily.pnl", realizedPnlAccumulator, accumulator -> accumulator
                    .getDaily(accountId)
                    .getTotal()
                    .doubleValue());
        }
    }

    @EventListener
    @Order(20)
    public void onRuleBreach(RuleBreachEvent event) {
        Counter.builder("riskguard.rule.breaches")
                .description("Rule breaches detected")
                .tag("rule", String.valueOf(event.getVerdict().getRuleKind()))
                .tag("enforced", String.valueOf(event.isEnforced()))
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onEnforcement(EnforcementEvent event) {
        Counter.builder("riskguard.enforcement.actions")
                .description("Broker enforcement calls")
                .tag("action", event.getAction())
                .tag("result", event.isSuccess() ? "success" : "failure")
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onLockout(LockoutEvent event) {
        String name = event.getEventType() == LockoutEventType.SET ? "riskguard.lockouts.set" : "riskguard.lockouts.cleared";
        Counter.builder(name)
                .tag("kind", event.getLockout().getKind().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onReset(ResetEvent event) {
        Counter.builder("riskguard.resets")
                .tag("type", event.getResetType().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onStopAdjustment(StopAdjustmentEvent event) {
        Counter.builder("riskguard.stop.adjustments")
                .description("Stop prices requested by trade management")
                .tag("symbol", String.valueOf(event.getSymbol()))
                .register(meterRegistry)
                .increment();
    }
}
