package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.pnl.TradeLog;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.TradeFrequencyParams;
import java.time.Duration;
import java.time.Instant;

/**
 * Counts executions in a rolling minute, a rolling hour and the current session. The first
 * window over its cap (checked in that order) decides the cooldown.
 */
public class TradeFrequencyLimitRule extends AbstractRiskRule {

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    private final TradeFrequencyParams params;

    public TradeFrequencyLimitRule(TradeFrequencyParams params) {
        super(RuleKind.TRADE_FREQUENCY_LIMIT, EnforcementCategory.COOLDOWN);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.TRADE_EXECUTED)) {
            return RuleVerdict.noBreach();
        }
        TradeLog tradeLog = context.getTradeLog();
        String accountId = event.getAccountId();

        if (params.getPerMinute() != null) {
            int count = tradeLog.countInLast(accountId, MINUTE);
            if (count > params.getPerMinute()) {
                return breachOf("minute", count, params.getPerMinute(), params.getMinuteCooldown());
            }
        }
        if (params.getPerHour() != null) {
            int count = tradeLog.countInLast(accountId, HOUR);
            if (count > params.getPerHour()) {
                return breachOf("hour", count, params.getPerHour(), params.getHourCooldown());
            }
        }
        if (params.getPerSession() != null) {
            Instant sessionStart = context.getResetScheduler().currentSessionStart(context.getClock().instant());
            int count = tradeLog.countSince(accountId, sessionStart);
            if (count > params.getPerSession()) {
                return breachOf("session", count, params.getPerSession(), params.getSessionCooldown());
            }
        }
        return RuleVerdict.noBreach();
    }

    private RuleVerdict breachOf(String window, int count, int cap, Duration cooldown) {
        return cooldown(cooldown, false, String.format("%d trades this %s exceed cap %d", count, window, cap));
    }
}
