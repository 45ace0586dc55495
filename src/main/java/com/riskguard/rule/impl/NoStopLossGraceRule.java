package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.Position;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.domain.model.TimerAction;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.StopLossGraceParams;
import com.riskguard.timer.TimerManager;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives a newly opened position a grace period to receive a protective stop order.
 *
 * <p>Opening a position without a working stop starts a {@code stop-grace:<symbol>} timer. A
 * stop order or a flat position cancels it. When the timer fires the engine calls
 * {@link #onGraceExpired} which closes the position if it is still unprotected.
 */
public class NoStopLossGraceRule extends AbstractRiskRule {

    private static final Logger log = LoggerFactory.getLogger(NoStopLossGraceRule.class);

    public static final String TIMER_PREFIX = "stop-grace:";

    private final StopLossGraceParams params;

    public NoStopLossGraceRule(StopLossGraceParams params) {
        super(RuleKind.NO_STOP_LOSS_GRACE, EnforcementCategory.TRADE_BY_TRADE);
        this.params = params;
    }

    public static String timerName(String symbol) {
        return TIMER_PREFIX + symbol;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        TimerManager timers = context.getTimerManager();
        String accountId = event.getAccountId();

        if (event.is(EventKind.ORDER_CHANGED)) {
            if (event.isStopOrder() && event.getOrderStatus() != null && event.getOrderStatus().isWorking()) {
                timers.cancel(accountId, timerName(event.getSymbol()));
            }
            return RuleVerdict.noBreach();
        }
        if (!event.is(EventKind.POSITION_CHANGED)) {
            return RuleVerdict.noBreach();
        }
        if (event.closesPosition()) {
            timers.cancel(accountId, timerName(event.getSymbol()));
        } else if (event.opensPosition() && !context.getOpenOrderBook().hasStopOrder(accountId, event.getSymbol())) {
            String positionId = accountId + ":" + event.getSymbol();
            timers.start(accountId, timerName(event.getSymbol()), params.getGrace(),
                    new TimerAction.CheckStopLoss(accountId, event.getSymbol(), positionId));
            log.debug("Stop-loss grace of {}s started for {} {}", params.getGrace().getSeconds(), accountId, event.getSymbol());
        }
        return RuleVerdict.noBreach();
    }

    /**
     * Re-checks a position whose grace timer expired.
     */
    public RuleVerdict onGraceExpired(TimerAction.CheckStopLoss action, RuleContext context) {
        Optional<Position> position = context.getPositionBook().get(action.accountId(), action.symbol());
        if (position.isEmpty() || position.get().getNetSize() == 0) {
            return RuleVerdict.noBreach();
        }
        if (context.getOpenOrderBook().hasStopOrder(action.accountId(), action.symbol())) {
            return RuleVerdict.noBreach();
        }
        return closeSymbol(action.symbol(),
                "No stop loss on " + action.symbol() + " within " + params.getGrace().getSeconds() + "s");
    }
}
