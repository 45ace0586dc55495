package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.PnlThresholdParams;
import java.math.BigDecimal;

public class DailyRealizedProfitRule extends AbstractRiskRule {

    private final PnlThresholdParams params;

    public DailyRealizedProfitRule(PnlThresholdParams params) {
        super(RuleKind.DAILY_REALIZED_PROFIT, EnforcementCategory.HARD_LOCKOUT);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.TRADE_EXECUTED) || event.isHalfTurn()) {
            return RuleVerdict.noBreach();
        }
        BigDecimal total = context.getPnlAccumulator().getDaily(event.getAccountId()).getTotal();
        if (total.compareTo(params.getThreshold()) < 0) {
            return RuleVerdict.noBreach();
        }
        return hardLockout(
                context.getResetScheduler().nextResetTime(context.getClock().instant()),
                true,
                "Daily profit target " + params.getThreshold().toPlainString() + " reached: " + total.toPlainString());
    }
}
