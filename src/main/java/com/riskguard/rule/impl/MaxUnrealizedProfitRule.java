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

/**
 * Takes profit on a single position once its floating gain reaches the target.
 */
public class MaxUnrealizedProfitRule extends AbstractRiskRule {

    private final PnlThresholdParams params;

    public MaxUnrealizedProfitRule(PnlThresholdParams params) {
        super(RuleKind.MAX_UNREALIZED_PROFIT, params.getCategory());
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.POSITION_CHANGED) || event.netSizeOrZero() == 0 || event.getUnrealizedPnl() == null) {
            return RuleVerdict.noBreach();
        }
        BigDecimal unrealized = event.getUnrealizedPnl();
        if (unrealized.compareTo(params.getThreshold()) < 0) {
            return RuleVerdict.noBreach();
        }

        String reason = event.getSymbol() + " unrealized profit " + unrealized.toPlainString()
                + " reached target " + params.getThreshold().toPlainString();
        if (category() == EnforcementCategory.HARD_LOCKOUT) {
            return hardLockout(context.getResetScheduler().nextResetTime(context.getClock().instant()), true, reason);
        }
        return closeSymbol(event.getSymbol(), reason);
    }
}
