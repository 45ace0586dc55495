package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.LossCooldownParams;

/**
 * Imposes a cooldown after a single losing trade, sized by the most severe tier the loss
 * reaches. Winning trades never shorten or clear a running cooldown.
 */
public class CooldownAfterLossRule extends AbstractRiskRule {

    private final LossCooldownParams params;

    public CooldownAfterLossRule(LossCooldownParams params) {
        super(RuleKind.COOLDOWN_AFTER_LOSS, EnforcementCategory.COOLDOWN);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.TRADE_EXECUTED) || event.isHalfTurn() || event.getRealizedPnl().signum() >= 0) {
            return RuleVerdict.noBreach();
        }
        return params.tierFor(event.getRealizedPnl())
                .map(tier -> cooldown(tier.cooldown(), params.isFlatten(), String.format(
                        "Loss %s reached tier %s: cooling down %ds",
                        event.getRealizedPnl().toPlainString(),
                        tier.lossAmount().toPlainString(),
                        tier.cooldown().getSeconds())))
                .orElseGet(RuleVerdict::noBreach);
    }
}
