package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;

/**
 * Reacts to the broker revoking trading permission with a permanent account-wide lockout.
 * The lockout is lifted by the engine when the broker restores permission.
 */
public class AuthLossGuardRule extends AbstractRiskRule {

    public AuthLossGuardRule() {
        super(RuleKind.AUTH_LOSS_GUARD, EnforcementCategory.HARD_LOCKOUT);
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.ACCOUNT_STATUS_CHANGED) || !Boolean.FALSE.equals(event.getCanTrade())) {
            return RuleVerdict.noBreach();
        }
        return hardLockout(null, false, "Broker revoked trading permission for " + event.getAccountId());
    }
}
