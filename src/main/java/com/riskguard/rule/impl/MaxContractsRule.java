package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.PositionMode;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.position.PositionBook;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.MaxContractsParams;

/**
 * Caps total contracts held across every symbol. A breach reduces the symbol that pushed the
 * account over by exactly the excess.
 */
public class MaxContractsRule extends AbstractRiskRule {

    private final MaxContractsParams params;

    public MaxContractsRule(MaxContractsParams params) {
        super(RuleKind.MAX_CONTRACTS, EnforcementCategory.TRADE_BY_TRADE);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.POSITION_CHANGED) || !event.increasesExposure()) {
            return RuleVerdict.noBreach();
        }
        PositionBook book = context.getPositionBook();
        String accountId = event.getAccountId();
        int total = params.getMode() == PositionMode.NET ? book.netTotal(accountId) : book.grossTotal(accountId);
        int excess = Math.abs(total) - params.getLimit();
        if (excess <= 0) {
            return RuleVerdict.noBreach();
        }

        int symbolSize = event.netSizeOrZero();
        // in NET mode shrinking a position on the opposite side of the total adds exposure
        if (params.getMode() == PositionMode.NET && Integer.signum(symbolSize) != Integer.signum(total)) {
            return RuleVerdict.noBreach();
        }
        int target = Math.max(0, Math.abs(symbolSize) - excess);
        String reason = String.format("%s contracts %d exceed limit %d", params.getMode(), Math.abs(total), params.getLimit());
        return target == 0 ? closeSymbol(event.getSymbol(), reason) : reduceTo(event.getSymbol(), target, reason);
    }
}
