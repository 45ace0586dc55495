package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.InstrumentLimitParams;
import java.util.Optional;

public class MaxContractsPerInstrumentRule extends AbstractRiskRule {

    private final InstrumentLimitParams params;

    public MaxContractsPerInstrumentRule(InstrumentLimitParams params) {
        super(RuleKind.MAX_CONTRACTS_PER_INSTRUMENT, EnforcementCategory.TRADE_BY_TRADE);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.POSITION_CHANGED) || !event.increasesExposure()) {
            return RuleVerdict.noBreach();
        }
        String symbol = event.getSymbol();
        int size = Math.abs(event.netSizeOrZero());
        Optional<Integer> limit = params.limitFor(symbol);
        if (limit.isEmpty() || size <= limit.get()) {
            return RuleVerdict.noBreach();
        }

        int cap = limit.get();
        if (cap == 0) {
            return closeSymbol(symbol, symbol + " has no configured contract limit");
        }
        String reason = String.format("%s size %d exceeds limit %d", symbol, size, cap);
        return params.isCloseOnBreach() ? closeSymbol(symbol, reason) : reduceTo(symbol, cap, reason);
    }
}
