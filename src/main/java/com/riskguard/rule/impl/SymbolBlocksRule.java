package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.SymbolBlockParams;

/**
 * Closes any position in a blocked symbol and locks that symbol permanently.
 */
public class SymbolBlocksRule extends AbstractRiskRule {

    private final SymbolBlockParams params;

    public SymbolBlocksRule(SymbolBlockParams params) {
        super(RuleKind.SYMBOL_BLOCKS, EnforcementCategory.HARD_LOCKOUT);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.POSITION_CHANGED) || event.netSizeOrZero() == 0) {
            return RuleVerdict.noBreach();
        }
        if (!params.isBlocked(event.getSymbol())) {
            return RuleVerdict.noBreach();
        }
        return symbolLockout(event.getSymbol(), null, event.getSymbol() + " is a blocked symbol");
    }
}
