package com.riskguard.rule;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;

/**
 * A single risk rule. Rules are stateless with respect to account state: everything they
 * read comes from the {@link RuleContext}.
 */
public interface RiskRule {

    RuleKind kind();

    EnforcementCategory category();

    /**
     * Evaluates one event. Returns {@link RuleVerdict#noBreach()} when the rule is not
     * violated or does not care about this event kind.
     */
    RuleVerdict evaluate(RiskEvent event, RuleContext context);
}
