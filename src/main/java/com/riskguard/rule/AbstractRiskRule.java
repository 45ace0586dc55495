package com.riskguard.rule;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.enums.VerdictActionType;
import com.riskguard.domain.model.RuleVerdict;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Verdict builders shared by the rule implementations. Each builder stamps the rule's kind
 * and category so that rules only state the action and the reason.
 */
public abstract class AbstractRiskRule implements RiskRule {

    private final RuleKind kind;
    private final EnforcementCategory category;

    protected AbstractRiskRule(RuleKind kind, EnforcementCategory category) {
        this.kind = kind;
        this.category = category;
    }

    @Override
    public RuleKind kind() {
        return kind;
    }

    @Override
    public EnforcementCategory category() {
        return category;
    }

    protected RuleVerdict.RuleVerdictBuilder breach(VerdictActionType action, String symbol, String reason) {
        return RuleVerdict.builder()
                .breached(true)
                .action(action)
                .ruleKind(kind)
                .category(category)
                .symbol(symbol)
                .reason(reason);
    }

    protected RuleVerdict closeSymbol(String symbol, String reason) {
        return breach(VerdictActionType.CLOSE_SYMBOL, symbol, reason).build();
    }

    protected RuleVerdict reduceTo(String symbol, int targetSize, String reason) {
        return breach(VerdictActionType.REDUCE_TO_LIMIT, symbol, reason).targetSize(targetSize).build();
    }

    protected RuleVerdict cooldown(Duration duration, boolean flatten, String reason) {
        return breach(VerdictActionType.COOLDOWN, null, reason).cooldown(duration).flatten(flatten).build();
    }

    /** Account-wide hard lockout; a null {@code until} makes it permanent. */
    protected RuleVerdict hardLockout(Instant until, boolean resetBound, String reason) {
        return breach(VerdictActionType.HARD_LOCKOUT_UNTIL, null, reason)
                .lockoutUntil(until)
                .resetBound(resetBound)
                .build();
    }

    protected RuleVerdict symbolLockout(String symbol, Instant until, String reason) {
        return breach(VerdictActionType.HARD_LOCKOUT_UNTIL, symbol, reason).lockoutUntil(until).build();
    }

    protected RuleVerdict modifyStop(String symbol, BigDecimal stopPrice, String reason) {
        return breach(VerdictActionType.MODIFY_STOP, symbol, reason).stopPrice(stopPrice).build();
    }

    @Override
    public String toString() {
        return kind.getConfigName();
    }
}
