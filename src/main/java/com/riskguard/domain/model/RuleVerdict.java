package com.riskguard.domain.model;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.enums.VerdictActionType;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of evaluating one rule against one event. Transient: produced per event per rule
 * and consumed immediately by the engine.
 *
 * <p>{@code symbol} is the verdict's scope: null means account-wide. Action-specific fields:
 * <ul>
 *   <li>REDUCE_TO_LIMIT: targetSize</li>
 *   <li>COOLDOWN: cooldown, plus flatten when positions must be closed first</li>
 *   <li>HARD_LOCKOUT_UNTIL: lockoutUntil (null for a permanent lockout), resetBound</li>
 *   <li>MODIFY_STOP: stopPrice</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class RuleVerdict {

    private static final RuleVerdict NO_BREACH = RuleVerdict.builder()
            .breached(false)
            .action(VerdictActionType.NONE)
            .build();

    private final boolean breached;
    private final VerdictActionType action;
    private final RuleKind ruleKind;
    private final EnforcementCategory category;
    private final String reason;
    private final String symbol;

    private final Integer targetSize;
    private final Duration cooldown;
    private final boolean flatten;
    private final Instant lockoutUntil;
    private final boolean resetBound;
    private final BigDecimal stopPrice;

    public static RuleVerdict noBreach() {
        return NO_BREACH;
    }

    public boolean isAccountWide() {
        return symbol == null;
    }

    public boolean imposesLockout() {
        return action == VerdictActionType.COOLDOWN || action == VerdictActionType.HARD_LOCKOUT_UNTIL;
    }
}
