package com.riskguard.domain.enums;

/**
 * What the engine does with a breaching verdict. The category is a property of the rule
 * configuration, not of the evaluation logic.
 */
public enum EnforcementCategory {
    /** Close or reduce the offending symbol only. No lockout. */
    TRADE_BY_TRADE,
    /** Optional close-all, then a timer-bound lockout. */
    COOLDOWN,
    /** Close all, cancel orders, then a wall-clock-bound lockout. */
    HARD_LOCKOUT,
    /** Stop order adjustments only. Never produces a lockout. */
    AUTOMATION
}
