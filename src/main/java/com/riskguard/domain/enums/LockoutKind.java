package com.riskguard.domain.enums;

/**
 * HARD lockouts expire at an absolute wall-clock time (or never, when expiresAt is null).
 * COOLDOWN lockouts are cleared by their paired timer, never by the expiry sweep.
 */
public enum LockoutKind {
    HARD,
    COOLDOWN
}
