package com.riskguard.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Actions a rule verdict can request, ranked by how restrictive they are.
 * The engine keeps the highest-ranked verdict when several rules breach on one event.
 */
@Getter
@RequiredArgsConstructor
public enum VerdictActionType {
    NONE(0),
    MODIFY_STOP(1),
    CANCEL_ORDERS(2),
    REDUCE_TO_LIMIT(3),
    CLOSE_SYMBOL(4),
    CLOSE_ALL(5),
    COOLDOWN(6),
    HARD_LOCKOUT_UNTIL(7);

    private final int restrictiveness;

    public boolean isMoreRestrictiveThan(VerdictActionType other) {
        return this.restrictiveness > other.restrictiveness;
    }
}
