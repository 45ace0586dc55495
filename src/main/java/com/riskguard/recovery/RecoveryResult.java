package com.riskguard.recovery;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    private int lockoutsRestored;
    private int timersRestored;
    private int cooldownTimersRearmed;
    private BigDecimal restoredDailyPnl;
    private boolean catchUpResetFired;
}
