package com.riskguard.domain.model;

/**
 * Bounded action a timer performs on expiry. Actions are plain data so that they can be
 * persisted with the timer and replayed after a restart.
 *
 * @see ClearLockout
 * @see CheckStopLoss
 */
public interface TimerAction {

    String CLEAR_LOCKOUT = "CLEAR_LOCKOUT";
    String CHECK_STOP_LOSS = "CHECK_STOP_LOSS";

    /** Discriminator stored in the timers table. */
    String type();

    /** Symbol the action applies to, or null for account-wide. */
    String symbol();

    /**
     * Clears the lockout for (accountId, symbol). Paired with every cooldown lockout.
     */
    record ClearLockout(String accountId, String symbol) implements TimerAction {

        @Override
        public String type() {
            return CLEAR_LOCKOUT;
        }
    }

    /**
     * Re-checks the open orders for a stop on the position's symbol and closes the
     * position if none is found.
     */
    record CheckStopLoss(String accountId, String symbol, String positionId) implements TimerAction {

        @Override
        public String type() {
            return CHECK_STOP_LOSS;
        }
    }
}
