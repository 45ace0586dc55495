package com.riskguard.timer;

import com.riskguard.domain.model.Timer;

/**
 * Performs a timer's expiry action. Supplied by the caller of {@link TimerManager#tick}
 * so the timer manager stays free of dependencies on the components its actions touch.
 */
@FunctionalInterface
public interface TimerActionHandler {

    void onExpire(Timer timer);
}
