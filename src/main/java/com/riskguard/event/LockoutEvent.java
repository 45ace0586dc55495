package com.riskguard.event;

import com.riskguard.domain.model.Lockout;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the LockoutManager whenever a lockout is installed or removed.
 *
 * <p>{@code cause} says why a lockout was cleared: "expired", "timer", "reset", "manual",
 * "broker" or "replaced". It is null for SET events.
 */
public class LockoutEvent extends ApplicationEvent {

    private final LockoutEventType eventType;
    private final Lockout lockout;
    private final String cause;

    public LockoutEvent(Object source, LockoutEventType eventType, Lockout lockout, String cause) {
        super(source);
        this.eventType = eventType;
        this.lockout = lockout;
        this.cause = cause;
    }

    public LockoutEventType getEventType() {
        return eventType;
    }

    public Lockout getLockout() {
        return lockout;
    }

    public String getCause() {
        return cause;
    }
}
