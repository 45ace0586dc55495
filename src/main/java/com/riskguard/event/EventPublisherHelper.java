package com.riskguard.event;

import com.riskguard.domain.enums.ResetType;
import com.riskguard.domain.model.Lockout;
import com.riskguard.domain.model.RuleVerdict;
import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the engine's application events.
 *
 * <p>Delivery is synchronous unless the listener is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Lockout ----

    public void publishLockoutSet(Object source, Lockout lockout) {
        applicationEventPublisher.publishEvent(new LockoutEvent(source, LockoutEventType.SET, lockout, null));
    }

    public void publishLockoutCleared(Object source, Lockout lockout, String cause) {
        applicationEventPublisher.publishEvent(new LockoutEvent(source, LockoutEventType.CLEARED, lockout, cause));
    }

    // ---- Rules and enforcement ----

    public void publishRuleBreach(Object source, String accountId, RuleVerdict verdict, boolean enforced) {
        applicationEventPublisher.publishEvent(new RuleBreachEvent(source, accountId, verdict, enforced));
    }

    public void publishEnforcement(
            Object source, String accountId, String action, String symbol, String reason, boolean success) {
        applicationEventPublisher.publishEvent(new EnforcementEvent(source, accountId, action, symbol, reason, success));
    }

    public void publishStopAdjustment(
            Object source, String accountId, String symbol, BigDecimal stopPrice, String reason) {
        applicationEventPublisher.publishEvent(new StopAdjustmentEvent(source, accountId, symbol, stopPrice, reason));
    }

    // ---- Reset ----

    public void publishReset(Object source, String accountId, ResetType resetType, Instant triggeredAt) {
        applicationEventPublisher.publishEvent(new ResetEvent(source, accountId, resetType, triggeredAt));
    }
}
