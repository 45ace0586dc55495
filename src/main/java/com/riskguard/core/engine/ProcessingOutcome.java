package com.riskguard.core.engine;

import com.riskguard.domain.model.Lockout;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.enforcement.EnforcementResult;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What the engine did with one event.
 */
@Getter
@Builder
@ToString
public class ProcessingOutcome {

    private final RiskEvent event;
    private final boolean duplicate;

    /** Set when a lockout stopped rule evaluation. */
    private final Lockout blockingLockout;

    @Builder.Default
    private final List<RuleVerdict> breaches = List.of();

    /** The verdict that was dispatched for enforcement, if any. */
    private final RuleVerdict enforced;

    @ToString.Exclude
    private final CompletableFuture<EnforcementResult> enforcement;

    public boolean isGated() {
        return blockingLockout != null;
    }

    public boolean hasEnforcement() {
        return enforcement != null;
    }
}
