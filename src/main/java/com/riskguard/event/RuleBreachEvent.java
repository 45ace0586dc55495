package com.riskguard.event;

import com.riskguard.domain.model.RuleVerdict;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every breaching verdict, including those that lose the most-restrictive
 * tie-break and are therefore not enforced.
 */
public class RuleBreachEvent extends ApplicationEvent {

    private final String accountId;
    private final RuleVerdict verdict;
    private final boolean enforced;

    public RuleBreachEvent(Object source, String accountId, RuleVerdict verdict, boolean enforced) {
        super(source);
        this.accountId = accountId;
        this.verdict = verdict;
        this.enforced = enforced;
    }

    public String getAccountId() {
        return accountId;
    }

    public RuleVerdict getVerdict() {
        return verdict;
    }

    public boolean isEnforced() {
        return enforced;
    }
}
