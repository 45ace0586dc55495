package com.riskguard.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published once per enforcement action after the broker call has finished, successfully
 * or not. Mirrors the audit_log row written for the same action.
 */
public class EnforcementEvent extends ApplicationEvent {

    private final String accountId;
    private final String action;
    private final String symbol;
    private final String reason;
    private final boolean success;

    public EnforcementEvent(Object source, String accountId, String action, String symbol, String reason, boolean success) {
        super(source);
        this.accountId = accountId;
        this.action = action;
        this.symbol = symbol;
        this.reason = reason;
        this.success = success;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getAction() {
        return action;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getReason() {
        return reason;
    }

    public boolean isSuccess() {
        return success;
    }
}
