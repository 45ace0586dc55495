package com.riskguard.event;

import com.riskguard.domain.enums.ResetType;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

public class ResetEvent extends ApplicationEvent {

    private final String accountId;
    private final ResetType resetType;
    private final Instant triggeredAt;

    public ResetEvent(Object source, String accountId, ResetType resetType, Instant triggeredAt) {
        super(source);
        this.accountId = accountId;
        this.resetType = resetType;
        this.triggeredAt = triggeredAt;
    }

    public String getAccountId() {
        return accountId;
    }

    public ResetType getResetType() {
        return resetType;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }
}
