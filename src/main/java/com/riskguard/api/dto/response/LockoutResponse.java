package com.riskguard.api.dto.response;

import com.riskguard.domain.enums.LockoutKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.Lockout;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class LockoutResponse {

    private final String accountId;
    private final String symbol;
    private final LockoutKind kind;
    private final RuleKind source;
    private final String reason;
    private final Instant createdAt;
    private final Instant expiresAt;

    /** -1 for a permanent lockout. */
    private final long remainingSeconds;

    private final boolean resetBound;

    public static LockoutResponse from(Lockout lockout, Instant now) {
        return LockoutResponse.builder()
                .accountId(lockout.getAccountId())
                .symbol(lockout.getSymbol())
                .kind(lockout.getKind())
                .source(lockout.getSource())
                .reason(lockout.getReason())
                .createdAt(lockout.getCreatedAt())
                .expiresAt(lockout.getExpiresAt())
                .remainingSeconds(lockout.remainingSeconds(now))
                .resetBound(lockout.isResetBound())
                .build();
    }
}
