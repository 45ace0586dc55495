package com.riskguard.domain.model;

import com.riskguard.domain.enums.LockoutKind;
import com.riskguard.domain.enums.RuleKind;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * An active trading restriction for an account, optionally narrowed to a single symbol.
 * A null symbol means the whole account is restricted; a null expiresAt means the lockout
 * stays until cleared by the broker or an admin.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Lockout {

    private String accountId;
    private String symbol;
    private String reason;
    private LockoutKind kind;
    private Instant expiresAt;
    private Instant createdAt;
    private RuleKind source;

    /** Cleared by the daily reset in addition to its own expiry. */
    private boolean resetBound;

    public boolean isAccountWide() {
        return symbol == null;
    }

    public boolean isPermanent() {
        return expiresAt == null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public long remainingSeconds(Instant now) {
        if (expiresAt == null) {
            return -1;
        }
        return Math.max(0, Duration.between(now, expiresAt).getSeconds());
    }

    /**
     * Ordering used when two lockouts compete for one key: HARD beats COOLDOWN, then the
     * later expiry wins, with a permanent lockout counted as the latest.
     */
    public boolean isMoreRestrictiveThan(Lockout other) {
        if (other == null) {
            return true;
        }
        if (kind != other.kind) {
            return kind == LockoutKind.HARD;
        }
        if (expiresAt == null) {
            return other.expiresAt != null;
        }
        if (other.expiresAt == null) {
            return false;
        }
        return expiresAt.isAfter(other.expiresAt);
    }
}
