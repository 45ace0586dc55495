package com.riskguard.unit.rule.impl;

import static com.riskguard.support.TestEvents.accountStatus;
import static com.riskguard.support.TestEvents.position;
import static org.assertj.core.api.Assertions.assertThat;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.enums.VerdictActionType;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.impl.AuthLossGuardRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AuthLossGuardRuleTest {

    private final RuleContext context = new RuleContext(null, null, null, null, null, null, null, null, null);
    private final AuthLossGuardRule rule = new AuthLossGuardRule();

    @Test
    @DisplayName("Revoked trading permission locks the whole account with no expiry")
    void revokedPermissionLocksPermanently() {
        RuleVerdict verdict = rule.evaluate(accountStatus(false), context);

        assertThat(verdict.isBreached()).isTrue();
        assertThat(verdict.getRuleKind()).isEqualTo(RuleKind.AUTH_LOSS_GUARD);
        assertThat(verdict.getCategory()).isEqualTo(EnforcementCategory.HARD_LOCKOUT);
        assertThat(verdict.getAction()).isEqualTo(VerdictActionType.HARD_LOCKOUT_UNTIL);
        assertThat(verdict.isAccountWide()).isTrue();
        assertThat(verdict.getLockoutUntil()).isNull();
        assertThat(verdict.isResetBound()).isFalse();
    }

    @Test
    @DisplayName("Granted permission is not a breach")
    void grantedPermissionIgnored() {
        assertThat(rule.evaluate(accountStatus(true), context).isBreached()).isFalse();
    }

    @Test
    @DisplayName("Other event kinds are ignored")
    void otherEventsIgnored() {
        assertThat(rule.evaluate(position("MNQ", 0, 1), context).isBreached()).isFalse();
    }
}
