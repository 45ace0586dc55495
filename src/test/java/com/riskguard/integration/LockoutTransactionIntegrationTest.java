package com.riskguard.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

import com.riskguard.domain.enums.LockoutKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.entity.TimerEntity;
import com.riskguard.exception.PersistenceException;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.repository.jpa.LockoutJpaRepository;
import com.riskguard.repository.jpa.TimerJpaRepository;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Lockout writes against a real H2 schema: a cooldown and its paired timer row are stored
 * together or not at all.
 */
@SpringBootTest(
        properties = {
            "spring.datasource.url=jdbc:h2:mem:riskguard-lockouts;DB_CLOSE_DELAY=-1",
            "spring.jpa.hibernate.ddl-auto=create-drop",
            "logging.file.name=",
            "riskguard.account-id=PRAC-LOCKOUT-ENGINE",
            "riskguard.broker.mode=dry-run"
        })
class LockoutTransactionIntegrationTest {

    @Autowired
    private LockoutManager lockoutManager;

    @Autowired
    private LockoutJpaRepository lockoutJpaRepository;

    @SpyBean
    private TimerJpaRepository timerJpaRepository;

    @Test
    @DisplayName("Failed timer write rolls back the cooldown row")
    void timerFailureRollsBackCooldown() {
        String account = "PRAC-LOCKOUT-1";
        doThrow(new DataAccessResourceFailureException("database locked"))
                .when(timerJpaRepository)
                .saveAndFlush(any(TimerEntity.class));

        assertThatThrownBy(() -> lockoutManager.setCooldown(account, null, "cooldown", Duration.ofSeconds(60)))
                .isInstanceOf(PersistenceException.class);

        assertThat(lockoutJpaRepository.findByAccountIdAndSymbolKey(account, "*")).isEmpty();
        assertThat(lockoutManager.isLockedOut(account, null)).isFalse();
    }

    @Test
    @DisplayName("Replacing a lockout keeps a single row per key")
    void replaceKeepsOneRow() {
        String account = "PRAC-LOCKOUT-2";

        lockoutManager.setCooldown(account, "MNQ", "cooldown", Duration.ofSeconds(60), RuleKind.TRADE_FREQUENCY_LIMIT);
        lockoutManager.setHard(account, "MNQ", "blocked", null, RuleKind.SYMBOL_BLOCKS, false);

        assertThat(lockoutJpaRepository.findByAccountIdAndSymbolKey(account, "MNQ"))
                .singleElement()
                .satisfies(row -> assertThat(row.getKind()).isEqualTo(LockoutKind.HARD));
        assertThat(timerJpaRepository.findByAccountIdAndName(account, "lockout:MNQ")).isEmpty();
    }
}
