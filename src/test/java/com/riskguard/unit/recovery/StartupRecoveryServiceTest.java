package com.riskguard.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.riskguard.calendar.ResetScheduler;
import com.riskguard.config.RiskGuardProperties;
import com.riskguard.core.engine.RiskEngine;
import com.riskguard.domain.model.DailyPnl;
import com.riskguard.exception.PersistenceException;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.pnl.TradeLog;
import com.riskguard.recovery.RecoveryResult;
import com.riskguard.recovery.StartupRecoveryService;
import com.riskguard.timer.TimerManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StartupRecoveryServiceTest {

    private static final String ACCOUNT = "PRAC-1";
    private static final Instant NOW = Instant.parse("2026-03-10T15:00:00Z");

    @Mock
    private LockoutManager lockoutManager;

    @Mock
    private TimerManager timerManager;

    @Mock
    private TradeLog tradeLog;

    @Mock
    private RealizedPnlAccumulator realizedPnlAccumulator;

    @Mock
    private ResetScheduler resetScheduler;

    @Mock
    private RiskEngine riskEngine;

    private RiskGuardProperties properties;
    private StartupRecoveryService service;

    @BeforeEach
    void setUp() {
        properties = new RiskGuardProperties();
        properties.setAccountId(ACCOUNT);
        service = new StartupRecoveryService(lockoutManager, timerManager, tradeLog, realizedPnlAccumulator,
                resetScheduler, riskEngine, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("State is restored before the event loop starts")
    void restoresThenStarts() {
        when(timerManager.reload()).thenReturn(2);
        when(lockoutManager.reload()).thenReturn(1);
        when(lockoutManager.rearmCooldownTimers()).thenReturn(1);
        when(realizedPnlAccumulator.getDaily(ACCOUNT)).thenReturn(DailyPnl.builder()
                .accountId(ACCOUNT)
                .date(LocalDate.of(2026, 3, 10))
                .total(new BigDecimal("-275.00"))
                .tradeCount(3)
                .build());
        when(resetScheduler.tick(NOW)).thenReturn(false);

        RecoveryResult result = service.recover();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTimersRestored()).isEqualTo(2);
        assertThat(result.getLockoutsRestored()).isEqualTo(1);
        assertThat(result.getCooldownTimersRearmed()).isEqualTo(1);
        assertThat(result.getRestoredDailyPnl()).isEqualByComparingTo("-275.00");

        InOrder order = inOrder(timerManager, lockoutManager, tradeLog, resetScheduler, riskEngine);
        order.verify(timerManager).reload();
        order.verify(lockoutManager).reload();
        order.verify(lockoutManager).rearmCooldownTimers();
        order.verify(tradeLog).reload(ACCOUNT);
        order.verify(resetScheduler).tick(NOW);
        order.verify(riskEngine).tick();
        order.verify(riskEngine).start();
    }

    @Test
    @DisplayName("Missed reset is reported")
    void catchUpResetReported() {
        when(realizedPnlAccumulator.getDaily(ACCOUNT)).thenReturn(DailyPnl.empty(ACCOUNT, LocalDate.of(2026, 3, 10)));
        when(resetScheduler.tick(NOW)).thenReturn(true);

        assertThat(service.recover().isCatchUpResetFired()).isTrue();
    }

    @Test
    @DisplayName("Storage failure leaves the loop stopped")
    void failureKeepsLoopStopped() {
        when(timerManager.reload()).thenThrow(new PersistenceException("database unavailable", null));

        RecoveryResult result = service.recover();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("database unavailable");
        verify(riskEngine, never()).start();
        verifyNoInteractions(resetScheduler);
    }

    @Test
    @DisplayName("Without an account id only lockouts and timers are restored")
    void noAccountConfigured() {
        properties.setAccountId(null);
        when(resetScheduler.tick(any())).thenReturn(false);

        RecoveryResult result = service.recover();

        assertThat(result.isSuccess()).isTrue();
        verifyNoInteractions(tradeLog, realizedPnlAccumulator);
        verify(riskEngine).start();
    }
}
