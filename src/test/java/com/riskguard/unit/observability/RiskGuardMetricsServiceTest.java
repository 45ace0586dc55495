package com.riskguard.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskguard.config.RiskGuardProperties;
import com.riskguard.core.engine.RiskEngine;
import com.riskguard.event.EnforcementEvent;
import com.riskguard.event.StopAdjustmentEvent;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.observability.RiskGuardMetricsService;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.timer.TimerManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RiskGuardMetricsServiceTest {

    @Mock
    private LockoutManager lockoutManager;

    @Mock
    private TimerManager timerManager;

    @Mock
    private RiskEngine riskEngine;

    @Mock
    private RealizedPnlAccumulator realizedPnlAccumulator;

    private SimpleMeterRegistry meterRegistry;
    private RiskGuardMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new RiskGuardMetricsService(
                meterRegistry, lockoutManager, timerManager, riskEngine, realizedPnlAccumulator, new RiskGuardProperties());
    }

    @Test
    @DisplayName("Stop adjustments are counted per symbol")
    void countsStopAdjustments() {
        metricsService.onStopAdjustment(new StopAdjustmentEvent(this, "PRAC-1", "MNQ", new BigDecimal("17998.00"), "initial stop"));
        metricsService.onStopAdjustment(new StopAdjustmentEvent(this, "PRAC-1", "MNQ", new BigDecimal("17999.00"), "trail"));
        metricsService.onStopAdjustment(new StopAdjustmentEvent(this, "PRAC-1", "ES", new BigDecimal("5000.00"), "initial stop"));

        assertThat(meterRegistry.counter("riskguard.stop.adjustments", "symbol", "MNQ").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("riskguard.stop.adjustments", "symbol", "ES").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Enforcement calls are counted by action and result")
    void countsEnforcementResults() {
        metricsService.onEnforcement(new EnforcementEvent(this, "PRAC-1", "CLOSE_ALL_POSITIONS", null, "daily loss", true));
        metricsService.onEnforcement(new EnforcementEvent(this, "PRAC-1", "CLOSE_ALL_POSITIONS", null, "daily loss", false));

        assertThat(meterRegistry.counter("riskguard.enforcement.actions", "action", "CLOSE_ALL_POSITIONS", "result", "success").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("riskguard.enforcement.actions", "action", "CLOSE_ALL_POSITIONS", "result", "failure").count())
                .isEqualTo(1.0);
    }
}
