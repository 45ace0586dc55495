package com.riskguard.integration;

import static com.riskguard.support.TestEvents.ACCOUNT;
import static com.riskguard.support.TestEvents.accountStatus;
import static com.riskguard.support.TestEvents.position;
import static com.riskguard.support.TestEvents.stopOrder;
import static com.riskguard.support.TestEvents.trade;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.riskguard.broker.BrokerGateway;
import com.riskguard.calendar.ResetConfig;
import com.riskguard.calendar.ResetScheduler;
import com.riskguard.config.EnforcementConfig;
import com.riskguard.core.engine.ProcessingOutcome;
import com.riskguard.core.engine.RiskEngine;
import com.riskguard.domain.enums.LockoutKind;
import com.riskguard.domain.enums.OrderStatus;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.Lockout;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.enforcement.AuditService;
import com.riskguard.enforcement.EnforcementExecutor;
import com.riskguard.event.EventPublisherHelper;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.pnl.TradeLedger;
import com.riskguard.pnl.TradeLog;
import com.riskguard.position.OpenOrderBook;
import com.riskguard.position.PositionBook;
import com.riskguard.repository.jpa.AuditLogJpaRepository;
import com.riskguard.repository.jpa.DailyPnlJpaRepository;
import com.riskguard.repository.jpa.LockoutJpaRepository;
import com.riskguard.repository.jpa.TimerJpaRepository;
import com.riskguard.repository.jpa.TradeRecordJpaRepository;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.RuleSet;
import com.riskguard.rule.RuleSetFactory;
import com.riskguard.rule.RuleSpec;
import com.riskguard.support.MutableClock;
import com.riskguard.timer.TimerManager;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * End-to-end event flows through the engine with real state managers, real rules and real
 * enforcement. Only storage and the broker are mocked.
 */
@ExtendWith(MockitoExtension.class)
class RiskEngineScenarioIntegrationTest {

    private static final Instant START = Instant.parse("2026-03-10T15:00:00Z");
    private static final Instant NEXT_RESET = Instant.parse("2026-03-10T21:00:00Z");

    @Mock
    private BrokerGateway brokerGateway;

    @Mock
    private ResetScheduler resetScheduler;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private LockoutJpaRepository lockoutJpaRepository;

    @Mock
    private TimerJpaRepository timerJpaRepository;

    @Mock
    private TradeRecordJpaRepository tradeRecordJpaRepository;

    @Mock
    private DailyPnlJpaRepository dailyPnlJpaRepository;

    @Mock
    private AuditLogJpaRepository auditLogJpaRepository;

    private MutableClock clock;
    private LockoutManager lockoutManager;
    private RuleContext context;
    private EnforcementExecutor enforcementExecutor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        TimerManager timerManager = new TimerManager(timerJpaRepository, clock);
        lockoutManager = new LockoutManager(lockoutJpaRepository, timerManager, eventPublisherHelper, clock);
        PositionBook positionBook = new PositionBook();
        context = new RuleContext(
                new RealizedPnlAccumulator(dailyPnlJpaRepository, new ResetConfig(), clock),
                lockoutManager,
                timerManager,
                new TradeLog(tradeRecordJpaRepository, clock),
                positionBook,
                new OpenOrderBook(),
                resetScheduler,
                null,
                clock);

        EnforcementConfig config = new EnforcementConfig();
        config.setMaxRetries(3);
        config.setInitialBackoffMs(0);
        config.setCallTimeoutMs(2000);
        enforcementExecutor = new EnforcementExecutor(brokerGateway, lockoutManager, positionBook,
                new AuditService(auditLogJpaRepository, clock), eventPublisherHelper, config);
    }

    @AfterEach
    void tearDown() {
        enforcementExecutor.shutdown();
    }

    private RiskEngine engine(Map<String, RuleSpec> rules) {
        RuleSet ruleSet = RuleSetFactory.build(rules);
        TradeLedger tradeLedger = new TradeLedger(context.getTradeLog(), context.getPnlAccumulator());
        return new RiskEngine(ruleSet, context, tradeLedger, enforcementExecutor, eventPublisherHelper, Runnable::run);
    }

    private static RiskEvent broker(RiskEvent event) {
        return event.toBuilder().previousSize(null).build();
    }

    @Test
    @DisplayName("Third losing trade crosses the daily limit: flatten once, locked until reset")
    void dailyLossLimit() {
        when(resetScheduler.nextResetTime(any())).thenReturn(NEXT_RESET);
        RuleSpec spec = new RuleSpec();
        spec.setLimit(new BigDecimal("-500"));
        RiskEngine engine = engine(Map.of("daily-realized-loss", spec));

        ProcessingOutcome first = engine.process(trade("T-1", "MNQ", "-200", START));
        clock.advance(Duration.ofSeconds(30));
        ProcessingOutcome second = engine.process(trade("T-2", "MNQ", "-150", clock.instant()));
        clock.advance(Duration.ofSeconds(30));
        ProcessingOutcome third = engine.process(trade("T-3", "MNQ", "-200", clock.instant()));

        assertThat(first.hasEnforcement()).isFalse();
        assertThat(second.hasEnforcement()).isFalse();
        assertThat(third.getEnforced().getRuleKind()).isEqualTo(RuleKind.DAILY_REALIZED_LOSS);

        InOrder order = inOrder(brokerGateway);
        order.verify(brokerGateway).cancelAllOrders(ACCOUNT);
        order.verify(brokerGateway).closeAllPositions(ACCOUNT);
        verify(brokerGateway, times(1)).closeAllPositions(ACCOUNT);

        Lockout lockout = lockoutManager.info(ACCOUNT, null);
        assertThat(lockout.getKind()).isEqualTo(LockoutKind.HARD);
        assertThat(lockout.getExpiresAt()).isEqualTo(NEXT_RESET);
        assertThat(lockout.isResetBound()).isTrue();

        // further trades are gated and do not flatten again
        ProcessingOutcome fourth = engine.process(trade("T-4", "MNQ", "-50", clock.instant()));
        assertThat(fourth.isGated()).isTrue();
        verify(brokerGateway, times(1)).closeAllPositions(ACCOUNT);
    }

    @Test
    @DisplayName("Fourth trade inside a minute starts a 60s cooldown without flattening")
    void tradeFrequencyCooldown() {
        RuleSpec spec = new RuleSpec();
        spec.setPerMinute(3);
        spec.setCooldownMinuteSeconds(60L);
        RiskEngine engine = engine(Map.of("trade-frequency-limit", spec));

        ProcessingOutcome last = null;
        for (int i = 1; i <= 4; i++) {
            last = engine.process(trade("T-" + i, "MNQ", null, clock.instant()));
            clock.advance(Duration.ofSeconds(10));
        }

        assertThat(last.getEnforced().getRuleKind()).isEqualTo(RuleKind.TRADE_FREQUENCY_LIMIT);
        Lockout lockout = lockoutManager.info(ACCOUNT, null);
        assertThat(lockout.getKind()).isEqualTo(LockoutKind.COOLDOWN);
        assertThat(lockout.getExpiresAt()).isEqualTo(START.plusSeconds(30).plusSeconds(60));
        verify(brokerGateway, never()).closeAllPositions(anyString());

        clock.set(START.plusSeconds(90));
        engine.tick();
        assertThat(lockoutManager.isLockedOut(ACCOUNT, null)).isFalse();
    }

    @Test
    @DisplayName("Unprotected position is closed when the stop-loss grace runs out")
    void stopLossGraceExpires() {
        RuleSpec spec = new RuleSpec();
        spec.setGraceSeconds(10L);
        RiskEngine engine = engine(Map.of("no-stop-loss-grace", spec));

        engine.process(broker(position("MNQ", 0, 1)));
        clock.advance(Duration.ofSeconds(9));
        engine.tick();
        engine.processQueued();
        verify(brokerGateway, never()).closePosition(anyString(), anyString());

        clock.advance(Duration.ofSeconds(1));
        engine.tick();
        engine.processQueued();

        verify(brokerGateway).closePosition(ACCOUNT, "MNQ");
        verify(brokerGateway, never()).closeAllPositions(anyString());
        assertThat(lockoutManager.isLockedOut(ACCOUNT, null)).isFalse();
        assertThat(lockoutManager.isLockedOut(ACCOUNT, "MNQ")).isFalse();
    }

    @Test
    @DisplayName("Placing a stop inside the grace window keeps the position open")
    void stopPlacedInTime() {
        RuleSpec spec = new RuleSpec();
        spec.setGraceSeconds(10L);
        RiskEngine engine = engine(Map.of("no-stop-loss-grace", spec));

        engine.process(broker(position("MNQ", 0, 1)));
        clock.advance(Duration.ofSeconds(5));
        engine.process(stopOrder("O-1", "MNQ", OrderStatus.OPEN));
        clock.advance(Duration.ofSeconds(10));
        engine.tick();
        engine.processQueued();

        verify(brokerGateway, never()).closePosition(anyString(), anyString());
    }

    @Test
    @DisplayName("Broker revokes trading: flatten, permanent lockout that survives the reset, lifted on restore")
    void authLossLocksUntilRestored() {
        RiskEngine engine = engine(Map.of("auth-loss-guard", new RuleSpec()));

        ProcessingOutcome outcome = engine.process(accountStatus(false));

        assertThat(outcome.getEnforced().getRuleKind()).isEqualTo(RuleKind.AUTH_LOSS_GUARD);
        InOrder order = inOrder(brokerGateway);
        order.verify(brokerGateway).cancelAllOrders(ACCOUNT);
        order.verify(brokerGateway).closeAllPositions(ACCOUNT);
        Lockout lockout = lockoutManager.info(ACCOUNT, null);
        assertThat(lockout.getKind()).isEqualTo(LockoutKind.HARD);
        assertThat(lockout.getExpiresAt()).isNull();
        assertThat(lockout.getSource()).isEqualTo(RuleKind.AUTH_LOSS_GUARD);

        clock.advance(Duration.ofDays(2));
        engine.tick();
        lockoutManager.clearResetBound(ACCOUNT);
        assertThat(lockoutManager.isLockedOut(ACCOUNT, "MNQ")).isTrue();
        assertThat(engine.process(broker(position("MNQ", 0, 1))).isGated()).isTrue();

        engine.process(accountStatus(true));
        assertThat(lockoutManager.isLockedOut(ACCOUNT, null)).isFalse();
        verify(brokerGateway, times(1)).closeAllPositions(ACCOUNT);
    }

    @Test
    @DisplayName("Several rules together: the hard lockout outranks the cooldown")
    void hardLockoutOutranksCooldown() {
        when(resetScheduler.nextResetTime(any())).thenReturn(NEXT_RESET);
        Map<String, RuleSpec> rules = new LinkedHashMap<>();
        RuleSpec frequency = new RuleSpec();
        frequency.setPerMinute(1);
        rules.put("trade-frequency-limit", frequency);
        RuleSpec loss = new RuleSpec();
        loss.setLimit(new BigDecimal("-100"));
        rules.put("daily-realized-loss", loss);
        RiskEngine engine = engine(rules);

        engine.process(trade("T-1", "MNQ", "-50", clock.instant()));
        ProcessingOutcome outcome = engine.process(trade("T-2", "MNQ", "-60", clock.instant()));

        assertThat(outcome.getBreaches()).hasSize(2);
        assertThat(outcome.getEnforced().getRuleKind()).isEqualTo(RuleKind.DAILY_REALIZED_LOSS);
        assertThat(lockoutManager.info(ACCOUNT, null).getKind()).isEqualTo(LockoutKind.HARD);
    }
}
