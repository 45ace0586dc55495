package com.riskguard.unit.rule.impl;

import static com.riskguard.support.TestEvents.ACCOUNT;
import static com.riskguard.support.TestEvents.position;
import static com.riskguard.support.TestEvents.positionWithUnrealized;
import static com.riskguard.support.TestEvents.trade;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.riskguard.calendar.ResetScheduler;
import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.enums.VerdictActionType;
import com.riskguard.domain.model.DailyPnl;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.position.PositionBook;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.RuleSpec;
import com.riskguard.rule.impl.DailyRealizedLossRule;
import com.riskguard.rule.impl.DailyRealizedProfitRule;
import com.riskguard.rule.impl.DailyUnrealizedLossRule;
import com.riskguard.rule.impl.MaxUnrealizedProfitRule;
import com.riskguard.rule.params.PnlThresholdParams;
import com.riskguard.support.MutableClock;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PnlRulesTest {

    private static final Instant NOW = Instant.parse("2026-03-10T15:00:00Z");
    private static final Instant NEXT_RESET = Instant.parse("2026-03-10T21:00:00Z");

    @Mock
    private RealizedPnlAccumulator pnlAccumulator;

    @Mock
    private ResetScheduler resetScheduler;

    private PositionBook positionBook;
    private RuleContext context;

    @BeforeEach
    void setUp() {
        positionBook = new PositionBook();
        context = new RuleContext(
                pnlAccumulator, null, null, null, positionBook, null, resetScheduler, null, new MutableClock(NOW));
    }

    private void dailyTotal(String total) {
        when(pnlAccumulator.getDaily(ACCOUNT)).thenReturn(DailyPnl.builder()
                .accountId(ACCOUNT)
                .date(LocalDate.of(2026, 3, 10))
                .total(new BigDecimal(total))
                .tradeCount(3)
                .build());
    }

    private static RuleSpec limit(String value) {
        RuleSpec spec = new RuleSpec();
        spec.setLimit(new BigDecimal(value));
        return spec;
    }

    private static RuleSpec target(String value) {
        RuleSpec spec = new RuleSpec();
        spec.setTarget(new BigDecimal(value));
        return spec;
    }

    // ==============================
    // DAILY REALIZED LOSS
    // ==============================

    @Nested
    @DisplayName("Daily realized loss")
    class DailyRealizedLoss {

        private final DailyRealizedLossRule rule = new DailyRealizedLossRule(
                PnlThresholdParams.lossLimit(RuleKind.DAILY_REALIZED_LOSS, limit("-500"), EnforcementCategory.HARD_LOCKOUT));

        @Test
        @DisplayName("Total above the limit does not breach")
        void aboveLimit() {
            dailyTotal("-350");

            assertThat(rule.evaluate(trade("T-2", "MNQ", "-150", NOW), context).isBreached()).isFalse();
        }

        @Test
        @DisplayName("Total at or below the limit locks out until the next reset")
        void atLimitLocksOut() {
            dailyTotal("-550");
            when(resetScheduler.nextResetTime(NOW)).thenReturn(NEXT_RESET);

            RuleVerdict verdict = rule.evaluate(trade("T-3", "MNQ", "-200", NOW), context);

            assertThat(verdict.isBreached()).isTrue();
            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.HARD_LOCKOUT_UNTIL);
            assertThat(verdict.getLockoutUntil()).isEqualTo(NEXT_RESET);
            assertThat(verdict.isResetBound()).isTrue();
            assertThat(verdict.isAccountWide()).isTrue();
        }

        @Test
        @DisplayName("Half-turn fills are ignored")
        void halfTurnIgnored() {
            assertThat(rule.evaluate(trade("T-1", "MNQ", null, NOW), context).isBreached()).isFalse();
        }
    }

    @Test
    @DisplayName("Daily realized profit target locks out until the next reset")
    void dailyProfitTarget() {
        DailyRealizedProfitRule rule = new DailyRealizedProfitRule(
                PnlThresholdParams.profitTarget(RuleKind.DAILY_REALIZED_PROFIT, target("1000"), EnforcementCategory.HARD_LOCKOUT));
        dailyTotal("1000");
        when(resetScheduler.nextResetTime(NOW)).thenReturn(NEXT_RESET);

        RuleVerdict verdict = rule.evaluate(trade("T-7", "ES", "400", NOW), context);

        assertThat(verdict.getAction()).isEqualTo(VerdictActionType.HARD_LOCKOUT_UNTIL);
        assertThat(verdict.getLockoutUntil()).isEqualTo(NEXT_RESET);
    }

    // ==============================
    // UNREALIZED
    // ==============================

    @Nested
    @DisplayName("Daily unrealized loss")
    class DailyUnrealizedLoss {

        @Test
        @DisplayName("Trade-by-trade closes the position that moved")
        void closesTriggeringSymbol() {
            DailyUnrealizedLossRule rule = new DailyUnrealizedLossRule(
                    PnlThresholdParams.lossLimit(RuleKind.DAILY_UNREALIZED_LOSS, limit("-300"), null));
            apply(positionWithUnrealized("ES", 0, 1, "-120"));
            RiskEvent event = positionWithUnrealized("MNQ", 2, 2, "-200");
            apply(event);

            RuleVerdict verdict = rule.evaluate(event, context);

            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.CLOSE_SYMBOL);
            assertThat(verdict.getSymbol()).isEqualTo("MNQ");
        }

        @Test
        @DisplayName("Trade-by-trade closes the worst position when the triggering symbol is flat")
        void closesWorstWhenTriggerFlat() {
            DailyUnrealizedLossRule rule = new DailyUnrealizedLossRule(
                    PnlThresholdParams.lossLimit(RuleKind.DAILY_UNREALIZED_LOSS, limit("-300"), null));
            apply(positionWithUnrealized("ES", 0, 1, "-250"));
            apply(positionWithUnrealized("NQ", 0, 1, "-100"));
            RiskEvent flat = position("MNQ", 1, 0);
            apply(flat);

            RuleVerdict verdict = rule.evaluate(flat, context);

            assertThat(verdict.getSymbol()).isEqualTo("ES");
        }

        @Test
        @DisplayName("Hard-lockout category locks the account until reset")
        void hardCategory() {
            RuleSpec spec = limit("-300");
            spec.setCategory(EnforcementCategory.HARD_LOCKOUT);
            DailyUnrealizedLossRule rule = new DailyUnrealizedLossRule(
                    PnlThresholdParams.lossLimit(RuleKind.DAILY_UNREALIZED_LOSS, spec, null));
            when(resetScheduler.nextResetTime(NOW)).thenReturn(NEXT_RESET);
            RiskEvent event = positionWithUnrealized("MNQ", 0, 3, "-301");
            apply(event);

            RuleVerdict verdict = rule.evaluate(event, context);

            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.HARD_LOCKOUT_UNTIL);
            assertThat(verdict.isResetBound()).isTrue();
        }
    }

    @Test
    @DisplayName("Unrealized profit target closes the symbol")
    void unrealizedProfitCloses() {
        MaxUnrealizedProfitRule rule = new MaxUnrealizedProfitRule(
                PnlThresholdParams.profitTarget(RuleKind.MAX_UNREALIZED_PROFIT, target("500"), null));

        assertThat(rule.evaluate(positionWithUnrealized("ES", 1, 1, "499.75"), context).isBreached()).isFalse();

        RuleVerdict verdict = rule.evaluate(positionWithUnrealized("ES", 1, 1, "500"), context);
        assertThat(verdict.getAction()).isEqualTo(VerdictActionType.CLOSE_SYMBOL);
        assertThat(verdict.getSymbol()).isEqualTo("ES");
    }

    private void apply(RiskEvent event) {
        positionBook.apply(event);
    }
}
