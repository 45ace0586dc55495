package com.riskguard.unit.rule.impl;

import static com.riskguard.support.TestEvents.accountStatus;
import static com.riskguard.support.TestEvents.position;
import static org.assertj.core.api.Assertions.assertThat;

import com.riskguard.domain.enums.PositionMode;
import com.riskguard.domain.enums.VerdictActionType;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.position.PositionBook;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.RuleSpec;
import com.riskguard.rule.impl.AuthLossGuardRule;
import com.riskguard.rule.impl.MaxContractsPerInstrumentRule;
import com.riskguard.rule.impl.MaxContractsRule;
import com.riskguard.rule.impl.SymbolBlocksRule;
import com.riskguard.rule.params.InstrumentLimitParams;
import com.riskguard.rule.params.MaxContractsParams;
import com.riskguard.rule.params.SymbolBlockParams;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PositionLimitRulesTest {

    private PositionBook positionBook;
    private RuleContext context;

    @BeforeEach
    void setUp() {
        positionBook = new PositionBook();
        context = new RuleContext(null, null, null, null, positionBook, null, null, null, null);
    }

    /** Applies the update to the book first, as the engine does before evaluating rules. */
    private RiskEvent applied(RiskEvent event) {
        positionBook.apply(event);
        return event;
    }

    // ==============================
    // MAX CONTRACTS
    // ==============================

    @Nested
    @DisplayName("Max contracts")
    class MaxContracts {

        private MaxContractsRule rule(PositionMode mode) {
            RuleSpec spec = new RuleSpec();
            spec.setMaxContracts(5);
            spec.setMode(mode);
            return new MaxContractsRule(MaxContractsParams.from(spec));
        }

        @Test
        @DisplayName("Gross total over the cap reduces the symbol that grew by the excess")
        void grossReducesByExcess() {
            applied(position("ES", 0, 3));
            RiskEvent event = applied(position("MNQ", 1, 4));

            RuleVerdict verdict = rule(PositionMode.GROSS).evaluate(event, context);

            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.REDUCE_TO_LIMIT);
            assertThat(verdict.getSymbol()).isEqualTo("MNQ");
            assertThat(verdict.getTargetSize()).isEqualTo(2);
        }

        @Test
        @DisplayName("Excess larger than the symbol closes it")
        void closesWhenExcessCoversSymbol() {
            applied(position("ES", 0, 5));
            RiskEvent event = applied(position("MNQ", 0, 2));

            RuleVerdict verdict = rule(PositionMode.GROSS).evaluate(event, context);

            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.CLOSE_SYMBOL);
        }

        @Test
        @DisplayName("Net mode lets a hedge offset the total")
        void netModeOffsets() {
            applied(position("ES", 0, 4));
            RiskEvent event = applied(position("MES", 0, -3));

            assertThat(rule(PositionMode.NET).evaluate(event, context).isBreached()).isFalse();
            assertThat(rule(PositionMode.GROSS).evaluate(event, context).isBreached()).isTrue();
        }

        @Test
        @DisplayName("Reducing a position never breaches")
        void reductionIgnored() {
            applied(position("ES", 0, 7));
            RiskEvent event = applied(position("ES", 7, 6));

            assertThat(rule(PositionMode.GROSS).evaluate(event, context).isBreached()).isFalse();
        }
    }

    // ==============================
    // PER INSTRUMENT
    // ==============================

    @Nested
    @DisplayName("Max contracts per instrument")
    class PerInstrument {

        private MaxContractsPerInstrumentRule rule(String enforcement, String unknownAction) {
            RuleSpec spec = new RuleSpec();
            spec.setLimits(Map.of("MNQ", 2, "ES", 1));
            spec.setEnforcement(enforcement);
            spec.setUnknownSymbolAction(unknownAction);
            return new MaxContractsPerInstrumentRule(InstrumentLimitParams.from(spec));
        }

        @Test
        @DisplayName("Over the symbol cap reduces to the cap by default")
        void reducesToCap() {
            RuleVerdict verdict = rule(null, null).evaluate(position("MNQ", 2, 3), context);

            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.REDUCE_TO_LIMIT);
            assertThat(verdict.getTargetSize()).isEqualTo(2);
        }

        @Test
        @DisplayName("close-all enforcement closes the symbol")
        void closeAllEnforcement() {
            RuleVerdict verdict = rule("close_all", null).evaluate(position("ES", 0, -2), context);

            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.CLOSE_SYMBOL);
            assertThat(verdict.getSymbol()).isEqualTo("ES");
        }

        @Test
        @DisplayName("Unknown symbol is closed when unknown symbols are blocked")
        void unknownBlocked() {
            RuleVerdict verdict = rule(null, "block").evaluate(position("CL", 0, 1), context);

            assertThat(verdict.getAction()).isEqualTo(VerdictActionType.CLOSE_SYMBOL);
            assertThat(verdict.getReason()).contains("no configured contract limit");
        }

        @Test
        @DisplayName("Unknown symbol gets the fallback cap with allow-with-limit")
        void unknownWithLimit() {
            MaxContractsPerInstrumentRule rule = rule(null, "allow-with-limit:3");

            assertThat(rule.evaluate(position("CL", 2, 3), context).isBreached()).isFalse();
            assertThat(rule.evaluate(position("CL", 3, 4), context).getTargetSize()).isEqualTo(3);
        }

        @Test
        @DisplayName("Unknown symbol is never capped with allow-unlimited")
        void unknownUnlimited() {
            assertThat(rule(null, "allow-unlimited").evaluate(position("CL", 0, 50), context).isBreached()).isFalse();
        }
    }

    // ==============================
    // ACCOUNT GUARDS
    // ==============================

    @Test
    @DisplayName("Blocked symbol pattern locks out that symbol only")
    void symbolBlocks() {
        RuleSpec spec = new RuleSpec();
        spec.setBlockedSymbols(List.of("RTY", "BTC*"));
        SymbolBlocksRule rule = new SymbolBlocksRule(SymbolBlockParams.from(spec));

        RuleVerdict verdict = rule.evaluate(position("BTCUSD", 0, 1), context);

        assertThat(verdict.getAction()).isEqualTo(VerdictActionType.HARD_LOCKOUT_UNTIL);
        assertThat(verdict.getSymbol()).isEqualTo("BTCUSD");
        assertThat(verdict.getLockoutUntil()).isNull();
        assertThat(rule.evaluate(position("MNQ", 0, 1), context).isBreached()).isFalse();
        assertThat(rule.evaluate(position("RTY", 1, 0), context).isBreached()).isFalse();
    }

    @Test
    @DisplayName("Losing trading permission locks out the account with no expiry")
    void authLoss() {
        AuthLossGuardRule rule = new AuthLossGuardRule();

        RuleVerdict verdict = rule.evaluate(accountStatus(false), context);

        assertThat(verdict.getAction()).isEqualTo(VerdictActionType.HARD_LOCKOUT_UNTIL);
        assertThat(verdict.isAccountWide()).isTrue();
        assertThat(verdict.getLockoutUntil()).isNull();
        assertThat(verdict.isResetBound()).isFalse();
        assertThat(rule.evaluate(accountStatus(true), context).isBreached()).isFalse();
    }
}
