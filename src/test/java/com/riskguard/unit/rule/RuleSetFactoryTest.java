package com.riskguard.unit.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.exception.ConfigException;
import com.riskguard.rule.RiskRule;
import com.riskguard.rule.RuleSet;
import com.riskguard.rule.RuleSetFactory;
import com.riskguard.rule.RuleSpec;
import com.riskguard.rule.impl.DailyUnrealizedLossRule;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RuleSetFactoryTest {

    // ==============================
    // VALID CONFIGURATION
    // ==============================

    @Nested
    @DisplayName("Valid configuration")
    class Valid {

        @Test
        @DisplayName("Rules come out in kind order regardless of config order")
        void ordersByKind() {
            Map<String, RuleSpec> specs = new LinkedHashMap<>();
            specs.put("symbol-blocks", symbolBlocks("RTY"));
            specs.put("daily-realized-loss", lossLimit("-500"));
            specs.put("auth-loss-guard", new RuleSpec());

            RuleSet ruleSet = RuleSetFactory.build(specs);

            assertThat(ruleSet.rules())
                    .extracting(RiskRule::kind)
                    .containsExactly(RuleKind.DAILY_REALIZED_LOSS, RuleKind.AUTH_LOSS_GUARD, RuleKind.SYMBOL_BLOCKS);
        }

        @Test
        @DisplayName("Disabled rules are left out")
        void skipsDisabled() {
            RuleSpec disabled = lossLimit("-500");
            disabled.setEnabled(false);
            Map<String, RuleSpec> specs = new LinkedHashMap<>();
            specs.put("daily-realized-loss", disabled);
            specs.put("auth-loss-guard", new RuleSpec());

            RuleSet ruleSet = RuleSetFactory.build(specs);

            assertThat(ruleSet.size()).isEqualTo(1);
            assertThat(ruleSet.isEnabled(RuleKind.DAILY_REALIZED_LOSS)).isFalse();
        }

        @Test
        @DisplayName("Unrealized loss rule takes its category from config")
        void unrealizedCategoryConfigurable() {
            RuleSpec spec = lossLimit("-300");
            spec.setCategory(EnforcementCategory.HARD_LOCKOUT);

            RuleSet ruleSet = RuleSetFactory.build(Map.of("daily-unrealized-loss", spec));

            assertThat(ruleSet.find(DailyUnrealizedLossRule.class))
                    .get()
                    .extracting(RiskRule::category)
                    .isEqualTo(EnforcementCategory.HARD_LOCKOUT);
        }
    }

    // ==============================
    // INVALID CONFIGURATION
    // ==============================

    @Nested
    @DisplayName("Invalid configuration")
    class Invalid {

        @Test
        @DisplayName("Unknown rule kind fails")
        void unknownKind() {
            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("max-drawdown", new RuleSpec())))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("max-drawdown");
        }

        @Test
        @DisplayName("Positive daily loss limit fails and names the field")
        void positiveLossLimit() {
            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("daily-realized-loss", lossLimit("500"))))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("daily-realized-loss.limit");
        }

        @Test
        @DisplayName("Realized loss rule rejects a non hard-lockout category")
        void realizedCategoryFixed() {
            RuleSpec spec = lossLimit("-500");
            spec.setCategory(EnforcementCategory.COOLDOWN);

            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("daily-realized-loss", spec)))
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Frequency rule without any cap fails")
        void frequencyWithoutCap() {
            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("trade-frequency-limit", new RuleSpec())))
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Session with equal start and end fails")
        void sessionEmptyWindow() {
            RuleSpec spec = new RuleSpec();
            spec.setStart("09:30");
            spec.setEnd("09:30");

            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("session-block-outside", spec)))
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Per-instrument limits with no symbols and blocked unknowns fail")
        void instrumentLimitsEmpty() {
            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("max-contracts-per-instrument", new RuleSpec())))
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Malformed allow-with-limit fails")
        void malformedUnknownLimit() {
            RuleSpec spec = new RuleSpec();
            spec.setLimits(Map.of("MNQ", 2));
            spec.setUnknownSymbolAction("allow-with-limit:lots");

            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("max-contracts-per-instrument", spec)))
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Loss tier without a cooldown fails")
        void tierWithoutCooldown() {
            RuleSpec.Tier tier = new RuleSpec.Tier();
            tier.setLossAmount(new BigDecimal("-100"));
            RuleSpec spec = new RuleSpec();
            spec.getTiers().add(tier);

            assertThatThrownBy(() -> RuleSetFactory.build(Map.of("cooldown-after-loss", spec)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("cooldown-seconds");
        }
    }

    private static RuleSpec lossLimit(String limit) {
        RuleSpec spec = new RuleSpec();
        spec.setLimit(new BigDecimal(limit));
        return spec;
    }

    private static RuleSpec symbolBlocks(String... symbols) {
        RuleSpec spec = new RuleSpec();
        spec.setBlockedSymbols(List.of(symbols));
        return spec;
    }
}
