package com.riskguard.rule;

import com.riskguard.config.RiskGuardProperties;
import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.exception.ConfigException;
import com.riskguard.rule.impl.AuthLossGuardRule;
import com.riskguard.rule.impl.CooldownAfterLossRule;
import com.riskguard.rule.impl.DailyRealizedLossRule;
import com.riskguard.rule.impl.DailyRealizedProfitRule;
import com.riskguard.rule.impl.DailyUnrealizedLossRule;
import com.riskguard.rule.impl.MaxContractsPerInstrumentRule;
import com.riskguard.rule.impl.MaxContractsRule;
import com.riskguard.rule.impl.MaxUnrealizedProfitRule;
import com.riskguard.rule.impl.NoStopLossGraceRule;
import com.riskguard.rule.impl.SessionBlockOutsideRule;
import com.riskguard.rule.impl.SymbolBlocksRule;
import com.riskguard.rule.impl.TradeFrequencyLimitRule;
import com.riskguard.rule.impl.TradeManagementRule;
import com.riskguard.rule.params.InstrumentLimitParams;
import com.riskguard.rule.params.LossCooldownParams;
import com.riskguard.rule.params.MaxContractsParams;
import com.riskguard.rule.params.PnlThresholdParams;
import com.riskguard.rule.params.SessionParams;
import com.riskguard.rule.params.StopLossGraceParams;
import com.riskguard.rule.params.SymbolBlockParams;
import com.riskguard.rule.params.TradeFrequencyParams;
import com.riskguard.rule.params.TradeManagementParams;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link RuleSet} from {@code riskguard.rules}. Any unknown kind or invalid parameter
 * raises {@link ConfigException}, which fails application startup.
 */
@Configuration
public class RuleSetFactory {

    private static final Logger log = LoggerFactory.getLogger(RuleSetFactory.class);

    @Bean
    public RuleSet ruleSet(RiskGuardProperties properties) {
        return build(properties.getRules());
    }

    public static RuleSet build(Map<String, RuleSpec> specs) {
        List<RiskRule> rules = new ArrayList<>();
        Set<RuleKind> seen = EnumSet.noneOf(RuleKind.class);
        for (Map.Entry<String, RuleSpec> entry : specs.entrySet()) {
            RuleKind kind = RuleKind.fromConfigName(entry.getKey());
            if (!seen.add(kind)) {
                throw new ConfigException("Rule configured twice: " + kind.getConfigName(),
                        Map.of("rule", kind.getConfigName()));
            }
            RuleSpec spec = entry.getValue() != null ? entry.getValue() : new RuleSpec();
            if (!spec.isEnabled()) {
                log.info("Rule {} is disabled", kind.getConfigName());
                continue;
            }
            RiskRule rule = create(kind, spec);
            log.info("Rule {} enabled (category={})", kind.getConfigName(), rule.category());
            rules.add(rule);
        }
        RuleSet ruleSet = new RuleSet(rules);
        log.info("Loaded {} risk rules", ruleSet.size());
        return ruleSet;
    }

    static RiskRule create(RuleKind kind, RuleSpec spec) {
        return switch (kind) {
            case MAX_CONTRACTS -> new MaxContractsRule(MaxContractsParams.from(spec));
            case MAX_CONTRACTS_PER_INSTRUMENT -> new MaxContractsPerInstrumentRule(InstrumentLimitParams.from(spec));
            case DAILY_REALIZED_LOSS -> new DailyRealizedLossRule(
                    PnlThresholdParams.lossLimit(kind, spec, EnforcementCategory.HARD_LOCKOUT));
            case DAILY_REALIZED_PROFIT -> new DailyRealizedProfitRule(
                    PnlThresholdParams.profitTarget(kind, spec, EnforcementCategory.HARD_LOCKOUT));
            case DAILY_UNREALIZED_LOSS -> new DailyUnrealizedLossRule(PnlThresholdParams.lossLimit(kind, spec, null));
            case MAX_UNREALIZED_PROFIT -> new MaxUnrealizedProfitRule(PnlThresholdParams.profitTarget(kind, spec, null));
            case TRADE_FREQUENCY_LIMIT -> new TradeFrequencyLimitRule(TradeFrequencyParams.from(spec));
            case COOLDOWN_AFTER_LOSS -> new CooldownAfterLossRule(LossCooldownParams.from(spec));
            case NO_STOP_LOSS_GRACE -> new NoStopLossGraceRule(StopLossGraceParams.from(spec));
            case SESSION_BLOCK_OUTSIDE -> new SessionBlockOutsideRule(SessionParams.from(spec));
            case AUTH_LOSS_GUARD -> new AuthLossGuardRule();
            case SYMBOL_BLOCKS -> new SymbolBlocksRule(SymbolBlockParams.from(spec));
            case TRADE_MANAGEMENT -> new TradeManagementRule(TradeManagementParams.from(spec));
        };
    }
}
