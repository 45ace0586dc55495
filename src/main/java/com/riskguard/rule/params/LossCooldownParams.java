package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Loss tiers for the cooldown-after-loss rule, held most severe first so that the first
 * matching tier is the one with the largest loss threshold.
 */
@Getter
@Builder
@ToString
public class LossCooldownParams {

    private static final RuleKind KIND = RuleKind.COOLDOWN_AFTER_LOSS;

    public record LossTier(BigDecimal lossAmount, Duration cooldown) {}

    private final List<LossTier> tiers;
    private final boolean flatten;

    /** The most severe tier whose threshold the realized loss meets or exceeds. */
    public Optional<LossTier> tierFor(BigDecimal realizedPnl) {
        return tiers.stream()
                .filter(tier -> realizedPnl.compareTo(tier.lossAmount()) <= 0)
                .findFirst();
    }

    public static LossCooldownParams from(RuleSpec spec) {
        if (spec.getTiers() == null || spec.getTiers().isEmpty()) {
            throw ParamValidation.invalid(KIND, "tiers", "must contain at least one tier");
        }
        List<LossTier> tiers = new ArrayList<>();
        for (int i = 0; i < spec.getTiers().size(); i++) {
            RuleSpec.Tier tier = spec.getTiers().get(i);
            String field = "tiers[" + i + "]";
            tiers.add(new LossTier(
                    ParamValidation.negative(KIND, field + ".loss-amount", tier.getLossAmount()),
                    ParamValidation.seconds(KIND, field + ".cooldown-seconds",
                            ParamValidation.required(KIND, field + ".cooldown-seconds", tier.getCooldownSeconds()), 0)));
        }
        tiers.sort(Comparator.comparing(LossTier::lossAmount));
        return LossCooldownParams.builder()
                .tiers(List.copyOf(tiers))
                .flatten(spec.getFlatten() == null || spec.getFlatten())
                .build();
    }
}
