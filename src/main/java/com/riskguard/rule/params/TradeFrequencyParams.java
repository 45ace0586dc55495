package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Trade-count caps per rolling minute, rolling hour and trading session, each with its own
 * cooldown. A null cap disables that window; at least one must be set.
 */
@Getter
@Builder
@ToString
public class TradeFrequencyParams {

    private static final RuleKind KIND = RuleKind.TRADE_FREQUENCY_LIMIT;

    private final Integer perMinute;
    private final Integer perHour;
    private final Integer perSession;
    private final Duration minuteCooldown;
    private final Duration hourCooldown;
    private final Duration sessionCooldown;

    public static TradeFrequencyParams from(RuleSpec spec) {
        if (spec.getPerMinute() == null && spec.getPerHour() == null && spec.getPerSession() == null) {
            throw ParamValidation.invalid(KIND, "per-minute", "or per-hour or per-session must be set");
        }
        return TradeFrequencyParams.builder()
                .perMinute(spec.getPerMinute() != null ? ParamValidation.positive(KIND, "per-minute", spec.getPerMinute()) : null)
                .perHour(spec.getPerHour() != null ? ParamValidation.positive(KIND, "per-hour", spec.getPerHour()) : null)
                .perSession(spec.getPerSession() != null ? ParamValidation.positive(KIND, "per-session", spec.getPerSession()) : null)
                .minuteCooldown(ParamValidation.seconds(KIND, "cooldown-minute-seconds", spec.getCooldownMinuteSeconds(), 60))
                .hourCooldown(ParamValidation.seconds(KIND, "cooldown-hour-seconds", spec.getCooldownHourSeconds(), 1800))
                .sessionCooldown(ParamValidation.seconds(KIND, "cooldown-session-seconds", spec.getCooldownSessionSeconds(), 3600))
                .build();
    }
}
