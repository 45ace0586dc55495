package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Automatic stop placement. {@code stopLossTicks} places an initial stop when a position opens;
 * {@code trailingTicks} trails it behind the best price seen. Either may be null.
 */
@Getter
@Builder
@ToString
public class TradeManagementParams {

    private static final RuleKind KIND = RuleKind.TRADE_MANAGEMENT;
    private static final BigDecimal DEFAULT_TICK_SIZE = new BigDecimal("0.25");

    private final Integer stopLossTicks;
    private final Integer trailingTicks;
    private final Map<String, BigDecimal> tickSizes;
    private final BigDecimal defaultTickSize;

    public BigDecimal tickSizeFor(String symbol) {
        return tickSizes.getOrDefault(symbol.toUpperCase(Locale.ROOT), defaultTickSize);
    }

    public static TradeManagementParams from(RuleSpec spec) {
        if (spec.getStopLossTicks() == null && spec.getTrailingTicks() == null) {
            throw ParamValidation.invalid(KIND, "stop-loss-ticks", "or trailing-ticks must be set");
        }
        Map<String, BigDecimal> tickSizes = new LinkedHashMap<>();
        spec.getTickSizes().forEach((symbol, size) ->
                tickSizes.put(symbol.toUpperCase(Locale.ROOT), ParamValidation.positive(KIND, "tick-sizes." + symbol, size)));
        return TradeManagementParams.builder()
                .stopLossTicks(spec.getStopLossTicks() != null
                        ? ParamValidation.positive(KIND, "stop-loss-ticks", spec.getStopLossTicks()) : null)
                .trailingTicks(spec.getTrailingTicks() != null
                        ? ParamValidation.positive(KIND, "trailing-ticks", spec.getTrailingTicks()) : null)
                .tickSizes(Map.copyOf(tickSizes))
                .defaultTickSize(spec.getDefaultTickSize() != null
                        ? ParamValidation.positive(KIND, "default-tick-size", spec.getDefaultTickSize()) : DEFAULT_TICK_SIZE)
                .build();
    }
}
