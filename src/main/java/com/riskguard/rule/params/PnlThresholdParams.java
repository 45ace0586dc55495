package com.riskguard.rule.params;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A single P&L threshold plus the category used when it is crossed. Loss limits are negative,
 * profit targets positive.
 */
@Getter
@Builder
@ToString
public class PnlThresholdParams {

    private final BigDecimal threshold;
    private final EnforcementCategory category;

    public static PnlThresholdParams lossLimit(RuleKind kind, RuleSpec spec, EnforcementCategory fixedCategory) {
        return PnlThresholdParams.builder()
                .threshold(ParamValidation.negative(kind, "limit", spec.getLimit()))
                .category(category(kind, spec, fixedCategory))
                .build();
    }

    public static PnlThresholdParams profitTarget(RuleKind kind, RuleSpec spec, EnforcementCategory fixedCategory) {
        return PnlThresholdParams.builder()
                .threshold(ParamValidation.positive(kind, "target", spec.getTarget()))
                .category(category(kind, spec, fixedCategory))
                .build();
    }

    /**
     * Realized rules have a fixed category. Unrealized rules pass null and accept either
     * trade-by-trade (the default) or hard-lockout.
     */
    private static EnforcementCategory category(RuleKind kind, RuleSpec spec, EnforcementCategory fixedCategory) {
        EnforcementCategory configured = spec.getCategory();
        if (fixedCategory != null) {
            if (configured != null && configured != fixedCategory) {
                throw ParamValidation.invalid(kind, "category", "must be " + fixedCategory + ", got " + configured);
            }
            return fixedCategory;
        }
        if (configured == null) {
            return EnforcementCategory.TRADE_BY_TRADE;
        }
        if (configured != EnforcementCategory.TRADE_BY_TRADE && configured != EnforcementCategory.HARD_LOCKOUT) {
            throw ParamValidation.invalid(kind, "category", "must be TRADE_BY_TRADE or HARD_LOCKOUT, got " + configured);
        }
        return configured;
    }
}
