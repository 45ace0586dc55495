package com.riskguard.rule.params;

import com.riskguard.domain.enums.PositionMode;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class MaxContractsParams {

    private final int limit;
    private final PositionMode mode;

    public static MaxContractsParams from(RuleSpec spec) {
        return MaxContractsParams.builder()
                .limit(ParamValidation.positive(RuleKind.MAX_CONTRACTS, "max-contracts", spec.getMaxContracts()))
                .mode(spec.getMode() != null ? spec.getMode() : PositionMode.GROSS)
                .build();
    }
}
