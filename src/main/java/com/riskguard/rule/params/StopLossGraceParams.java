package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class StopLossGraceParams {

    private final Duration grace;

    public static StopLossGraceParams from(RuleSpec spec) {
        return StopLossGraceParams.builder()
                .grace(ParamValidation.seconds(RuleKind.NO_STOP_LOSS_GRACE, "grace-seconds", spec.getGraceSeconds(), 10))
                .build();
    }
}
