package com.riskguard.enforcement;

import com.riskguard.domain.enums.VerdictActionType;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of enforcing one verdict. Broker steps are best-effort: each failure is collected in
 * {@code errors} and the lockout, if any, is only installed when every step succeeded.
 */
@Data
@Builder
public class EnforcementResult {

    private String accountId;
    private VerdictActionType action;
    private String symbol;
    private boolean success;
    private boolean lockoutInstalled;
    private int brokerCalls;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
