package com.riskguard.rule;

import com.riskguard.domain.enums.RuleKind;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The enabled rules, in {@link RuleKind} declaration order. That order is also the tie-break
 * between verdicts of equal restrictiveness.
 */
public class RuleSet {

    private final List<RiskRule> rules;

    public RuleSet(List<RiskRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparing(RiskRule::kind))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<RiskRule> rules() {
        return rules;
    }

    public <T extends RiskRule> Optional<T> find(Class<T> type) {
        return rules.stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    public boolean isEnabled(RuleKind kind) {
        return rules.stream().anyMatch(rule -> rule.kind() == kind);
    }

    public int size() {
        return rules.size();
    }
}
