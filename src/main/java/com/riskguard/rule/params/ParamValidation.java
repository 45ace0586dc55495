package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.exception.ConfigException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Shared range checks for rule parameters. Every failure is a {@link ConfigException}
 * naming the rule and the offending field.
 */
final class ParamValidation {

    private ParamValidation() {}

    static ConfigException invalid(RuleKind kind, String field, String message) {
        return new ConfigException(
                kind.getConfigName() + "." + field + " " + message,
                Map.of("rule", kind.getConfigName(), "field", field));
    }

    static <T> T required(RuleKind kind, String field, T value) {
        if (value == null) {
            throw invalid(kind, field, "is required");
        }
        return value;
    }

    static int positive(RuleKind kind, String field, Integer value) {
        required(kind, field, value);
        if (value <= 0) {
            throw invalid(kind, field, "must be positive, got " + value);
        }
        return value;
    }

    static BigDecimal negative(RuleKind kind, String field, BigDecimal value) {
        required(kind, field, value);
        if (value.signum() >= 0) {
            throw invalid(kind, field, "must be negative, got " + value.toPlainString());
        }
        return value;
    }

    static BigDecimal positive(RuleKind kind, String field, BigDecimal value) {
        required(kind, field, value);
        if (value.signum() <= 0) {
            throw invalid(kind, field, "must be positive, got " + value.toPlainString());
        }
        return value;
    }

    static Duration seconds(RuleKind kind, String field, Long value, long defaultSeconds) {
        long seconds = value != null ? value : defaultSeconds;
        if (seconds < 0) {
            throw invalid(kind, field, "must not be negative, got " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }
}
