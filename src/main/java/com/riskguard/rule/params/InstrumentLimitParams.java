package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-symbol contract caps.
 *
 * <p>{@code unknown-symbol-action} accepts {@code block}, {@code allow-unlimited} or
 * {@code allow-with-limit:N}; underscores are accepted in place of dashes.
 */
@Getter
@Builder
@ToString
public class InstrumentLimitParams {

    private static final RuleKind KIND = RuleKind.MAX_CONTRACTS_PER_INSTRUMENT;

    public enum UnknownSymbolPolicy {
        BLOCK,
        ALLOW_WITH_LIMIT,
        ALLOW_UNLIMITED
    }

    private final Map<String, Integer> limits;
    private final boolean closeOnBreach;
    private final UnknownSymbolPolicy unknownSymbolPolicy;
    private final Integer unknownSymbolLimit;

    /** The cap for a symbol, or empty when the symbol may be held without limit. */
    public Optional<Integer> limitFor(String symbol) {
        Integer configured = limits.get(symbol.toUpperCase(Locale.ROOT));
        if (configured != null) {
            return Optional.of(configured);
        }
        return switch (unknownSymbolPolicy) {
            case BLOCK -> Optional.of(0);
            case ALLOW_WITH_LIMIT -> Optional.of(unknownSymbolLimit);
            case ALLOW_UNLIMITED -> Optional.empty();
        };
    }

    public boolean isConfigured(String symbol) {
        return limits.containsKey(symbol.toUpperCase(Locale.ROOT));
    }

    public static InstrumentLimitParams from(RuleSpec spec) {
        Map<String, Integer> limits = new LinkedHashMap<>();
        spec.getLimits().forEach((symbol, limit) ->
                limits.put(symbol.toUpperCase(Locale.ROOT), ParamValidation.positive(KIND, "limits." + symbol, limit)));

        String enforcement = normalize(spec.getEnforcement(), "reduce-to-limit");
        boolean closeOnBreach = switch (enforcement) {
            case "reduce-to-limit" -> false;
            case "close-all" -> true;
            default -> throw ParamValidation.invalid(KIND, "enforcement", "must be reduce-to-limit or close-all, got " + enforcement);
        };

        String action = normalize(spec.getUnknownSymbolAction(), "block");
        UnknownSymbolPolicy policy;
        Integer unknownLimit = null;
        if (action.equals("block")) {
            policy = UnknownSymbolPolicy.BLOCK;
        } else if (action.equals("allow-unlimited")) {
            policy = UnknownSymbolPolicy.ALLOW_UNLIMITED;
        } else if (action.startsWith("allow-with-limit:")) {
            policy = UnknownSymbolPolicy.ALLOW_WITH_LIMIT;
            try {
                unknownLimit = ParamValidation.positive(
                        KIND, "unknown-symbol-action", Integer.parseInt(action.substring(action.indexOf(':') + 1).trim()));
            } catch (NumberFormatException e) {
                throw ParamValidation.invalid(KIND, "unknown-symbol-action", "has a malformed limit: " + action);
            }
        } else {
            throw ParamValidation.invalid(KIND, "unknown-symbol-action", "is not recognised: " + action);
        }

        if (limits.isEmpty() && policy == UnknownSymbolPolicy.BLOCK) {
            throw ParamValidation.invalid(KIND, "limits", "is empty while unknown symbols are blocked");
        }

        return InstrumentLimitParams.builder()
                .limits(Collections.unmodifiableMap(limits))
                .closeOnBreach(closeOnBreach)
                .unknownSymbolPolicy(policy)
                .unknownSymbolLimit(unknownLimit)
                .build();
    }

    private static String normalize(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
