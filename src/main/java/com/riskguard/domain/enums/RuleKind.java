package com.riskguard.domain.enums;

import com.riskguard.exception.ConfigException;
import java.util.Arrays;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of rule kinds the engine knows how to build. Configuration keys are the
 * kebab-case {@link #configName}; anything else fails startup.
 */
@Getter
@RequiredArgsConstructor
public enum RuleKind {
    MAX_CONTRACTS("max-contracts"),
    MAX_CONTRACTS_PER_INSTRUMENT("max-contracts-per-instrument"),
    DAILY_REALIZED_LOSS("daily-realized-loss"),
    DAILY_UNREALIZED_LOSS("daily-unrealized-loss"),
    MAX_UNREALIZED_PROFIT("max-unrealized-profit"),
    TRADE_FREQUENCY_LIMIT("trade-frequency-limit"),
    COOLDOWN_AFTER_LOSS("cooldown-after-loss"),
    NO_STOP_LOSS_GRACE("no-stop-loss-grace"),
    SESSION_BLOCK_OUTSIDE("session-block-outside"),
    AUTH_LOSS_GUARD("auth-loss-guard"),
    SYMBOL_BLOCKS("symbol-blocks"),
    TRADE_MANAGEMENT("trade-management"),
    DAILY_REALIZED_PROFIT("daily-realized-profit");

    private final String configName;

    public static RuleKind fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.configName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new ConfigException("Unknown rule kind: " + name, Map.of("rule", String.valueOf(name))));
    }
}
