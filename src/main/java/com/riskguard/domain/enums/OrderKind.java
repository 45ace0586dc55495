package com.riskguard.domain.enums;

/**
 * Order types as the broker reports them. Broker type codes: 1 limit, 2 market,
 * 3 stop-limit, 4 stop, 5 trailing stop.
 */
public enum OrderKind {
    LIMIT,
    MARKET,
    STOP_LIMIT,
    STOP,
    TRAILING_STOP,
    UNKNOWN;

    public boolean isStopType() {
        return this == STOP || this == STOP_LIMIT || this == TRAILING_STOP;
    }

    public static OrderKind fromBrokerCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code) {
            case 1 -> LIMIT;
            case 2 -> MARKET;
            case 3 -> STOP_LIMIT;
            case 4 -> STOP;
            case 5 -> TRAILING_STOP;
            default -> UNKNOWN;
        };
    }
}
